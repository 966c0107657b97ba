package cn.xbhel.fetch.transport;

import java.io.IOException;
import java.net.BindException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.Locale;

import javax.net.ssl.SSLException;

import org.apache.http.NoHttpResponseException;
import org.apache.http.conn.ConnectTimeoutException;

/**
 * Error codes shared by the transport and the retry options. Network failures use
 * the conventional socket error names so they can be listed in
 * {@code RetryOptions#errorCodes}.
 *
 * @author xbhel
 */
public final class ErrorCodes {

    public static final String ETIMEDOUT = "ETIMEDOUT";
    public static final String ECONNRESET = "ECONNRESET";
    public static final String EADDRINUSE = "EADDRINUSE";
    public static final String ECONNREFUSED = "ECONNREFUSED";
    public static final String EPIPE = "EPIPE";
    public static final String ENOTFOUND = "ENOTFOUND";
    public static final String ENETUNREACH = "ENETUNREACH";
    public static final String EHOSTUNREACH = "EHOSTUNREACH";
    public static final String EAI_AGAIN = "EAI_AGAIN";

    public static final String ERR_TLS = "ERR_TLS";
    public static final String ERR_TRANSPORT = "ERR_TRANSPORT";
    public static final String ERR_CANCELED = "ERR_CANCELED";
    public static final String ERR_NON_2XX_3XX_RESPONSE = "ERR_NON_2XX_3XX_RESPONSE";
    public static final String ERR_TOO_MANY_REDIRECTS = "ERR_TOO_MANY_REDIRECTS";
    public static final String ERR_RETRY_STRATEGY = "ERR_RETRY_STRATEGY";
    public static final String ERR_INVALID_URL = "ERR_INVALID_URL";

    private ErrorCodes() {
    }

    /**
     * Resolves the error code of a transport failure. A {@link CodedIOException}
     * keeps its own code, other exceptions are mapped by type.
     */
    public static String resolve(IOException exception) {
        if (exception instanceof CodedIOException coded) {
            return coded.getCode();
        }
        if (exception instanceof UnknownHostException) {
            return ENOTFOUND;
        }
        if (exception instanceof ConnectTimeoutException || exception instanceof SocketTimeoutException) {
            return ETIMEDOUT;
        }
        if (exception instanceof NoRouteToHostException) {
            return EHOSTUNREACH;
        }
        if (exception instanceof BindException) {
            return EADDRINUSE;
        }
        if (exception instanceof ConnectException) {
            return ECONNREFUSED;
        }
        if (exception instanceof NoHttpResponseException) {
            return ECONNRESET;
        }
        if (exception instanceof SSLException) {
            return ERR_TLS;
        }
        if (exception instanceof SocketException) {
            return fromSocketMessage(exception.getMessage());
        }
        return ERR_TRANSPORT;
    }

    static String fromSocketMessage(String message) {
        var text = message == null ? "" : message.toLowerCase(Locale.ROOT);
        if (text.contains("reset")) {
            return ECONNRESET;
        }
        if (text.contains("broken pipe")) {
            return EPIPE;
        }
        if (text.contains("network is unreachable")) {
            return ENETUNREACH;
        }
        return ERR_TRANSPORT;
    }

}
