package cn.xbhel.fetch.transport;

import java.io.IOException;

import org.apache.http.HttpClientConnection;
import org.apache.http.HttpException;
import org.apache.http.HttpInetConnection;
import org.apache.http.HttpRequest;
import org.apache.http.HttpResponse;
import org.apache.http.protocol.HttpContext;
import org.apache.http.protocol.HttpRequestExecutor;

/**
 * Reports the send and response-head phases of an exchange.
 *
 * @author xbhel
 */
class ListeningRequestExecutor extends HttpRequestExecutor {

    @Override
    protected HttpResponse doSendRequest(HttpRequest request, HttpClientConnection conn, HttpContext context)
            throws IOException, HttpException {
        var listener = ApacheHttpTransport.listenerOf(context);
        listener.onSocketReady(connectionId(conn));
        var response = super.doSendRequest(request, conn, context);
        listener.onRequestSent();
        return response;
    }

    @Override
    protected HttpResponse doReceiveResponse(HttpRequest request, HttpClientConnection conn, HttpContext context)
            throws HttpException, IOException {
        var response = super.doReceiveResponse(request, conn, context);
        ApacheHttpTransport.listenerOf(context).onResponse();
        return response;
    }

    static String connectionId(HttpClientConnection conn) {
        if (conn instanceof HttpInetConnection inet && inet.getLocalAddress() != null
                && inet.getRemoteAddress() != null) {
            return inet.getLocalAddress().getHostAddress() + ":" + inet.getLocalPort()
                    + "->" + inet.getRemoteAddress().getHostAddress() + ":" + inet.getRemotePort();
        }
        return Integer.toHexString(System.identityHashCode(conn));
    }

}
