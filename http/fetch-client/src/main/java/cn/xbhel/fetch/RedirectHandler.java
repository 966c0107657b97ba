package cn.xbhel.fetch;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

import javax.annotation.Nullable;

import org.apache.http.HttpHeaders;
import org.apache.http.HttpStatus;
import org.apache.http.client.utils.URIUtils;

import cn.xbhel.fetch.transport.ErrorCodes;

/**
 * Computes the next hop of a redirect chain.
 * <p>
 * 303 always switches to {@code GET}, and so do 301 and 302 for methods other
 * than {@code GET} and {@code HEAD}; the body and its headers are dropped on a
 * switch. 307 and 308 keep the method and the body. Credentials are not sent to
 * another host.
 * </p>
 *
 * @author xbhel
 */
public final class RedirectHandler {

    static final Set<Integer> REDIRECT_STATUS_CODES = Set.of(
            HttpStatus.SC_MOVED_PERMANENTLY,
            HttpStatus.SC_MOVED_TEMPORARILY,
            HttpStatus.SC_SEE_OTHER,
            HttpStatus.SC_TEMPORARY_REDIRECT,
            308 // Permanent Redirect
    );

    private RedirectHandler() {
    }

    public static boolean isRedirect(int statusCode, @Nullable String location) {
        return REDIRECT_STATUS_CODES.contains(statusCode) && location != null && !location.isBlank();
    }

    /**
     * Builds the request for the redirect target.
     *
     * @param current    the request that received the redirect
     * @param statusCode the redirect status
     * @param location   the raw {@code Location} header value
     */
    public static PreparedRequest follow(PreparedRequest current, int statusCode, String location) {
        var target = resolve(current.getUri(), location);
        var method = current.getMethod();
        var entity = current.getEntity();
        var headers = new TreeMap<String, String>(String.CASE_INSENSITIVE_ORDER);
        headers.putAll(current.getHeaders());

        if (switchesToGet(statusCode, method)) {
            method = "GET";
            entity = null;
            headers.remove(HttpHeaders.CONTENT_TYPE);
            headers.remove(HttpHeaders.CONTENT_LENGTH);
            headers.remove(HttpHeaders.CONTENT_ENCODING);
        }
        if (!Objects.equals(current.getUri().getHost(), target.getHost())) {
            headers.remove(HttpHeaders.AUTHORIZATION);
        }
        return new PreparedRequest(method, target, headers, entity, current.getCharset());
    }

    static boolean switchesToGet(int statusCode, String method) {
        if (statusCode == HttpStatus.SC_SEE_OTHER) {
            return !"HEAD".equals(method);
        }
        if (statusCode == HttpStatus.SC_MOVED_PERMANENTLY || statusCode == HttpStatus.SC_MOVED_TEMPORARILY) {
            return !"GET".equals(method) && !"HEAD".equals(method);
        }
        return false;
    }

    static URI resolve(URI base, String location) {
        try {
            return URIUtils.resolve(base, new URI(location.trim()));
        } catch (URISyntaxException e) {
            throw new HttpExecutionException(ErrorCodes.ERR_INVALID_URL, "Invalid redirect location: " + location, e);
        }
    }

}
