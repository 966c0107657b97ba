package cn.xbhel.fetch;

import java.net.URI;
import java.nio.charset.Charset;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import javax.annotation.Nullable;

import org.apache.http.HttpEntity;

import lombok.Getter;

/**
 * The wire form of a request: resolved URI, final headers and body entity. It is
 * built once per request and re-sent as is by every retry, redirects derive new
 * instances.
 *
 * @author xbhel
 */
@Getter
public class PreparedRequest {

    private final String method;
    private final URI uri;
    private final Map<String, String> headers;
    @Nullable
    private final HttpEntity entity;
    private final Charset charset;

    public PreparedRequest(String method, URI uri, Map<String, String> headers, @Nullable HttpEntity entity,
            Charset charset) {
        this.method = method;
        this.uri = uri;
        var copy = new TreeMap<String, String>(String.CASE_INSENSITIVE_ORDER);
        copy.putAll(headers);
        this.headers = Collections.unmodifiableMap(copy);
        this.entity = entity;
        this.charset = charset;
    }

    /**
     * Whether the body can be sent more than once.
     */
    public boolean isReplayable() {
        return entity == null || entity.isRepeatable();
    }

    public boolean isSecure() {
        return "https".equalsIgnoreCase(uri.getScheme());
    }

    @Override
    public String toString() {
        return method + " " + uri;
    }
}
