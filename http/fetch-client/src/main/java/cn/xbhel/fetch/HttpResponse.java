package cn.xbhel.fetch;

import java.net.URI;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import javax.annotation.Nullable;

import org.apache.http.impl.EnglishReasonPhraseCatalog;

import lombok.Builder;
import lombok.Getter;

/**
 * A fully received response. Header names are case-insensitive and repeated
 * headers are joined with a comma.
 *
 * @author xbhel
 */
@Getter
public class HttpResponse {

    private static final byte[] EMPTY_BODY = new byte[0];

    private final int statusCode;
    private final String reasonPhrase;
    private final Map<String, String> headers;
    private final byte[] body;
    private final URI url;
    private final List<URI> redirectUrls;
    /** The number of retries it took to obtain this response. */
    private final int retryCount;

    @Builder(toBuilder = true)
    private HttpResponse(int statusCode, @Nullable String reasonPhrase, @Nullable Map<String, String> headers,
            @Nullable byte[] body, URI url, @Nullable List<URI> redirectUrls, int retryCount) {
        this.statusCode = statusCode;
        this.reasonPhrase = Optional.ofNullable(reasonPhrase)
                .filter(reason -> !reason.isEmpty())
                .orElseGet(() -> Optional.ofNullable(EnglishReasonPhraseCatalog.INSTANCE.getReason(statusCode, null))
                        .orElse("Unknown"));
        var caseInsensitive = new TreeMap<String, String>(String.CASE_INSENSITIVE_ORDER);
        Optional.ofNullable(headers).ifPresent(caseInsensitive::putAll);
        this.headers = Collections.unmodifiableMap(caseInsensitive);
        this.body = Optional.ofNullable(body).orElse(EMPTY_BODY);
        this.url = url;
        this.redirectUrls = redirectUrls == null ? List.of() : List.copyOf(redirectUrls);
        this.retryCount = retryCount;
    }

    @Nullable
    public String getHeader(String name) {
        return headers.get(name);
    }

    public String getBodyAsString() {
        return getBodyAsString(StandardCharsets.UTF_8);
    }

    public String getBodyAsString(Charset charset) {
        return new String(body, charset);
    }

    public HttpResponse withBody(byte[] newBody) {
        return toBuilder().body(newBody).build();
    }

    @Override
    public String toString() {
        return "HttpResponse [url=" + url + ", statusCode=" + statusCode + ", retryCount=" + retryCount + "]";
    }
}
