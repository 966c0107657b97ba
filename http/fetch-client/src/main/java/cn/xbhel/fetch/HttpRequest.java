package cn.xbhel.fetch;

import java.nio.charset.Charset;
import java.util.Map;

import javax.annotation.Nonnull;

import cn.xbhel.fetch.retry.RetryOptions;
import cn.xbhel.fetch.timeout.TimeoutOptions;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * @author xbhel
 */
@Data
@Accessors(chain = true)
@RequiredArgsConstructor
public class HttpRequest {

    public static final int DEFAULT_MAX_REDIRECTS = 10;

    @Nonnull
    private final String url;
    @Nonnull
    private final String method;
    private Map<String, String> headers;
    private Map<String, String> queryParams;
    private Object data;
    private Charset charset;
    private RetryOptions retry = RetryOptions.defaults();
    private TimeoutOptions timeout = TimeoutOptions.none();
    /**
     * Whether a final response outside the successful range fails the request. When
     * disabled such a response is returned, after retries, like any other.
     */
    private boolean throwHttpErrors = true;
    private boolean followRedirect = true;
    private int maxRedirects = DEFAULT_MAX_REDIRECTS;

    /**
     * Retries with the default options up to {@code limit} times, 0 disables
     * retrying.
     */
    public HttpRequest retry(int limit) {
        return setRetry(RetryOptions.ofLimit(limit));
    }

    /**
     * Bounds socket inactivity to the given milliseconds.
     */
    public HttpRequest timeout(long socketTimeoutMillis) {
        return setTimeout(TimeoutOptions.of(socketTimeoutMillis));
    }

    @Override
    public String toString() {
        return "HttpRequest [url=" + url + ", method=" + method + "]";
    }
}
