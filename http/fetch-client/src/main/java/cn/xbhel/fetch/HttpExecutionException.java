package cn.xbhel.fetch;

import javax.annotation.Nullable;

import lombok.Getter;

/**
 * The base failure of a request execution.
 * <p>
 * Every failure carries a machine readable {@link #getCode() code}, this is the
 * value matched against {@link cn.xbhel.fetch.retry.RetryOptions#getErrorCodes()}
 * when deciding whether an attempt may be retried.
 * </p>
 *
 * @author xbhel
 */
@Getter
public class HttpExecutionException extends RuntimeException {

    private final String code;
    @Nullable
    private final transient HttpResponse response;

    public HttpExecutionException(String code, String message) {
        this(code, message, null, null);
    }

    public HttpExecutionException(String code, String message, Throwable cause) {
        this(code, message, null, cause);
    }

    public HttpExecutionException(String code, String message, @Nullable HttpResponse response,
            @Nullable Throwable cause) {
        super(message);
        // left unset when absent so a timeout can attach the I/O failure it caused later
        if (cause != null) {
            initCause(cause);
        }
        this.code = code;
        this.response = response;
    }

}
