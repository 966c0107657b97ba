package cn.xbhel.fetch.retry;

import javax.annotation.Nullable;

import cn.xbhel.fetch.HttpExecutionException;
import cn.xbhel.fetch.HttpResponse;
import lombok.Builder;
import lombok.Value;

/**
 * What a {@link RetryDelayStrategy} knows about the failure it is asked to delay.
 *
 * @author xbhel
 */
@Value
@Builder
public class RetryContext {

    /** The ordinal of the attempt that failed, 1 for the first try. */
    int attemptCount;
    HttpExecutionException error;
    /** The parsed {@code Retry-After} header in milliseconds, if any. */
    @Nullable
    Long retryAfter;
    @Nullable
    HttpResponse response;
    /** The delay the default strategy would pick. */
    long computedValue;
    RetryOptions retryOptions;

}
