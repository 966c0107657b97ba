package cn.xbhel.fetch.retry;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.ToLongFunction;

/**
 * Decides how long to wait before the next attempt. A value of 0 stops retrying,
 * a positive value is the wait in milliseconds.
 * <p>
 * The returned stage may complete later; the request stays suspended until it
 * does. Completing it exceptionally fails the request with that exception.
 * </p>
 *
 * @author xbhel
 */
@FunctionalInterface
public interface RetryDelayStrategy {

    CompletionStage<Long> calculateDelay(RetryContext context);

    /**
     * Adapts a synchronous computation.
     */
    static RetryDelayStrategy of(ToLongFunction<RetryContext> function) {
        return context -> CompletableFuture.completedFuture(function.applyAsLong(context));
    }

}
