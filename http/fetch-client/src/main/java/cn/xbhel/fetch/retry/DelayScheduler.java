package cn.xbhel.fetch.retry;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import javax.annotation.Nullable;

import org.apache.http.HttpHeaders;

import cn.xbhel.fetch.HttpExecutionException;
import cn.xbhel.fetch.RetryStrategyException;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns an eligible failure into a {@link DelayDecision}.
 * <p>
 * A {@code Retry-After} above the allowed maximum stops without consulting the
 * strategy. Otherwise the strategy of the retry options is invoked with the
 * parsed header and the value the default strategy would pick, and its answer
 * is validated: 0 stops, a positive value is the wait, anything else fails the
 * request with a {@link RetryStrategyException}. Exceptions raised by the
 * strategy are propagated as they are.
 * </p>
 *
 * @author xbhel
 */
@Slf4j
public class DelayScheduler {

    private final Clock clock;

    public DelayScheduler(Clock clock) {
        this.clock = clock;
    }

    /**
     * @param maxRetryAfter the effective upper bound of {@code Retry-After} in
     *                      milliseconds, {@code null} when unbounded
     */
    public CompletableFuture<DelayDecision> decide(int attemptCount, HttpExecutionException error,
            RetryOptions options, @Nullable Long maxRetryAfter) {
        var response = error.getResponse();
        var retryAfter = response == null ? null : RetryAfter.parse(response.getHeader(HttpHeaders.RETRY_AFTER), clock);
        if (retryAfter != null && maxRetryAfter != null && retryAfter > maxRetryAfter) {
            log.debug("Retry-After of {} ms exceeds the maximum of {} ms, not retrying.", retryAfter, maxRetryAfter);
            return CompletableFuture.completedFuture(DelayDecision.STOP);
        }

        var context = RetryContext.builder()
                .attemptCount(attemptCount)
                .error(error)
                .retryAfter(retryAfter)
                .response(response)
                .computedValue(DefaultRetryDelayStrategy.INSTANCE.compute(attemptCount, retryAfter, response))
                .retryOptions(options)
                .build();

        CompletionStage<Long> stage;
        try {
            stage = options.getCalculateDelay().calculateDelay(context);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        if (stage == null) {
            return CompletableFuture.failedFuture(
                    new RetryStrategyException("The retry delay strategy returned no result"));
        }
        return stage.toCompletableFuture().thenApply(DelayScheduler::toDecision);
    }

    static DelayDecision toDecision(Long delay) {
        if (delay == null) {
            throw new RetryStrategyException("The retry delay strategy returned a null delay");
        }
        if (delay < 0) {
            throw new RetryStrategyException("The retry delay strategy returned a negative delay: " + delay);
        }
        return DelayDecision.of(Math.min(delay, Integer.MAX_VALUE));
    }

}
