package cn.xbhel.fetch.retry;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * A strategy that never retries.
 *
 * @author xbhel
 */
public class NoRetryDelayStrategy implements RetryDelayStrategy {

    public static final NoRetryDelayStrategy INSTANCE = new NoRetryDelayStrategy();

    @Override
    public CompletionStage<Long> calculateDelay(RetryContext context) {
        return CompletableFuture.completedFuture(0L);
    }

}
