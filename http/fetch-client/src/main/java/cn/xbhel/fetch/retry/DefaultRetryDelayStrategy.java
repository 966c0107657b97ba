package cn.xbhel.fetch.retry;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ThreadLocalRandom;

import javax.annotation.Nullable;

import org.apache.http.HttpStatus;

import cn.xbhel.fetch.HttpResponse;
import lombok.Getter;

/**
 * Exponential backoff with a little noise, honouring {@code Retry-After}.
 *
 * <ul>
 * <li>a response carrying {@code Retry-After} waits at least that long;</li>
 * <li>413 without {@code Retry-After} is not retried;</li>
 * <li>otherwise waits {@code backoffFactor * 2^attemptCount} seconds plus up to
 * {@code maxNoiseMillis}.</li>
 * </ul>
 *
 * @author xbhel
 */
@Getter
public class DefaultRetryDelayStrategy implements RetryDelayStrategy {

    private static final double DEFAULT_BACKOFF_FACTOR = 0.5d;
    private static final int DEFAULT_MAX_NOISE_MILLIS = 100;

    public static final DefaultRetryDelayStrategy INSTANCE = new DefaultRetryDelayStrategy();

    private final double backoffFactor;
    private final int maxNoiseMillis;

    public DefaultRetryDelayStrategy() {
        this(DEFAULT_BACKOFF_FACTOR, DEFAULT_MAX_NOISE_MILLIS);
    }

    public DefaultRetryDelayStrategy(double backoffFactor, int maxNoiseMillis) {
        if (backoffFactor <= 0 || maxNoiseMillis < 0) {
            throw new IllegalArgumentException(String.format(
                    "Invalid backoff settings: backoffFactor=%s, maxNoiseMillis=%s", backoffFactor, maxNoiseMillis));
        }
        this.backoffFactor = backoffFactor;
        this.maxNoiseMillis = maxNoiseMillis;
    }

    @Override
    public CompletionStage<Long> calculateDelay(RetryContext context) {
        return CompletableFuture.completedFuture(context.getComputedValue());
    }

    public long compute(int attemptCount, @Nullable Long retryAfter, @Nullable HttpResponse response) {
        if (response != null) {
            if (retryAfter != null) {
                return Math.max(retryAfter, 1L);
            }
            if (response.getStatusCode() == HttpStatus.SC_REQUEST_TOO_LONG) {
                return 0L;
            }
        }
        var noise = maxNoiseMillis == 0 ? 0 : ThreadLocalRandom.current().nextInt(maxNoiseMillis + 1);
        var backoff = getBackoffTimeMillis(attemptCount);
        // saturate instead of overflowing once the backoff reaches Long.MAX_VALUE
        return backoff > Long.MAX_VALUE - noise ? Long.MAX_VALUE : backoff + noise;
    }

    public long getBackoffTimeMillis(int attempts) {
        var backoff = backoffFactor * Math.pow(2, attempts) * 1000;
        return backoff >= Long.MAX_VALUE ? Long.MAX_VALUE : (long) backoff;
    }

}
