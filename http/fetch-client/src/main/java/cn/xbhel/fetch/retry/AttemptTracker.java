package cn.xbhel.fetch.retry;

import java.time.Clock;

import javax.annotation.Nullable;

/**
 * Hands out consecutive attempt ordinals for one request.
 *
 * @author xbhel
 */
public class AttemptTracker {

    private final Clock clock;
    private final int seededRetryCount;
    private int lastOrdinal;
    @Nullable
    private Attempt current;

    public AttemptTracker(Clock clock) {
        this(0, clock);
    }

    private AttemptTracker(int retryCount, Clock clock) {
        if (retryCount < 0) {
            throw new IllegalArgumentException("The retry count must not be negative, got " + retryCount);
        }
        this.seededRetryCount = retryCount;
        this.lastOrdinal = retryCount;
        this.clock = clock;
    }

    /**
     * Creates a tracker whose first attempt continues a request that has already
     * been retried {@code retryCount} times.
     */
    public static AttemptTracker resumingFrom(int retryCount, Clock clock) {
        return new AttemptTracker(retryCount, clock);
    }

    public Attempt begin() {
        current = new Attempt(++lastOrdinal, clock.instant());
        return current;
    }

    @Nullable
    public Attempt current() {
        return current;
    }

    /**
     * The retry count to report to the caller: the retry count of the current
     * attempt, or the count the tracker was seeded with before any attempt began.
     */
    public int finalCount() {
        return current == null ? seededRetryCount : current.getRetryCount();
    }

}
