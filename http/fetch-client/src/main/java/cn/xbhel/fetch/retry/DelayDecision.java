package cn.xbhel.fetch.retry;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * The outcome of the delay scheduler: wait the given milliseconds and retry, or
 * stop.
 *
 * @author xbhel
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DelayDecision {

    public static final DelayDecision STOP = new DelayDecision(0);

    long delayMillis;

    public static DelayDecision of(long delayMillis) {
        if (delayMillis < 0) {
            throw new IllegalArgumentException("The delay must not be negative, got " + delayMillis);
        }
        return delayMillis == 0 ? STOP : new DelayDecision(delayMillis);
    }

    public boolean isStop() {
        return delayMillis == 0;
    }

}
