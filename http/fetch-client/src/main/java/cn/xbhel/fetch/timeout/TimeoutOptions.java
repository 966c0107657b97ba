package cn.xbhel.fetch.timeout;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import javax.annotation.Nullable;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Per-phase timeouts of a request, in milliseconds. Phases without a value are
 * never bounded.
 *
 * <pre>
 * // a single value bounds socket inactivity
 * TimeoutOptions.of(300);
 *
 * TimeoutOptions.builder()
 *         .connect(1_000)
 *         .response(5_000)
 *         .build();
 * </pre>
 *
 * @author xbhel
 */
@ToString
@EqualsAndHashCode
public final class TimeoutOptions {

    private static final TimeoutOptions NONE = new TimeoutOptions(new EnumMap<>(Phase.class));

    private final Map<Phase, Long> durations;

    private TimeoutOptions(EnumMap<Phase, Long> durations) {
        this.durations = Collections.unmodifiableMap(durations);
    }

    public static TimeoutOptions none() {
        return NONE;
    }

    /**
     * The shorthand form: one value applied to the socket inactivity phase.
     */
    public static TimeoutOptions of(long socketTimeoutMillis) {
        return builder().socket(socketTimeoutMillis).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Nullable
    public Long get(Phase phase) {
        return durations.get(phase);
    }

    public boolean isSet(Phase phase) {
        return durations.containsKey(phase);
    }

    public Map<Phase, Long> asMap() {
        return durations;
    }

    public static class Builder {

        private final EnumMap<Phase, Long> durations = new EnumMap<>(Phase.class);

        public Builder phase(Phase phase, long timeoutMillis) {
            if (timeoutMillis <= 0) {
                throw new IllegalArgumentException(
                        "The timeout of phase '" + phase + "' must be positive, got " + timeoutMillis);
            }
            durations.put(phase, timeoutMillis);
            return this;
        }

        public Builder lookup(long timeoutMillis) {
            return phase(Phase.LOOKUP, timeoutMillis);
        }

        public Builder connect(long timeoutMillis) {
            return phase(Phase.CONNECT, timeoutMillis);
        }

        public Builder secureConnect(long timeoutMillis) {
            return phase(Phase.SECURE_CONNECT, timeoutMillis);
        }

        public Builder socket(long timeoutMillis) {
            return phase(Phase.SOCKET, timeoutMillis);
        }

        public Builder send(long timeoutMillis) {
            return phase(Phase.SEND, timeoutMillis);
        }

        public Builder response(long timeoutMillis) {
            return phase(Phase.RESPONSE, timeoutMillis);
        }

        public Builder read(long timeoutMillis) {
            return phase(Phase.READ, timeoutMillis);
        }

        public Builder request(long timeoutMillis) {
            return phase(Phase.REQUEST, timeoutMillis);
        }

        public TimeoutOptions build() {
            return durations.isEmpty() ? NONE : new TimeoutOptions(new EnumMap<>(durations));
        }
    }

}
