package cn.xbhel.fetch.retry;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import javax.annotation.Nullable;

import cn.xbhel.fetch.transport.ErrorCodes;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Retry settings of a request. Every option left unset falls back to its default.
 *
 * <pre>
 * RetryOptions.builder()
 *         .limit(5)
 *         .methods(Set.of("GET", "POST"))
 *         .calculateDelay(RetryDelayStrategy.of(ctx -> ctx.getAttemptCount() &lt; 3 ? 100 : 0))
 *         .build();
 * </pre>
 *
 * @author xbhel
 */
@Getter
@ToString
@EqualsAndHashCode
public final class RetryOptions {

    public static final int DEFAULT_LIMIT = 2;
    public static final Set<String> DEFAULT_METHODS = Set.of(
            "GET", "PUT", "HEAD", "DELETE", "OPTIONS", "TRACE");
    public static final Set<Integer> DEFAULT_STATUS_CODES = Set.of(
            408, // Request Timeout
            413, // Payload Too Large
            429, // Too Many Requests
            500, // Internal Server Error
            502, // Bad Gateway
            503, // Service Unavailable
            504, // Gateway Timeout
            521, // Web Server Is Down
            522, // Connection Timed Out
            524 // A Timeout Occurred
    );
    public static final Set<String> DEFAULT_ERROR_CODES = Set.of(
            ErrorCodes.ETIMEDOUT,
            ErrorCodes.ECONNRESET,
            ErrorCodes.EADDRINUSE,
            ErrorCodes.ECONNREFUSED,
            ErrorCodes.EPIPE,
            ErrorCodes.ENOTFOUND,
            ErrorCodes.ENETUNREACH,
            ErrorCodes.EAI_AGAIN);

    private static final RetryOptions DEFAULTS = builder().build();

    /** The maximum number of retries, 0 disables retrying. */
    private final int limit;
    private final Set<String> methods;
    private final Set<Integer> statusCodes;
    private final Set<String> errorCodes;
    /**
     * The longest {@code Retry-After} that is honoured, in milliseconds. When
     * {@code null} it is derived from the request timeouts.
     */
    @Nullable
    private final Long maxRetryAfter;
    private final RetryDelayStrategy calculateDelay;

    @Builder(toBuilder = true)
    private RetryOptions(@Nullable Integer limit, @Nullable Set<String> methods, @Nullable Set<Integer> statusCodes,
            @Nullable Set<String> errorCodes, @Nullable Long maxRetryAfter,
            @Nullable RetryDelayStrategy calculateDelay) {
        this.limit = Optional.ofNullable(limit).orElse(DEFAULT_LIMIT);
        if (this.limit < 0) {
            throw new IllegalArgumentException("The retry limit must not be negative, got " + this.limit);
        }
        if (maxRetryAfter != null && maxRetryAfter < 0) {
            throw new IllegalArgumentException("The maxRetryAfter must not be negative, got " + maxRetryAfter);
        }
        this.methods = Optional.ofNullable(methods)
                .map(values -> values.stream()
                        .map(method -> method.toUpperCase(Locale.ROOT))
                        .collect(Collectors.toUnmodifiableSet()))
                .orElse(DEFAULT_METHODS);
        this.statusCodes = Optional.ofNullable(statusCodes).map(Set::copyOf).orElse(DEFAULT_STATUS_CODES);
        this.errorCodes = Optional.ofNullable(errorCodes)
                .map(values -> Collections.unmodifiableSet(new LinkedHashSet<>(values)))
                .orElse(DEFAULT_ERROR_CODES);
        this.maxRetryAfter = maxRetryAfter;
        this.calculateDelay = Optional.ofNullable(calculateDelay).orElse(DefaultRetryDelayStrategy.INSTANCE);
    }

    public static RetryOptions defaults() {
        return DEFAULTS;
    }

    /**
     * The numeric shorthand: default options with the given retry limit.
     */
    public static RetryOptions ofLimit(int limit) {
        return builder().limit(limit).build();
    }

    public static RetryOptions disabled() {
        return builder().limit(0).calculateDelay(NoRetryDelayStrategy.INSTANCE).build();
    }

    public boolean isEnabled() {
        return limit > 0;
    }

}
