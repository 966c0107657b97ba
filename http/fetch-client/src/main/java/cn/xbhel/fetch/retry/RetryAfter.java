package cn.xbhel.fetch.retry;

import java.time.Clock;
import java.util.regex.Pattern;

import javax.annotation.Nullable;

import org.apache.http.client.utils.DateUtils;

/**
 * Parses {@code Retry-After} header values.
 *
 * @author xbhel
 */
public final class RetryAfter {

    private static final Pattern DELAY_SECONDS = Pattern.compile("\\d+");

    private RetryAfter() {
    }

    /**
     * Converts a header value, delay-seconds or an HTTP date, to milliseconds from
     * now. Returns {@code null} when the value is missing or unparsable, and 0 for a
     * date in the past.
     */
    @Nullable
    public static Long parse(@Nullable String value, Clock clock) {
        if (value == null || value.isBlank()) {
            return null;
        }
        var text = value.trim();
        if (DELAY_SECONDS.matcher(text).matches()) {
            try {
                return Math.multiplyExact(Long.parseLong(text), 1000L);
            } catch (NumberFormatException | ArithmeticException e) {
                // more seconds than a long holds
                return Long.MAX_VALUE;
            }
        }
        var date = DateUtils.parseDate(text);
        if (date == null) {
            return null;
        }
        return Math.max(0L, date.getTime() - clock.millis());
    }

}
