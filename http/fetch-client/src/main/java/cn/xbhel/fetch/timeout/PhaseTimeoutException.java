package cn.xbhel.fetch.timeout;

import cn.xbhel.fetch.HttpExecutionException;
import cn.xbhel.fetch.transport.ErrorCodes;
import lombok.Getter;

/**
 * Raised when a phase deadline elapses. The attempt has been aborted by the time
 * the exception is observed.
 *
 * @author xbhel
 */
@Getter
public class PhaseTimeoutException extends HttpExecutionException {

    private final Phase phase;
    private final long timeoutMillis;

    public PhaseTimeoutException(Phase phase, long timeoutMillis) {
        super(ErrorCodes.ETIMEDOUT, String.format("Timeout awaiting '%s' for %dms", phase, timeoutMillis), null, null);
        this.phase = phase;
        this.timeoutMillis = timeoutMillis;
    }

}
