package cn.xbhel.fetch.timeout;

import java.util.EnumMap;
import java.util.Map;

import javax.annotation.Nullable;

import org.apache.http.concurrent.Cancellable;

import cn.xbhel.fetch.transport.TransportListener;
import lombok.extern.slf4j.Slf4j;

/**
 * Arms and disarms the phase timers of one network exchange as transport events
 * arrive.
 * <p>
 * At most one timer per phase is armed at any time. The first timer to fire wins:
 * it records a {@link PhaseTimeoutException}, disarms every other timer and runs
 * the abort action. Events received after the exchange has completed or timed out
 * are ignored, and so are fires of timers that have been superseded.
 * </p>
 *
 * @author xbhel
 */
@Slf4j
public class TimeoutComposer implements TransportListener {

    private final TimeoutOptions options;
    private final TimerService timerService;
    private final Runnable abortAction;
    private final boolean secure;

    private final Map<Phase, Armed> armed = new EnumMap<>(Phase.class);
    private boolean finished;
    @Nullable
    private PhaseTimeoutException timeout;

    public TimeoutComposer(TimeoutOptions options, TimerService timerService, Runnable abortAction,
            boolean secure) {
        this.options = options;
        this.timerService = timerService;
        this.abortAction = abortAction;
        this.secure = secure;
    }

    /**
     * Starts the exchange: the overall request deadline, socket inactivity and the
     * lookup phase begin counting.
     */
    public synchronized void start() {
        if (finished) {
            return;
        }
        arm(Phase.REQUEST);
        arm(Phase.SOCKET);
        arm(Phase.LOOKUP);
    }

    @Override
    public synchronized void onLookup() {
        if (touch()) {
            disarm(Phase.LOOKUP);
            arm(Phase.CONNECT);
        }
    }

    @Override
    public synchronized void onConnect() {
        if (touch()) {
            disarm(Phase.CONNECT);
            if (secure) {
                arm(Phase.SECURE_CONNECT);
            }
        }
    }

    @Override
    public synchronized void onSecureConnect() {
        if (touch()) {
            disarm(Phase.SECURE_CONNECT);
        }
    }

    @Override
    public synchronized void onSocketReady(String connectionId) {
        if (touch()) {
            // a pooled connection skips lookup and connect entirely
            disarm(Phase.LOOKUP);
            disarm(Phase.CONNECT);
            disarm(Phase.SECURE_CONNECT);
            arm(Phase.SEND);
        }
    }

    @Override
    public synchronized void onRequestSent() {
        if (touch()) {
            disarm(Phase.SEND);
            arm(Phase.RESPONSE);
        }
    }

    @Override
    public synchronized void onResponse() {
        if (touch()) {
            disarm(Phase.RESPONSE);
            arm(Phase.READ);
        }
    }

    @Override
    public synchronized void onData(int bytes) {
        touch();
    }

    /**
     * Ends the exchange and disarms every timer. Safe to call more than once.
     */
    public synchronized void complete() {
        if (finished) {
            return;
        }
        finished = true;
        disarmAll();
    }

    @Nullable
    public synchronized PhaseTimeoutException getTimeout() {
        return timeout;
    }

    public synchronized boolean isTimedOut() {
        return timeout != null;
    }

    /**
     * Restarts the socket inactivity timer, returns {@code false} once the exchange
     * is over.
     */
    private boolean touch() {
        if (finished) {
            return false;
        }
        arm(Phase.SOCKET);
        return true;
    }

    private void arm(Phase phase) {
        var duration = options.get(phase);
        if (duration == null) {
            return;
        }
        disarm(phase);
        var token = new Armed();
        armed.put(phase, token);
        token.handle = timerService.schedule(() -> fire(phase, token), duration);
    }

    private void disarm(Phase phase) {
        var token = armed.remove(phase);
        if (token != null) {
            token.cancel();
        }
    }

    private void disarmAll() {
        armed.values().forEach(Armed::cancel);
        armed.clear();
    }

    private void fire(Phase phase, Armed token) {
        synchronized (this) {
            if (finished || armed.get(phase) != token) {
                return;
            }
            armed.remove(phase);
            finished = true;
            timeout = new PhaseTimeoutException(phase, options.get(phase));
            disarmAll();
        }
        log.debug("Phase '{}' timed out after {} ms, aborting the exchange.", phase, options.get(phase));
        abortAction.run();
    }

    private static final class Armed {

        @Nullable
        private Cancellable handle;

        void cancel() {
            if (handle != null) {
                handle.cancel();
            }
        }
    }

}
