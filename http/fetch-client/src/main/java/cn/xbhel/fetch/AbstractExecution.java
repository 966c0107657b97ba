package cn.xbhel.fetch;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;

import javax.annotation.Nullable;

import org.apache.http.client.methods.HttpUriRequest;

import cn.xbhel.fetch.retry.ExecutionState;
import cn.xbhel.fetch.timeout.TimeoutComposer;
import cn.xbhel.fetch.timeout.TimerService;
import cn.xbhel.util.ThreadUtils;

/**
 * The cancellable lifecycle shared by buffered executions and streams.
 * <p>
 * At most one network exchange and one wait are active at any time. Cancelling
 * disarms the timers of the active exchange, aborts it and interrupts the wait;
 * the execution then ends with a {@link RequestCancelledException}.
 * </p>
 *
 * @author xbhel
 */
public abstract class AbstractExecution {

    protected final HttpRequest request;
    protected final TimerService timerService;

    private final CompletableFuture<Void> cancellation = new CompletableFuture<>();
    @Nullable
    private volatile HttpUriRequest activeRequest;
    @Nullable
    private volatile TimeoutComposer activeComposer;
    @Nullable
    private volatile Future<?> pendingWait;
    private volatile ExecutionState state = ExecutionState.ATTEMPTING;

    protected AbstractExecution(HttpRequest request, TimerService timerService) {
        this.request = request;
        this.timerService = timerService;
    }

    public HttpRequest getRequest() {
        return request;
    }

    public ExecutionState getState() {
        return state;
    }

    protected void setState(ExecutionState state) {
        this.state = state;
    }

    public boolean isCancelled() {
        return cancellation.isDone();
    }

    /**
     * Cancels the execution. Has no effect once the execution is over or already
     * cancelled.
     */
    public void cancel() {
        if (state.isTerminal() || !cancellation.complete(null)) {
            return;
        }
        var composer = activeComposer;
        if (composer != null) {
            composer.complete();
        }
        var exchange = activeRequest;
        if (exchange != null) {
            exchange.abort();
        }
        var wait = pendingWait;
        if (wait != null) {
            wait.cancel(true);
        }
    }

    /**
     * Registers the exchange about to be sent so that {@link #cancel()} can abort
     * it.
     */
    void bind(HttpUriRequest exchange, TimeoutComposer composer) {
        activeRequest = exchange;
        activeComposer = composer;
        if (isCancelled()) {
            composer.complete();
            exchange.abort();
            throw new RequestCancelledException();
        }
    }

    void unbind() {
        activeRequest = null;
        activeComposer = null;
    }

    void throwIfCancelled() {
        if (isCancelled()) {
            throw new RequestCancelledException();
        }
    }

    /**
     * Waits for the future unless the execution is cancelled first. The failure of
     * the future is rethrown as it is.
     */
    protected <T> T await(CompletableFuture<T> future) throws Exception {
        pendingWait = future;
        try {
            if (isCancelled()) {
                future.cancel(true);
                throw new RequestCancelledException();
            }
            try {
                ThreadUtils.await(CompletableFuture.anyOf(future, cancellation));
            } catch (InterruptedException e) {
                cancel();
                throw new RequestCancelledException(e);
            } catch (Exception e) {
                // cancellation takes precedence over the failure it provoked
                throwIfCancelled();
                throw e;
            }
            if (isCancelled()) {
                future.cancel(true);
                throw new RequestCancelledException();
            }
            return ThreadUtils.await(future);
        } finally {
            pendingWait = null;
        }
    }

    protected void awaitDelay(long delayMillis) throws Exception {
        await(timerService.delay(delayMillis));
    }

}
