package cn.xbhel.fetch.timeout;

import java.io.Closeable;
import java.util.concurrent.CompletableFuture;

import org.apache.http.concurrent.Cancellable;

/**
 * Schedules cancellable one-shot timers. Phase timeouts and retry waits are
 * driven through this abstraction so tests can substitute a manual clock.
 *
 * @author xbhel
 */
public interface TimerService extends Closeable {

    /**
     * Runs the task once after the delay unless the returned handle is cancelled
     * first.
     */
    Cancellable schedule(Runnable task, long delayMillis);

    /**
     * Returns a future completed after the delay. Cancelling the future disarms
     * the underlying timer.
     */
    default CompletableFuture<Void> delay(long delayMillis) {
        var future = new CompletableFuture<Void>();
        var timer = schedule(() -> future.complete(null), delayMillis);
        future.whenComplete((ignored, error) -> {
            if (future.isCancelled()) {
                timer.cancel();
            }
        });
        return future;
    }

    @Override
    default void close() {
    }

}
