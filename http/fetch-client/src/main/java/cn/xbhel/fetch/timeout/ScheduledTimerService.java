package cn.xbhel.fetch.timeout;

import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.http.concurrent.Cancellable;

/**
 * A {@link TimerService} on a single daemon scheduler thread. Timer tasks must be
 * short: they only flip state and abort transports.
 *
 * @author xbhel
 */
public class ScheduledTimerService implements TimerService {

    private static final AtomicInteger POOL_COUNTER = new AtomicInteger();

    private final ScheduledThreadPoolExecutor scheduler;

    public ScheduledTimerService() {
        var poolId = POOL_COUNTER.incrementAndGet();
        this.scheduler = new ScheduledThreadPoolExecutor(1, runnable -> {
            var thread = new Thread(runnable, "fetch-timer-" + poolId);
            thread.setDaemon(true);
            return thread;
        });
        // cancelled phase timers are re-armed on every progress event, drop them eagerly
        this.scheduler.setRemoveOnCancelPolicy(true);
    }

    @Override
    public Cancellable schedule(Runnable task, long delayMillis) {
        var future = scheduler.schedule(task, Math.max(0, delayMillis), TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }

}
