package cn.xbhel.fetch.timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.apache.http.concurrent.Cancellable;

/**
 * A {@link TimerService} driven by hand: timers fire only when the test advances
 * the clock.
 */
public class ManualTimerService implements TimerService {

    private final List<Timer> timers = new ArrayList<>();
    private long now;

    @Override
    public synchronized Cancellable schedule(Runnable task, long delayMillis) {
        var timer = new Timer(task, now + delayMillis, delayMillis);
        timers.add(timer);
        return () -> {
            synchronized (ManualTimerService.this) {
                return timers.remove(timer);
            }
        };
    }

    /**
     * Moves the clock forward and runs every timer that became due, outside the
     * lock, in due order.
     */
    public void advance(long millis) {
        List<Timer> due;
        synchronized (this) {
            now += millis;
            due = timers.stream()
                    .filter(timer -> timer.dueAt <= now)
                    .sorted((a, b) -> Long.compare(a.dueAt, b.dueAt))
                    .collect(Collectors.toList());
            timers.removeAll(due);
        }
        due.forEach(timer -> timer.task.run());
    }

    public synchronized int pending() {
        return timers.size();
    }

    /**
     * The delays of the pending timers, in scheduling order.
     */
    public synchronized List<Long> pendingDelays() {
        return timers.stream().map(timer -> timer.delay).collect(Collectors.toList());
    }

    private static final class Timer {

        private final Runnable task;
        private final long dueAt;
        private final long delay;

        Timer(Runnable task, long dueAt, long delay) {
            this.task = task;
            this.dueAt = dueAt;
            this.delay = delay;
        }
    }

}
