package com.cellgraph.testing;

import com.cellgraph.api.GraphScheduler;
import com.cellgraph.api.Subscription;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Deterministic scheduler for tests: tasks run inline, timers fire only when
 * virtual time is advanced.
 */
public final class ManualScheduler implements GraphScheduler {
    private final List<Timer> timers = new ArrayList<>();
    private long nowNanos;
    private long sequence;

    private static final class Timer {
        final Runnable task;
        final long dueNanos;
        final long seq;
        boolean cancelled;

        Timer(Runnable task, long dueNanos, long seq) {
            this.task = task;
            this.dueNanos = dueNanos;
            this.seq = seq;
        }
    }

    @Override
    public void execute(Runnable task) {
        task.run();
    }

    @Override
    public Subscription schedule(Runnable task, Duration delay) {
        Timer timer = new Timer(task, nowNanos + delay.toNanos(), sequence++);
        timers.add(timer);
        return () -> timer.cancelled = true;
    }

    /** Moves virtual time forward, firing every timer that falls due, in order. */
    public void advance(Duration duration) {
        long target = nowNanos + duration.toNanos();
        while (true) {
            Timer next = timers.stream()
                    .filter(t -> !t.cancelled && t.dueNanos <= target)
                    .min(Comparator.<Timer>comparingLong(t -> t.dueNanos).thenComparingLong(t -> t.seq))
                    .orElse(null);
            if (next == null)
                break;
            timers.remove(next);
            nowNanos = next.dueNanos;
            next.task.run();
        }
        nowNanos = target;
        timers.removeIf(t -> t.cancelled);
    }

    /** Number of timers neither fired nor cancelled. */
    public int pendingTimers() {
        return (int) timers.stream().filter(t -> !t.cancelled).count();
    }
}
