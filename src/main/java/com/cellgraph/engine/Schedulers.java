package com.cellgraph.engine;

import com.cellgraph.api.GraphScheduler;
import com.cellgraph.api.Subscription;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Standard {@link GraphScheduler} implementations.
 */
public final class Schedulers {
    private Schedulers() {
        // Utility class
    }

    /**
     * Runs tasks on the calling thread. Timers never fire on a thread of their
     * own: once due, they run on the thread driving the graph the next time a
     * container operation finishes.
     *
     * Each call returns a new instance; it must not be shared between
     * container trees driven from different threads.
     */
    public static GraphScheduler direct() {
        return new DirectScheduler();
    }

    static final class DirectScheduler implements GraphScheduler {
        private final List<Timer> timers = new ArrayList<>();

        @Override
        public void execute(Runnable task) {
            task.run();
        }

        @Override
        public Subscription schedule(Runnable task, Duration delay) {
            Timer timer = new Timer(System.nanoTime() + delay.toNanos(), task);
            timers.add(timer);
            return () -> timers.remove(timer);
        }

        @Override
        public void runDueTimers() {
            if (timers.isEmpty())
                return;
            long now = System.nanoTime();
            List<Timer> due = new ArrayList<>();
            for (Iterator<Timer> it = timers.iterator(); it.hasNext();) {
                Timer t = it.next();
                if (now - t.deadline >= 0) {
                    due.add(t);
                    it.remove();
                }
            }
            for (Timer t : due)
                t.task.run();
        }

        int pendingTimers() {
            return timers.size();
        }
    }

    private static final class Timer {
        final long deadline;
        final Runnable task;

        Timer(long deadline, Runnable task) {
            this.deadline = deadline;
            this.task = task;
        }
    }
}
