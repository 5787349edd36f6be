package com.cellgraph.disruptor;

import com.cellgraph.api.GraphScheduler;
import com.cellgraph.api.Subscription;
import com.cellgraph.util.ErrorRateLimiter;
import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.LifecycleAware;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import lombok.extern.log4j.Log4j2;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Single-threaded graph executor backed by an LMAX Disruptor ring buffer.
 *
 * <h3>Workflow</h3>
 * <ol>
 * <li>Any thread publishes a task into the ring buffer (multi-producer).</li>
 * <li>The Disruptor sequences the tasks.</li>
 * <li>One consumer thread, the graph thread, runs them in order.</li>
 * </ol>
 *
 * Used as a container's {@link GraphScheduler}, it brings async completions
 * and delayed-dispose timers back onto the graph thread. Application code
 * joins in through {@link #execute(Runnable)} or {@link #submit(Callable)}, so
 * every read, write and recomputation of a container tree happens on one
 * thread without locks.
 *
 * A task submitted from the graph thread itself runs inline.
 */
@Log4j2
public final class GraphReactor implements GraphScheduler, AutoCloseable {
    public static final int DEFAULT_BUFFER_SIZE = 1024;

    private final ErrorRateLimiter errLimiter = new ErrorRateLimiter(log, 1000);
    private final Disruptor<GraphTask> disruptor;
    private final RingBuffer<GraphTask> ringBuffer;
    private final ScheduledExecutorService timer;
    private final TaskHandler handler = new TaskHandler();
    private volatile boolean closed;

    public GraphReactor() {
        this(DEFAULT_BUFFER_SIZE);
    }

    /**
     * @param bufferSize Ring buffer size, must be a power of 2.
     */
    public GraphReactor(int bufferSize) {
        this.disruptor = new Disruptor<>(
                GraphTask::new,
                bufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BlockingWaitStrategy());
        this.disruptor.handleEventsWith(handler);
        this.ringBuffer = disruptor.start();
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cellgraph-reactor-timer");
            t.setDaemon(true);
            return t;
        });
    }

    /** Returns true if the calling thread is the graph thread. */
    public boolean isGraphThread() {
        return Thread.currentThread() == handler.graphThread;
    }

    @Override
    public void execute(Runnable task) {
        if (closed) {
            log.warn("Reactor closed, dropping task {}", task);
            return;
        }
        if (isGraphThread()) {
            runSafely(task);
            return;
        }
        long seq = ringBuffer.next();
        try {
            GraphTask slot = ringBuffer.get(seq);
            slot.set(task, seq);
        } finally {
            ringBuffer.publish(seq);
        }
    }

    @Override
    public Subscription schedule(Runnable task, Duration delay) {
        ScheduledFuture<?> future = timer.schedule(() -> execute(task), delay.toNanos(), TimeUnit.NANOSECONDS);
        return () -> future.cancel(false);
    }

    /**
     * Runs {@code call} on the graph thread.
     *
     * @return a future completed with the call's result or error.
     */
    public <V> CompletableFuture<V> submit(Callable<V> call) {
        CompletableFuture<V> future = new CompletableFuture<>();
        execute(() -> {
            try {
                future.complete(call.call());
            } catch (Exception e) {
                future.completeExceptionally(e);
            }
        });
        if (closed && !future.isDone())
            future.completeExceptionally(new IllegalStateException("Reactor is closed"));
        return future;
    }

    /**
     * Stops the timer and drains the ring buffer before halting the graph
     * thread. Called from the graph thread itself, it halts without draining.
     */
    @Override
    public void close() {
        if (closed)
            return;
        closed = true;
        timer.shutdownNow();
        if (isGraphThread())
            disruptor.halt();
        else
            disruptor.shutdown();
        log.debug("Reactor stopped");
    }

    private void runSafely(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            errLimiter.log(String.format("Graph task failed: %s", e.getMessage()), e);
        }
    }

    private final class TaskHandler implements EventHandler<GraphTask>, LifecycleAware {
        private volatile Thread graphThread;

        @Override
        public void onEvent(GraphTask event, long sequence, boolean endOfBatch) {
            Runnable task = event.task();
            event.clear();
            if (task != null)
                runSafely(task);
        }

        @Override
        public void onStart() {
            graphThread = Thread.currentThread();
        }

        @Override
        public void onShutdown() {
            graphThread = null;
        }
    }
}
