package com.cellgraph.node;

import com.cellgraph.api.Atom;
import com.cellgraph.api.AsyncAtom;
import com.cellgraph.api.AsyncValue;
import com.cellgraph.api.CircularDependencyException;
import com.cellgraph.api.Watch;
import com.cellgraph.engine.GraphContext;
import lombok.extern.log4j.Log4j2;

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

/**
 * A derived node backed by an asynchronous operation.
 *
 * Every run bumps a generation counter, publishes {@link AsyncValue.Loading}
 * carrying the previous data, and starts the compute function. Its completion
 * is handed to the context's scheduler and committed only if no newer run has
 * started in the meantime; older completions are discarded.
 *
 * Runs start on activation and on every upstream change. Errors, whether
 * thrown synchronously or completing the stage exceptionally, are published as
 * {@link AsyncValue.Failure} and never reach the reader.
 *
 * @param <T> The value type the operation completes with.
 */
@Log4j2
public final class AsyncComputeNode<T> extends Node<AsyncValue<T>> implements Dependent {
    private final AsyncAtom<T> async;
    private final DependencyTracker tracker;
    private long generation;
    private boolean dirty;

    public AsyncComputeNode(AsyncAtom<T> atom, GraphContext context, NodeResolver resolver) {
        super(atom, context);
        this.async = atom;
        this.tracker = new DependencyTracker(this, context, resolver);
    }

    @Override
    public void activate() {
        run();
    }

    @Override
    public AsyncValue<T> value() {
        return storedValue();
    }

    @Override
    public void markStale() {
        dirty = true;
    }

    /** Async values only change when a run completes, never on read. */
    @Override
    public boolean markMaybeStale() {
        return false;
    }

    @Override
    public void onDependencyChanged() {
        if (dirty && !isDisposed())
            run();
    }

    public long generation() {
        return generation;
    }

    @Override
    public Set<Atom<?>> dependencies() {
        return tracker.dependencies();
    }

    private void run() {
        // A cycle fails here, before the node is touched
        CompletionStage<T> stage = tracker.evaluate(this::start);
        final long gen = ++generation;
        dirty = false;
        AsyncValue<T> current = peek();
        publish(AsyncValue.loading(current == null ? null : current.valueOrNull()));
        context.listener().onRecompute(atom, tracker.dependencies(), tracker.lastDurationNanos(), true);
        stage.whenComplete((value, error) -> context.scheduler().execute(() -> complete(gen, value, error)));
    }

    private CompletionStage<T> start(Watch watch) {
        try {
            CompletionStage<T> stage = async.computeFn().compute(watch);
            if (stage == null)
                return CompletableFuture.failedFuture(
                        new NullPointerException("Async atom '" + atom.name() + "' returned no stage"));
            return stage;
        } catch (CircularDependencyException | VirtualMachineError e) {
            throw e;
        } catch (Throwable t) {
            return CompletableFuture.failedFuture(t);
        }
    }

    private void complete(long gen, T value, Throwable error) {
        if (isDisposed())
            return;
        if (gen != generation) {
            log.debug("Discarding stale result of '{}': generation {} superseded by {}", atom.name(), gen,
                    generation);
            context.listener().onStaleResult(atom, gen, generation);
            return;
        }
        if (error != null) {
            Throwable cause = unwrap(error);
            context.listener().onNodeError(atom, cause);
            publish(AsyncValue.failure(cause));
        } else {
            publish(AsyncValue.data(value));
        }
        context.drain();
    }

    private static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null)
            t = t.getCause();
        return t;
    }

    @Override
    public void dispose() {
        super.dispose();
        generation++;
        tracker.release();
    }
}
