package com.cellgraph.engine;

import com.cellgraph.api.CircularDependencyException;
import com.cellgraph.api.GraphListener;
import com.cellgraph.api.GraphScheduler;
import com.cellgraph.node.Dependent;
import com.cellgraph.node.Node;
import com.cellgraph.node.StateNode;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Runtime state shared by a root container and all of its child scopes.
 *
 * Responsibilities:
 * 1. Evaluation stack: the derived nodes currently computing, used to detect
 * cycles. It belongs to one container tree, not to the process, so separate
 * trees never see each other's evaluations.
 * 2. Propagation queue: dependents waiting to react to an upstream change.
 * A dependent is queued at most once; draining is deferred while any
 * evaluation is on the stack, which keeps propagation from re-entering a
 * computation.
 * 3. Batch state: nesting depth and the state cells with a deferred
 * notification.
 * 4. Configuration: scheduler, clock, listener and dispose delay.
 *
 * Thread Safety:
 * Not thread-safe. Use a single graph thread, e.g. a
 * {@link com.cellgraph.disruptor.GraphReactor}.
 */
public final class GraphContext {
    private final ContainerConfig config;

    private final Deque<Node<?>> stack = new ArrayDeque<>();
    private final Set<Node<?>> onStack = Collections.newSetFromMap(new IdentityHashMap<>());

    private final LinkedHashSet<Dependent> pending = new LinkedHashSet<>();
    private boolean draining;

    private final LinkedHashSet<StateNode<?>> deferred = new LinkedHashSet<>();
    private int batchDepth;

    public GraphContext(ContainerConfig config) {
        this.config = config;
    }

    public ContainerConfig config() {
        return config;
    }

    public GraphListener listener() {
        return config.getListener();
    }

    public GraphScheduler scheduler() {
        return config.getScheduler();
    }

    public Clock clock() {
        return config.getClock();
    }

    public Duration delayedDisposeDelay() {
        return config.getDelayedDisposeDelay();
    }

    // ── Evaluation stack ─────────────────────────────────────────

    /**
     * @throws CircularDependencyException if {@code node} is already evaluating.
     */
    public void push(Node<?> node) {
        if (onStack.contains(node))
            throw new CircularDependencyException(cyclePath(node));
        onStack.add(node);
        stack.push(node);
    }

    public void pop(Node<?> node) {
        Node<?> top = stack.pop();
        if (top != node)
            throw new IllegalStateException("Evaluation stack corrupted: expected " + node + " but found " + top);
        onStack.remove(node);
    }

    public boolean isEvaluating(Node<?> node) {
        return onStack.contains(node);
    }

    public boolean isIdle() {
        return stack.isEmpty();
    }

    /**
     * Renders the cycle closed by re-entering {@code node}, e.g.
     * {@code Circular dependency detected: a -> b -> a}.
     */
    public String cyclePath(Node<?> node) {
        List<String> path = new ArrayList<>();
        boolean inCycle = false;
        for (Iterator<Node<?>> it = stack.descendingIterator(); it.hasNext();) {
            Node<?> n = it.next();
            if (n == node)
                inCycle = true;
            if (inCycle)
                path.add(n.atom().name());
        }
        path.add(node.atom().name());
        return "Circular dependency detected: " + String.join(" -> ", path);
    }

    // ── Propagation queue ────────────────────────────────────────

    /**
     * Queues {@code dependent} and marks it stale. Every node downstream of it
     * is marked possibly stale and checks its inputs before its next read.
     */
    public void enqueue(Dependent dependent) {
        pending.add(dependent);
        dependent.markStale();
        markDownstream(dependent);
    }

    private static void markDownstream(Dependent dependent) {
        for (Dependent d : new ArrayList<>(dependent.observers())) {
            if (d.markMaybeStale())
                markDownstream(d);
        }
    }

    public int pendingCount() {
        return pending.size();
    }

    /**
     * Delivers queued changes until the queue is empty. Returns immediately if
     * a drain is already running or an evaluation is on the stack; that caller
     * finishes the work. If a dependent throws, the remaining queue is dropped
     * and the error propagates. Outside a batch, a completed drain also runs
     * the scheduler's due timers on this thread.
     */
    public void drain() {
        if (draining || !stack.isEmpty())
            return;
        draining = true;
        try {
            while (!pending.isEmpty()) {
                Iterator<Dependent> it = pending.iterator();
                Dependent next = it.next();
                it.remove();
                next.onDependencyChanged();
            }
        } catch (RuntimeException | Error e) {
            pending.clear();
            throw e;
        } finally {
            draining = false;
        }
        if (batchDepth == 0)
            scheduler().runDueTimers();
    }

    // ── Batching ─────────────────────────────────────────────────

    public boolean inBatch() {
        return batchDepth > 0;
    }

    public void beginBatch() {
        batchDepth++;
    }

    /**
     * @return true if this closed the outermost batch.
     */
    public boolean endBatch() {
        return --batchDepth == 0;
    }

    public void defer(StateNode<?> cell) {
        deferred.add(cell);
    }

    /**
     * Delivers each deferred notification once, then drains. Observers of all
     * cells are queued before the first listener runs, so listeners only see
     * the complete post-batch state.
     */
    public void flushDeferred() {
        List<StateNode<?>> cells = new ArrayList<>(deferred);
        deferred.clear();
        for (StateNode<?> cell : cells)
            cell.flushObservers();
        for (StateNode<?> cell : cells)
            cell.flushListeners();
        drain();
    }
}
