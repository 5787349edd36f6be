package com.cellgraph.util;

import com.cellgraph.api.Atom;
import com.cellgraph.api.GraphListener;
import lombok.extern.log4j.Log4j2;

import java.util.Set;

/**
 * Writes graph activity to the Log4j log.
 *
 * State changes at INFO, recomputes, propagation and disposals at DEBUG, node
 * errors at ERROR (rate limited). Each category except errors can be switched
 * off.
 */
@Log4j2
public final class LoggingGraphListener implements GraphListener {
    private final ErrorRateLimiter errLimiter = new ErrorRateLimiter(log, 1000);
    private final boolean logStateChanges;
    private final boolean logRecomputes;
    private final boolean logDisposals;

    public LoggingGraphListener() {
        this(true, true, true);
    }

    public LoggingGraphListener(boolean logStateChanges, boolean logRecomputes, boolean logDisposals) {
        this.logStateChanges = logStateChanges;
        this.logRecomputes = logRecomputes;
        this.logDisposals = logDisposals;
    }

    @Override
    public void onStateChange(Atom<?> atom, Object oldValue, Object newValue) {
        if (logStateChanges)
            log.info("State '{}' changed: {} -> {}", atom.name(), oldValue, newValue);
    }

    @Override
    public void onRecompute(Atom<?> atom, Set<Atom<?>> dependencies, long durationNanos, boolean changed) {
        if (logRecomputes && log.isDebugEnabled())
            log.debug("Recomputed '{}' in {} us (changed={}, deps={})", atom.name(),
                    String.format("%.2f", durationNanos / 1000.0), changed, dependencies);
    }

    @Override
    public void onDirtyPropagation(Atom<?> source, Set<Atom<?>> affected) {
        if (logRecomputes)
            log.debug("'{}' changed, queued {}", source.name(), affected);
    }

    @Override
    public void onNodeError(Atom<?> atom, Throwable error) {
        errLimiter.log(String.format("Node '%s' failed: %s", atom.name(), error.getMessage()), null);
    }

    @Override
    public void onStaleResult(Atom<?> atom, long generation, long currentGeneration) {
        if (logRecomputes)
            log.debug("Stale result of '{}' dropped (generation {} < {})", atom.name(), generation,
                    currentGeneration);
    }

    @Override
    public void onNodeDisposed(Atom<?> atom) {
        if (logDisposals)
            log.debug("Node '{}' disposed", atom.name());
    }
}
