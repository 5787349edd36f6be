package com.cellgraph.util;

import com.cellgraph.api.Atom;
import com.cellgraph.api.GraphListener;

import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A listener that tracks recomputation metrics.
 *
 * <p>
 * Captures:
 * <ul>
 * <li><b>Latency:</b> Min, Max, Average compute time (in nanoseconds).</li>
 * <li><b>Workload:</b> Total recomputes, how many produced a change, and a
 * per-atom count.</li>
 * <li><b>Failures:</b> Node errors and discarded async results.</li>
 * </ul>
 */
public final class RecomputeStatsListener implements GraphListener {
    private final Map<Atom<?>, Long> perAtom = new IdentityHashMap<>();
    private long totalRecomputes, changedRecomputes, totalLatencyNanos;
    private long minLatencyNanos = Long.MAX_VALUE, maxLatencyNanos = Long.MIN_VALUE;
    private long errors, staleResults, stateChanges;

    @Override
    public void onRecompute(Atom<?> atom, Set<Atom<?>> dependencies, long durationNanos, boolean changed) {
        totalRecomputes++;
        if (changed)
            changedRecomputes++;
        totalLatencyNanos += durationNanos;
        if (durationNanos < minLatencyNanos)
            minLatencyNanos = durationNanos;
        if (durationNanos > maxLatencyNanos)
            maxLatencyNanos = durationNanos;
        perAtom.merge(atom, 1L, Long::sum);
    }

    @Override
    public void onStateChange(Atom<?> atom, Object oldValue, Object newValue) {
        stateChanges++;
    }

    @Override
    public void onNodeError(Atom<?> atom, Throwable error) {
        errors++;
    }

    @Override
    public void onStaleResult(Atom<?> atom, long generation, long currentGeneration) {
        staleResults++;
    }

    public long recomputeCount(Atom<?> atom) {
        return perAtom.getOrDefault(atom, 0L);
    }

    public long totalRecomputes() {
        return totalRecomputes;
    }

    public long changedRecomputes() {
        return changedRecomputes;
    }

    public long stateChanges() {
        return stateChanges;
    }

    public long errors() {
        return errors;
    }

    public long staleResults() {
        return staleResults;
    }

    public double avgLatencyNanos() {
        return totalRecomputes > 0 ? (double) totalLatencyNanos / totalRecomputes : 0;
    }

    public double avgLatencyMicros() {
        return avgLatencyNanos() / 1000.0;
    }

    public long minLatencyNanos() {
        return minLatencyNanos == Long.MAX_VALUE ? 0 : minLatencyNanos;
    }

    public long maxLatencyNanos() {
        return maxLatencyNanos == Long.MIN_VALUE ? 0 : maxLatencyNanos;
    }

    public void reset() {
        perAtom.clear();
        totalRecomputes = 0;
        changedRecomputes = 0;
        totalLatencyNanos = 0;
        minLatencyNanos = Long.MAX_VALUE;
        maxLatencyNanos = Long.MIN_VALUE;
        errors = 0;
        staleResults = 0;
        stateChanges = 0;
    }

    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-20s | %10s | %10s | %10s | %10s\n", "Metric", "Value", "Avg (us)", "Min (us)",
                "Max (us)"));
        sb.append("------------------------------------------------------------------------------\n");
        sb.append(String.format("%-20s | %10d | %10.2f | %10.2f | %10.2f\n",
                "Recomputes",
                totalRecomputes,
                avgLatencyMicros(),
                minLatencyNanos() / 1000.0,
                maxLatencyNanos() / 1000.0));
        sb.append(String.format("%-20s | %10d |\n", "Changed", changedRecomputes));
        sb.append(String.format("%-20s | %10d |\n", "State changes", stateChanges));
        sb.append(String.format("%-20s | %10d |\n", "Errors", errors));
        sb.append(String.format("%-20s | %10d |\n", "Stale results", staleResults));
        for (Map.Entry<Atom<?>, Long> e : perAtom.entrySet())
            sb.append(String.format("  %-18s | %10d |\n", e.getKey().name(), e.getValue()));
        return sb.toString();
    }
}
