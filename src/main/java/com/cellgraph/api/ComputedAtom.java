package com.cellgraph.api;

/**
 * Descriptor of a synchronous derived value, recomputed lazily or eagerly.
 *
 * @param <T> the derived value type.
 */
public final class ComputedAtom<T> extends Atom<T> {
    private final ComputeFn<T> computeFn;
    private final RecomputeStrategy strategy;
    private final DisposePolicy disposePolicy;
    private final Cutoff<? super T> cutoff;

    ComputedAtom(String name, ComputeFn<T> computeFn, RecomputeStrategy strategy,
            DisposePolicy disposePolicy, Cutoff<? super T> cutoff) {
        super(name, strategy == RecomputeStrategy.EAGER ? "eager" : "computed");
        this.computeFn = computeFn;
        this.strategy = strategy;
        this.disposePolicy = disposePolicy;
        this.cutoff = cutoff;
    }

    public ComputeFn<T> computeFn() {
        return computeFn;
    }

    public RecomputeStrategy strategy() {
        return strategy;
    }

    @Override
    public DisposePolicy disposePolicy() {
        return disposePolicy;
    }

    public Cutoff<? super T> cutoff() {
        return cutoff;
    }

    @Override
    public <R> R accept(AtomVisitor<R> visitor) {
        return visitor.visitComputed(this);
    }
}
