package com.cellgraph.api;

/**
 * Descriptor of a writable state cell.
 *
 * @param <T> the cell's value type.
 */
public final class StateAtom<T> extends Atom<T> {
    private final T initialValue;
    private final DisposePolicy disposePolicy;
    private final Cutoff<? super T> cutoff;

    StateAtom(String name, T initialValue, DisposePolicy disposePolicy, Cutoff<? super T> cutoff) {
        super(name, "state");
        this.initialValue = initialValue;
        this.disposePolicy = disposePolicy;
        this.cutoff = cutoff;
    }

    public T initialValue() {
        return initialValue;
    }

    @Override
    public DisposePolicy disposePolicy() {
        return disposePolicy;
    }

    public Cutoff<? super T> cutoff() {
        return cutoff;
    }

    /** Pairs this cell with a replacement initial value for a child scope. */
    public ScopeOverride<T> overrideWith(T value) {
        return new ScopeOverride<>(this, value);
    }

    @Override
    public <R> R accept(AtomVisitor<R> visitor) {
        return visitor.visitState(this);
    }
}
