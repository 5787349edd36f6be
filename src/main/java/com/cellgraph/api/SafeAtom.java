package com.cellgraph.api;

/**
 * Descriptor of a lazy derived value whose compute errors are captured as
 * {@link Result.Failure} instead of being thrown to the reader.
 *
 * @param <T> the value type of a successful computation.
 */
public final class SafeAtom<T> extends Atom<Result<T>> {
    private final ComputeFn<T> computeFn;
    private final DisposePolicy disposePolicy;

    SafeAtom(String name, ComputeFn<T> computeFn, DisposePolicy disposePolicy) {
        super(name, "safe");
        this.computeFn = computeFn;
        this.disposePolicy = disposePolicy;
    }

    public ComputeFn<T> computeFn() {
        return computeFn;
    }

    @Override
    public DisposePolicy disposePolicy() {
        return disposePolicy;
    }

    @Override
    public <R> R accept(AtomVisitor<R> visitor) {
        return visitor.visitSafe(this);
    }
}
