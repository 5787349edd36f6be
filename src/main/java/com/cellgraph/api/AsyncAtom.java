package com.cellgraph.api;

/**
 * Descriptor of a derived value produced by an asynchronous operation. Read as
 * an {@link AsyncValue}: loading, data or failure.
 *
 * @param <T> the value type the operation completes with.
 */
public final class AsyncAtom<T> extends Atom<AsyncValue<T>> {
    private final AsyncComputeFn<T> computeFn;
    private final DisposePolicy disposePolicy;

    AsyncAtom(String name, AsyncComputeFn<T> computeFn, DisposePolicy disposePolicy) {
        super(name, "async");
        this.computeFn = computeFn;
        this.disposePolicy = disposePolicy;
    }

    public AsyncComputeFn<T> computeFn() {
        return computeFn;
    }

    @Override
    public DisposePolicy disposePolicy() {
        return disposePolicy;
    }

    @Override
    public <R> R accept(AtomVisitor<R> visitor) {
        return visitor.visitAsync(this);
    }
}
