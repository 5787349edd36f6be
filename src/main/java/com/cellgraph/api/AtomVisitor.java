package com.cellgraph.api;

/**
 * Double dispatch over the atom kinds. Used to build the node that matches a
 * descriptor without instance checks.
 *
 * @param <R> the result type.
 */
public interface AtomVisitor<R> {

    <T> R visitState(StateAtom<T> atom);

    <T> R visitComputed(ComputedAtom<T> atom);

    <T> R visitSafe(SafeAtom<T> atom);

    <T> R visitAsync(AsyncAtom<T> atom);

    <T> R visitEffect(EffectAtom<T> atom);
}
