package com.cellgraph.api;

import java.util.Objects;

/**
 * Replacement initial value for one atom, consumed when a child scope is built.
 * The child materializes its own state node holding {@code value}; the parent's
 * node for the same atom is untouched.
 *
 * @param atom  the overridden atom; effect channels cannot be overridden.
 * @param value the scope-local initial value.
 * @param <T>   the atom's value type.
 */
public record ScopeOverride<T>(Atom<T> atom, T value) {

    public ScopeOverride {
        Objects.requireNonNull(atom, "atom");
        if (atom instanceof EffectAtom)
            throw new IllegalArgumentException("Effect channels cannot be overridden: " + atom.name());
    }
}
