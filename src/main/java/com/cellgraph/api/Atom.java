package com.cellgraph.api;

import com.cellgraph.util.Cutoffs;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiPredicate;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * An immutable descriptor naming one slot of reactive state.
 *
 * Atoms carry no runtime value. A container materializes a node for an atom on
 * first resolution and keeps it for the atom's lifetime in that container.
 * Identity is the object reference: create an atom once and share it, two atoms
 * built from the same arguments are unrelated slots.
 *
 * The name is only used for diagnostics (logging, graph dumps, snapshots) and
 * need not be unique.
 *
 * @param <T> The type of value read from this atom.
 */
public abstract class Atom<T> {
    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final String name;

    Atom(String name, String kind) {
        this.name = name != null ? name : kind + "#" + SEQUENCE.incrementAndGet();
    }

    /** Returns the diagnostic name of this atom. */
    public final String name() {
        return name;
    }

    /** Returns the lifecycle policy of the node built for this atom. */
    public abstract DisposePolicy disposePolicy();

    public abstract <R> R accept(AtomVisitor<R> visitor);

    // ── Selectors ────────────────────────────────────────────────

    /**
     * Derives a lazy atom holding one projection of this atom's value.
     * Downstream consumers are only notified when the projection changes.
     */
    public <R> ComputedAtom<R> select(Function<? super T, ? extends R> selector) {
        return Atoms.computed(name + ".select", watch -> selector.apply(watch.get(this)));
    }

    /**
     * Same as {@link #select(Function)} but compares projections with
     * {@code equals} instead of {@link Object#equals(Object)}.
     */
    public <R> ComputedAtom<R> select(Function<? super T, ? extends R> selector,
            BiPredicate<? super R, ? super R> equals) {
        return Atoms.computed(name + ".select", watch -> selector.apply(watch.get(this)),
                DisposePolicy.KEEP_ALIVE, Cutoffs.by(equals));
    }

    /**
     * Derives a lazy atom holding several projections at once. Changes when any
     * of them changes.
     */
    public <R> ComputedAtom<List<R>> selectMany(List<? extends Function<? super T, ? extends R>> selectors) {
        List<Function<? super T, ? extends R>> copy = List.copyOf(selectors);
        return Atoms.computed(name + ".selectMany", watch -> {
            T value = watch.get(this);
            List<R> out = new ArrayList<>(copy.size());
            for (Function<? super T, ? extends R> s : copy)
                out.add(s.apply(value));
            return Collections.unmodifiableList(out);
        });
    }

    /**
     * Derives a lazy atom that holds this atom's value while {@code predicate}
     * accepts it, and is empty otherwise.
     */
    public ComputedAtom<Optional<T>> where(Predicate<? super T> predicate) {
        return Atoms.computed(name + ".where", watch -> {
            T value = watch.get(this);
            return predicate.test(value) ? Optional.ofNullable(value) : Optional.empty();
        });
    }

    @Override
    public String toString() {
        return name;
    }
}
