package com.cellgraph.node;

import com.cellgraph.api.Atom;

/**
 * Maps an atom to the live node a container resolves it to, creating the node
 * on first use.
 */
@FunctionalInterface
public interface NodeResolver {

    /**
     * @throws IllegalArgumentException if {@code atom} is an effect channel,
     *                                  which has no readable node.
     */
    <T> Node<T> resolve(Atom<T> atom);
}
