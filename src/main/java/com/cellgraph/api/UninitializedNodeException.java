package com.cellgraph.api;

/**
 * Thrown when a node's value is read before it has ever been computed.
 */
public class UninitializedNodeException extends IllegalStateException {

    public UninitializedNodeException(String atomName) {
        super("Node '" + atomName + "' accessed before initialization");
    }
}
