package com.cellgraph.api;

/**
 * Thrown when a derived node's evaluation re-enters itself, directly or through
 * other derived nodes. Structural and never captured into a result value.
 */
public class CircularDependencyException extends IllegalStateException {

    public CircularDependencyException(String message) {
        super(message);
    }
}
