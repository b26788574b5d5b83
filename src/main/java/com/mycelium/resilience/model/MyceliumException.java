package com.mycelium.resilience.model;

/**
 * Base class of the engine's recoverable error conditions.
 *
 * A rejected operation never leaves the graph partially mutated.
 */
public abstract class MyceliumException extends RuntimeException {

    protected MyceliumException(String message) {
        super(message);
    }
}
