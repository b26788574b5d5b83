package com.mycelium.resilience.model;

/** Thrown when deleting (or looking up) an edge or node that does not exist. */
public class NotFoundException extends MyceliumException {
    private final String identifier;

    public NotFoundException(String identifier) {
        super("Not found: " + identifier);
        this.identifier = identifier;
    }

    public String identifier() {
        return identifier;
    }
}
