package com.mycelium.resilience.model;

/** Thrown when inserting a node or edge whose identifier is already taken. */
public class DuplicateIdentifierException extends MyceliumException {
    private final String identifier;

    public DuplicateIdentifierException(String identifier) {
        super("Duplicate identifier: " + identifier);
        this.identifier = identifier;
    }

    public String identifier() {
        return identifier;
    }
}
