package com.deepansh.memgraph.exception;

public class EntityNotFoundException extends MemoryGraphException {

    public EntityNotFoundException(String message) {
        super(message);
    }
}
