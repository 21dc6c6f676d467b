package com.deepansh.memgraph.exception;

/** A persisted file could not be written. Reads never raise this; they recover as empty. */
public class MemoryStorageException extends MemoryGraphException {

    public MemoryStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
