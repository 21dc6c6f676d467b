package com.deepansh.memgraph.exception;

/**
 * Base type for failures raised by the memory graph.
 * Recoverable conditions (missing files, an unreachable semantic service)
 * are absorbed where they happen and never surface as this exception.
 */
public class MemoryGraphException extends RuntimeException {

    public MemoryGraphException(String message) {
        super(message);
    }

    public MemoryGraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
