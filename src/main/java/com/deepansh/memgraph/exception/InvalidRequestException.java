package com.deepansh.memgraph.exception;

/** Caller input that cannot be acted on: bad weights, malformed keys, negative depth. */
public class InvalidRequestException extends MemoryGraphException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
