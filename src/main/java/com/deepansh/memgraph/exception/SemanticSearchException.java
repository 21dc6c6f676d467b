package com.deepansh.memgraph.exception;

/** The semantic-search service could not be reached or answered with something unusable. */
public class SemanticSearchException extends MemoryGraphException {

    public SemanticSearchException(String message, Throwable cause) {
        super(message, cause);
    }
}
