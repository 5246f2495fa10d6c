package com.nas.fgraph.api;

/**
 * The graph structure violates the adapter's contract, e.g. a non-input node
 * without predecessors.
 */
public class MalformedGraphException extends GraphAnnotationException {

    public MalformedGraphException(String message) {
        super(message);
    }
}
