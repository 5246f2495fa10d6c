package com.nas.fgraph.api;

/**
 * Base class of the errors raised while building or annotating a model graph.
 * Annotation passes never catch these; they abort the pass.
 */
public class GraphAnnotationException extends RuntimeException {

    public GraphAnnotationException(String message) {
        super(message);
    }

    public GraphAnnotationException(String message, Throwable cause) {
        super(message, cause);
    }
}
