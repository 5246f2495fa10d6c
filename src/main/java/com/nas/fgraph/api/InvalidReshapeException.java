package com.nas.fgraph.api;

/**
 * A flatten or squeeze node targets the batch dimension, addresses a dimension
 * outside its input, or lacks a required dimension argument.
 */
public class InvalidReshapeException extends GraphAnnotationException {
    private final String nodeName;

    public InvalidReshapeException(String nodeName, String message) {
        super(message + " (node: " + nodeName + ")");
        this.nodeName = nodeName;
    }

    public String nodeName() {
        return nodeName;
    }
}
