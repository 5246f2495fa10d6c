package com.nas.fgraph.api;

/**
 * No classification or calculator branch matches a node. Never defaulted:
 * a wrong guess would corrupt every downstream channel count.
 */
public class UnsupportedNodeException extends GraphAnnotationException {
    private final String nodeName;
    private final OpKind opKind;
    private final String target;

    public UnsupportedNodeException(String nodeName, OpKind opKind, String target) {
        super("Unsupported node " + nodeName + " (op: " + opKind.traceName() + ", target: " + target + ")");
        this.nodeName = nodeName;
        this.opKind = opKind;
        this.target = target;
    }

    public String nodeName() {
        return nodeName;
    }

    public OpKind opKind() {
        return opKind;
    }

    public String target() {
        return target;
    }
}
