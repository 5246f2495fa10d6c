package com.nas.fgraph.api;

import java.util.Locale;

/**
 * The kind of operation a graph node performs.
 *
 * Mirrors the operation codes of a traced forward computation: placeholders
 * for network inputs, the single output sink, and calls into layers, free
 * functions or tensor methods.
 */
public enum OpKind {
    INPUT("placeholder"),
    OUTPUT("output"),
    CALL_MODULE("call_module"),
    CALL_FUNCTION("call_function"),
    CALL_METHOD("call_method");

    private final String traceName;

    OpKind(String traceName) {
        this.traceName = traceName;
    }

    /** The name used for this kind in traced graph dumps and JSON definitions. */
    public String traceName() {
        return traceName;
    }

    /**
     * Parses either the trace name ({@code call_module}) or the enum name
     * ({@code CALL_MODULE}, case-insensitive). {@code input} is accepted as an
     * alias of {@code placeholder}.
     */
    public static OpKind fromString(String s) {
        if (s == null)
            throw new IllegalArgumentException("Operation kind must not be null");
        String key = s.trim().toLowerCase(Locale.ROOT);
        if (key.equals("input"))
            return INPUT;
        for (OpKind kind : values()) {
            if (kind.traceName.equals(key) || kind.name().equalsIgnoreCase(key))
                return kind;
        }
        throw new IllegalArgumentException("Unknown operation kind: " + s);
    }
}
