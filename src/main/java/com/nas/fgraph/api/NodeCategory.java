package com.nas.fgraph.api;

import java.util.Locale;

/**
 * Semantic category of a node with respect to its channel count.
 * Every annotated node belongs to exactly one.
 */
public enum NodeCategory {
    /** Output channels equal input channels (activations, normalization, pooling). */
    FEATURES_PROPAGATING,
    /** Output channels fixed by the layer's own configuration (convolutions, linear). */
    FEATURES_DEFINING,
    /** Element-wise combiners that require equal channels on all inputs. */
    SHARED_INPUT_FEATURES,
    FLATTEN,
    SQUEEZE,
    /** Concatenation along the channel axis. */
    FEATURES_CONCATENATE;

    /** Accepts {@code features_defining}, {@code FEATURES_DEFINING} or {@code features-defining}. */
    public static NodeCategory fromString(String s) {
        if (s == null)
            throw new IllegalArgumentException("Category must not be null");
        String key = s.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        try {
            return valueOf(key);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown node category: " + s, e);
        }
    }
}
