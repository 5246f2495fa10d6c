package com.nas.fgraph.calc;

/** A fixed channel count, set by a features-defining node. */
public record ConstFeaturesCalculator(int features) implements FeaturesCalculator {

    public ConstFeaturesCalculator {
        if (features <= 0)
            throw new IllegalArgumentException("Channel count must be positive: " + features);
    }
}
