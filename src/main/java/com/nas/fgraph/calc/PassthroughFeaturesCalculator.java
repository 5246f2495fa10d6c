package com.nas.fgraph.calc;

import java.util.Objects;

/** Forwards the channel count of a single upstream calculator. */
public record PassthroughFeaturesCalculator(FeaturesCalculator upstream) implements FeaturesCalculator {

    public PassthroughFeaturesCalculator {
        Objects.requireNonNull(upstream, "upstream");
    }

    @Override
    public int features() {
        return upstream.features();
    }
}
