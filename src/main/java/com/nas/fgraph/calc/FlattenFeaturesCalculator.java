package com.nas.fgraph.calc;

import java.util.Objects;

/**
 * Channel count after spatial dimensions are merged into the channel axis:
 * {@code upstream * multiplier}, where the multiplier is the product of the
 * merged spatial extents.
 *
 * Note this is not the static output shape: when the upstream layer is being
 * pruned, only its active channels are multiplied.
 */
public record FlattenFeaturesCalculator(FeaturesCalculator upstream, int multiplier) implements FeaturesCalculator {

    public FlattenFeaturesCalculator {
        Objects.requireNonNull(upstream, "upstream");
        if (multiplier <= 0)
            throw new IllegalArgumentException("Flatten multiplier must be positive: " + multiplier);
    }

    @Override
    public int features() {
        return upstream.features() * multiplier;
    }
}
