package com.nas.fgraph.calc;

import java.util.List;

/** Channel count of a channel-axis concatenation: the sum of its inputs. */
public record ConcatFeaturesCalculator(List<FeaturesCalculator> inputs) implements FeaturesCalculator {

    public ConcatFeaturesCalculator {
        inputs = List.copyOf(inputs);
        if (inputs.isEmpty())
            throw new IllegalArgumentException("Concatenation needs at least one input");
    }

    @Override
    public int features() {
        int sum = 0;
        for (int i = 0; i < inputs.size(); i++)
            sum += inputs.get(i).features();
        return sum;
    }
}
