package com.nas.fgraph.calc;

/**
 * Lazily evaluated channel count of a node's output.
 *
 * Calculators form a small expression tree mirroring the graph: a value is
 * derived only from the calculators it references, never by walking the graph
 * again. Masked layers outside this library read the value at training time,
 * so it must stay cheap to evaluate.
 */
public sealed interface FeaturesCalculator
        permits ConstFeaturesCalculator, PassthroughFeaturesCalculator,
        FlattenFeaturesCalculator, ConcatFeaturesCalculator {

    /** Returns the current number of output channels. */
    int features();
}
