package io.surfworks.rangeforge.core.range.rules;

import io.surfworks.rangeforge.core.graph.Graph;
import io.surfworks.rangeforge.core.graph.NodeEvaluator;
import io.surfworks.rangeforge.core.range.Range;
import io.surfworks.rangeforge.core.range.RangeStore;

/**
 * Everything a {@link RangeRule} may read.
 *
 * @param graph       The graph being analyzed
 * @param evaluator   Single-node evaluator used for sampling
 * @param store       Ranges resolved so far
 * @param channelAxis Channel axis of activations
 */
public record RangeContext(Graph graph, NodeEvaluator evaluator, RangeStore store, int channelAxis) {

    public Range rangeOf(String tensorName) {
        return store.require(tensorName).range();
    }

    /**
     * Same graph and evaluator over a different store.
     */
    public RangeContext withStore(RangeStore other) {
        return new RangeContext(graph, evaluator, other, channelAxis);
    }
}
