package io.surfworks.rangeforge.core.range.scaledint;

import io.surfworks.rangeforge.core.graph.Graph;
import io.surfworks.rangeforge.core.graph.NodeEvaluator;
import io.surfworks.rangeforge.core.range.Range;
import io.surfworks.rangeforge.core.range.RangeInfo;
import io.surfworks.rangeforge.core.range.RangeStore;
import io.surfworks.rangeforge.core.range.rules.RangeContext;
import io.surfworks.rangeforge.core.range.rules.RangeRuleRegistry;
import io.surfworks.rangeforge.core.tensor.Tensor;

/**
 * State shared by the scaled-integer rules: the completed real-valued store,
 * plus what is needed to rerun real-valued rules in the integer domain.
 */
public final class ScaledIntegerContext {

    private final Graph graph;
    private final RangeStore store;
    private final RangeRuleRegistry rangeRules;
    private final NodeEvaluator evaluator;
    private final int channelAxis;

    public ScaledIntegerContext(Graph graph, RangeStore store, RangeRuleRegistry rangeRules,
                                NodeEvaluator evaluator, int channelAxis) {
        this.graph = graph;
        this.store = store;
        this.rangeRules = rangeRules;
        this.evaluator = evaluator;
        this.channelAxis = channelAxis;
    }

    public Graph graph() {
        return graph;
    }

    public RangeInfo info(String tensorName) {
        return store.require(tensorName);
    }

    public RangeRuleRegistry rangeRules() {
        return rangeRules;
    }

    /**
     * Context for running a real-valued rule over a scratch store.
     */
    public RangeContext rangeContext(RangeStore scratch) {
        return new RangeContext(graph, evaluator, scratch, channelAxis);
    }

    /**
     * Record integer info for a tensor. Multi-element scale and bias are
     * flattened to one value per channel, single-element ones become scalars.
     */
    public void attach(String tensorName, Range intRange, Tensor scale, Tensor bias) {
        store.attachIntegerInfo(tensorName, intRange, scale.squeezeToChannels(), bias.squeezeToChannels());
    }
}
