package io.surfworks.rangeforge.core.range.scaledint;

import io.surfworks.rangeforge.core.graph.Graph;
import io.surfworks.rangeforge.core.graph.Node;
import io.surfworks.rangeforge.core.graph.NodeEvaluator;
import io.surfworks.rangeforge.core.range.RangeStore;
import io.surfworks.rangeforge.core.range.rules.RangeRuleRegistry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Second walk over a completed range store that recovers, where possible,
 * the integer interval and the affine scale/bias of each tensor.
 *
 * <p>Missing integer info on an output is a loss of precision, not an error.
 */
public final class ScaledIntegerPass {

    private static final Logger LOG = Logger.getLogger(ScaledIntegerPass.class.getName());

    private final Map<String, ScaledIntegerRule> rules = new LinkedHashMap<>();
    private final RangeRuleRegistry rangeRules;
    private final NodeEvaluator evaluator;
    private final int channelAxis;

    public ScaledIntegerPass(RangeRuleRegistry rangeRules, NodeEvaluator evaluator, int channelAxis) {
        this.rangeRules = rangeRules;
        this.evaluator = evaluator;
        this.channelAxis = channelAxis;
        ScaledIntegerRule linear = new LinearIntegerRule();
        ScaledIntegerRule identity = new IdentityIntegerRule();
        rules.put("Conv", linear);
        rules.put("MatMul", linear);
        rules.put("BatchNormalization", linear);
        rules.put("Add", linear);
        rules.put("Relu", new ReluIntegerRule());
        rules.put("Quant", new QuantIntegerRule());
        rules.put("Pad", identity);
        rules.put("MaxPool", identity);
        rules.put("Reshape", identity);
    }

    /**
     * Attach integer info to the entries of {@code store}.
     *
     * @return Names of the nodes that were skipped
     */
    public List<String> run(Graph graph, RangeStore store) {
        ScaledIntegerContext context = new ScaledIntegerContext(graph, store, rangeRules, evaluator, channelAxis);
        List<String> skipped = new ArrayList<>();
        for (Node node : graph.nodes()) {
            ScaledIntegerRule rule = rules.get(node.opType());
            if (rule == null) {
                LOG.warning("Skipping " + node.name() + " : no scaled-integer rule for " + node.opType());
                skipped.add(node.name());
                continue;
            }
            boolean resolved = Stream.concat(node.inputs().stream(), node.outputs().stream())
                .filter(name -> !name.isEmpty())
                .allMatch(store::contains);
            if (!resolved) {
                LOG.warning("Skipping " + node.name() + " : missing range information");
                skipped.add(node.name());
                continue;
            }
            rule.apply(node, context);
        }
        return Collections.unmodifiableList(skipped);
    }
}
