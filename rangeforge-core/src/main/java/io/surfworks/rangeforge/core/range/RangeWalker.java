package io.surfworks.rangeforge.core.range;

import io.surfworks.rangeforge.core.graph.Graph;
import io.surfworks.rangeforge.core.graph.Node;
import io.surfworks.rangeforge.core.graph.NodeEvaluator;
import io.surfworks.rangeforge.core.range.rules.RangeContext;
import io.surfworks.rangeforge.core.range.rules.RangeRule;
import io.surfworks.rangeforge.core.range.rules.RangeRuleRegistry;
import io.surfworks.rangeforge.core.tensor.Tensor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Propagates ranges through a graph in one pass over its nodes.
 *
 * <p>Graph inputs and initializers are seeded first. Each node is then visited
 * once, in declared order: if all of its dynamic inputs are resolved and its
 * operator kind has a rule, the rule computes the outputs; otherwise the node
 * is skipped and so, transitively, are its consumers. Non-constant outputs
 * are checked for stuck channels and simplified to scalar intervals when all
 * channels agree.
 */
public final class RangeWalker {

    private static final Logger LOG = Logger.getLogger(RangeWalker.class.getName());

    private final RangeRuleRegistry rules;
    private final NodeEvaluator evaluator;
    private final int channelAxis;

    public RangeWalker(RangeRuleRegistry rules, NodeEvaluator evaluator, int channelAxis) {
        this.rules = rules;
        this.evaluator = evaluator;
        this.channelAxis = channelAxis;
    }

    public WalkResult walk(Graph graph, InputRange inputRange) {
        RangeStore store = new RangeStore();
        seed(graph, inputRange, store);

        RangeContext context = new RangeContext(graph, evaluator, store, channelAxis);
        Map<String, List<StuckChannel>> stuckChannels = new LinkedHashMap<>();
        List<String> skipped = new ArrayList<>();

        for (Node node : graph.nodes()) {
            boolean inputsReady = node.inputs().stream()
                .filter(graph::isDynamic)
                .allMatch(store::contains);
            RangeRule rule = rules.ruleFor(node);
            boolean ruleFound = rule.supports(node);
            if (!inputsReady || !ruleFound) {
                LOG.warning("Skipping " + node.name() + " : input ranges ready? " + inputsReady
                    + ", rule for " + node.opType() + "? " + ruleFound);
                skipped.add(node.name());
                continue;
            }

            Map<String, RangeInfo> produced = rule.apply(node, context);
            for (String out : node.outputs()) {
                RangeInfo info = produced.get(out);
                if (info == null) {
                    continue;
                }
                if (!info.initializer()) {
                    List<StuckChannel> stuck = info.range().stuckChannels();
                    if (!stuck.isEmpty()) {
                        stuckChannels.put(out, stuck);
                    }
                    info = info.withRange(info.range().simplify());
                }
                store.define(out, info);
            }
        }
        LOG.fine(() -> "Range walk resolved " + store.size() + " tensors, skipped " + skipped.size() + " nodes");
        return new WalkResult(graph, store, stuckChannels, skipped);
    }

    /**
     * Seed graph inputs from the configured input range and every initializer
     * with its constant value.
     */
    static void seed(Graph graph, InputRange inputRange, RangeStore store) {
        for (String input : graph.inputs()) {
            if (!graph.isInitializer(input)) {
                store.define(input, inputRange.resolve(graph, input));
            }
        }
        for (Map.Entry<String, Tensor> init : graph.initializers().entrySet()) {
            store.define(init.getKey(), RangeInfo.constant(init.getValue()));
        }
    }
}
