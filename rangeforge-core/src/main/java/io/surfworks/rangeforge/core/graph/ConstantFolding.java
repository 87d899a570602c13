package io.surfworks.rangeforge.core.graph;

import io.surfworks.rangeforge.core.tensor.Tensor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Replaces every node whose inputs are all constants by initializers holding its outputs.
 *
 * <p>Quantizer nodes are preserved by default so that weight quantization
 * stays visible to the scaled-integer analysis.
 */
public final class ConstantFolding implements GraphNormalizer {

    private static final Logger LOG = Logger.getLogger(ConstantFolding.class.getName());

    public static final Set<String> DEFAULT_EXCLUDED_OPS = Set.of("Quant", "BipolarQuant", "Trunc");

    private final NodeEvaluator evaluator;
    private final Set<String> excludedOps;

    public ConstantFolding(NodeEvaluator evaluator) {
        this(evaluator, DEFAULT_EXCLUDED_OPS);
    }

    public ConstantFolding(NodeEvaluator evaluator, Set<String> excludedOps) {
        this.evaluator = evaluator;
        this.excludedOps = Set.copyOf(excludedOps);
    }

    @Override
    public Graph apply(Graph graph) {
        Map<String, Tensor> constants = new HashMap<>(graph.initializers());
        List<Node> kept = new ArrayList<>();
        Graph.Builder builder = graph.toBuilder();
        int folded = 0;

        for (Node node : graph.nodes()) {
            if (!isFoldable(node, constants)) {
                kept.add(node);
                continue;
            }
            List<Tensor> inputs = new ArrayList<>(node.inputCount());
            for (String in : node.inputs()) {
                inputs.add(in.isEmpty() ? null : constants.get(in));
            }
            List<Tensor> outputs = evaluator.evaluate(node, inputs);
            for (int i = 0; i < node.outputCount(); i++) {
                constants.put(node.output(i), outputs.get(i));
                builder.initializer(node.output(i), outputs.get(i));
            }
            folded++;
        }

        if (folded > 0) {
            LOG.fine("Folded " + folded + " constant node(s) in " + graph.name());
        }
        return builder.nodes(kept).build();
    }

    private boolean isFoldable(Node node, Map<String, Tensor> constants) {
        if (excludedOps.contains(node.opType()) || !evaluator.supports(node)) {
            return false;
        }
        for (String in : node.inputs()) {
            if (!in.isEmpty() && !constants.containsKey(in)) {
                return false;
            }
        }
        return true;
    }
}
