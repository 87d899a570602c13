package io.surfworks.rangeforge.core.graph;

import io.surfworks.rangeforge.core.tensor.Tensor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Fills in missing output shapes by evaluating each node on zero-filled inputs.
 *
 * <p>Initializers are passed with their real values so that shape-carrying
 * operands (such as a Reshape target) are honored. Nodes whose input shapes
 * are unknown, or that the evaluator does not support, are left as they are.
 */
public final class ShapeInference implements GraphNormalizer {

    private static final Logger LOG = Logger.getLogger(ShapeInference.class.getName());

    private final NodeEvaluator evaluator;

    public ShapeInference(NodeEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    @Override
    public Graph apply(Graph graph) {
        Graph.Builder builder = graph.toBuilder();
        Map<String, int[]> shapes = new HashMap<>();
        for (String name : graph.allTensorNames()) {
            graph.shapeOf(name).ifPresent(shape -> shapes.put(name, shape));
        }

        for (Node node : graph.nodes()) {
            boolean complete = node.outputs().stream().allMatch(shapes::containsKey);
            if (complete) {
                continue;
            }
            List<Tensor> inputs = new ArrayList<>(node.inputCount());
            boolean known = true;
            for (String in : node.inputs()) {
                if (in.isEmpty()) {
                    inputs.add(null);
                } else if (graph.isInitializer(in)) {
                    inputs.add(graph.initializer(in));
                } else if (shapes.containsKey(in)) {
                    inputs.add(Tensor.zeros(shapes.get(in)));
                } else {
                    known = false;
                    break;
                }
            }
            if (!known || !evaluator.supports(node)) {
                LOG.warning("Cannot infer output shapes of " + node.name() + " (" + node.opType() + ")");
                continue;
            }
            List<Tensor> outputs = evaluator.evaluate(node, inputs);
            for (int i = 0; i < node.outputCount(); i++) {
                String out = node.output(i);
                int[] shape = outputs.get(i).shape();
                shapes.put(out, shape);
                ValueInfo existing = graph.valueInfo(out).orElse(null);
                builder.valueInfo(existing == null ? ValueInfo.of(out, shape) : existing.withShape(shape));
                LOG.fine(() -> "Inferred shape " + Arrays.toString(shape) + " for " + out);
            }
        }
        return builder.build();
    }
}
