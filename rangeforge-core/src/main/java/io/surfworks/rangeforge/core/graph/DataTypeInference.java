package io.surfworks.rangeforge.core.graph;

import io.surfworks.rangeforge.core.tensor.DataType;
import io.surfworks.rangeforge.core.tensor.Tensor;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Annotates output datatypes that follow directly from operator settings.
 *
 * <p>Quantizers with unit scale and zero zero-point produce plain integers of
 * their declared bit-width. Data-movement operators pass their input datatype
 * through. Existing annotations are never overwritten.
 */
public final class DataTypeInference implements GraphNormalizer {

    private static final Logger LOG = Logger.getLogger(DataTypeInference.class.getName());

    private static final Set<String> PASS_THROUGH_OPS =
        Set.of("Reshape", "Flatten", "Transpose", "MaxPool", "Split", "Identity");

    @Override
    public Graph apply(Graph graph) {
        Graph.Builder builder = graph.toBuilder();
        Map<String, DataType> known = new HashMap<>();
        for (String name : graph.allTensorNames()) {
            graph.dataTypeOf(name).ifPresent(dt -> known.put(name, dt));
        }

        for (Node node : graph.nodes()) {
            Optional<DataType> inferred = infer(node, graph, known);
            if (inferred.isEmpty()) {
                continue;
            }
            for (String out : node.outputs()) {
                if (known.containsKey(out)) {
                    continue;
                }
                DataType dt = inferred.get();
                known.put(out, dt);
                ValueInfo existing = graph.valueInfo(out).orElse(null);
                builder.valueInfo(existing == null ? new ValueInfo(out, null, dt) : existing.withDataType(dt));
                LOG.fine(() -> "Inferred datatype " + dt + " for " + out);
            }
        }
        return builder.build();
    }

    private Optional<DataType> infer(Node node, Graph graph, Map<String, DataType> known) {
        return switch (node.opType()) {
            case "Quant" -> {
                Tensor bitWidth = graph.initializer(node.input(3));
                if (bitWidth == null || !isUnitScaleZeroOffset(graph, node)) {
                    yield Optional.empty();
                }
                boolean signed = node.intAttr("signed", 1) != 0;
                yield Optional.of(DataType.quantized((int) bitWidth.getFlat(0), signed));
            }
            case "Trunc" -> {
                Tensor bitWidth = graph.initializer(node.input(4));
                if (bitWidth == null || !isUnitScaleZeroOffset(graph, node)) {
                    yield Optional.empty();
                }
                DataType inputType = known.get(node.input(0));
                boolean signed = inputType == null || inputType.signed();
                yield Optional.of(DataType.integer((int) bitWidth.getFlat(0), signed));
            }
            case "BipolarQuant" -> {
                Tensor scale = graph.initializer(node.input(1));
                yield scale != null && scale.allMatch(s -> s == 1.0)
                    ? Optional.of(DataType.BIPOLAR)
                    : Optional.empty();
            }
            default -> PASS_THROUGH_OPS.contains(node.opType())
                ? Optional.ofNullable(known.get(node.input(0)))
                : Optional.empty();
        };
    }

    private static boolean isUnitScaleZeroOffset(Graph graph, Node node) {
        Tensor scale = graph.initializer(node.input(1));
        Tensor zeroPoint = graph.initializer(node.input(2));
        return scale != null && zeroPoint != null
            && scale.allMatch(s -> s == 1.0) && zeroPoint.allMatch(z -> z == 0.0);
    }
}
