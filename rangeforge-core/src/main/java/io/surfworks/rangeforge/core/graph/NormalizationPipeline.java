package io.surfworks.rangeforge.core.graph;

import java.util.List;

/**
 * Runs a fixed sequence of normalization passes.
 */
public final class NormalizationPipeline implements GraphNormalizer {

    private final List<GraphNormalizer> passes;

    public NormalizationPipeline(List<GraphNormalizer> passes) {
        this.passes = List.copyOf(passes);
    }

    /**
     * Shape inference, constant folding (quantizers preserved), then datatype inference.
     */
    public static NormalizationPipeline standard(NodeEvaluator evaluator) {
        return new NormalizationPipeline(List.of(
            new ShapeInference(evaluator),
            new ConstantFolding(evaluator),
            new DataTypeInference()
        ));
    }

    @Override
    public Graph apply(Graph graph) {
        Graph current = graph;
        for (GraphNormalizer pass : passes) {
            current = pass.apply(current);
        }
        return current;
    }

    public List<GraphNormalizer> passes() {
        return passes;
    }
}
