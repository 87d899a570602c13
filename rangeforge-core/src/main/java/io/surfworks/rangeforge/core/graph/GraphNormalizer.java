package io.surfworks.rangeforge.core.graph;

/**
 * An upstream normalization pass over a graph (shape inference, constant folding, ...).
 * Passes return a new graph and never modify their input.
 */
@FunctionalInterface
public interface GraphNormalizer {

    Graph apply(Graph graph);

    default GraphNormalizer andThen(GraphNormalizer next) {
        return graph -> next.apply(apply(graph));
    }
}
