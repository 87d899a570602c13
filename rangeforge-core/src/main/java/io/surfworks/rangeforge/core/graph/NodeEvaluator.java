package io.surfworks.rangeforge.core.graph;

import io.surfworks.rangeforge.core.tensor.Tensor;

import java.util.List;

/**
 * Evaluates a single node on concrete tensors.
 *
 * <p>Implementations must be pure: the same inputs always give the same
 * outputs and nothing outside the returned list is modified. Range analysis
 * calls an evaluator repeatedly on synthetic inputs to sample operator extremes.
 */
@FunctionalInterface
public interface NodeEvaluator {

    /**
     * Evaluate the node.
     *
     * @param node   The node to evaluate
     * @param inputs Input values aligned with {@link Node#inputs()}; an omitted
     *               optional input (empty name) is passed as {@code null}
     * @return Output values aligned with {@link Node#outputs()}
     * @throws UnsupportedOperationException if the operator kind is not supported
     */
    List<Tensor> evaluate(Node node, List<Tensor> inputs);

    /**
     * Check if this evaluator can handle the given node.
     * Default implementation returns true (evaluator handles validation).
     */
    default boolean supports(Node node) {
        return true;
    }
}
