package io.surfworks.rangeforge.backend.cpu.ops;

import io.surfworks.rangeforge.core.graph.Node;
import io.surfworks.rangeforge.core.tensor.Tensor;

import java.util.List;

/**
 * Interface for operator kernels.
 * Each kernel implements execution logic for one or more operator kinds.
 */
@FunctionalInterface
public interface OpKernel {

    /**
     * Execute the node.
     *
     * @param node   The node to execute
     * @param inputs Input tensors aligned with the node inputs; omitted optional inputs are null
     * @return Output tensors aligned with the node outputs
     */
    List<Tensor> execute(Node node, List<Tensor> inputs);

    /**
     * Check if this kernel supports the given node.
     * Default implementation returns true (kernel handles validation).
     *
     * @param node The node to check
     * @return true if supported
     */
    default boolean supports(Node node) {
        return true;
    }
}
