package io.surfworks.rangeforge.backend.cpu.ops.scalar;

import io.surfworks.rangeforge.backend.cpu.ops.OpKernel;
import io.surfworks.rangeforge.core.graph.Node;
import io.surfworks.rangeforge.core.tensor.Tensor;

import java.util.List;

/**
 * Base class for binary elementwise operations.
 * Applies a function to corresponding elements of two input tensors,
 * with NumPy broadcasting.
 */
public abstract class BinaryElementwiseKernel implements OpKernel {

    @Override
    public List<Tensor> execute(Node node, List<Tensor> inputs) {
        if (inputs.size() != 2) {
            throw new IllegalArgumentException("Binary operation requires exactly 2 inputs, got " + inputs.size());
        }
        Tensor lhs = KernelInputs.require(node, inputs, 0);
        Tensor rhs = KernelInputs.require(node, inputs, 1);
        return List.of(lhs.broadcast(rhs, this::apply));
    }

    protected abstract double apply(double a, double b);
}
