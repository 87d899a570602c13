package io.surfworks.rangeforge.backend.cpu.ops.scalar;

import io.surfworks.rangeforge.backend.cpu.ops.OpKernel;
import io.surfworks.rangeforge.core.graph.Node;
import io.surfworks.rangeforge.core.tensor.Tensor;

import java.util.List;

/**
 * Base class for unary elementwise operations.
 */
public abstract class UnaryElementwiseKernel implements OpKernel {

    @Override
    public List<Tensor> execute(Node node, List<Tensor> inputs) {
        return List.of(KernelInputs.require(node, inputs, 0).map(this::apply));
    }

    protected abstract double apply(double x);
}
