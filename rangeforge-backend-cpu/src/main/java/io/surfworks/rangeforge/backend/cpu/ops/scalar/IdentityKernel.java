package io.surfworks.rangeforge.backend.cpu.ops.scalar;

import io.surfworks.rangeforge.backend.cpu.ops.OpKernel;
import io.surfworks.rangeforge.core.graph.Node;
import io.surfworks.rangeforge.core.tensor.Tensor;

import java.util.List;

/** Identity - returns its input. */
public class IdentityKernel implements OpKernel {
    @Override
    public List<Tensor> execute(Node node, List<Tensor> inputs) {
        return List.of(KernelInputs.require(node, inputs, 0));
    }
}
