package io.surfworks.rangeforge.backend.cpu.ops.scalar;

import io.surfworks.rangeforge.backend.cpu.ops.OpKernel;
import io.surfworks.rangeforge.core.graph.Node;
import io.surfworks.rangeforge.core.tensor.Tensor;

import java.util.List;

/**
 * Reshape - target shape from input 1. A 0 copies the input dimension
 * (unless {@code allowzero} is set) and a single -1 is inferred.
 */
public class ReshapeKernel implements OpKernel {

    @Override
    public List<Tensor> execute(Node node, List<Tensor> inputs) {
        Tensor x = KernelInputs.require(node, inputs, 0);
        int[] target = KernelInputs.toInts(KernelInputs.require(node, inputs, 1));
        boolean allowZero = node.intAttr("allowzero", 0) != 0;
        if (!allowZero) {
            for (int i = 0; i < target.length; i++) {
                if (target[i] == 0) {
                    target[i] = x.shape()[i];
                }
            }
        }
        return List.of(x.reshape(target));
    }
}
