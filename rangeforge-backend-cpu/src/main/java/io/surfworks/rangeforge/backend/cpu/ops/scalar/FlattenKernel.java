package io.surfworks.rangeforge.backend.cpu.ops.scalar;

import io.surfworks.rangeforge.backend.cpu.ops.OpKernel;
import io.surfworks.rangeforge.core.graph.Node;
import io.surfworks.rangeforge.core.tensor.Tensor;

import java.util.List;

/**
 * Flatten - collapse to 2-D around {@code axis} (default 1).
 */
public class FlattenKernel implements OpKernel {

    @Override
    public List<Tensor> execute(Node node, List<Tensor> inputs) {
        Tensor x = KernelInputs.require(node, inputs, 0);
        int rank = x.rank();
        long axisAttr = node.intAttr("axis", 1);
        int axis = (int) (axisAttr < 0 ? axisAttr + rank : axisAttr);
        if (axis < 0 || axis > rank) {
            throw new IllegalArgumentException("Flatten axis " + axisAttr + " out of range for rank " + rank);
        }
        int outer = 1;
        for (int i = 0; i < axis; i++) {
            outer *= x.shape()[i];
        }
        int inner = outer == 0 ? 0 : x.elementCount() / outer;
        return List.of(x.reshape(outer, inner));
    }
}
