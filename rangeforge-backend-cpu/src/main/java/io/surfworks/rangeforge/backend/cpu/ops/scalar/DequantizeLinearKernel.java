package io.surfworks.rangeforge.backend.cpu.ops.scalar;

import io.surfworks.rangeforge.backend.cpu.ops.OpKernel;
import io.surfworks.rangeforge.core.graph.Node;
import io.surfworks.rangeforge.core.tensor.Tensor;

import java.util.List;

/**
 * DequantizeLinear - {@code y = (x - x_zero_point) * x_scale}, per-axis along {@code axis} (default 1).
 */
public class DequantizeLinearKernel implements OpKernel {

    @Override
    public List<Tensor> execute(Node node, List<Tensor> inputs) {
        Tensor x = KernelInputs.require(node, inputs, 0);
        int axis = x.rank() > 1 ? KernelInputs.normalizeAxis(node.intAttr("axis", 1), x.rank()) : 0;
        Tensor scale = KernelInputs.alongAxis(KernelInputs.require(node, inputs, 1), x.rank(), axis);
        Tensor zp = KernelInputs.optional(inputs, 2);
        Tensor zeroPoint = zp == null ? Tensor.scalar(0.0) : KernelInputs.alongAxis(zp, x.rank(), axis);
        return List.of(x.subtract(zeroPoint).multiply(scale));
    }
}
