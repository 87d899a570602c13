package io.surfworks.rangeforge.backend.cpu.ops.scalar;

import io.surfworks.rangeforge.backend.cpu.ops.OpKernel;
import io.surfworks.rangeforge.core.graph.Node;
import io.surfworks.rangeforge.core.tensor.Tensor;

import java.util.List;

/**
 * QuantizeLinear - {@code y = saturate(round(x / y_scale) + y_zero_point)}.
 *
 * <p>Saturates to uint8 unless {@code output_dtype} names int8 (ONNX type 3).
 * Per-axis scales follow {@code axis} (default 1).
 */
public class QuantizeLinearKernel implements OpKernel {

    private static final long ONNX_INT8 = 3;

    @Override
    public List<Tensor> execute(Node node, List<Tensor> inputs) {
        Tensor x = KernelInputs.require(node, inputs, 0);
        int axis = x.rank() > 1 ? KernelInputs.normalizeAxis(node.intAttr("axis", 1), x.rank()) : 0;
        Tensor scale = KernelInputs.alongAxis(KernelInputs.require(node, inputs, 1), x.rank(), axis);
        Tensor zp = KernelInputs.optional(inputs, 2);
        Tensor zeroPoint = zp == null ? Tensor.scalar(0.0) : KernelInputs.alongAxis(zp, x.rank(), axis);

        boolean int8 = node.intAttr("output_dtype", 2) == ONNX_INT8;
        double min = int8 ? -128 : 0;
        double max = int8 ? 127 : 255;
        Tensor y = x.divide(scale).rint().add(zeroPoint).map(v -> Math.min(Math.max(v, min), max));
        return List.of(y);
    }
}
