package io.surfworks.rangeforge.backend.cpu.ops.scalar;

import io.surfworks.rangeforge.backend.cpu.ops.OpKernel;
import io.surfworks.rangeforge.core.graph.Node;
import io.surfworks.rangeforge.core.tensor.Tensor;

import java.util.List;

/**
 * QONNX Trunc - drop least significant bits of a quantized tensor.
 *
 * <p>Inputs {@code (x, scale, zeropoint, input_bit_width, output_bit_width)};
 * attribute {@code rounding_mode} (default FLOOR).
 */
public class TruncKernel implements OpKernel {

    @Override
    public List<Tensor> execute(Node node, List<Tensor> inputs) {
        Tensor x = KernelInputs.require(node, inputs, 0);
        Tensor scale = KernelInputs.require(node, inputs, 1);
        Tensor zeroPoint = KernelInputs.require(node, inputs, 2);
        double inBits = KernelInputs.require(node, inputs, 3).getFlat(0);
        double outBits = KernelInputs.require(node, inputs, 4).getFlat(0);
        RoundingMode rounding = RoundingMode.parse(node.stringAttr("rounding_mode", "FLOOR"));

        double truncScale = Math.pow(2.0, inBits - outBits);
        Tensor y = x.divide(scale).add(zeroPoint).rint()
            .map(v -> rounding.apply(v / truncScale))
            .subtract(zeroPoint)
            .multiply(scale);
        return List.of(y);
    }
}
