package io.surfworks.rangeforge.backend.cpu.ops.scalar;

import io.surfworks.rangeforge.backend.cpu.ops.OpKernel;
import io.surfworks.rangeforge.core.graph.Node;
import io.surfworks.rangeforge.core.tensor.Tensor;

import java.util.List;

/**
 * QONNX Quant - uniform fake quantization.
 *
 * <p>Inputs {@code (x, scale, zeropoint, bitwidth)}; attributes {@code signed}
 * (default 1), {@code narrow} (default 0), {@code rounding_mode} (default ROUND,
 * half to even). {@code y = (round(clip(x / scale + zeropoint)) - zeropoint) * scale}.
 */
public class QuantKernel implements OpKernel {

    @Override
    public List<Tensor> execute(Node node, List<Tensor> inputs) {
        Tensor x = KernelInputs.require(node, inputs, 0);
        Tensor scale = KernelInputs.require(node, inputs, 1);
        Tensor zeroPoint = KernelInputs.require(node, inputs, 2);
        double bitWidth = KernelInputs.require(node, inputs, 3).getFlat(0);
        boolean signed = node.intAttr("signed", 1) != 0;
        boolean narrow = node.intAttr("narrow", 0) != 0;
        RoundingMode rounding = RoundingMode.parse(node.stringAttr("rounding_mode", "ROUND"));

        Tensor scaled = x.divide(scale).add(zeroPoint);
        Tensor quantized;
        if (bitWidth == 1 && signed) {
            quantized = scaled.map(v -> v >= 0 ? 1.0 : -1.0);
        } else {
            double min = minInt(signed, narrow, bitWidth);
            double max = maxInt(signed, narrow, bitWidth);
            quantized = scaled.map(v -> rounding.apply(Math.min(Math.max(v, min), max)));
        }
        return List.of(quantized.subtract(zeroPoint).multiply(scale));
    }

    static double minInt(boolean signed, boolean narrow, double bitWidth) {
        if (!signed) {
            return 0;
        }
        double min = -Math.pow(2, bitWidth - 1);
        return narrow ? min + 1 : min;
    }

    static double maxInt(boolean signed, boolean narrow, double bitWidth) {
        if (signed) {
            return Math.pow(2, bitWidth - 1) - 1;
        }
        double max = Math.pow(2, bitWidth) - 1;
        return narrow ? max - 1 : max;
    }
}
