package io.surfworks.rangeforge.backend.cpu.ops.scalar;

import io.surfworks.rangeforge.backend.cpu.ops.OpKernel;
import io.surfworks.rangeforge.core.graph.Node;
import io.surfworks.rangeforge.core.tensor.Tensor;

import java.util.Arrays;
import java.util.List;

/**
 * GlobalAveragePool - mean over all spatial axes, keeping them as size 1.
 */
public class GlobalAveragePoolKernel implements OpKernel {

    @Override
    public List<Tensor> execute(Node node, List<Tensor> inputs) {
        Tensor x = KernelInputs.require(node, inputs, 0);
        int[] shape = x.shape();
        if (shape.length < 3) {
            throw new IllegalArgumentException("GlobalAveragePool expects (N, C, spatial...)");
        }
        int outer = shape[0] * shape[1];
        int window = x.elementCount() / outer;
        double[] out = new double[outer];
        for (int i = 0; i < outer; i++) {
            double sum = 0.0;
            for (int j = 0; j < window; j++) {
                sum += x.getFlat(i * window + j);
            }
            out[i] = sum / window;
        }
        int[] outShape = new int[shape.length];
        Arrays.fill(outShape, 1);
        outShape[0] = shape[0];
        outShape[1] = shape[1];
        return List.of(Tensor.of(out, outShape));
    }
}
