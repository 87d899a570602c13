package io.surfworks.rangeforge.backend.cpu.ops.scalar;

import io.surfworks.rangeforge.backend.cpu.ops.OpKernel;
import io.surfworks.rangeforge.core.graph.Node;
import io.surfworks.rangeforge.core.tensor.Tensor;

import java.util.List;

/**
 * QONNX BipolarQuant - {@code y = (x / scale >= 0 ? 1 : -1) * scale}.
 */
public class BipolarQuantKernel implements OpKernel {

    @Override
    public List<Tensor> execute(Node node, List<Tensor> inputs) {
        Tensor x = KernelInputs.require(node, inputs, 0);
        Tensor scale = KernelInputs.require(node, inputs, 1);
        Tensor sign = x.divide(scale).map(v -> v >= 0 ? 1.0 : -1.0);
        return List.of(sign.multiply(scale));
    }
}
