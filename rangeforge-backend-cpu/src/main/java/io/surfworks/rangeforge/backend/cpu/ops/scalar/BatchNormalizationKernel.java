package io.surfworks.rangeforge.backend.cpu.ops.scalar;

import io.surfworks.rangeforge.backend.cpu.ops.OpKernel;
import io.surfworks.rangeforge.core.graph.Node;
import io.surfworks.rangeforge.core.tensor.Tensor;

import java.util.List;

/**
 * BatchNormalization (inference) -
 * {@code y = scale * (x - mean) / sqrt(var + epsilon) + B}, per channel on axis 1.
 */
public class BatchNormalizationKernel implements OpKernel {

    @Override
    public List<Tensor> execute(Node node, List<Tensor> inputs) {
        Tensor x = KernelInputs.require(node, inputs, 0);
        int rank = x.rank();
        int axis = rank > 1 ? 1 : 0;
        Tensor scale = KernelInputs.alongAxis(KernelInputs.require(node, inputs, 1), rank, axis);
        Tensor bias = KernelInputs.alongAxis(KernelInputs.require(node, inputs, 2), rank, axis);
        Tensor mean = KernelInputs.alongAxis(KernelInputs.require(node, inputs, 3), rank, axis);
        Tensor var = KernelInputs.alongAxis(KernelInputs.require(node, inputs, 4), rank, axis);
        double epsilon = node.floatAttr("epsilon", 1e-5);

        Tensor invStd = var.map(v -> 1.0 / Math.sqrt(v + epsilon));
        Tensor y = x.subtract(mean).multiply(invStd).multiply(scale).add(bias);
        return List.of(y);
    }
}
