package io.surfworks.rangeforge.backend.cpu.ops.scalar;

import io.surfworks.rangeforge.backend.cpu.ops.OpKernel;
import io.surfworks.rangeforge.core.graph.Node;
import io.surfworks.rangeforge.core.tensor.Tensor;

import java.util.List;

/**
 * Clip - clamp to [min, max]. Bounds come from optional inputs 1 and 2,
 * or from the legacy {@code min}/{@code max} attributes.
 */
public class ClipKernel implements OpKernel {

    @Override
    public List<Tensor> execute(Node node, List<Tensor> inputs) {
        Tensor x = KernelInputs.require(node, inputs, 0);
        Tensor minInput = KernelInputs.optional(inputs, 1);
        Tensor maxInput = KernelInputs.optional(inputs, 2);
        double lo = minInput != null ? minInput.getFlat(0) : node.floatAttr("min", Double.NEGATIVE_INFINITY);
        double hi = maxInput != null ? maxInput.getFlat(0) : node.floatAttr("max", Double.POSITIVE_INFINITY);
        return List.of(x.map(v -> Math.min(Math.max(v, lo), hi)));
    }
}
