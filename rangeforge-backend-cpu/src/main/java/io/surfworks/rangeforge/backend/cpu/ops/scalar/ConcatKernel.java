package io.surfworks.rangeforge.backend.cpu.ops.scalar;

import io.surfworks.rangeforge.backend.cpu.ops.OpKernel;
import io.surfworks.rangeforge.core.graph.Node;
import io.surfworks.rangeforge.core.tensor.Tensor;
import io.surfworks.rangeforge.core.tensor.TensorSpec;

import java.util.List;

/**
 * Concat - join inputs along {@code axis}.
 */
public class ConcatKernel implements OpKernel {

    @Override
    public List<Tensor> execute(Node node, List<Tensor> inputs) {
        if (inputs.isEmpty()) {
            throw new IllegalArgumentException("Concat requires at least 1 input");
        }
        Tensor first = KernelInputs.require(node, inputs, 0);
        int rank = first.rank();
        int axis = KernelInputs.normalizeAxis(node.intAttr("axis", 0), rank);

        int[] outShape = first.shape();
        int[] offsets = new int[inputs.size() + 1];
        for (int i = 0; i < inputs.size(); i++) {
            Tensor t = KernelInputs.require(node, inputs, i);
            offsets[i + 1] = offsets[i] + t.shape()[axis];
        }
        outShape[axis] = offsets[inputs.size()];

        TensorSpec outSpec = TensorSpec.of(outShape);
        double[] out = new double[outSpec.elementCount()];
        int[] idx = new int[rank];
        for (int flat = 0; flat < out.length; flat++) {
            outSpec.unflatten(flat, idx);
            int source = 0;
            while (idx[axis] >= offsets[source + 1]) {
                source++;
            }
            int[] srcIdx = idx.clone();
            srcIdx[axis] -= offsets[source];
            out[flat] = inputs.get(source).get(srcIdx);
        }
        return List.of(Tensor.of(out, outShape));
    }
}
