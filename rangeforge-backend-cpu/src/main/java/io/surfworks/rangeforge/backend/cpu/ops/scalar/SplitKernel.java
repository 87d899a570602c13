package io.surfworks.rangeforge.backend.cpu.ops.scalar;

import io.surfworks.rangeforge.backend.cpu.ops.OpKernel;
import io.surfworks.rangeforge.core.graph.Node;
import io.surfworks.rangeforge.core.tensor.Tensor;
import io.surfworks.rangeforge.core.tensor.TensorSpec;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Split - cut the input along {@code axis}. Part sizes come from input 1,
 * the legacy {@code split} attribute, or an even split over the outputs.
 */
public class SplitKernel implements OpKernel {

    @Override
    public List<Tensor> execute(Node node, List<Tensor> inputs) {
        Tensor x = KernelInputs.require(node, inputs, 0);
        int axis = KernelInputs.normalizeAxis(node.intAttr("axis", 0), x.rank());
        int extent = x.shape()[axis];
        int parts = node.outputCount();

        Tensor splitInput = KernelInputs.optional(inputs, 1);
        int[] sizes;
        if (splitInput != null) {
            sizes = KernelInputs.toInts(splitInput);
        } else if (node.hasAttr("split")) {
            sizes = node.intsAttr("split", null);
        } else {
            if (extent % parts != 0) {
                throw new IllegalArgumentException(
                    "Cannot split extent " + extent + " evenly into " + parts + " parts");
            }
            sizes = new int[parts];
            Arrays.fill(sizes, extent / parts);
        }

        List<Tensor> outputs = new ArrayList<>(sizes.length);
        int start = 0;
        for (int size : sizes) {
            int[] outShape = x.shape();
            outShape[axis] = size;
            TensorSpec outSpec = TensorSpec.of(outShape);
            double[] out = new double[outSpec.elementCount()];
            int[] idx = new int[outShape.length];
            for (int flat = 0; flat < out.length; flat++) {
                outSpec.unflatten(flat, idx);
                idx[axis] += start;
                out[flat] = x.get(idx);
            }
            outputs.add(Tensor.of(out, outShape));
            start += size;
        }
        return outputs;
    }
}
