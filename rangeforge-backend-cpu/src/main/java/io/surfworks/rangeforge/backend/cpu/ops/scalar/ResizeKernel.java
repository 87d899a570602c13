package io.surfworks.rangeforge.backend.cpu.ops.scalar;

import io.surfworks.rangeforge.backend.cpu.ops.OpKernel;
import io.surfworks.rangeforge.core.graph.Node;
import io.surfworks.rangeforge.core.tensor.Tensor;
import io.surfworks.rangeforge.core.tensor.TensorSpec;

import java.util.List;

/**
 * Resize and Upsample in nearest mode.
 *
 * <p>Upsample takes {@code (X, scales)}; Resize takes {@code (X, roi, scales, sizes)}.
 * Output index {@code i} reads input index {@code floor(i / scale)}.
 */
public class ResizeKernel implements OpKernel {

    @Override
    public boolean supports(Node node) {
        return "nearest".equals(node.stringAttr("mode", "nearest"));
    }

    @Override
    public List<Tensor> execute(Node node, List<Tensor> inputs) {
        if (!supports(node)) {
            throw new UnsupportedOperationException(
                node.opType() + " mode '" + node.stringAttr("mode", "") + "' is not supported");
        }
        Tensor x = KernelInputs.require(node, inputs, 0);
        int rank = x.rank();
        int[] inShape = x.shape();
        double[] scales = new double[rank];
        int[] outShape = new int[rank];

        Tensor scaleInput = "Upsample".equals(node.opType())
            ? KernelInputs.optional(inputs, 1)
            : KernelInputs.optional(inputs, 2);
        Tensor sizesInput = "Upsample".equals(node.opType()) ? null : KernelInputs.optional(inputs, 3);

        if (scaleInput != null && scaleInput.elementCount() == rank) {
            for (int d = 0; d < rank; d++) {
                scales[d] = scaleInput.getFlat(d);
                outShape[d] = (int) Math.floor(inShape[d] * scales[d]);
            }
        } else if (sizesInput != null && sizesInput.elementCount() == rank) {
            for (int d = 0; d < rank; d++) {
                outShape[d] = (int) sizesInput.getFlat(d);
                scales[d] = (double) outShape[d] / inShape[d];
            }
        } else {
            throw new IllegalArgumentException(node.opType() + " node " + node.name() + " needs scales or sizes");
        }

        TensorSpec outSpec = TensorSpec.of(outShape);
        double[] out = new double[outSpec.elementCount()];
        int[] idx = new int[rank];
        int[] src = new int[rank];
        for (int flat = 0; flat < out.length; flat++) {
            outSpec.unflatten(flat, idx);
            for (int d = 0; d < rank; d++) {
                src[d] = Math.min((int) Math.floor(idx[d] / scales[d]), inShape[d] - 1);
            }
            out[flat] = x.get(src);
        }
        return List.of(Tensor.of(out, outShape));
    }
}
