package io.surfworks.rangeforge.backend.cpu.ops.scalar;

import io.surfworks.rangeforge.backend.cpu.ops.OpKernel;
import io.surfworks.rangeforge.core.graph.Node;
import io.surfworks.rangeforge.core.tensor.Tensor;
import io.surfworks.rangeforge.core.tensor.TensorSpec;

import java.util.List;

/**
 * Pad - constant padding. Pads are {@code [x1_begin, x2_begin, ..., x1_end, x2_end, ...]},
 * taken from input 1 or the legacy {@code pads} attribute; the value from
 * input 2 or the {@code value} attribute (default 0).
 */
public class PadKernel implements OpKernel {

    @Override
    public List<Tensor> execute(Node node, List<Tensor> inputs) {
        String mode = node.stringAttr("mode", "constant");
        if (!"constant".equals(mode)) {
            throw new UnsupportedOperationException("Pad mode '" + mode + "' is not supported");
        }
        Tensor x = KernelInputs.require(node, inputs, 0);
        Tensor padsInput = KernelInputs.optional(inputs, 1);
        int[] pads = padsInput != null ? KernelInputs.toInts(padsInput) : node.intsAttr("pads", null);
        if (pads == null) {
            throw new IllegalArgumentException("Pad node " + node.name() + " has no pads");
        }
        Tensor valueInput = KernelInputs.optional(inputs, 2);
        double value = valueInput != null ? valueInput.getFlat(0) : node.floatAttr("value", 0.0);

        int rank = x.rank();
        if (pads.length != 2 * rank) {
            throw new IllegalArgumentException("Pad expects " + (2 * rank) + " pad values, got " + pads.length);
        }
        int[] inShape = x.shape();
        int[] outShape = new int[rank];
        for (int d = 0; d < rank; d++) {
            outShape[d] = inShape[d] + pads[d] + pads[d + rank];
        }
        TensorSpec outSpec = TensorSpec.of(outShape);
        double[] out = new double[outSpec.elementCount()];
        int[] idx = new int[rank];
        int[] src = new int[rank];
        for (int flat = 0; flat < out.length; flat++) {
            outSpec.unflatten(flat, idx);
            boolean inside = true;
            for (int d = 0; d < rank; d++) {
                src[d] = idx[d] - pads[d];
                if (src[d] < 0 || src[d] >= inShape[d]) {
                    inside = false;
                    break;
                }
            }
            out[flat] = inside ? x.get(src) : value;
        }
        return List.of(Tensor.of(out, outShape));
    }
}
