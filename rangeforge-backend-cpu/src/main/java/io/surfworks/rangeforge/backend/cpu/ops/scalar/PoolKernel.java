package io.surfworks.rangeforge.backend.cpu.ops.scalar;

import io.surfworks.rangeforge.backend.cpu.ops.OpKernel;
import io.surfworks.rangeforge.core.graph.Node;
import io.surfworks.rangeforge.core.tensor.Tensor;
import io.surfworks.rangeforge.core.tensor.TensorSpec;

import java.util.Arrays;
import java.util.List;

/**
 * MaxPool and AveragePool over the spatial axes of an (N, C, spatial...) tensor.
 *
 * <p>Attributes: {@code kernel_shape} (required), {@code strides} (default 1),
 * {@code pads} (default 0) and, for averaging, {@code count_include_pad} (default 0).
 * Floor-mode output sizing with unit dilations and explicit padding only.
 */
public class PoolKernel implements OpKernel {

    private final boolean max;

    public PoolKernel(boolean max) {
        this.max = max;
    }

    @Override
    public List<Tensor> execute(Node node, List<Tensor> inputs) {
        Tensor x = KernelInputs.require(node, inputs, 0);
        int[] inShape = x.shape();
        int spatial = inShape.length - 2;
        if (spatial < 1) {
            throw new IllegalArgumentException(node.opType() + " expects (N, C, spatial...), got "
                + Arrays.toString(inShape));
        }
        int[] kernel = node.intsAttr("kernel_shape", null);
        if (kernel == null || kernel.length != spatial) {
            throw new IllegalArgumentException(node.opType() + " node " + node.name() + " needs kernel_shape");
        }
        if (node.intAttr("ceil_mode", 0) != 0) {
            throw new UnsupportedOperationException(node.opType() + " ceil_mode is not supported");
        }
        int[] dilations = node.intsAttr("dilations", null);
        if (dilations != null && Arrays.stream(dilations).anyMatch(d -> d != 1)) {
            throw new UnsupportedOperationException(node.opType() + " dilations "
                + Arrays.toString(dilations) + " are not supported");
        }
        String autoPad = node.stringAttr("auto_pad", "NOTSET");
        if (!"NOTSET".equals(autoPad) && !"VALID".equals(autoPad)) {
            throw new UnsupportedOperationException(node.opType() + " auto_pad " + autoPad + " is not supported");
        }
        int[] strides = node.intsAttr("strides", filled(spatial, 1));
        int[] pads = node.intsAttr("pads", filled(2 * spatial, 0));
        boolean includePad = node.intAttr("count_include_pad", 0) != 0;

        int[] outShape = new int[inShape.length];
        outShape[0] = inShape[0];
        outShape[1] = inShape[1];
        for (int s = 0; s < spatial; s++) {
            outShape[s + 2] = (inShape[s + 2] + pads[s] + pads[s + spatial] - kernel[s]) / strides[s] + 1;
        }
        int kernelVolume = 1;
        for (int k : kernel) {
            kernelVolume *= k;
        }
        TensorSpec kernelSpec = TensorSpec.of(kernel);
        TensorSpec outSpec = TensorSpec.of(outShape);
        double[] out = new double[outSpec.elementCount()];
        int[] idx = new int[outShape.length];
        int[] kIdx = new int[spatial];
        int[] src = new int[inShape.length];

        for (int flat = 0; flat < out.length; flat++) {
            outSpec.unflatten(flat, idx);
            src[0] = idx[0];
            src[1] = idx[1];
            double acc = max ? Double.NEGATIVE_INFINITY : 0.0;
            int count = 0;
            for (int k = 0; k < kernelVolume; k++) {
                kernelSpec.unflatten(k, kIdx);
                boolean inside = true;
                for (int s = 0; s < spatial; s++) {
                    src[s + 2] = idx[s + 2] * strides[s] - pads[s] + kIdx[s];
                    if (src[s + 2] < 0 || src[s + 2] >= inShape[s + 2]) {
                        inside = false;
                        break;
                    }
                }
                if (!inside) {
                    continue;
                }
                double v = x.get(src);
                acc = max ? Math.max(acc, v) : acc + v;
                count++;
            }
            if (max) {
                out[flat] = acc;
            } else {
                out[flat] = acc / (includePad ? kernelVolume : Math.max(count, 1));
            }
        }
        return List.of(Tensor.of(out, outShape));
    }

    private static int[] filled(int length, int value) {
        int[] values = new int[length];
        Arrays.fill(values, value);
        return values;
    }
}
