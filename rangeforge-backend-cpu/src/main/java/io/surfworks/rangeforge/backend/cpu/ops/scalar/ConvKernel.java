package io.surfworks.rangeforge.backend.cpu.ops.scalar;

import io.surfworks.rangeforge.backend.cpu.ops.OpKernel;
import io.surfworks.rangeforge.core.graph.Node;
import io.surfworks.rangeforge.core.tensor.Tensor;
import io.surfworks.rangeforge.core.tensor.TensorSpec;

import java.util.Arrays;
import java.util.List;

/**
 * Conv - N-dimensional grouped convolution.
 *
 * <p>X is (N, C, spatial...), W is (M, C / group, k...), optional B is (M).
 * Attributes: {@code group}, {@code strides}, {@code pads}, {@code dilations}.
 * Only explicit padding ({@code auto_pad} NOTSET or VALID) is supported.
 */
public class ConvKernel implements OpKernel {

    @Override
    public List<Tensor> execute(Node node, List<Tensor> inputs) {
        Tensor x = KernelInputs.require(node, inputs, 0);
        Tensor w = KernelInputs.require(node, inputs, 1);
        Tensor b = KernelInputs.optional(inputs, 2);

        String autoPad = node.stringAttr("auto_pad", "NOTSET");
        if (!"NOTSET".equals(autoPad) && !"VALID".equals(autoPad)) {
            throw new UnsupportedOperationException("Conv auto_pad " + autoPad + " is not supported");
        }

        int[] inShape = x.shape();
        int[] wShape = w.shape();
        int spatial = inShape.length - 2;
        if (spatial < 1 || wShape.length != inShape.length) {
            throw new IllegalArgumentException("Conv shapes do not match: X " + Arrays.toString(inShape)
                + ", W " + Arrays.toString(wShape));
        }
        int groups = (int) node.intAttr("group", 1);
        int outChannels = wShape[0];
        int groupInChannels = wShape[1];
        if (groupInChannels * groups != inShape[1] || outChannels % groups != 0) {
            throw new IllegalArgumentException("Conv group=" + groups + " does not match X "
                + Arrays.toString(inShape) + " and W " + Arrays.toString(wShape));
        }
        int outPerGroup = outChannels / groups;

        int[] strides = node.intsAttr("strides", ones(spatial));
        int[] dilations = node.intsAttr("dilations", ones(spatial));
        int[] pads = node.intsAttr("pads", new int[2 * spatial]);

        int[] outShape = new int[inShape.length];
        outShape[0] = inShape[0];
        outShape[1] = outChannels;
        int[] kernel = Arrays.copyOfRange(wShape, 2, wShape.length);
        for (int s = 0; s < spatial; s++) {
            int effective = dilations[s] * (kernel[s] - 1) + 1;
            outShape[s + 2] = (inShape[s + 2] + pads[s] + pads[s + spatial] - effective) / strides[s] + 1;
        }

        TensorSpec kernelSpec = TensorSpec.of(kernel);
        int kernelVolume = kernelSpec.elementCount();
        TensorSpec outSpec = TensorSpec.of(outShape);
        double[] out = new double[outSpec.elementCount()];
        int[] idx = new int[outShape.length];
        int[] kIdx = new int[spatial];
        int[] src = new int[inShape.length];
        int[] wIdx = new int[wShape.length];

        for (int flat = 0; flat < out.length; flat++) {
            outSpec.unflatten(flat, idx);
            int oc = idx[1];
            int group = oc / outPerGroup;
            double sum = b != null ? b.getFlat(oc) : 0.0;
            src[0] = idx[0];
            wIdx[0] = oc;
            for (int ic = 0; ic < groupInChannels; ic++) {
                src[1] = group * groupInChannels + ic;
                wIdx[1] = ic;
                for (int k = 0; k < kernelVolume; k++) {
                    kernelSpec.unflatten(k, kIdx);
                    boolean inside = true;
                    for (int s = 0; s < spatial; s++) {
                        int pos = idx[s + 2] * strides[s] - pads[s] + kIdx[s] * dilations[s];
                        if (pos < 0 || pos >= inShape[s + 2]) {
                            inside = false;
                            break;
                        }
                        src[s + 2] = pos;
                        wIdx[s + 2] = kIdx[s];
                    }
                    if (inside) {
                        sum += x.get(src) * w.get(wIdx);
                    }
                }
            }
            out[flat] = sum;
        }
        return List.of(Tensor.of(out, outShape));
    }

    private static int[] ones(int n) {
        int[] values = new int[n];
        Arrays.fill(values, 1);
        return values;
    }
}
