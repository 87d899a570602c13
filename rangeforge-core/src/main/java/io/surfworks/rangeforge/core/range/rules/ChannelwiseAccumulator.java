package io.surfworks.rangeforge.core.range.rules;

import io.surfworks.rangeforge.core.range.IntervalKernel;
import io.surfworks.rangeforge.core.range.Range;
import io.surfworks.rangeforge.core.tensor.Tensor;

/**
 * Per output channel interval evaluation shared by the convolution rules.
 */
final class ChannelwiseAccumulator {

    private ChannelwiseAccumulator() {}

    /**
     * Repeat each per-channel bound {@code kernelVolume} times so that it lines
     * up with a flattened (in-channels x kernel) weight row. Scalar bounds are kept.
     */
    static Tensor replicate(Tensor bound, int kernelVolume) {
        return bound.rank() == 0 ? bound : bound.repeatEach(kernelVolume);
    }

    /**
     * Evaluate each row of {@code weights} on its own.
     *
     * @param weights      Flattened weights of shape (out-channels, cols)
     * @param min          Replicated lower input bound
     * @param max          Replicated upper input bound
     * @param sliceWidth   When positive, row {@code i} only sees bound elements
     *                     {@code [i*sliceWidth, (i+1)*sliceWidth)} (depthwise)
     */
    static Range evaluate(Tensor weights, Tensor min, Tensor max, int sliceWidth) {
        int rows = weights.shape()[0];
        int cols = weights.shape()[1];
        double[] outMin = new double[rows];
        double[] outMax = new double[rows];
        for (int i = 0; i < rows; i++) {
            Tensor row = weights.slice(i * cols, (i + 1) * cols).reshape(1, cols);
            Tensor lo = sliceWidth > 0 ? sliceOf(min, i, sliceWidth) : min;
            Tensor hi = sliceWidth > 0 ? sliceOf(max, i, sliceWidth) : max;
            Range r = IntervalKernel.matVec(row, lo, hi);
            outMin[i] = r.min().getFlat(0);
            outMax[i] = r.max().getFlat(0);
        }
        return Range.perChannel(outMin, outMax);
    }

    private static Tensor sliceOf(Tensor bound, int index, int width) {
        return bound.rank() == 0 ? bound : bound.slice(index * width, (index + 1) * width);
    }
}
