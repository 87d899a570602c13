package io.surfworks.rangeforge.core.range;

import io.surfworks.rangeforge.core.tensor.Tensor;
import io.surfworks.rangeforge.core.tensor.TensorSpec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A closed interval {@code [min, max]} bounding the values of a tensor.
 *
 * <p>Each bound is a {@link Tensor}: rank 0 for a scalar interval shared by
 * all elements, rank 1 for one interval per channel, or the full tensor shape
 * for constants. The two bounds may have different ranks as long as they
 * broadcast against each other.
 *
 * @param min Lower bound
 * @param max Upper bound
 */
public record Range(Tensor min, Tensor max) {

    public Range {
        if (min == null || max == null) {
            throw new IllegalArgumentException("Range bounds must not be null");
        }
    }

    /**
     * Scalar interval.
     */
    public static Range of(double min, double max) {
        return new Range(Tensor.scalar(min), Tensor.scalar(max));
    }

    /**
     * Per-channel interval.
     */
    public static Range perChannel(double[] min, double[] max) {
        if (min.length != max.length) {
            throw new IllegalArgumentException(
                "Per-channel bounds differ in length: " + min.length + " vs " + max.length);
        }
        return new Range(Tensor.vector(min), Tensor.vector(max));
    }

    /**
     * Degenerate interval {@code [value, value]}, used for constants.
     */
    public static Range degenerate(Tensor value) {
        return new Range(value, value);
    }

    public boolean isScalar() {
        return min.rank() == 0 && max.rank() == 0;
    }

    /**
     * True when every position has {@code min == max}.
     */
    public boolean isDegenerate() {
        for (boolean eq : min.elementwiseEquals(max)) {
            if (!eq) {
                return false;
            }
        }
        return true;
    }

    public int channelCount() {
        return Math.max(min.elementCount(), max.elementCount());
    }

    /**
     * Collapse a per-channel interval to a scalar one when all channels agree.
     * Scalar intervals, and intervals with a scalar bound, are returned unchanged.
     */
    public Range simplify() {
        if (min.rank() == 0 || max.rank() == 0 || min.elementCount() == 0 || max.elementCount() == 0) {
            return this;
        }
        if (min.isUniform() && max.isUniform()) {
            return of(min.getFlat(0), max.getFlat(0));
        }
        return this;
    }

    /**
     * Positions where {@code min == max}, in ascending order. A scalar interval
     * reports its single position as channel 0.
     */
    public List<StuckChannel> stuckChannels() {
        int[] shape = TensorSpec.broadcastShape(min.shape(), max.shape());
        Tensor lo = min.broadcastTo(shape);
        Tensor hi = max.broadcastTo(shape);
        List<StuckChannel> stuck = new ArrayList<>();
        for (int i = 0; i < lo.elementCount(); i++) {
            if (lo.getFlat(i) == hi.getFlat(i)) {
                stuck.add(new StuckChannel(i, lo.getFlat(i)));
            }
        }
        return Collections.unmodifiableList(stuck);
    }

    @Override
    public String toString() {
        return "(" + min.formatValues() + ", " + max.formatValues() + ")";
    }
}
