package io.surfworks.rangeforge.core.range;

import io.surfworks.rangeforge.core.tensor.Tensor;

/**
 * Abstract value of a tensor.
 *
 * <p>{@code range} bounds the real values. When {@code intRange}, {@code scale}
 * and {@code bias} are all present the tensor has integer info, and
 * {@code real = scale * integer + bias} relates both domains.
 *
 * @param range       Real-valued interval, never null
 * @param intRange    Interval of the integer representation, or null
 * @param scale       Affine scale, or null
 * @param bias        Affine bias, or null
 * @param initializer True iff the tensor is a graph constant
 */
public record RangeInfo(
    Range range,
    Range intRange,
    Tensor scale,
    Tensor bias,
    boolean initializer
) {
    private static final Tensor UNIT_SCALE = Tensor.vector(1.0);
    private static final Tensor ZERO_BIAS = Tensor.vector(0.0);

    public RangeInfo {
        if (range == null) {
            throw new IllegalArgumentException("RangeInfo requires a range");
        }
    }

    public static RangeInfo of(Range range) {
        return new RangeInfo(range, null, null, null, false);
    }

    public static RangeInfo of(double min, double max) {
        return of(Range.of(min, max));
    }

    /**
     * Range info for a graph initializer. Integral constants also carry
     * integer info with unit scale and zero bias.
     */
    public static RangeInfo constant(Tensor value) {
        Range range = Range.degenerate(value);
        if (value.allMatch(v -> v % 1 == 0)) {
            return new RangeInfo(range, range, UNIT_SCALE, ZERO_BIAS, true);
        }
        return new RangeInfo(range, null, null, null, true);
    }

    /**
     * Range info for a tensor computed entirely from constants.
     */
    public static RangeInfo evaluatedConstant(Tensor value) {
        return new RangeInfo(Range.degenerate(value), null, null, null, true);
    }

    public boolean hasIntegerInfo() {
        return intRange != null && scale != null && bias != null;
    }

    public RangeInfo withRange(Range newRange) {
        return new RangeInfo(newRange, intRange, scale, bias, initializer);
    }

    public RangeInfo withIntegerInfo(Range newIntRange, Tensor newScale, Tensor newBias) {
        return new RangeInfo(range, newIntRange, newScale, newBias, initializer);
    }

    /**
     * Check {@code range == scale * intRange + bias} elementwise within a tolerance.
     * Always false without integer info.
     */
    public boolean isConsistent(double tolerance) {
        if (!hasIntegerInfo()) {
            return false;
        }
        Tensor lo = intRange.min().multiply(scale).add(bias);
        Tensor hi = intRange.max().multiply(scale).add(bias);
        return withinTolerance(lo, range.min(), tolerance) && withinTolerance(hi, range.max(), tolerance);
    }

    private static boolean withinTolerance(Tensor a, Tensor b, double tolerance) {
        return a.broadcast(b, (x, y) -> Math.abs(x - y) <= tolerance ? 1.0 : 0.0).allMatch(v -> v == 1.0);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("RangeInfo(range=").append(range);
        if (intRange != null) {
            sb.append(", int_range=").append(intRange);
        }
        if (scale != null) {
            sb.append(", scale=").append(scale.formatValues());
        }
        if (bias != null) {
            sb.append(", bias=").append(bias.formatValues());
        }
        if (initializer) {
            sb.append(", initializer");
        }
        return sb.append(")").toString();
    }
}
