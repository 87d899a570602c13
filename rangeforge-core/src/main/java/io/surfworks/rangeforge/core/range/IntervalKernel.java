package io.surfworks.rangeforge.core.range;

import io.surfworks.rangeforge.core.tensor.Tensor;

import java.util.Arrays;

/**
 * Exact interval transform of an affine map.
 */
public final class IntervalKernel {

    private IntervalKernel() {}

    /**
     * Interval of {@code y = A * x} for all {@code x} with {@code vmin <= x <= vmax}.
     *
     * <p>Per row, the maximum takes {@code vmax} where the coefficient is
     * positive and {@code vmin} elsewhere; the minimum takes the opposite.
     *
     * @param matrix Coefficients of shape (rows, cols)
     * @param vmin   Lower input bound, a single value or one per column
     * @param vmax   Upper input bound, a single value or one per column
     * @return Rank-1 bounds of length {@code rows}
     */
    public static Range matVec(Tensor matrix, Tensor vmin, Tensor vmax) {
        if (matrix.rank() != 2) {
            throw new IllegalArgumentException(
                "Expected a 2-D coefficient matrix, got shape " + Arrays.toString(matrix.shape()));
        }
        int rows = matrix.shape()[0];
        int cols = matrix.shape()[1];
        checkOperand(vmin, cols);
        checkOperand(vmax, cols);
        boolean minScalar = vmin.elementCount() == 1;
        boolean maxScalar = vmax.elementCount() == 1;

        double[] outMin = new double[rows];
        double[] outMax = new double[rows];
        for (int r = 0; r < rows; r++) {
            double lo = 0.0;
            double hi = 0.0;
            for (int c = 0; c < cols; c++) {
                double a = matrix.getFlat(r * cols + c);
                double xmin = vmin.getFlat(minScalar ? 0 : c);
                double xmax = vmax.getFlat(maxScalar ? 0 : c);
                if (a > 0) {
                    hi += a * xmax;
                    lo += a * xmin;
                } else {
                    hi += a * xmin;
                    lo += a * xmax;
                }
            }
            outMin[r] = lo;
            outMax[r] = hi;
        }
        return Range.perChannel(outMin, outMax);
    }

    private static void checkOperand(Tensor bound, int cols) {
        int n = bound.elementCount();
        if (n != 1 && n != cols) {
            throw new RangeAnalysisException(
                "Dot product length mismatch: bound has " + n + " elements, matrix has " + cols + " columns");
        }
    }
}
