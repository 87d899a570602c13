package io.surfworks.rangeforge.core.range;

import io.surfworks.rangeforge.core.tensor.Tensor;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IntervalKernelTest {

    @Test
    void picksBoundBySignOfCoefficient() {
        // rows: [1, -1], [2, 0.5]
        Tensor a = Tensor.of(new double[]{1, -1, 2, 0.5}, 2, 2);
        Range r = IntervalKernel.matVec(a, Tensor.scalar(-1), Tensor.scalar(2));
        assertArrayEquals(new double[]{-3, -2.5}, r.min().toDoubleArray());
        assertArrayEquals(new double[]{3, 5}, r.max().toDoubleArray());
    }

    @Test
    void usesPerColumnBounds() {
        Tensor a = Tensor.of(new double[]{1, 1}, 1, 2);
        Range r = IntervalKernel.matVec(a, Tensor.vector(0, -5), Tensor.vector(1, 5));
        assertArrayEquals(new double[]{-5}, r.min().toDoubleArray());
        assertArrayEquals(new double[]{6}, r.max().toDoubleArray());
    }

    @Test
    void zeroCoefficientsContributeNothing() {
        Tensor a = Tensor.zeros(3, 4);
        Range r = IntervalKernel.matVec(a, Tensor.scalar(-100), Tensor.scalar(100));
        assertArrayEquals(new double[]{0, 0, 0}, r.min().toDoubleArray());
        assertArrayEquals(new double[]{0, 0, 0}, r.max().toDoubleArray());
    }

    @Test
    void boundsEverySampledPoint() {
        Random random = new Random(42);
        int rows = 5;
        int cols = 7;
        double[] coefficients = new double[rows * cols];
        double[] lo = new double[cols];
        double[] hi = new double[cols];
        for (int i = 0; i < coefficients.length; i++) {
            coefficients[i] = random.nextGaussian();
        }
        for (int c = 0; c < cols; c++) {
            lo[c] = random.nextDouble() * -3;
            hi[c] = lo[c] + random.nextDouble() * 4;
        }
        Tensor a = Tensor.of(coefficients, rows, cols);
        Range r = IntervalKernel.matVec(a, Tensor.vector(lo), Tensor.vector(hi));

        for (int sample = 0; sample < 200; sample++) {
            double[] x = new double[cols];
            for (int c = 0; c < cols; c++) {
                x[c] = lo[c] + random.nextDouble() * (hi[c] - lo[c]);
            }
            for (int row = 0; row < rows; row++) {
                double y = 0;
                for (int c = 0; c < cols; c++) {
                    y += coefficients[row * cols + c] * x[c];
                }
                assertTrue(y >= r.min().getFlat(row) - 1e-9 && y <= r.max().getFlat(row) + 1e-9,
                    "row " + row + " value " + y + " escapes " + r);
            }
        }
    }

    @Test
    void rejectsLengthMismatch() {
        Tensor a = Tensor.zeros(2, 3);
        RangeAnalysisException e = assertThrows(RangeAnalysisException.class,
            () -> IntervalKernel.matVec(a, Tensor.vector(0, 0), Tensor.vector(1, 1)));
        assertTrue(e.getMessage().startsWith("Dot product length mismatch"));
    }

    @Test
    void rejectsNonMatrix() {
        assertThrows(IllegalArgumentException.class,
            () -> IntervalKernel.matVec(Tensor.vector(1, 2), Tensor.scalar(0), Tensor.scalar(1)));
    }
}
