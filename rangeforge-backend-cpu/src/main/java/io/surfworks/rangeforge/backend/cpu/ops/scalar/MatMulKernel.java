package io.surfworks.rangeforge.backend.cpu.ops.scalar;

import io.surfworks.rangeforge.backend.cpu.ops.OpKernel;
import io.surfworks.rangeforge.core.graph.Node;
import io.surfworks.rangeforge.core.tensor.Tensor;

import java.util.Arrays;
import java.util.List;

/**
 * MatMul - {@code A (..., K) x B (K, N) -> (..., N)}, or {@code B (K)} for a
 * matrix-vector product. Leading axes of A are batch axes.
 */
public class MatMulKernel implements OpKernel {

    @Override
    public List<Tensor> execute(Node node, List<Tensor> inputs) {
        Tensor a = KernelInputs.require(node, inputs, 0);
        Tensor b = KernelInputs.require(node, inputs, 1);
        if (b.rank() > 2 || a.rank() < 1) {
            throw new UnsupportedOperationException("MatMul supports A of rank >= 1 and B of rank 1 or 2, got "
                + Arrays.toString(a.shape()) + " x " + Arrays.toString(b.shape()));
        }
        int[] aShape = a.shape();
        int k = aShape[aShape.length - 1];
        if (b.shape()[0] != k) {
            throw new IllegalArgumentException("MatMul inner dimensions differ: "
                + Arrays.toString(aShape) + " x " + Arrays.toString(b.shape()));
        }
        int n = b.rank() == 2 ? b.shape()[1] : 1;
        int rows = a.elementCount() / k;

        double[] out = new double[rows * n];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < n; c++) {
                double sum = 0.0;
                for (int i = 0; i < k; i++) {
                    sum += a.getFlat(r * k + i) * b.getFlat(i * n + c);
                }
                out[r * n + c] = sum;
            }
        }
        int[] outShape;
        if (b.rank() == 2) {
            outShape = aShape.clone();
            outShape[outShape.length - 1] = n;
        } else {
            outShape = Arrays.copyOf(aShape, aShape.length - 1);
        }
        return List.of(Tensor.of(out, outShape));
    }
}
