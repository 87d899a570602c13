package io.surfworks.rangeforge.backend.cpu.ops.scalar;

import io.surfworks.rangeforge.backend.cpu.ops.OpKernel;
import io.surfworks.rangeforge.core.graph.Node;
import io.surfworks.rangeforge.core.tensor.Tensor;

import java.util.List;

/**
 * Gemm - {@code Y = alpha * A' x B' + beta * C} where A' and B' are optionally transposed.
 */
public class GemmKernel implements OpKernel {

    @Override
    public List<Tensor> execute(Node node, List<Tensor> inputs) {
        Tensor a = KernelInputs.require(node, inputs, 0);
        Tensor b = KernelInputs.require(node, inputs, 1);
        Tensor c = KernelInputs.optional(inputs, 2);
        if (a.rank() != 2 || b.rank() != 2) {
            throw new IllegalArgumentException("Gemm requires 2-D A and B");
        }
        if (node.intAttr("transA", 0) != 0) {
            a = a.transpose(1, 0);
        }
        if (node.intAttr("transB", 0) != 0) {
            b = b.transpose(1, 0);
        }
        double alpha = node.floatAttr("alpha", 1.0);
        double beta = node.floatAttr("beta", 1.0);

        int m = a.shape()[0];
        int k = a.shape()[1];
        int n = b.shape()[1];
        if (b.shape()[0] != k) {
            throw new IllegalArgumentException("Gemm inner dimensions differ: " + k + " vs " + b.shape()[0]);
        }
        double[] out = new double[m * n];
        for (int i = 0; i < m; i++) {
            for (int j = 0; j < n; j++) {
                double sum = 0.0;
                for (int p = 0; p < k; p++) {
                    sum += a.getFlat(i * k + p) * b.getFlat(p * n + j);
                }
                out[i * n + j] = alpha * sum;
            }
        }
        Tensor y = Tensor.of(out, m, n);
        if (c != null) {
            y = y.add(c.multiply(beta));
        }
        return List.of(y);
    }
}
