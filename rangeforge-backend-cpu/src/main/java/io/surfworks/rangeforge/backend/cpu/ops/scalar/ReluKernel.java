package io.surfworks.rangeforge.backend.cpu.ops.scalar;

/** Relu - max(x, 0). */
public class ReluKernel extends UnaryElementwiseKernel {
    @Override
    protected double apply(double x) {
        return Math.max(x, 0.0);
    }
}
