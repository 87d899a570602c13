package io.surfworks.rangeforge.backend.cpu.ops.scalar;

/** Mul - Element-wise multiplication. */
public class MulKernel extends BinaryElementwiseKernel {
    @Override
    protected double apply(double a, double b) {
        return a * b;
    }
}
