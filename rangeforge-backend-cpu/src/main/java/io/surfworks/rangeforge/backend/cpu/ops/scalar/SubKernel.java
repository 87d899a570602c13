package io.surfworks.rangeforge.backend.cpu.ops.scalar;

/** Sub - Element-wise subtraction. */
public class SubKernel extends BinaryElementwiseKernel {
    @Override
    protected double apply(double a, double b) {
        return a - b;
    }
}
