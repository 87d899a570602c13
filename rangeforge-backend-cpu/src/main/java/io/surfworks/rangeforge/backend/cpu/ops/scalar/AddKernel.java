package io.surfworks.rangeforge.backend.cpu.ops.scalar;

/** Add - Element-wise addition. */
public class AddKernel extends BinaryElementwiseKernel {
    @Override
    protected double apply(double a, double b) {
        return a + b;
    }
}
