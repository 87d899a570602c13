package io.surfworks.rangeforge.backend.cpu.ops.scalar;

/** Div - Element-wise division. */
public class DivKernel extends BinaryElementwiseKernel {
    @Override
    protected double apply(double a, double b) {
        return a / b;
    }
}
