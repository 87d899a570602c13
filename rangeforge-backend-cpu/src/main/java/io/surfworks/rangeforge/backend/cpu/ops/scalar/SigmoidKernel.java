package io.surfworks.rangeforge.backend.cpu.ops.scalar;

/** Sigmoid - logistic function. */
public class SigmoidKernel extends UnaryElementwiseKernel {
    @Override
    protected double apply(double x) {
        return 1.0 / (1.0 + Math.exp(-x));
    }
}
