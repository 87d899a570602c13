package io.surfworks.rangeforge.backend.cpu.ops.scalar;

import java.util.function.DoubleUnaryOperator;

/**
 * Rounding modes of the QONNX quantizers.
 */
enum RoundingMode {
    ROUND(Math::rint),
    CEIL(Math::ceil),
    FLOOR(Math::floor),
    ROUND_TO_ZERO(v -> v < 0 ? Math.ceil(v) : Math.floor(v));

    private final DoubleUnaryOperator fn;

    RoundingMode(DoubleUnaryOperator fn) {
        this.fn = fn;
    }

    double apply(double value) {
        return fn.applyAsDouble(value);
    }

    static RoundingMode parse(String name) {
        try {
            return valueOf(name.toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new UnsupportedOperationException("Unsupported rounding mode: " + name, e);
        }
    }
}
