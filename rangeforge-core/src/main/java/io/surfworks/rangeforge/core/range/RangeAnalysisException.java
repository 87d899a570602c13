package io.surfworks.rangeforge.core.range;

/**
 * Thrown when a graph violates the input contract of range analysis,
 * e.g. non-constant weights or an unsupported operator configuration.
 */
public class RangeAnalysisException extends RuntimeException {

    public RangeAnalysisException(String message) {
        super(message);
    }

    public RangeAnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
