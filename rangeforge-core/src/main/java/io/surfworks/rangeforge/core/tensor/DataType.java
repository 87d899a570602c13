package io.surfworks.rangeforge.core.tensor;

/**
 * Declared element datatype of a tensor, using the QONNX naming scheme.
 *
 * <p>Supported annotations:
 * <ul>
 *   <li>{@code INTn} - signed two's complement integer, n bits</li>
 *   <li>{@code UINTn} - unsigned integer, n bits</li>
 *   <li>{@code BIPOLAR} - values in {-1, +1}</li>
 *   <li>{@code BINARY} - values in {0, 1}</li>
 *   <li>{@code TERNARY} - values in {-1, 0, +1}</li>
 *   <li>{@code FLOAT32}, {@code FLOAT16} - IEEE floating point</li>
 * </ul>
 *
 * @param kind     Family of the datatype
 * @param bitWidth Number of bits per element
 */
public record DataType(Kind kind, int bitWidth) {

    public enum Kind {
        INT, UINT, BIPOLAR, BINARY, TERNARY, FLOAT
    }

    public static final DataType BIPOLAR = new DataType(Kind.BIPOLAR, 1);
    public static final DataType BINARY = new DataType(Kind.BINARY, 1);
    public static final DataType TERNARY = new DataType(Kind.TERNARY, 2);
    public static final DataType FLOAT32 = new DataType(Kind.FLOAT, 32);
    public static final DataType FLOAT16 = new DataType(Kind.FLOAT, 16);

    public DataType {
        if (kind == null) {
            throw new IllegalArgumentException("DataType kind is required");
        }
        if (bitWidth < 1) {
            throw new IllegalArgumentException("Bit width must be >= 1, got " + bitWidth);
        }
        if ((kind == Kind.INT || kind == Kind.UINT) && bitWidth > 63) {
            throw new IllegalArgumentException("Integer bit width must be <= 63, got " + bitWidth);
        }
        if (kind == Kind.FLOAT && bitWidth != 16 && bitWidth != 32) {
            throw new IllegalArgumentException("Unsupported float width " + bitWidth);
        }
    }

    /**
     * Integer datatype of the given width and signedness.
     */
    public static DataType integer(int bitWidth, boolean signed) {
        return new DataType(signed ? Kind.INT : Kind.UINT, bitWidth);
    }

    /**
     * Integer datatype of a quantizer's output. A 1-bit quantizer produces
     * {@link #BIPOLAR} when signed and {@link #BINARY} otherwise.
     */
    public static DataType quantized(int bitWidth, boolean signed) {
        if (bitWidth == 1) {
            return signed ? BIPOLAR : BINARY;
        }
        return integer(bitWidth, signed);
    }

    /**
     * Parse a QONNX datatype name such as {@code INT8}, {@code UINT4} or {@code BIPOLAR}.
     */
    public static DataType parse(String name) {
        String n = name.trim().toUpperCase();
        return switch (n) {
            case "BIPOLAR" -> BIPOLAR;
            case "BINARY" -> BINARY;
            case "TERNARY" -> TERNARY;
            case "FLOAT32" -> FLOAT32;
            case "FLOAT16" -> FLOAT16;
            default -> {
                if (n.startsWith("UINT")) {
                    yield integer(parseWidth(name, n.substring(4)), false);
                }
                if (n.startsWith("INT")) {
                    yield integer(parseWidth(name, n.substring(3)), true);
                }
                throw new IllegalArgumentException("Unknown datatype: " + name);
            }
        };
    }

    private static int parseWidth(String name, String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Unknown datatype: " + name, e);
        }
    }

    public boolean isInteger() {
        return kind != Kind.FLOAT;
    }

    public boolean signed() {
        return switch (kind) {
            case INT, BIPOLAR, TERNARY, FLOAT -> true;
            case UINT, BINARY -> false;
        };
    }

    /**
     * Smallest representable value.
     */
    public double min() {
        return switch (kind) {
            case INT -> -Math.pow(2, bitWidth - 1);
            case UINT, BINARY -> 0;
            case BIPOLAR, TERNARY -> -1;
            case FLOAT -> bitWidth == 16 ? -65504.0 : -Float.MAX_VALUE;
        };
    }

    /**
     * Largest representable value.
     */
    public double max() {
        return switch (kind) {
            case INT -> Math.pow(2, bitWidth - 1) - 1;
            case UINT -> Math.pow(2, bitWidth) - 1;
            case BINARY, BIPOLAR, TERNARY -> 1;
            case FLOAT -> bitWidth == 16 ? 65504.0 : Float.MAX_VALUE;
        };
    }

    /**
     * Check whether a value is representable in this datatype.
     */
    public boolean allowed(double value) {
        if (kind == Kind.FLOAT) {
            return value >= min() && value <= max();
        }
        if (kind == Kind.BIPOLAR) {
            return value == -1 || value == 1;
        }
        return value == Math.rint(value) && value >= min() && value <= max();
    }

    /**
     * QONNX name of this datatype.
     */
    public String name() {
        return switch (kind) {
            case INT -> "INT" + bitWidth;
            case UINT -> "UINT" + bitWidth;
            case BIPOLAR -> "BIPOLAR";
            case BINARY -> "BINARY";
            case TERNARY -> "TERNARY";
            case FLOAT -> "FLOAT" + bitWidth;
        };
    }

    @Override
    public String toString() {
        return name();
    }
}
