package io.surfworks.rangeforge.core.io;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Metadata of a NumPy .npy array: element type, byte order, layout and shape.
 *
 * @param majorVersion Format major version (1, 2 or 3)
 * @param minorVersion Format minor version
 * @param elementType  Stored element type
 * @param byteOrder    Byte order of multi-byte elements
 * @param fortranOrder True for column-major data
 * @param shape        Array shape, empty for a scalar
 */
public record NpyHeader(
    int majorVersion,
    int minorVersion,
    ElementType elementType,
    ByteOrder byteOrder,
    boolean fortranOrder,
    int[] shape
) {
    // {'descr': '<f4', 'fortran_order': False, 'shape': (2, 3), }
    private static final Pattern ENTRY = Pattern.compile("'(descr|fortran_order|shape)'\\s*:\\s*('[^']*'|True|False|\\([^)]*\\))");

    public NpyHeader {
        shape = shape.clone();
    }

    /**
     * Element types the reader widens to double.
     */
    public enum ElementType {
        F4("f4", 4) {
            @Override
            double read(ByteBuffer buffer, int index) {
                return buffer.getFloat(index * 4);
            }
        },
        F8("f8", 8) {
            @Override
            double read(ByteBuffer buffer, int index) {
                return buffer.getDouble(index * 8);
            }
        },
        I1("i1", 1) {
            @Override
            double read(ByteBuffer buffer, int index) {
                return buffer.get(index);
            }
        },
        U1("u1", 1) {
            @Override
            double read(ByteBuffer buffer, int index) {
                return buffer.get(index) & 0xFF;
            }
        },
        I2("i2", 2) {
            @Override
            double read(ByteBuffer buffer, int index) {
                return buffer.getShort(index * 2);
            }
        },
        U2("u2", 2) {
            @Override
            double read(ByteBuffer buffer, int index) {
                return buffer.getShort(index * 2) & 0xFFFF;
            }
        },
        I4("i4", 4) {
            @Override
            double read(ByteBuffer buffer, int index) {
                return buffer.getInt(index * 4);
            }
        },
        I8("i8", 8) {
            @Override
            double read(ByteBuffer buffer, int index) {
                return buffer.getLong(index * 8);
            }
        },
        B1("b1", 1) {
            @Override
            double read(ByteBuffer buffer, int index) {
                return buffer.get(index) != 0 ? 1.0 : 0.0;
            }
        };

        private final String code;
        private final int byteSize;

        ElementType(String code, int byteSize) {
            this.code = code;
            this.byteSize = byteSize;
        }

        public String code() {
            return code;
        }

        public int byteSize() {
            return byteSize;
        }

        /**
         * Decode the element at {@code index} as a double.
         */
        abstract double read(ByteBuffer buffer, int index);

        static ElementType fromCode(String code) {
            if ("?".equals(code)) {
                return B1;
            }
            for (ElementType type : values()) {
                if (type.code.equals(code)) {
                    return type;
                }
            }
            throw new IllegalArgumentException("Unsupported NumPy dtype: " + code);
        }
    }

    /**
     * Parse the header dict literal that follows the magic and length fields.
     */
    public static NpyHeader parse(int majorVersion, int minorVersion, String dict) {
        String descr = null;
        String shapeTuple = null;
        boolean fortran = false;
        Matcher m = ENTRY.matcher(dict);
        while (m.find()) {
            String value = m.group(2);
            switch (m.group(1)) {
                case "descr" -> descr = value.substring(1, value.length() - 1);
                case "fortran_order" -> fortran = "True".equals(value);
                default -> shapeTuple = value.substring(1, value.length() - 1);
            }
        }
        if (descr == null || descr.isEmpty()) {
            throw new IllegalArgumentException("Missing 'descr' in header: " + dict);
        }
        if (shapeTuple == null) {
            throw new IllegalArgumentException("Missing 'shape' in header: " + dict);
        }

        char orderMark = descr.charAt(0);
        boolean marked = orderMark == '<' || orderMark == '>' || orderMark == '|' || orderMark == '=';
        ByteOrder order = switch (orderMark) {
            case '<' -> ByteOrder.LITTLE_ENDIAN;
            case '>' -> ByteOrder.BIG_ENDIAN;
            default -> ByteOrder.nativeOrder();
        };
        ElementType type = ElementType.fromCode(marked ? descr.substring(1) : descr);
        return new NpyHeader(majorVersion, minorVersion, type, order, fortran, parseShape(shapeTuple));
    }

    // "3," and "2, 3" both occur; empty means scalar
    private static int[] parseShape(String tuple) {
        return Arrays.stream(tuple.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .mapToInt(Integer::parseInt)
            .toArray();
    }

    @Override
    public int[] shape() {
        return shape.clone();
    }

    public int elementCount() {
        int count = 1;
        for (int dim : shape) {
            count *= dim;
        }
        return count;
    }

    /**
     * Number of data bytes following the header.
     */
    public int dataLength() {
        return elementCount() * elementType.byteSize();
    }

    /**
     * The dict literal for this header, without padding.
     */
    public String toHeaderString() {
        char orderMark = elementType.byteSize() == 1 ? '|' : (byteOrder == ByteOrder.BIG_ENDIAN ? '>' : '<');
        StringBuilder dims = new StringBuilder();
        for (int dim : shape) {
            dims.append(dim).append(", ");
        }
        if (shape.length > 1) {
            dims.setLength(dims.length() - 2);
        }
        return "{'descr': '" + orderMark + elementType.code() + "', 'fortran_order': "
            + (fortranOrder ? "True" : "False") + ", 'shape': (" + dims.toString().trim() + "), }";
    }
}
