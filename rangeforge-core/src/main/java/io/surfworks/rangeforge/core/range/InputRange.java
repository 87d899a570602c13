package io.surfworks.rangeforge.core.range;

import io.surfworks.rangeforge.core.graph.Graph;
import io.surfworks.rangeforge.core.tensor.DataType;

import java.util.Arrays;

/**
 * How graph inputs are seeded before the walk. The forms are mutually exclusive.
 */
public sealed interface InputRange
    permits InputRange.FromDataType, InputRange.Uniform, InputRange.PerChannel, InputRange.Prebuilt {

    /**
     * Resolve the range info of one graph input.
     */
    RangeInfo resolve(Graph graph, String inputName);

    static InputRange fromDataType() {
        return FromDataType.INSTANCE;
    }

    static InputRange uniform(double min, double max) {
        return new Uniform(min, max);
    }

    static InputRange perChannel(double[] min, double[] max) {
        return new PerChannel(min, max);
    }

    static InputRange prebuilt(RangeInfo info) {
        return new Prebuilt(info);
    }

    /**
     * Parse {@code "lo,hi"} or {@code "[l0,l1,...],[h0,h1,...]"}. An empty
     * string selects the declared input datatype.
     */
    static InputRange parse(String text) {
        String s = text == null ? "" : text.replaceAll("\\s+", "");
        if (s.isEmpty()) {
            return fromDataType();
        }
        if (s.startsWith("(") && s.endsWith(")")) {
            s = s.substring(1, s.length() - 1);
        }
        if (s.startsWith("[")) {
            int split = s.indexOf("],[");
            if (split < 0 || !s.endsWith("]")) {
                throw new IllegalArgumentException("Malformed per-channel input range: " + text);
            }
            double[] min = parseList(s.substring(1, split), text);
            double[] max = parseList(s.substring(split + 3, s.length() - 1), text);
            return perChannel(min, max);
        }
        double[] pair = parseList(s, text);
        if (pair.length != 2) {
            throw new IllegalArgumentException("Input range needs exactly two values: " + text);
        }
        return uniform(pair[0], pair[1]);
    }

    private static double[] parseList(String list, String original) {
        String[] parts = list.split(",");
        double[] values = new double[parts.length];
        try {
            for (int i = 0; i < parts.length; i++) {
                values[i] = Double.parseDouble(parts[i]);
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed input range: " + original, e);
        }
        return values;
    }

    /**
     * Use the declared datatype's representable interval.
     */
    final class FromDataType implements InputRange {
        static final FromDataType INSTANCE = new FromDataType();

        private FromDataType() {}

        @Override
        public RangeInfo resolve(Graph graph, String inputName) {
            DataType dataType = graph.dataTypeOf(inputName).orElseThrow(() -> new RangeAnalysisException(
                "Could not infer the range of input '" + inputName + "', please specify an input range"));
            return RangeInfo.of(dataType.min(), dataType.max());
        }

        @Override
        public String toString() {
            return "FromDataType";
        }
    }

    record Uniform(double min, double max) implements InputRange {
        public Uniform {
            if (min > max) {
                throw new IllegalArgumentException("Input range min " + min + " exceeds max " + max);
            }
        }

        @Override
        public RangeInfo resolve(Graph graph, String inputName) {
            return RangeInfo.of(min, max);
        }
    }

    record PerChannel(double[] min, double[] max) implements InputRange {
        public PerChannel {
            if (min.length != max.length) {
                throw new IllegalArgumentException(
                    "Per-channel input range lengths differ: " + min.length + " vs " + max.length);
            }
            min = min.clone();
            max = max.clone();
        }

        @Override
        public RangeInfo resolve(Graph graph, String inputName) {
            return RangeInfo.of(Range.perChannel(min, max));
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof PerChannel other
                && Arrays.equals(min, other.min) && Arrays.equals(max, other.max);
        }

        @Override
        public int hashCode() {
            return 31 * Arrays.hashCode(min) + Arrays.hashCode(max);
        }

        @Override
        public String toString() {
            return "PerChannel[min=" + Arrays.toString(min) + ", max=" + Arrays.toString(max) + "]";
        }
    }

    /**
     * The same fully built range info for every input.
     */
    record Prebuilt(RangeInfo info) implements InputRange {
        @Override
        public RangeInfo resolve(Graph graph, String inputName) {
            return info;
        }
    }
}
