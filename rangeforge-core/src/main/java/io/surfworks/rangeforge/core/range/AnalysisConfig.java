package io.surfworks.rangeforge.core.range;

import io.surfworks.rangeforge.core.report.ReportMode;

/**
 * Settings of one range analysis run.
 *
 * @param inputRange        How graph inputs are seeded
 * @param keyFilter         Only report tensors whose name contains this string (empty keeps all)
 * @param reportMode        Shape of the report
 * @param stripInitializers Drop constants from a range report
 * @param scaledInt         Run the scaled-integer reconstruction pass
 * @param normalize         Run shape inference, constant folding and datatype inference first
 * @param channelAxis       Channel axis used by the sampling rule
 */
public record AnalysisConfig(
    InputRange inputRange,
    String keyFilter,
    ReportMode reportMode,
    boolean stripInitializers,
    boolean scaledInt,
    boolean normalize,
    int channelAxis
) {
    public AnalysisConfig {
        if (inputRange == null) {
            inputRange = InputRange.fromDataType();
        }
        if (keyFilter == null) {
            keyFilter = "";
        }
        if (reportMode == null) {
            reportMode = ReportMode.STUCK_CHANNEL;
        }
    }

    public static AnalysisConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .inputRange(inputRange)
            .keyFilter(keyFilter)
            .reportMode(reportMode)
            .stripInitializers(stripInitializers)
            .scaledInt(scaledInt)
            .normalize(normalize)
            .channelAxis(channelAxis);
    }

    public static final class Builder {
        private InputRange inputRange = InputRange.fromDataType();
        private String keyFilter = "";
        private ReportMode reportMode = ReportMode.STUCK_CHANNEL;
        private boolean stripInitializers = true;
        private boolean scaledInt = false;
        private boolean normalize = false;
        private int channelAxis = 1;

        private Builder() {}

        public Builder inputRange(InputRange inputRange) {
            this.inputRange = inputRange;
            return this;
        }

        public Builder keyFilter(String keyFilter) {
            this.keyFilter = keyFilter;
            return this;
        }

        public Builder reportMode(ReportMode reportMode) {
            this.reportMode = reportMode;
            return this;
        }

        public Builder stripInitializers(boolean stripInitializers) {
            this.stripInitializers = stripInitializers;
            return this;
        }

        public Builder scaledInt(boolean scaledInt) {
            this.scaledInt = scaledInt;
            return this;
        }

        public Builder normalize(boolean normalize) {
            this.normalize = normalize;
            return this;
        }

        public Builder channelAxis(int channelAxis) {
            this.channelAxis = channelAxis;
            return this;
        }

        public AnalysisConfig build() {
            return new AnalysisConfig(inputRange, keyFilter, reportMode,
                stripInitializers, scaledInt, normalize, channelAxis);
        }
    }
}
