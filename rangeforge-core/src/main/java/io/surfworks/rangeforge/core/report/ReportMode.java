package io.surfworks.rangeforge.core.report;

import java.util.Arrays;

/**
 * Shape of a range analysis report.
 */
public enum ReportMode {
    /** Full range info per tensor. */
    RANGE("range"),
    /** Stuck channels with their values per tensor. */
    STUCK_CHANNEL("stuck_channel"),
    /** Channel indices stuck at exactly zero per tensor. */
    ZEROSTUCK_CHANNEL("zerostuck_channel");

    private final String label;

    ReportMode(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Parse a report mode selector such as {@code stuck_channel}.
     *
     * @throws IllegalArgumentException for an unrecognized selector
     */
    public static ReportMode fromString(String value) {
        for (ReportMode mode : values()) {
            if (mode.label.equals(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unrecognized report mode '" + value + "', must be one of "
            + Arrays.stream(values()).map(ReportMode::label).toList());
    }
}
