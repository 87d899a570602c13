package io.surfworks.rangeforge.core.report;

import io.surfworks.rangeforge.core.range.AnalysisConfig;
import io.surfworks.rangeforge.core.range.RangeInfo;
import io.surfworks.rangeforge.core.range.StuckChannel;
import io.surfworks.rangeforge.core.range.WalkResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a {@link WalkResult} into the report selected by the configuration.
 */
public final class RangeReportBuilder {

    private RangeReportBuilder() {}

    public static RangeReport build(WalkResult result, AnalysisConfig config) {
        String filter = config.keyFilter();
        return switch (config.reportMode()) {
            case RANGE -> {
                Map<String, RangeInfo> ranges = new LinkedHashMap<>();
                result.store().entries().forEach((name, info) -> {
                    if (!(config.stripInitializers() && info.initializer()) && name.contains(filter)) {
                        ranges.put(name, info);
                    }
                });
                yield new RangeReport.Ranges(ranges);
            }
            case STUCK_CHANNEL -> stuck(result, filter);
            case ZEROSTUCK_CHANNEL -> stuck(result, filter).zeroStuck();
        };
    }

    private static RangeReport.StuckChannels stuck(WalkResult result, String filter) {
        Map<String, List<StuckChannel>> stuck = new LinkedHashMap<>();
        result.stuckChannels().forEach((name, channels) -> {
            if (name.contains(filter)) {
                stuck.put(name, channels);
            }
        });
        return new RangeReport.StuckChannels(stuck);
    }
}
