package io.surfworks.rangeforge.core.report;

import io.surfworks.rangeforge.core.range.RangeInfo;
import io.surfworks.rangeforge.core.range.StuckChannel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Result of a range analysis, shaped by a {@link ReportMode}. Entries keep
 * the order in which tensors were resolved.
 */
public sealed interface RangeReport
    permits RangeReport.Ranges, RangeReport.StuckChannels, RangeReport.ZeroStuckChannels {

    ReportMode mode();

    Set<String> tensorNames();

    /**
     * Deterministic human-readable rendering, one tensor per line.
     */
    String render();

    default boolean isEmpty() {
        return tensorNames().isEmpty();
    }

    record Ranges(Map<String, RangeInfo> entries) implements RangeReport {
        public Ranges {
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }

        @Override
        public ReportMode mode() {
            return ReportMode.RANGE;
        }

        @Override
        public Set<String> tensorNames() {
            return entries.keySet();
        }

        @Override
        public String render() {
            StringBuilder sb = new StringBuilder();
            entries.forEach((name, info) -> sb.append(name).append(": ").append(info).append('\n'));
            return sb.toString();
        }
    }

    record StuckChannels(Map<String, List<StuckChannel>> entries) implements RangeReport {
        public StuckChannels {
            Map<String, List<StuckChannel>> copy = new LinkedHashMap<>();
            entries.forEach((name, channels) -> copy.put(name, List.copyOf(channels)));
            entries = Collections.unmodifiableMap(copy);
        }

        @Override
        public ReportMode mode() {
            return ReportMode.STUCK_CHANNEL;
        }

        @Override
        public Set<String> tensorNames() {
            return entries.keySet();
        }

        /**
         * Keep only channels stuck at exactly zero, dropping tensors left with none.
         */
        public ZeroStuckChannels zeroStuck() {
            Map<String, Set<Integer>> zero = new LinkedHashMap<>();
            entries.forEach((name, channels) -> {
                Set<Integer> indices = new LinkedHashSet<>();
                for (StuckChannel channel : channels) {
                    if (channel.value() == 0) {
                        indices.add(channel.channel());
                    }
                }
                if (!indices.isEmpty()) {
                    zero.put(name, indices);
                }
            });
            return new ZeroStuckChannels(zero);
        }

        @Override
        public String render() {
            StringBuilder sb = new StringBuilder();
            entries.forEach((name, channels) -> sb.append(name).append(": ").append(channels).append('\n'));
            return sb.toString();
        }
    }

    record ZeroStuckChannels(Map<String, Set<Integer>> entries) implements RangeReport {
        public ZeroStuckChannels {
            Map<String, Set<Integer>> copy = new LinkedHashMap<>();
            entries.forEach((name, channels) ->
                copy.put(name, Collections.unmodifiableSet(new LinkedHashSet<>(channels))));
            entries = Collections.unmodifiableMap(copy);
        }

        @Override
        public ReportMode mode() {
            return ReportMode.ZEROSTUCK_CHANNEL;
        }

        @Override
        public Set<String> tensorNames() {
            return entries.keySet();
        }

        @Override
        public String render() {
            StringBuilder sb = new StringBuilder();
            entries.forEach((name, channels) -> sb.append(name).append(": ").append(channels).append('\n'));
            return sb.toString();
        }
    }
}
