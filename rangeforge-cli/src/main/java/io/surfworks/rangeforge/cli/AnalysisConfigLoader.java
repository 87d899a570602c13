package io.surfworks.rangeforge.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.surfworks.rangeforge.core.range.AnalysisConfig;
import io.surfworks.rangeforge.core.range.InputRange;
import io.surfworks.rangeforge.core.report.ReportMode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads an {@link AnalysisConfig} from a JSON file.
 *
 * <p>Configuration sources (in order of precedence):
 * <ol>
 *   <li>Command-line flags, applied by the caller on top of the result</li>
 *   <li>Config file</li>
 *   <li>Defaults</li>
 * </ol>
 *
 * <p>Recognized keys: {@code irange} (string form or {@code {"min": [...], "max": [...]}}),
 * {@code keyFilter}, {@code reportMode}, {@code keepInitializers}, {@code scaledInt},
 * {@code normalize}, {@code channelAxis}. Unknown keys are ignored.
 */
public final class AnalysisConfigLoader {

    private static final ObjectMapper JSON = new ObjectMapper();

    private AnalysisConfigLoader() {
    }

    public static AnalysisConfig load(Path configFile) throws IOException {
        if (!Files.exists(configFile)) {
            throw new IOException("Config file not found: " + configFile);
        }
        return apply(JSON.readTree(configFile.toFile()), AnalysisConfig.defaults());
    }

    static AnalysisConfig apply(JsonNode root, AnalysisConfig base) throws IOException {
        if (root == null || !root.isObject()) {
            throw new IOException("Config JSON must be an object");
        }
        AnalysisConfig.Builder builder = base.toBuilder();

        if (root.has("irange")) {
            builder.inputRange(parseInputRange(root.get("irange")));
        }
        if (root.has("keyFilter")) {
            builder.keyFilter(root.get("keyFilter").asText());
        }
        if (root.has("reportMode")) {
            builder.reportMode(ReportMode.fromString(root.get("reportMode").asText()));
        }
        if (root.has("keepInitializers")) {
            builder.stripInitializers(!root.get("keepInitializers").asBoolean());
        }
        if (root.has("scaledInt")) {
            builder.scaledInt(root.get("scaledInt").asBoolean());
        }
        if (root.has("normalize")) {
            builder.normalize(root.get("normalize").asBoolean());
        }
        if (root.has("channelAxis")) {
            builder.channelAxis(root.get("channelAxis").asInt());
        }
        return builder.build();
    }

    private static InputRange parseInputRange(JsonNode node) {
        if (node.isObject()) {
            return InputRange.perChannel(toDoubles(node.path("min")), toDoubles(node.path("max")));
        }
        return InputRange.parse(node.asText());
    }

    private static double[] toDoubles(JsonNode node) {
        if (!node.isArray()) {
            return new double[] {node.asDouble()};
        }
        double[] values = new double[node.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = node.get(i).asDouble();
        }
        return values;
    }
}
