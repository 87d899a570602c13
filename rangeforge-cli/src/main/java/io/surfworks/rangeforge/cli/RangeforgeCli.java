package io.surfworks.rangeforge.cli;

import io.surfworks.rangeforge.backend.cpu.CpuNodeEvaluator;
import io.surfworks.rangeforge.core.graph.Graph;
import io.surfworks.rangeforge.core.range.AnalysisConfig;
import io.surfworks.rangeforge.core.range.InputRange;
import io.surfworks.rangeforge.core.range.RangeAnalysis;
import io.surfworks.rangeforge.core.range.RangeAnalysisException;
import io.surfworks.rangeforge.core.report.RangeReport;
import io.surfworks.rangeforge.core.report.ReportMode;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.logging.LogManager;

/**
 * Command-line interface for range analysis of quantized dataflow graphs.
 *
 * <p>Usage: rangeforge &lt;graph.json&gt; [options]
 *
 * <p>Reads the graph, propagates input ranges through it with the CPU
 * evaluator and prints the selected report.
 */
public class RangeforgeCli {

    private static final String VERSION = "0.1.0";

    private static final List<String> VALUE_FLAGS = List.of(
        "--config", "--irange", "--key-filter", "--report-mode", "--channel-axis");

    public static void main(String[] args) {
        configureLogging();
        int status = run(args, System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Run the CLI and return its exit status.
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length == 0 || hasFlag(args, "--help") || hasFlag(args, "-h")) {
            printHelp(out);
            return 0;
        }
        if (hasFlag(args, "--version") || hasFlag(args, "-v")) {
            out.println("rangeforge " + VERSION);
            return 0;
        }

        try {
            Path graphFile = Path.of(graphArgument(args));
            AnalysisConfig config = buildConfig(args);
            Graph graph = GraphJsonReader.read(graphFile);

            RangeReport report = new RangeAnalysis(new CpuNodeEvaluator()).run(graph, config);
            if (hasFlag(args, "--json")) {
                out.println(ReportJsonWriter.write(report));
            } else {
                out.print(report.render());
            }
            return 0;
        } catch (RangeAnalysisException e) {
            err.println("Analysis error: " + e.getMessage());
            return 1;
        } catch (UnsupportedOperationException e) {
            err.println("Evaluation error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("I/O error: " + e.getMessage());
            return 1;
        } catch (IllegalArgumentException | IllegalStateException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Defaults, then the config file, then command-line flags.
     */
    static AnalysisConfig buildConfig(String[] args) throws IOException {
        String configFile = getFlagValue(args, "--config");
        AnalysisConfig base = configFile != null
            ? AnalysisConfigLoader.load(Path.of(configFile))
            : AnalysisConfig.defaults();
        AnalysisConfig.Builder builder = base.toBuilder();

        String irange = getFlagValue(args, "--irange");
        if (irange != null) {
            builder.inputRange(InputRange.parse(irange));
        }
        String keyFilter = getFlagValue(args, "--key-filter");
        if (keyFilter != null) {
            builder.keyFilter(keyFilter);
        }
        String reportMode = getFlagValue(args, "--report-mode");
        if (reportMode != null) {
            builder.reportMode(ReportMode.fromString(reportMode));
        }
        if (hasFlag(args, "--keep-initializers")) {
            builder.stripInitializers(false);
        }
        if (hasFlag(args, "--scaled-int")) {
            builder.scaledInt(true);
        }
        if (hasFlag(args, "--normalize")) {
            builder.normalize(true);
        }
        String channelAxis = getFlagValue(args, "--channel-axis");
        if (channelAxis != null) {
            try {
                builder.channelAxis(Integer.parseInt(channelAxis));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid channel axis: " + channelAxis, e);
            }
        }
        return builder.build();
    }

    /**
     * The first argument that is neither a flag nor a flag's value.
     */
    static String graphArgument(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (VALUE_FLAGS.contains(arg)) {
                i++;
            } else if (!arg.startsWith("--")) {
                return arg;
            }
        }
        throw new IllegalArgumentException("Missing graph file. Run 'rangeforge --help' for usage.");
    }

    private static void configureLogging() {
        try (InputStream in = RangeforgeCli.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Could not load logging configuration: " + e.getMessage());
        }
    }

    private static boolean hasFlag(String[] args, String flag) {
        return Arrays.asList(args).contains(flag);
    }

    private static String getFlagValue(String[] args, String flag) {
        List<String> argList = Arrays.asList(args);
        int index = argList.indexOf(flag);
        if (index >= 0 && index < args.length - 1) {
            return args[index + 1];
        }
        if (index >= 0) {
            throw new IllegalArgumentException("Flag " + flag + " requires a value");
        }
        return null;
    }

    // ===== Help output =====

    private static void printHelp(PrintStream out) {
        out.println("Rangeforge - range analysis for quantized dataflow graphs");
        out.println();
        out.println("Usage: rangeforge <graph.json> [options]");
        out.println();
        out.println("Options:");
        out.println("  --config <file>        JSON config file; flags override its values");
        out.println("  --irange <range>       Input range: \"lo,hi\" or \"[l0,l1,...],[h0,h1,...]\"");
        out.println("                         (default: from the input datatype annotation)");
        out.println("  --key-filter <s>       Only report tensors whose name contains <s>");
        out.println("  --report-mode <mode>   range | stuck_channel | zerostuck_channel (default: stuck_channel)");
        out.println("  --keep-initializers    Include constants in a range report");
        out.println("  --scaled-int           Reconstruct integer ranges, scales and biases");
        out.println("  --normalize            Infer shapes, fold constants and infer datatypes first");
        out.println("  --channel-axis <n>     Channel axis for per-channel ranges (default: 1)");
        out.println("  --json                 Print the report as JSON");
        out.println("  -h, --help             Show this help");
        out.println("  -v, --version          Show version");
        out.println();
        out.println("Examples:");
        out.println("  rangeforge model.json --irange \"0,1\" --report-mode range");
        out.println("  rangeforge model.json --report-mode zerostuck_channel --key-filter Relu");
    }
}
