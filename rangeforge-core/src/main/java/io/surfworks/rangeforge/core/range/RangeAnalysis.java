package io.surfworks.rangeforge.core.range;

import io.surfworks.rangeforge.core.graph.Graph;
import io.surfworks.rangeforge.core.graph.NodeEvaluator;
import io.surfworks.rangeforge.core.graph.NormalizationPipeline;
import io.surfworks.rangeforge.core.range.rules.RangeRuleRegistry;
import io.surfworks.rangeforge.core.range.scaledint.ScaledIntegerPass;
import io.surfworks.rangeforge.core.report.RangeReport;
import io.surfworks.rangeforge.core.report.RangeReportBuilder;

import java.util.logging.Logger;

/**
 * Entry point for range analysis of a graph.
 *
 * <pre>{@code
 * RangeAnalysis analysis = new RangeAnalysis(new CpuNodeEvaluator());
 * RangeReport report = analysis.run(graph, AnalysisConfig.builder()
 *     .inputRange(InputRange.uniform(0, 1))
 *     .reportMode(ReportMode.RANGE)
 *     .build());
 * }</pre>
 */
public final class RangeAnalysis {

    private static final Logger LOG = Logger.getLogger(RangeAnalysis.class.getName());

    private final NodeEvaluator evaluator;
    private final RangeRuleRegistry rules;

    public RangeAnalysis(NodeEvaluator evaluator) {
        this(evaluator, RangeRuleRegistry.defaults());
    }

    public RangeAnalysis(NodeEvaluator evaluator, RangeRuleRegistry rules) {
        this.evaluator = evaluator;
        this.rules = rules;
    }

    /**
     * Normalize (optionally), walk, and reconstruct integer info (optionally).
     * The returned store is sealed.
     */
    public WalkResult analyze(Graph graph, AnalysisConfig config) {
        Graph prepared = graph;
        if (config.normalize()) {
            prepared = NormalizationPipeline.standard(evaluator).apply(graph);
        }
        RangeWalker walker = new RangeWalker(rules, evaluator, config.channelAxis());
        WalkResult result = walker.walk(prepared, config.inputRange());
        if (config.scaledInt()) {
            new ScaledIntegerPass(rules, evaluator, config.channelAxis()).run(result.graph(), result.store());
        }
        result.store().seal();
        LOG.fine(() -> "Analyzed " + graph.name() + ": " + result.stuckChannels().size()
            + " tensors with stuck channels");
        return result;
    }

    /**
     * Analyze and shape the result into the configured report.
     */
    public RangeReport run(Graph graph, AnalysisConfig config) {
        return RangeReportBuilder.build(analyze(graph, config), config);
    }
}
