package io.surfworks.rangeforge.backend.cpu;

import io.surfworks.rangeforge.core.graph.Graph;
import io.surfworks.rangeforge.core.graph.Node;
import io.surfworks.rangeforge.core.range.AnalysisConfig;
import io.surfworks.rangeforge.core.range.InputRange;
import io.surfworks.rangeforge.core.range.Range;
import io.surfworks.rangeforge.core.range.RangeAnalysis;
import io.surfworks.rangeforge.core.range.RangeInfo;
import io.surfworks.rangeforge.core.range.StuckChannel;
import io.surfworks.rangeforge.core.range.WalkResult;
import io.surfworks.rangeforge.core.report.RangeReport;
import io.surfworks.rangeforge.core.report.ReportMode;
import io.surfworks.rangeforge.core.tensor.Tensor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Range analysis driven by the CPU evaluator, checked against concrete executions.
 */
class CpuRangeAnalysisTest {

    private static final double EPS = 1e-9;

    private CpuNodeEvaluator evaluator;
    private RangeAnalysis analysis;

    @BeforeEach
    void setUp() {
        evaluator = new CpuNodeEvaluator();
        analysis = new RangeAnalysis(evaluator);
    }

    private static Node node(String name, String opType, List<String> inputs, String output,
                             Map<String, Object> attributes) {
        return new Node(name, opType, inputs, List.of(output), attributes);
    }

    private static AnalysisConfig perChannel(double[] min, double[] max) {
        return AnalysisConfig.builder()
            .inputRange(InputRange.perChannel(min, max))
            .build();
    }

    private static void assertWithin(Range range, Tensor value) {
        for (int i = 0; i < value.elementCount(); i++) {
            double lo = range.min().elementCount() == 1 ? range.min().getFlat(0) : range.min().getFlat(i);
            double hi = range.max().elementCount() == 1 ? range.max().getFlat(0) : range.max().getFlat(i);
            double v = value.getFlat(i);
            assertTrue(v >= lo - EPS && v <= hi + EPS,
                "element " + i + " = " + v + " outside [" + lo + ", " + hi + "]");
        }
    }

    @Nested
    @DisplayName("Dense layer")
    class DenseLayer {

        private final Tensor weights = Tensor.of(new double[]{1, -1, 2, 3}, 2, 2);

        private Graph gemm() {
            return Graph.builder("dense")
                .input("x", 1, 2)
                .initializer("w", weights)
                .initializer("b", Tensor.vector(0, 0))
                .valueInfo("y", 1, 2)
                .node(node("fc", "Gemm", List.of("x", "w", "b"), "y", Map.of("transB", 1L)))
                .output("y")
                .build();
        }

        @Test
        void perChannelBoundsFollowWeightSigns() {
            WalkResult result = analysis.analyze(gemm(), perChannel(new double[]{0, 0}, new double[]{1, 1}));

            Range y = result.store().require("y").range();
            assertArrayEquals(new double[]{-1, 0}, y.min().toDoubleArray(), EPS);
            assertArrayEquals(new double[]{1, 5}, y.max().toDoubleArray(), EPS);
        }

        @Test
        void concreteOutputsStayInsideTheInterval() {
            WalkResult result = analysis.analyze(gemm(), perChannel(new double[]{0, 0}, new double[]{1, 1}));
            Range y = result.store().require("y").range();
            Node fc = gemm().nodes().get(0);

            double[][] corners = {{0, 0}, {0, 1}, {1, 0}, {1, 1}, {0.25, 0.75}};
            for (double[] corner : corners) {
                Tensor out = evaluator.evaluate(fc,
                    List.of(Tensor.of(corner, 1, 2), weights, Tensor.vector(0, 0))).get(0);
                assertWithin(y, out);
            }
        }

        @Test
        void matMulAgreesWithGemm() {
            Graph graph = Graph.builder("matmul")
                .input("x", 1, 2)
                .initializer("w", weights.transpose(1, 0))
                .valueInfo("y", 1, 2)
                .node(node("mm", "MatMul", List.of("x", "w"), "y", Map.of()))
                .build();

            WalkResult result = analysis.analyze(graph, perChannel(new double[]{0, 0}, new double[]{1, 1}));

            Range y = result.store().require("y").range();
            assertArrayEquals(new double[]{-1, 0}, y.min().toDoubleArray(), EPS);
            assertArrayEquals(new double[]{1, 5}, y.max().toDoubleArray(), EPS);
        }
    }

    @Nested
    @DisplayName("Constant-only nodes")
    class ConstantOnly {

        private Graph graph() {
            return Graph.builder("const")
                .input("x", 1, 2)
                .initializer("a", Tensor.vector(1, 2))
                .initializer("b", Tensor.vector(3, 4))
                .valueInfo("y", 1, 2)
                .valueInfo("z", 1, 2)
                .node(node("sum", "Add", List.of("a", "b"), "c", Map.of()))
                .node(node("shift", "Add", List.of("x", "c"), "y", Map.of()))
                .node(node("act", "Relu", List.of("y"), "z", Map.of()))
                .output("z")
                .build();
        }

        @Test
        void evaluatedOnceAndFlaggedAsInitializer() {
            WalkResult result = analysis.analyze(graph(), AnalysisConfig.builder()
                .inputRange(InputRange.uniform(-1, 1))
                .build());

            RangeInfo c = result.store().require("c");
            assertTrue(c.initializer());
            assertTrue(c.range().isDegenerate());
            assertArrayEquals(new double[]{4, 6}, c.range().min().toDoubleArray(), EPS);
            assertArrayEquals(new double[]{4, 6}, c.range().max().toDoubleArray(), EPS);
        }

        @Test
        void constantFeedsDynamicConsumer() {
            WalkResult result = analysis.analyze(graph(), AnalysisConfig.builder()
                .inputRange(InputRange.uniform(-1, 1))
                .build());

            Range y = result.store().require("y").range();
            assertArrayEquals(new double[]{3, 5}, y.min().toDoubleArray(), EPS);
            assertArrayEquals(new double[]{5, 7}, y.max().toDoubleArray(), EPS);
            assertFalse(result.stuckChannels().containsKey("c"));
        }

        @Test
        void strippedFromRangeReport() {
            AnalysisConfig config = AnalysisConfig.builder()
                .inputRange(InputRange.uniform(-1, 1))
                .reportMode(ReportMode.RANGE)
                .build();

            RangeReport stripped = analysis.run(graph(), config);
            RangeReport kept = analysis.run(graph(), config.toBuilder().stripInitializers(false).build());

            assertFalse(stripped.tensorNames().contains("c"));
            assertFalse(stripped.tensorNames().contains("a"));
            assertTrue(stripped.tensorNames().containsAll(List.of("x", "y", "z")));
            assertTrue(kept.tensorNames().containsAll(List.of("a", "b", "c")));
        }
    }

    @Nested
    @DisplayName("Depthwise convolution")
    class Depthwise {

        private final Tensor weights = Tensor.of(new double[]{2, 2, -3, -1}, 2, 1, 1, 2);

        private Graph graph() {
            return Graph.builder("depthwise")
                .input("x", 1, 2, 1, 2)
                .initializer("w", weights)
                .valueInfo("y", 1, 2, 1, 1)
                .node(node("dw", "Conv", List.of("x", "w"), "y", Map.of("group", 2L)))
                .output("y")
                .build();
        }

        @Test
        void channelsKeepTheirOwnSignPattern() {
            WalkResult result = analysis.analyze(graph(), perChannel(new double[]{0, 0}, new double[]{1, 2}));

            Range y = result.store().require("y").range();
            assertArrayEquals(new double[]{0, -8}, y.min().toDoubleArray(), EPS);
            assertArrayEquals(new double[]{4, 0}, y.max().toDoubleArray(), EPS);
        }

        @Test
        void concreteOutputsStayInsideTheInterval() {
            WalkResult result = analysis.analyze(graph(), perChannel(new double[]{0, 0}, new double[]{1, 2}));
            Range y = result.store().require("y").range();
            Node dw = graph().nodes().get(0);

            double[][] samples = {{0, 0, 0, 0}, {1, 1, 2, 2}, {1, 0, 0, 2}, {0.5, 1, 1.5, 0}};
            for (double[] sample : samples) {
                Tensor out = evaluator.evaluate(dw, List.of(Tensor.of(sample, 1, 2, 1, 2), weights)).get(0);
                assertWithin(y, out);
            }
        }
    }

    @Nested
    @DisplayName("Sampled operators")
    class Sampled {

        @Test
        void maxPoolIsReducedPerChannel() {
            Graph graph = Graph.builder("pool")
                .input("x", 1, 2, 2, 2)
                .valueInfo("y", 1, 2, 1, 1)
                .node(node("pool", "MaxPool", List.of("x"), "y", Map.of("kernel_shape", List.of(2L, 2L))))
                .build();

            WalkResult result = analysis.analyze(graph, perChannel(new double[]{-1, 2}, new double[]{1, 3}));

            Range y = result.store().require("y").range();
            assertArrayEquals(new double[]{-1, 2}, y.min().toDoubleArray(), EPS);
            assertArrayEquals(new double[]{1, 3}, y.max().toDoubleArray(), EPS);
        }

        @Test
        void reluStuckChannelIsReported() {
            Graph graph = Graph.builder("relu")
                .input("x", 1, 3)
                .valueInfo("y", 1, 3)
                .node(node("act", "Relu", List.of("x"), "y", Map.of()))
                .build();
            AnalysisConfig config = perChannel(new double[]{-2, -1, 1}, new double[]{-1, 1, 2});

            RangeReport stuck = analysis.run(graph, config);
            RangeReport zero = analysis.run(graph, config.toBuilder().reportMode(ReportMode.ZEROSTUCK_CHANNEL).build());

            assertEquals(Map.of("y", List.of(new StuckChannel(0, 0.0))),
                ((RangeReport.StuckChannels) stuck).entries());
            assertEquals(((RangeReport.StuckChannels) stuck).zeroStuck(), zero);
        }

        @Test
        void quantizerClampsToItsGrid() {
            Graph graph = Graph.builder("quant")
                .input("x", 1, 2)
                .initializer("s", Tensor.scalar(0.5))
                .initializer("z", Tensor.scalar(0))
                .initializer("bw", Tensor.scalar(4))
                .valueInfo("q", 1, 2)
                .node(node("quant", "Quant", List.of("x", "s", "z", "bw"), "q", Map.of()))
                .build();
            AnalysisConfig config = AnalysisConfig.builder()
                .inputRange(InputRange.uniform(-4, 4))
                .scaledInt(true)
                .build();

            RangeInfo q = analysis.analyze(graph, config).store().require("q");

            assertEquals(Range.of(-4, 3.5), q.range());
            assertEquals(Range.of(-8, 7), q.intRange());
            assertEquals(0.5, q.scale().item(), EPS);
            assertTrue(q.isConsistent(1e-9));
        }

        @Test
        void signedOneBitQuantizerIsBipolar() {
            Graph graph = Graph.builder("bipolar")
                .input("x", 1, 2)
                .initializer("s", Tensor.scalar(1))
                .initializer("z", Tensor.scalar(0))
                .initializer("bw", Tensor.scalar(1))
                .valueInfo("q", 1, 2)
                .node(node("quant", "Quant", List.of("x", "s", "z", "bw"), "q", Map.of()))
                .build();
            AnalysisConfig config = AnalysisConfig.builder()
                .inputRange(InputRange.uniform(-4, 4))
                .scaledInt(true)
                .build();

            RangeInfo q = analysis.analyze(graph, config).store().require("q");

            assertEquals(Range.of(-1, 1), q.range());
            assertEquals(Range.of(-1, 1), q.intRange());
            assertTrue(q.isConsistent(1e-9));
        }

        @Test
        void unsignedOneBitQuantizerIsBinary() {
            Graph graph = Graph.builder("binary")
                .input("x", 1, 2)
                .initializer("s", Tensor.scalar(1))
                .initializer("z", Tensor.scalar(0))
                .initializer("bw", Tensor.scalar(1))
                .valueInfo("q", 1, 2)
                .node(node("quant", "Quant", List.of("x", "s", "z", "bw"), "q", Map.of("signed", 0L)))
                .build();
            AnalysisConfig config = AnalysisConfig.builder()
                .inputRange(InputRange.uniform(-4, 4))
                .scaledInt(true)
                .build();

            RangeInfo q = analysis.analyze(graph, config).store().require("q");

            assertEquals(Range.of(0, 1), q.range());
            assertEquals(Range.of(0, 1), q.intRange());
            assertTrue(q.isConsistent(1e-9));
        }

        @Test
        void unsupportedOperatorIsSkipped() {
            Graph graph = Graph.builder("skip")
                .input("x", 1, 2)
                .valueInfo("y", 1, 2)
                .node(node("mystery", "Einsum", List.of("x"), "y", Map.of()))
                .build();

            WalkResult result = analysis.analyze(graph, AnalysisConfig.builder()
                .inputRange(InputRange.uniform(0, 1))
                .build());

            assertEquals(List.of("mystery"), result.skippedNodes());
            assertFalse(result.store().contains("y"));
        }
    }

    @Test
    void evaluatorChecksDeclaredOutputCount() {
        Node split = new Node("split", "Split", List.of("x"), List.of("a", "b", "c"),
            Map.of("split", List.of(2L, 2L)));

        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> evaluator.evaluate(split, List.of(Tensor.vector(1, 2, 3, 4))));
        assertTrue(e.getMessage().contains("declares 3"));
    }

    @Test
    void evaluatorReportsSupport() {
        assertTrue(evaluator.supports(new Node("c", "Conv", List.of("x", "w"), List.of("y"), Map.of())));
        assertFalse(evaluator.supports(new Node("r", "Resize", List.of("x"), List.of("y"),
            Map.of("mode", "cubic"))));
    }
}
