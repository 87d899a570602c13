package io.surfworks.rangeforge.core.range.rules;

import io.surfworks.rangeforge.core.graph.Graph;
import io.surfworks.rangeforge.core.range.Range;
import io.surfworks.rangeforge.core.range.RangeAnalysisException;
import io.surfworks.rangeforge.core.range.RangeInfo;
import io.surfworks.rangeforge.core.range.RangeStore;
import io.surfworks.rangeforge.core.tensor.Tensor;
import io.surfworks.rangeforge.core.testing.SyntheticEvaluator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static io.surfworks.rangeforge.core.testing.Graphs.node;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MonotonicRangeRuleTest {

    private final SyntheticEvaluator evaluator = new SyntheticEvaluator();
    private final MonotonicRangeRule rule = new MonotonicRangeRule();

    private RangeContext context(Graph graph, Map<String, Range> dynamic) {
        RangeStore store = new RangeStore();
        dynamic.forEach((name, range) -> store.define(name, RangeInfo.of(range)));
        graph.initializers().forEach((name, value) -> store.define(name, RangeInfo.constant(value)));
        return new RangeContext(graph, evaluator, store, 1);
    }

    @Nested
    @DisplayName("Sampling")
    class Sampling {

        @Test
        void reluClampsLowerBoundPerChannel() {
            Graph g = Graph.builder("relu")
                .input("x", 1, 3, 2)
                .node(node("relu", "Relu", List.of("x"), "y"))
                .build();
            RangeInfo out = rule.apply(g.nodes().get(0), context(g, Map.of("x", Range.of(-1, 2)))).get("y");
            assertArrayEquals(new double[]{0, 0, 0}, out.range().min().toDoubleArray());
            assertArrayEquals(new double[]{2, 2, 2}, out.range().max().toDoubleArray());
            assertEquals(2, evaluator.calls().size());
        }

        @Test
        void constantOperandShiftsChannels() {
            Graph g = Graph.builder("add")
                .input("x", 1, 3)
                .initializer("c", Tensor.vector(1, 2, 3))
                .node(node("add", "Add", List.of("x", "c"), "y"))
                .build();
            RangeInfo out = rule.apply(g.nodes().get(0), context(g, Map.of("x", Range.of(0, 1)))).get("y");
            assertArrayEquals(new double[]{1, 2, 3}, out.range().min().toDoubleArray());
            assertArrayEquals(new double[]{2, 3, 4}, out.range().max().toDoubleArray());
        }

        @Test
        void enumeratesAllCombinationsOfDistinctInputs() {
            Graph g = Graph.builder("sub")
                .input("x", 1, 2)
                .input("z", 1, 2)
                .node(node("sub", "Sub", List.of("x", "z"), "y"))
                .build();
            RangeInfo out = rule.apply(g.nodes().get(0),
                context(g, Map.of("x", Range.of(0, 1), "z", Range.of(0, 1)))).get("y");
            assertArrayEquals(new double[]{-1, -1}, out.range().min().toDoubleArray());
            assertArrayEquals(new double[]{1, 1}, out.range().max().toDoubleArray());
            assertEquals(4, evaluator.calls().size());
        }

        @Test
        void repeatedInputGetsTheSameValueEverywhere() {
            // sampling is exact only for monotonic operators: x*x on [-1, 1] never sees 0
            Graph g = Graph.builder("square")
                .input("x", 1, 2)
                .node(node("sq", "Mul", List.of("x", "x"), "y"))
                .build();
            RangeInfo out = rule.apply(g.nodes().get(0), context(g, Map.of("x", Range.of(-1, 1)))).get("y");
            assertArrayEquals(new double[]{1, 1}, out.range().min().toDoubleArray());
            assertArrayEquals(new double[]{1, 1}, out.range().max().toDoubleArray());
            assertEquals(2, evaluator.calls().size());
        }

        @Test
        void rankOneOutputsKeepEveryElement() {
            Graph g = Graph.builder("vec")
                .input("x", 3)
                .initializer("c", Tensor.vector(0, 10, 20))
                .node(node("add", "Add", List.of("x", "c"), "y"))
                .build();
            RangeInfo out = rule.apply(g.nodes().get(0), context(g, Map.of("x", Range.of(0, 1)))).get("y");
            assertArrayEquals(new double[]{0, 10, 20}, out.range().min().toDoubleArray());
            assertArrayEquals(new double[]{1, 11, 21}, out.range().max().toDoubleArray());
        }

        @Test
        void perChannelInputBounds() {
            Graph g = Graph.builder("neg")
                .input("x", 1, 2, 2)
                .node(node("neg", "Neg", List.of("x"), "y"))
                .build();
            Range in = Range.perChannel(new double[]{0, 1}, new double[]{2, 3});
            RangeInfo out = rule.apply(g.nodes().get(0), context(g, Map.of("x", in))).get("y");
            assertArrayEquals(new double[]{-2, -3}, out.range().min().toDoubleArray(), 1e-12);
            assertArrayEquals(new double[]{0, -1}, out.range().max().toDoubleArray(), 1e-12);
        }
    }

    @Test
    void allConstantInputsEvaluateOnce() {
        Graph g = Graph.builder("const")
            .initializer("a", Tensor.vector(1, 2))
            .initializer("b", Tensor.vector(3, 4))
            .node(node("add", "Add", List.of("a", "b"), "y"))
            .build();
        RangeInfo out = rule.apply(g.nodes().get(0), context(g, Map.of())).get("y");
        assertTrue(out.initializer());
        assertTrue(out.range().isDegenerate());
        assertArrayEquals(new double[]{4, 6}, out.range().min().toDoubleArray());
        assertEquals(1, evaluator.calls().size());
    }

    @Test
    void storeConstantsTakePrecedenceOverGraphValues() {
        Graph g = Graph.builder("scratch")
            .input("x", 2)
            .initializer("c", Tensor.vector(1, 1))
            .node(node("add", "Add", List.of("x", "c"), "y"))
            .build();
        RangeStore store = new RangeStore();
        store.define("x", RangeInfo.of(0, 1));
        store.define("c", RangeInfo.constant(Tensor.vector(10, 10)));
        RangeInfo out = rule.apply(g.nodes().get(0), new RangeContext(g, evaluator, store, 1)).get("y");
        assertArrayEquals(new double[]{10, 10}, out.range().min().toDoubleArray());
    }

    @Test
    void missingShapeIsFatal() {
        Graph g = Graph.builder("noshape")
            .valueInfo("other", 1)
            .node(node("relu", "Relu", List.of("x"), "y"))
            .build();
        RangeAnalysisException e = assertThrows(RangeAnalysisException.class,
            () -> rule.apply(g.nodes().get(0), context(g, Map.of("x", Range.of(0, 1)))));
        assertTrue(e.getMessage().contains("'x'"));
    }

    @Nested
    @DisplayName("Prototype tensors")
    class Prototypes {

        @Test
        void singleValueFillsTensor() {
            PrototypeTensors p = PrototypeTensors.of(Range.of(-1, 1), new int[]{2, 2}, 1);
            assertEquals(Tensor.full(-1, 2, 2), p.min());
            assertEquals(Tensor.full(1, 2, 2), p.max());
        }

        @Test
        void singleElementVectorIsUniform() {
            PrototypeTensors p = PrototypeTensors.of(
                new Range(Tensor.vector(0), Tensor.vector(5)), new int[]{1, 3}, 1);
            assertEquals(Tensor.full(5, 1, 3), p.max());
        }

        @Test
        void fullShapeIsUsedAsIs() {
            Tensor bound = Tensor.of(new double[]{1, 2, 3, 4}, 2, 2);
            assertEquals(bound, PrototypeTensors.expand(bound, new int[]{2, 2}, 1));
        }

        @Test
        void channelVectorBroadcastsAlongAxis() {
            Tensor expanded = PrototypeTensors.expand(Tensor.vector(1, 2), new int[]{1, 2, 2}, 1);
            assertArrayEquals(new double[]{1, 1, 2, 2}, expanded.toDoubleArray());
            Tensor lastAxis = PrototypeTensors.expand(Tensor.vector(1, 2), new int[]{2, 2}, -1);
            assertArrayEquals(new double[]{1, 2, 1, 2}, lastAxis.toDoubleArray());
        }

        @Test
        void otherShapesAreRejected() {
            RangeAnalysisException e = assertThrows(RangeAnalysisException.class,
                () -> PrototypeTensors.expand(Tensor.vector(1, 2, 3), new int[]{1, 2, 2}, 1));
            assertTrue(e.getMessage().startsWith("Unrecognized interval representation"));
        }
    }
}
