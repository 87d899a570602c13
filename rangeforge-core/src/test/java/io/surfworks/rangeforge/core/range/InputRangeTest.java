package io.surfworks.rangeforge.core.range;

import io.surfworks.rangeforge.core.graph.Graph;
import io.surfworks.rangeforge.core.graph.ValueInfo;
import io.surfworks.rangeforge.core.tensor.DataType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InputRangeTest {

    @Nested
    @DisplayName("parse")
    class Parse {

        @Test
        void emptySelectsDatatype() {
            assertSame(InputRange.fromDataType(), InputRange.parse(""));
            assertSame(InputRange.fromDataType(), InputRange.parse(null));
        }

        @Test
        void uniformPair() {
            assertEquals(InputRange.uniform(-1, 1), InputRange.parse("-1,1"));
            assertEquals(InputRange.uniform(0, 0.5), InputRange.parse("(0, 0.5)"));
        }

        @Test
        void perChannelLists() {
            InputRange parsed = InputRange.parse("[0, -1, 2], [1, 1, 3]");
            assertEquals(InputRange.perChannel(new double[]{0, -1, 2}, new double[]{1, 1, 3}), parsed);
        }

        @ParameterizedTest
        @ValueSource(strings = {"1", "1,2,3", "a,b", "[0,1]", "[0,1],[2]", "2,1"})
        void rejectsMalformed(String text) {
            assertThrows(IllegalArgumentException.class, () -> InputRange.parse(text));
        }
    }

    @Nested
    @DisplayName("resolve")
    class Resolve {

        private final Graph graph = Graph.builder("g")
            .input(ValueInfo.of("q", DataType.parse("UINT4"), 1, 3))
            .input("plain", 1, 3)
            .build();

        @Test
        void datatypeRange() {
            RangeInfo info = InputRange.fromDataType().resolve(graph, "q");
            assertEquals(Range.of(0, 15), info.range());
        }

        @Test
        void missingDatatypeIsFatal() {
            RangeAnalysisException e = assertThrows(RangeAnalysisException.class,
                () -> InputRange.fromDataType().resolve(graph, "plain"));
            assertTrue(e.getMessage().contains("'plain'"));
        }

        @Test
        void perChannelResolvesToVectors() {
            RangeInfo info = InputRange.perChannel(new double[]{0, 1, 2}, new double[]{1, 2, 3})
                .resolve(graph, "plain");
            assertArrayEquals(new double[]{0, 1, 2}, info.range().min().toDoubleArray());
            assertEquals(3, info.range().channelCount());
        }

        @Test
        void prebuiltIsReturnedAsIs() {
            RangeInfo info = RangeInfo.of(-3, 3);
            assertSame(info, InputRange.prebuilt(info).resolve(graph, "q"));
        }
    }
}
