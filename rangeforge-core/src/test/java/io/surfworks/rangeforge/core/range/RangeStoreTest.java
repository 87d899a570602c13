package io.surfworks.rangeforge.core.range;

import io.surfworks.rangeforge.core.tensor.Tensor;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RangeStoreTest {

    @Test
    void definesOnce() {
        RangeStore store = new RangeStore();
        store.define("x", RangeInfo.of(0, 1));
        assertThrows(IllegalStateException.class, () -> store.define("x", RangeInfo.of(0, 2)));
        assertEquals(Range.of(0, 1), store.require("x").range());
    }

    @Test
    void keepsDefinitionOrder() {
        RangeStore store = new RangeStore();
        store.define("b", RangeInfo.of(0, 1));
        store.define("a", RangeInfo.of(0, 1));
        store.define("c", RangeInfo.of(0, 1));
        assertEquals(List.of("b", "a", "c"), List.copyOf(store.names()));
        assertEquals(3, store.size());
    }

    @Test
    void attachingIntegerInfoKeepsRange() {
        RangeStore store = new RangeStore();
        store.define("x", RangeInfo.of(-1, 1));
        store.attachIntegerInfo("x", Range.of(-2, 2), Tensor.scalar(0.5), Tensor.scalar(0));
        RangeInfo info = store.require("x");
        assertEquals(Range.of(-1, 1), info.range());
        assertTrue(info.hasIntegerInfo());
    }

    @Test
    void missingTensors() {
        RangeStore store = new RangeStore();
        assertTrue(store.get("nope").isEmpty());
        assertThrows(RangeAnalysisException.class, () -> store.require("nope"));
        assertThrows(IllegalStateException.class,
            () -> store.attachIntegerInfo("nope", Range.of(0, 1), Tensor.scalar(1), Tensor.scalar(0)));
    }

    @Test
    void sealedStoreRejectsWrites() {
        RangeStore store = new RangeStore();
        store.define("x", RangeInfo.of(0, 1));
        store.seal();

        assertTrue(store.isSealed());
        assertThrows(IllegalStateException.class, () -> store.define("y", RangeInfo.of(0, 1)));
        assertThrows(IllegalStateException.class,
            () -> store.attachIntegerInfo("x", Range.of(0, 1), Tensor.scalar(1), Tensor.scalar(0)));
        assertEquals(Range.of(0, 1), store.require("x").range());
        assertEquals(1, store.size());
    }
}
