package io.surfworks.rangeforge.core.tensor;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DataTypeTest {

    @ParameterizedTest
    @CsvSource({
        "INT8, -128, 127",
        "UINT8, 0, 255",
        "INT4, -8, 7",
        "UINT4, 0, 15",
        "INT2, -2, 1",
        "BIPOLAR, -1, 1",
        "BINARY, 0, 1",
        "TERNARY, -1, 1",
        "FLOAT16, -65504, 65504"
    })
    void representableInterval(String name, double min, double max) {
        DataType dt = DataType.parse(name);
        assertEquals(min, dt.min());
        assertEquals(max, dt.max());
        assertEquals(name, dt.name());
    }

    @Test
    void parseIsCaseInsensitive() {
        assertEquals(DataType.integer(4, true), DataType.parse("int4"));
        assertSame(DataType.BIPOLAR, DataType.parse("bipolar"));
    }

    @Test
    void parseRejectsUnknownNames() {
        assertThrows(IllegalArgumentException.class, () -> DataType.parse("QUATERNARY"));
        assertThrows(IllegalArgumentException.class, () -> DataType.parse("INTX"));
    }

    @Test
    void allowedValues() {
        assertFalse(DataType.BIPOLAR.allowed(0));
        assertTrue(DataType.BIPOLAR.allowed(-1));
        assertTrue(DataType.parse("INT4").allowed(-8));
        assertFalse(DataType.parse("INT4").allowed(8));
        assertFalse(DataType.parse("UINT8").allowed(1.5));
        assertTrue(DataType.FLOAT32.allowed(1.5));
    }

    @Test
    void signedness() {
        assertTrue(DataType.parse("INT8").signed());
        assertFalse(DataType.parse("UINT8").signed());
        assertFalse(DataType.BINARY.signed());
        assertTrue(DataType.BIPOLAR.isInteger());
        assertFalse(DataType.FLOAT32.isInteger());
    }

    @Test
    void quantizedWidths() {
        assertEquals(DataType.BIPOLAR, DataType.quantized(1, true));
        assertEquals(DataType.BINARY, DataType.quantized(1, false));
        assertEquals(DataType.parse("INT4"), DataType.quantized(4, true));
        assertEquals(DataType.parse("UINT2"), DataType.quantized(2, false));
    }
}
