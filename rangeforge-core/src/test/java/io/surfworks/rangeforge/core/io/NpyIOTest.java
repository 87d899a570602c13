package io.surfworks.rangeforge.core.io;

import io.surfworks.rangeforge.core.tensor.Tensor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class NpyIOTest {

    @TempDir
    Path tempDir;

    /**
     * Version 1.0 .npy bytes with the given header dict and payload.
     */
    private static byte[] npy(String header, byte[] payload) {
        byte[] headerBytes = (header + "\n").getBytes(StandardCharsets.US_ASCII);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(new byte[]{(byte) 0x93, 'N', 'U', 'M', 'P', 'Y', 1, 0});
        out.write(headerBytes.length & 0xFF);
        out.write((headerBytes.length >> 8) & 0xFF);
        out.writeBytes(headerBytes);
        out.writeBytes(payload);
        return out.toByteArray();
    }

    @Test
    void writtenFileReadsBackWithShape() throws IOException {
        Tensor original = Tensor.of(new double[]{0.5, -1.25, 3, 4, 5, 6}, 3, 2);
        Path file = tempDir.resolve("w.npy");
        NpyIO.write(original, file);

        assertEquals(original, NpyIO.read(file));
        NpyHeader header = NpyIO.readHeader(file);
        assertEquals(NpyHeader.ElementType.F8, header.elementType());
        assertArrayEquals(new int[]{3, 2}, header.shape());
        assertFalse(header.fortranOrder());
    }

    @Test
    void readsSignedBytesWidenedToDouble() throws IOException {
        byte[] data = npy("{'descr': '|i1', 'fortran_order': False, 'shape': (4,), }",
            new byte[]{-128, -1, 0, 127});
        Tensor t = NpyIO.read(new ByteArrayInputStream(data));
        assertArrayEquals(new int[]{4}, t.shape());
        assertArrayEquals(new double[]{-128, -1, 0, 127}, t.toDoubleArray());
    }

    @Test
    void readsBigEndianInts() throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(8).order(ByteOrder.BIG_ENDIAN);
        buffer.putInt(7).putInt(-3);
        byte[] data = npy("{'descr': '>i4', 'fortran_order': False, 'shape': (2,), }", buffer.array());
        assertArrayEquals(new double[]{7, -3}, NpyIO.read(new ByteArrayInputStream(data)).toDoubleArray());
    }

    @Test
    void fortranOrderIsTransposedToRowMajor() throws IOException {
        // column-major [[1, 2, 3], [4, 5, 6]]
        ByteBuffer buffer = ByteBuffer.allocate(6 * 4).order(ByteOrder.LITTLE_ENDIAN);
        for (float v : new float[]{1, 4, 2, 5, 3, 6}) {
            buffer.putFloat(v);
        }
        byte[] data = npy("{'descr': '<f4', 'fortran_order': True, 'shape': (2, 3), }", buffer.array());
        Tensor t = NpyIO.read(new ByteArrayInputStream(data));
        assertArrayEquals(new int[]{2, 3}, t.shape());
        assertArrayEquals(new double[]{1, 2, 3, 4, 5, 6}, t.toDoubleArray());
    }

    @Test
    void scalarShape() throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(8).order(ByteOrder.LITTLE_ENDIAN).putDouble(2.5);
        byte[] data = npy("{'descr': '<f8', 'fortran_order': False, 'shape': (), }", buffer.array());
        Tensor t = NpyIO.read(new ByteArrayInputStream(data));
        assertEquals(0, t.rank());
        assertEquals(2.5, t.item());
    }

    @Test
    void rejectsBadMagic() {
        byte[] data = {1, 2, 3, 4, 5, 6, 7, 8, 9, 10};
        assertThrows(IOException.class, () -> NpyIO.read(new ByteArrayInputStream(data)));
    }

    @Test
    void rejectsUnsupportedDtype() {
        byte[] data = npy("{'descr': '<c16', 'fortran_order': False, 'shape': (1,), }", new byte[16]);
        assertThrows(IOException.class, () -> NpyIO.read(new ByteArrayInputStream(data)));
    }
}
