package io.surfworks.rangeforge.core.io;

import io.surfworks.rangeforge.core.tensor.Tensor;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes constant tensors in NumPy's .npy format.
 *
 * <p>Every supported element type is widened to double on read; writes always use
 * little-endian float64.
 */
public final class NpyIO {

    private static final byte[] MAGIC = {(byte) 0x93, 'N', 'U', 'M', 'P', 'Y'};

    private NpyIO() {
    }

    /**
     * Read a tensor from a .npy file.
     */
    public static Tensor read(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path);
             BufferedInputStream bis = new BufferedInputStream(is)) {
            return read(bis);
        }
    }

    /**
     * Read a tensor from an input stream.
     */
    public static Tensor read(InputStream in) throws IOException {
        DataInputStream dis = new DataInputStream(in);
        NpyHeader header = readHeader(dis);

        byte[] data = new byte[header.dataLength()];
        dis.readFully(data);
        ByteBuffer buffer = ByteBuffer.wrap(data).order(header.byteOrder());

        double[] values = new double[header.elementCount()];
        for (int i = 0; i < values.length; i++) {
            values[i] = header.elementType().read(buffer, i);
        }

        int[] shape = header.shape();
        if (!header.fortranOrder() || shape.length < 2) {
            return Tensor.of(values, shape);
        }
        // Column-major data is the row-major layout of the reversed shape
        int rank = shape.length;
        int[] reversed = new int[rank];
        int[] perm = new int[rank];
        for (int i = 0; i < rank; i++) {
            reversed[i] = shape[rank - 1 - i];
            perm[i] = rank - 1 - i;
        }
        return Tensor.of(values, reversed).transpose(perm);
    }

    /**
     * Write a tensor to a .npy file as little-endian float64.
     */
    public static void write(Tensor tensor, Path path) throws IOException {
        try (OutputStream os = Files.newOutputStream(path);
             BufferedOutputStream bos = new BufferedOutputStream(os)) {
            write(tensor, bos);
        }
    }

    /**
     * Write a tensor to an output stream as little-endian float64.
     */
    public static void write(Tensor tensor, OutputStream out) throws IOException {
        DataOutputStream dos = new DataOutputStream(out);
        dos.write(MAGIC);

        NpyHeader header = new NpyHeader(
            1, 0,
            NpyHeader.ElementType.F8,
            ByteOrder.LITTLE_ENDIAN,
            false,
            tensor.shape()
        );
        String headerStr = header.toHeaderString();

        // Pad header to 64-byte alignment
        // Total: 6 (magic) + 2 (version) + 2 (header len) + headerStr.length + padding + \n
        int baseLen = 6 + 2 + 2 + headerStr.length() + 1;
        int padding = (64 - (baseLen % 64)) % 64;
        int totalHeaderLen = headerStr.length() + padding + 1;

        dos.writeByte(1);
        dos.writeByte(0);
        dos.writeByte(totalHeaderLen & 0xFF);
        dos.writeByte((totalHeaderLen >> 8) & 0xFF);
        dos.write(headerStr.getBytes(StandardCharsets.US_ASCII));
        for (int i = 0; i < padding; i++) {
            dos.writeByte(' ');
        }
        dos.writeByte('\n');

        ByteBuffer buffer = ByteBuffer.allocate(tensor.elementCount() * 8).order(ByteOrder.LITTLE_ENDIAN);
        for (int i = 0; i < tensor.elementCount(); i++) {
            buffer.putDouble(tensor.getFlat(i));
        }
        dos.write(buffer.array());
        dos.flush();
    }

    /**
     * Read the header of a .npy file without its data.
     */
    public static NpyHeader readHeader(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path);
             BufferedInputStream bis = new BufferedInputStream(is)) {
            return readHeader(new DataInputStream(bis));
        }
    }

    private static NpyHeader readHeader(DataInputStream dis) throws IOException {
        byte[] magic = new byte[6];
        dis.readFully(magic);
        for (int i = 0; i < MAGIC.length; i++) {
            if (magic[i] != MAGIC[i]) {
                throw new IOException("Invalid NumPy magic number");
            }
        }

        int majorVersion = dis.readUnsignedByte();
        int minorVersion = dis.readUnsignedByte();

        // 1.x stores a u16 header length, later versions a u32
        byte[] lengthBytes = new byte[majorVersion == 1 ? 2 : 4];
        dis.readFully(lengthBytes);
        ByteBuffer length = ByteBuffer.wrap(lengthBytes).order(ByteOrder.LITTLE_ENDIAN);
        int headerLength = majorVersion == 1 ? Short.toUnsignedInt(length.getShort()) : length.getInt();
        if (headerLength < 0) {
            throw new IOException("Malformed .npy header: length " + Integer.toUnsignedString(headerLength));
        }

        byte[] dictBytes = new byte[headerLength];
        dis.readFully(dictBytes);
        String dict = new String(dictBytes,
            majorVersion >= 3 ? StandardCharsets.UTF_8 : StandardCharsets.US_ASCII).trim();

        try {
            return NpyHeader.parse(majorVersion, minorVersion, dict);
        } catch (IllegalArgumentException e) {
            throw new IOException("Malformed .npy header: " + e.getMessage(), e);
        }
    }
}
