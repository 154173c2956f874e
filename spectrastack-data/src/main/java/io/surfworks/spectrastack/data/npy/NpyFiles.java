package io.surfworks.spectrastack.data.npy;

import io.surfworks.spectrastack.core.array.NdArray;
import io.surfworks.spectrastack.core.array.ScalarType;

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
import java.util.Arrays;

/**
 * Whole-file NumPy .npy reading and writing.
 *
 * The .npy format stores a single NumPy array with:
 * - Magic number: \x93NUMPY
 * - Version: 1.0, 2.0, or 3.0
 * - Header: Python dict with dtype, shape, fortran_order
 * - Data: Raw binary array data
 */
public final class NpyFiles {

    // Magic bytes: \x93NUMPY
    private static final byte[] MAGIC = {(byte) 0x93, 'N', 'U', 'M', 'P', 'Y'};

    /**
     * A parsed header and the file offset at which the array data starts.
     */
    public record Preamble(NpyHeader header, long dataOffset) {}

    private NpyFiles() {} // Utility class

    // ==================== Reading ====================

    /**
     * Read a whole .npy file into a row-major array.
     */
    public static NdArray read(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path);
             BufferedInputStream bis = new BufferedInputStream(is)) {
            DataInputStream dis = new DataInputStream(bis);
            NpyHeader header = readPreamble(dis).header();
            byte[] dataBytes = new byte[Math.toIntExact(header.dataSize())];
            dis.readFully(dataBytes);

            ByteBuffer buffer = ByteBuffer.wrap(dataBytes).order(header.byteOrder());
            int[] shape = header.shape();
            int size = Math.toIntExact(header.elementCount());
            double[] data = new double[size];
            int[] fileStrides = strides(shape, header.fortranOrder());
            int[] counter = new int[shape.length];
            for (int k = 0; k < size; k++) {
                long element = 0;
                for (int d = 0; d < shape.length; d++) {
                    element += (long) counter[d] * fileStrides[d];
                }
                data[k] = decode(buffer, (int) element * header.dtype().byteSize(), header.dtype());
                for (int d = shape.length - 1; d >= 0; d--) {
                    if (++counter[d] < shape[d]) {
                        break;
                    }
                    counter[d] = 0;
                }
            }
            return NdArray.of(data, shape);
        }
    }

    /**
     * Read only the header from a .npy file.
     */
    public static NpyHeader readHeader(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path);
             BufferedInputStream bis = new BufferedInputStream(is)) {
            return readPreamble(new DataInputStream(bis)).header();
        }
    }

    /**
     * Read magic, version and header, leaving the stream at the start of the data.
     */
    public static Preamble readPreamble(DataInputStream dis) throws IOException {
        byte[] magic = new byte[6];
        dis.readFully(magic);
        for (int i = 0; i < MAGIC.length; i++) {
            if (magic[i] != MAGIC[i]) {
                throw new IOException("Invalid NumPy magic number");
            }
        }

        int majorVersion = dis.readUnsignedByte();
        int minorVersion = dis.readUnsignedByte();

        // Header length is little-endian: 2 bytes in version 1.0, 4 bytes after
        int headerLen;
        int lengthBytes;
        if (majorVersion == 1) {
            int b0 = dis.readUnsignedByte();
            int b1 = dis.readUnsignedByte();
            headerLen = b0 | (b1 << 8);
            lengthBytes = 2;
        } else {
            int b0 = dis.readUnsignedByte();
            int b1 = dis.readUnsignedByte();
            int b2 = dis.readUnsignedByte();
            int b3 = dis.readUnsignedByte();
            headerLen = b0 | (b1 << 8) | (b2 << 16) | (b3 << 24);
            lengthBytes = 4;
        }

        byte[] headerBytes = new byte[headerLen];
        dis.readFully(headerBytes);
        String headerStr = new String(headerBytes, StandardCharsets.US_ASCII).trim();

        NpyHeader header = NpyHeader.parse(majorVersion, minorVersion, headerStr);
        return new Preamble(header, MAGIC.length + 2L + lengthBytes + headerLen);
    }

    // ==================== Writing ====================

    /**
     * Write {@code array} as a little-endian, row-major .npy file of the given type.
     */
    public static void write(Path path, NdArray array, ScalarType dtype) throws IOException {
        write(path, array, NpyHeader.of(dtype, ByteOrder.LITTLE_ENDIAN, false, array.shape()));
    }

    /**
     * Write {@code array} with the dtype, byte order and memory layout of {@code header}.
     *
     * @throws IllegalArgumentException if the header shape differs from the array shape
     */
    public static void write(Path path, NdArray array, NpyHeader header) throws IOException {
        if (!Arrays.equals(header.shape(), array.shape())) {
            throw new IllegalArgumentException("Header shape does not match array shape");
        }
        try (OutputStream os = Files.newOutputStream(path);
             BufferedOutputStream bos = new BufferedOutputStream(os)) {
            write(bos, array, header);
        }
    }

    private static void write(OutputStream out, NdArray array, NpyHeader header) throws IOException {
        DataOutputStream dos = new DataOutputStream(out);
        dos.write(MAGIC);

        String headerStr = header.toHeaderString();

        // Pad header to 64-byte alignment
        // Total: 6 (magic) + 2 (version) + 2 (header len) + headerStr.length + padding + \n
        int baseLen = 6 + 2 + 2 + headerStr.length() + 1;
        int padding = (64 - (baseLen % 64)) % 64;
        int totalHeaderLen = headerStr.length() + padding + 1;

        dos.writeByte(1); // major
        dos.writeByte(0); // minor
        dos.writeByte(totalHeaderLen & 0xFF);
        dos.writeByte((totalHeaderLen >> 8) & 0xFF);
        dos.write(headerStr.getBytes(StandardCharsets.US_ASCII));
        for (int i = 0; i < padding; i++) {
            dos.writeByte(' ');
        }
        dos.writeByte('\n');

        ScalarType dtype = header.dtype();
        int[] shape = array.shape();
        int size = array.size();
        ByteBuffer buffer = ByteBuffer.allocate(Math.toIntExact(header.dataSize())).order(header.byteOrder());
        int[] fileStrides = strides(shape, header.fortranOrder());
        int[] counter = new int[shape.length];
        for (int k = 0; k < size; k++) {
            long element = 0;
            for (int d = 0; d < shape.length; d++) {
                element += (long) counter[d] * fileStrides[d];
            }
            encode(buffer, (int) element * dtype.byteSize(), dtype, array.getFlat(k));
            for (int d = shape.length - 1; d >= 0; d--) {
                if (++counter[d] < shape[d]) {
                    break;
                }
                counter[d] = 0;
            }
        }
        dos.write(buffer.array());
        dos.flush();
    }

    // ==================== Element codec ====================

    /**
     * Element strides of a file layout.
     */
    static int[] strides(int[] shape, boolean fortranOrder) {
        int[] strides = new int[shape.length];
        int stride = 1;
        if (fortranOrder) {
            for (int d = 0; d < shape.length; d++) {
                strides[d] = stride;
                stride *= shape[d];
            }
        } else {
            for (int d = shape.length - 1; d >= 0; d--) {
                strides[d] = stride;
                stride *= shape[d];
            }
        }
        return strides;
    }

    static double decode(ByteBuffer buffer, int position, ScalarType dtype) {
        return switch (dtype) {
            case F32 -> buffer.getFloat(position);
            case F64 -> buffer.getDouble(position);
            case I8 -> buffer.get(position);
            case I16 -> buffer.getShort(position);
            case I32 -> buffer.getInt(position);
            case I64 -> buffer.getLong(position);
            case U8 -> buffer.get(position) & 0xFF;
            case U16 -> buffer.getShort(position) & 0xFFFF;
            case BOOL -> buffer.get(position) != 0 ? 1 : 0;
        };
    }

    static void encode(ByteBuffer buffer, int position, ScalarType dtype, double value) {
        double v = dtype.coerce(value);
        switch (dtype) {
            case F32 -> buffer.putFloat(position, (float) v);
            case F64 -> buffer.putDouble(position, v);
            case I8, U8, BOOL -> buffer.put(position, (byte) (long) v);
            case I16, U16 -> buffer.putShort(position, (short) (long) v);
            case I32 -> buffer.putInt(position, (int) (long) v);
            case I64 -> buffer.putLong(position, (long) v);
        }
    }
}
