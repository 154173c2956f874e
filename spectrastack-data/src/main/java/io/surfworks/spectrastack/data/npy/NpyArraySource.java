package io.surfworks.spectrastack.data.npy;

import io.surfworks.spectrastack.core.array.ArraySource;
import io.surfworks.spectrastack.core.array.NdArray;
import io.surfworks.spectrastack.core.array.ScalarType;
import io.surfworks.spectrastack.core.array.Selection;
import io.surfworks.spectrastack.core.index.AxisIndex;

import java.io.BufferedInputStream;
import java.io.DataInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.logging.Logger;

/**
 * {@link ArraySource} reading and writing a .npy file in place.
 *
 * <p>Only the selected elements are transferred; runs of adjacent elements are moved with
 * one channel operation each. Like chunked HDF5 datasets, the file accepts an integer list
 * on one axis per access only, so views with masks over several axes read it spectrum by
 * spectrum.
 *
 * <p>I/O failures during {@link #get} and {@link #set} surface as {@link UncheckedIOException}.
 */
public final class NpyArraySource implements ArraySource, AutoCloseable {

    private static final Logger LOG = Logger.getLogger(NpyArraySource.class.getName());

    private final Path path;
    private final FileChannel channel;
    private final NpyHeader header;
    private final long dataOffset;
    private final boolean writable;
    private final int[] shape;
    private final int[] fileStrides;
    private final int itemSize;

    private NpyArraySource(Path path, FileChannel channel, NpyFiles.Preamble preamble, boolean writable) {
        this.path = path;
        this.channel = channel;
        this.header = preamble.header();
        this.dataOffset = preamble.dataOffset();
        this.writable = writable;
        this.shape = header.shape();
        this.fileStrides = NpyFiles.strides(shape, header.fortranOrder());
        this.itemSize = header.dtype().byteSize();
    }

    /**
     * Open a file for reading.
     */
    public static NpyArraySource open(Path path) throws IOException {
        return open(path, false);
    }

    /**
     * Open a file, for reading and writing if {@code writable}.
     */
    public static NpyArraySource open(Path path, boolean writable) throws IOException {
        FileChannel channel = writable
            ? FileChannel.open(path, StandardOpenOption.READ, StandardOpenOption.WRITE)
            : FileChannel.open(path, StandardOpenOption.READ);
        try {
            // The preamble stream must not close the shared channel
            DataInputStream dis = new DataInputStream(new BufferedInputStream(Channels.newInputStream(channel)));
            NpyFiles.Preamble preamble = NpyFiles.readPreamble(dis);
            long expected = preamble.dataOffset() + preamble.header().dataSize();
            if (channel.size() < expected) {
                throw new IOException("Truncated .npy file " + path + ": " + channel.size()
                    + " bytes, expected " + expected);
            }
            LOG.fine(() -> "Opened " + path + " " + preamble.header());
            return new NpyArraySource(path, channel, preamble, writable);
        } catch (IOException | RuntimeException e) {
            channel.close();
            throw e;
        }
    }

    public NpyHeader header() {
        return header;
    }

    public Path path() {
        return path;
    }

    @Override
    public int[] shape() {
        return shape.clone();
    }

    @Override
    public ScalarType dtype() {
        return header.dtype();
    }

    @Override
    public NdArray get(AxisIndex... index) {
        Selection selection = select(index);
        long[] offsets = fileOffsets(selection);
        double[] out = new double[offsets.length];
        try {
            int k = 0;
            while (k < offsets.length) {
                int run = runLength(offsets, k);
                ByteBuffer buffer = ByteBuffer.allocate(run * itemSize).order(header.byteOrder());
                readFully(buffer, dataOffset + offsets[k] * itemSize);
                for (int i = 0; i < run; i++) {
                    out[k + i] = NpyFiles.decode(buffer, i * itemSize, header.dtype());
                }
                k += run;
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read from " + path, e);
        }
        return NdArray.of(out, selection.resultShape());
    }

    @Override
    public void set(NdArray values, AxisIndex... index) {
        if (!writable) {
            throw new UnsupportedOperationException(path + " was opened read-only");
        }
        Selection selection = select(index);
        if (values.size() != selection.size()) {
            throw new IllegalArgumentException(
                "Cannot assign " + Arrays.toString(values.shape()) + " to selection of shape "
                + Arrays.toString(selection.resultShape()));
        }
        long[] offsets = fileOffsets(selection);
        try {
            int k = 0;
            while (k < offsets.length) {
                int run = runLength(offsets, k);
                ByteBuffer buffer = ByteBuffer.allocate(run * itemSize).order(header.byteOrder());
                for (int i = 0; i < run; i++) {
                    NpyFiles.encode(buffer, i * itemSize, header.dtype(), values.getFlat(k + i));
                }
                writeFully(buffer, dataOffset + offsets[k] * itemSize);
                k += run;
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write to " + path, e);
        }
    }

    /**
     * Force written data to the storage device.
     */
    public void sync() throws IOException {
        channel.force(false);
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }

    private Selection select(AxisIndex... index) {
        Selection selection = Selection.of(shape, index);
        if (selection.listAxes() > 1) {
            throw new UnsupportedOperationException(
                "Only one indexing list is allowed per access: " + Arrays.toString(index));
        }
        return selection;
    }

    /**
     * Translate row-major element offsets into the file's element order.
     */
    private long[] fileOffsets(Selection selection) {
        long[] offsets = selection.offsets();
        if (!header.fortranOrder()) {
            return offsets;
        }
        for (int k = 0; k < offsets.length; k++) {
            long rest = offsets[k];
            long fileOffset = 0;
            for (int d = shape.length - 1; d >= 0; d--) {
                fileOffset += (rest % shape[d]) * fileStrides[d];
                rest /= shape[d];
            }
            offsets[k] = fileOffset;
        }
        return offsets;
    }

    private static int runLength(long[] offsets, int from) {
        int run = 1;
        while (from + run < offsets.length && offsets[from + run] == offsets[from] + run) {
            run++;
        }
        return run;
    }

    private void readFully(ByteBuffer buffer, long position) throws IOException {
        long pos = position;
        while (buffer.hasRemaining()) {
            int n = channel.read(buffer, pos);
            if (n < 0) {
                throw new IOException("Unexpected end of file at " + pos);
            }
            pos += n;
        }
        buffer.flip();
    }

    private void writeFully(ByteBuffer buffer, long position) throws IOException {
        long pos = position;
        while (buffer.hasRemaining()) {
            pos += channel.write(buffer, pos);
        }
    }

    @Override
    public String toString() {
        return "NpyArraySource[" + path + ", " + header.descr() + " " + Arrays.toString(shape) + "]";
    }
}
