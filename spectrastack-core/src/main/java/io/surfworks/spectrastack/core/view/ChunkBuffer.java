package io.surfworks.spectrastack.core.view;

import io.surfworks.spectrastack.core.array.NdArray;

import java.util.Arrays;
import java.util.Objects;
import java.util.function.DoubleUnaryOperator;

/**
 * A (rows, channels) window over a view's shared buffer storage.
 *
 * <p>Every chunk of a traversal is presented through a buffer backed by the same array, so
 * a buffer obtained for one chunk shows the next chunk's values once the traversal moves on.
 * Writes go straight to the shared storage and reach the source when a writable view
 * flushes the chunk.
 */
public final class ChunkBuffer {

    private final double[] storage;
    private final int rows;
    private final int channels;

    ChunkBuffer(double[] storage, int rows, int channels) {
        if ((long) rows * channels > storage.length) {
            throw new IllegalArgumentException(
                "Window " + rows + "x" + channels + " exceeds storage of " + storage.length);
        }
        this.storage = storage;
        this.rows = rows;
        this.channels = channels;
    }

    public int rows() {
        return rows;
    }

    public int channels() {
        return channels;
    }

    public int[] shape() {
        return new int[]{rows, channels};
    }

    public double get(int row, int channel) {
        return storage[offset(row, channel)];
    }

    public void set(int row, int channel, double value) {
        storage[offset(row, channel)] = value;
    }

    /**
     * Copy of one spectrum.
     */
    public double[] row(int row) {
        double[] out = new double[channels];
        System.arraycopy(storage, offset(row, 0), out, 0, channels);
        return out;
    }

    public void setRow(int row, double[] values) {
        Objects.checkIndex(row, rows);
        if (values.length != channels) {
            throw new IllegalArgumentException(
                "Row has " + channels + " channels, got " + values.length + " values");
        }
        System.arraycopy(values, 0, storage, row * channels, channels);
    }

    public void fill(double value) {
        Arrays.fill(storage, 0, rows * channels, value);
    }

    /**
     * Apply {@code op} to every element in place.
     */
    public void apply(DoubleUnaryOperator op) {
        int size = rows * channels;
        for (int i = 0; i < size; i++) {
            storage[i] = op.applyAsDouble(storage[i]);
        }
    }

    /**
     * Copy of the window as a {@code [rows][channels]} array.
     */
    public double[][] toArray() {
        double[][] out = new double[rows][];
        for (int r = 0; r < rows; r++) {
            out[r] = row(r);
        }
        return out;
    }

    /**
     * Copy of the window as a (rows, channels) array.
     */
    public NdArray toNdArray() {
        double[] data = new double[rows * channels];
        System.arraycopy(storage, 0, data, 0, data.length);
        return NdArray.of(data, rows, channels);
    }

    /**
     * Whether both buffers are windows over the same storage.
     */
    public boolean sharesStorageWith(ChunkBuffer other) {
        return storage == other.storage;
    }

    double[] storage() {
        return storage;
    }

    private int offset(int row, int channel) {
        Objects.checkIndex(row, rows);
        Objects.checkIndex(channel, channels);
        return row * channels + channel;
    }

    @Override
    public String toString() {
        return "ChunkBuffer[" + rows + "x" + channels + "]";
    }
}
