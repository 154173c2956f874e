package io.surfworks.spectrastack.core.array;

import java.util.Arrays;

/**
 * A heap-backed multi-dimensional array of {@code double} values in row-major order.
 *
 * <p>This is the exchange format between {@link ArraySource} implementations and the
 * chunk view: sources return an {@code NdArray} for an index and accept one for write-back.
 */
public final class NdArray {

    private final int[] shape;
    private final long[] strides;
    private final double[] data;

    private NdArray(double[] data, int[] shape) {
        this.shape = shape;
        this.strides = computeRowMajorStrides(shape);
        this.data = data;
    }

    // ==================== Factory Methods ====================

    /**
     * Create a zero-initialized array with the given shape.
     */
    public static NdArray zeros(int... shape) {
        return new NdArray(new double[checkedSize(shape)], shape.clone());
    }

    /**
     * Create an array from flat row-major data. The data is copied.
     */
    public static NdArray of(double[] data, int... shape) {
        if (data.length != checkedSize(shape)) {
            throw new IllegalArgumentException(
                "Data length " + data.length + " doesn't match shape " + Arrays.toString(shape) +
                " (expected " + checkedSize(shape) + " elements)");
        }
        return new NdArray(data.clone(), shape.clone());
    }

    /**
     * Create an array whose elements are their own flat index (0, 1, 2, ...).
     */
    public static NdArray arange(int... shape) {
        double[] data = new double[checkedSize(shape)];
        for (int i = 0; i < data.length; i++) {
            data[i] = i;
        }
        return new NdArray(data, shape.clone());
    }

    /**
     * Wrap flat row-major data without copying.
     */
    static NdArray wrap(double[] data, int... shape) {
        return new NdArray(data, shape.clone());
    }

    // ==================== Accessors ====================

    public int[] shape() {
        return shape.clone();
    }

    public int rank() {
        return shape.length;
    }

    public int size() {
        return data.length;
    }

    public double get(int... indices) {
        return data[flatIndex(indices)];
    }

    public void set(double value, int... indices) {
        data[flatIndex(indices)] = value;
    }

    public double getFlat(int index) {
        return data[index];
    }

    public void setFlat(int index, double value) {
        data[index] = value;
    }

    /**
     * Copy of the flat row-major data.
     */
    public double[] toArray() {
        return data.clone();
    }

    /**
     * Flat row-major data, shared with this array.
     */
    double[] data() {
        return data;
    }

    // ==================== Shape Operations ====================

    /**
     * View of the same data with a different shape of equal size.
     */
    public NdArray reshape(int... newShape) {
        if (checkedSize(newShape) != data.length) {
            throw new IllegalArgumentException(
                "Cannot reshape " + Arrays.toString(shape) + " to " + Arrays.toString(newShape));
        }
        return new NdArray(data, newShape.clone());
    }

    /**
     * Copy with permuted dimensions: result axis {@code i} is this array's axis {@code perm[i]}.
     */
    public NdArray transpose(int... perm) {
        validatePermutation(perm, shape.length);
        int[] newShape = new int[perm.length];
        long[] srcStrides = new long[perm.length];
        for (int i = 0; i < perm.length; i++) {
            newShape[i] = shape[perm[i]];
            srcStrides[i] = strides[perm[i]];
        }
        double[] result = new double[data.length];
        int[] counter = new int[perm.length];
        long src = 0;
        for (int dst = 0; dst < result.length; dst++) {
            result[dst] = data[(int) src];
            // Odometer increment over the permuted shape
            for (int axis = perm.length - 1; axis >= 0; axis--) {
                counter[axis]++;
                src += srcStrides[axis];
                if (counter[axis] < newShape[axis]) {
                    break;
                }
                src -= srcStrides[axis] * newShape[axis];
                counter[axis] = 0;
            }
        }
        return new NdArray(result, newShape);
    }

    /**
     * Element-wise equality of shape and values (NaN equals NaN).
     */
    public boolean contentEquals(NdArray other) {
        return Arrays.equals(shape, other.shape) && Arrays.equals(data, other.data);
    }

    // ==================== Helpers ====================

    private int flatIndex(int... indices) {
        if (indices.length != shape.length) {
            throw new IllegalArgumentException(
                "Expected " + shape.length + " indices, got " + indices.length);
        }
        long idx = 0;
        for (int i = 0; i < indices.length; i++) {
            if (indices[i] < 0 || indices[i] >= shape[i]) {
                throw new IndexOutOfBoundsException(
                    "Index " + indices[i] + " out of bounds for dimension " + i + " with size " + shape[i]);
            }
            idx += indices[i] * strides[i];
        }
        return (int) idx;
    }

    static long[] computeRowMajorStrides(int[] shape) {
        long[] strides = new long[shape.length];
        long stride = 1;
        for (int i = shape.length - 1; i >= 0; i--) {
            strides[i] = stride;
            stride *= shape[i];
        }
        return strides;
    }

    static int checkedSize(int[] shape) {
        long count = 1;
        for (int dim : shape) {
            if (dim < 0) {
                throw new IllegalArgumentException("Negative dimension in shape " + Arrays.toString(shape));
            }
            count *= dim;
        }
        if (count > Integer.MAX_VALUE) {
            throw new IllegalStateException("Array too large for heap storage: " + count);
        }
        return (int) count;
    }

    private static void validatePermutation(int[] perm, int rank) {
        if (perm.length != rank) {
            throw new IllegalArgumentException(
                "Permutation " + Arrays.toString(perm) + " does not match rank " + rank);
        }
        boolean[] seen = new boolean[rank];
        for (int p : perm) {
            if (p < 0 || p >= rank || seen[p]) {
                throw new IllegalArgumentException("Invalid permutation: " + Arrays.toString(perm));
            }
            seen[p] = true;
        }
    }

    @Override
    public String toString() {
        return "NdArray[shape=" + Arrays.toString(shape) + "]";
    }
}
