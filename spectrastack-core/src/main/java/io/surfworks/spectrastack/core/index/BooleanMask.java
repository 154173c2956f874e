package io.surfworks.spectrastack.core.index;

import io.surfworks.spectrastack.core.ChunkingException;

import java.util.Arrays;

/**
 * Boolean mask stored flat in row-major (C) order.
 */
public record BooleanMask(boolean[] values, int[] shape) implements Mask {

    public BooleanMask {
        values = values.clone();
        shape = shape.clone();
        long expected = 1;
        for (int dim : shape) {
            if (dim < 0) {
                throw new IllegalArgumentException("Negative mask dimension: " + Arrays.toString(shape));
            }
            expected *= dim;
        }
        if (expected != values.length) {
            throw new IllegalArgumentException(
                    "Mask has " + values.length + " values but shape " + Arrays.toString(shape)
                    + " needs " + expected);
        }
    }

    /**
     * One-dimensional mask.
     */
    public static BooleanMask of(boolean... values) {
        return new BooleanMask(values, new int[]{values.length});
    }

    /**
     * Two-dimensional mask from nested rows.
     */
    public static BooleanMask of(boolean[][] rows) {
        int cols = rows.length == 0 ? 0 : rows[0].length;
        boolean[] flat = new boolean[rows.length * cols];
        for (int i = 0; i < rows.length; i++) {
            if (rows[i].length != cols) {
                throw new IllegalArgumentException("Ragged mask rows");
            }
            System.arraycopy(rows[i], 0, flat, i * cols, cols);
        }
        return new BooleanMask(flat, new int[]{rows.length, cols});
    }

    @Override
    public boolean[] values() {
        return values.clone();
    }

    @Override
    public int[] shape() {
        return shape.clone();
    }

    @Override
    public int ndim() {
        return shape.length;
    }

    public boolean get(int flatIndex) {
        return values[flatIndex];
    }

    @Override
    public int count() {
        int n = 0;
        for (boolean v : values) {
            if (v) {
                n++;
            }
        }
        return n;
    }

    @Override
    public int[][] nonzero() {
        int count = count();
        int[][] result = new int[shape.length][count];
        int k = 0;
        for (int flat = 0; flat < values.length; flat++) {
            if (!values[flat]) {
                continue;
            }
            int rem = flat;
            for (int axis = shape.length - 1; axis >= 0; axis--) {
                result[axis][k] = rem % shape[axis];
                rem /= shape[axis];
            }
            k++;
        }
        return result;
    }

    @Override
    public BooleanMask complement(int[] shape) {
        if (!Arrays.equals(this.shape, shape)) {
            throw new ChunkingException(
                    "Mask shape " + Arrays.toString(this.shape) + " does not match "
                    + Arrays.toString(shape),
                    ChunkingException.ErrorCode.MASK_MISMATCH);
        }
        boolean[] inverted = new boolean[values.length];
        for (int i = 0; i < values.length; i++) {
            inverted[i] = !values[i];
        }
        return new BooleanMask(inverted, shape);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BooleanMask that)) return false;
        return Arrays.equals(values, that.values) && Arrays.equals(shape, that.shape);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(values) + Arrays.hashCode(shape);
    }

    @Override
    public String toString() {
        return "BooleanMask[shape=" + Arrays.toString(shape) + ", selected=" + count() + "]";
    }
}
