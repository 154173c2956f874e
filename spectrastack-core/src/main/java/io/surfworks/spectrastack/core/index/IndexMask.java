package io.surfworks.spectrastack.core.index;

import io.surfworks.spectrastack.core.ChunkingException;

import java.util.Arrays;

/**
 * Mask given as explicit coordinate lists, one list per order axis.
 *
 * <p>Row {@code k} of the selection is {@code (lists[0][k], lists[1][k], ...)}. The lists
 * are not checked for equal length here; {@link #validate()} does that when a traversal
 * is planned.
 */
public record IndexMask(int[][] lists) implements Mask {

    public IndexMask {
        int[][] copy = new int[lists.length][];
        for (int i = 0; i < lists.length; i++) {
            copy[i] = lists[i].clone();
        }
        lists = copy;
    }

    public static IndexMask of(int[]... lists) {
        return new IndexMask(lists);
    }

    @Override
    public int[][] lists() {
        return nonzero();
    }

    @Override
    public int ndim() {
        return lists.length;
    }

    @Override
    public int[][] nonzero() {
        int[][] copy = new int[lists.length][];
        for (int i = 0; i < lists.length; i++) {
            copy[i] = lists[i].clone();
        }
        return copy;
    }

    /**
     * Check that every coordinate list has the same length.
     *
     * @return the common length
     * @throws ChunkingException with {@code INCONSISTENT_MASK} otherwise
     */
    public int validate() {
        int[] lengths = new int[lists.length];
        for (int i = 0; i < lists.length; i++) {
            lengths[i] = lists[i].length;
        }
        for (int len : lengths) {
            if (len != lengths[0]) {
                throw ChunkingException.inconsistentMask(lengths);
            }
        }
        return lengths.length == 0 ? 0 : lengths[0];
    }

    @Override
    public int count() {
        return validate();
    }

    @Override
    public BooleanMask complement(int[] shape) {
        if (shape.length != lists.length) {
            throw ChunkingException.maskMismatch(lists.length, shape.length);
        }
        int rows = validate();
        int size = 1;
        for (int dim : shape) {
            size *= dim;
        }
        boolean[] values = new boolean[size];
        Arrays.fill(values, true);
        for (int k = 0; k < rows; k++) {
            int flat = 0;
            for (int axis = 0; axis < shape.length; axis++) {
                flat = flat * shape[axis] + Point.resolve(lists[axis][k], shape[axis]);
            }
            values[flat] = false;
        }
        return new BooleanMask(values, shape);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IndexMask that)) return false;
        return Arrays.deepEquals(lists, that.lists);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(lists);
    }

    @Override
    public String toString() {
        return "IndexMask" + Arrays.deepToString(lists);
    }
}
