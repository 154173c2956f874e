package io.surfworks.spectrastack.core.index;

import java.util.Arrays;

/**
 * Integer-list (fancy) index along one axis. Negative values count from the end.
 */
public record IndexList(int[] values) implements AxisIndex {

    public IndexList {
        values = values.clone();
    }

    public static IndexList of(int... values) {
        return new IndexList(values);
    }

    @Override
    public int[] values() {
        return values.clone();
    }

    public int size() {
        return values.length;
    }

    public int get(int i) {
        return values[i];
    }

    /**
     * Sub-list {@code [from, to)}.
     */
    public IndexList range(int from, int to) {
        return new IndexList(Arrays.copyOfRange(values, from, to));
    }

    @Override
    public int length(int n) {
        return values.length;
    }

    @Override
    public int[] positions(int n) {
        int[] result = new int[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = Point.resolve(values[i], n);
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IndexList that)) return false;
        return Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return Arrays.toString(values);
    }
}
