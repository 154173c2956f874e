package io.surfworks.spectrastack.core.index;

/**
 * Scalar index along one axis. The axis is dropped from the indexing result.
 */
public record Point(int value) implements AxisIndex {

    public static Point of(int value) {
        return new Point(value);
    }

    @Override
    public int length(int n) {
        return 1;
    }

    @Override
    public int[] positions(int n) {
        return new int[]{resolve(value, n)};
    }

    /**
     * Resolve a possibly negative index against an axis of length {@code n}.
     */
    static int resolve(int index, int n) {
        int resolved = index < 0 ? index + n : index;
        if (resolved < 0 || resolved >= n) {
            throw new IndexOutOfBoundsException(
                    "Index " + index + " out of bounds for axis with size " + n);
        }
        return resolved;
    }

    @Override
    public String toString() {
        return Integer.toString(value);
    }
}
