package io.surfworks.spectrastack.core.index;

/**
 * Index applied to a single array axis.
 *
 * <p>A {@link Slice} keeps the axis, an {@link IndexList} keeps it with the listed
 * positions (fancy indexing), and a {@link Point} removes it from the result.
 */
public sealed interface AxisIndex permits Slice, IndexList, Point {

    /**
     * Number of positions this index selects on an axis of length {@code n}.
     * A point selects one position but contributes no result dimension.
     */
    int length(int n);

    /**
     * Selected positions on an axis of length {@code n}, in selection order.
     */
    int[] positions(int n);
}
