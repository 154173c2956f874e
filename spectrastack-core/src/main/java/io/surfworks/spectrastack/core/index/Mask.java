package io.surfworks.spectrastack.core.index;

/**
 * Sparse selection of rows over the order axes of an array.
 *
 * <p>Either a boolean array over the combined order-axes shape ({@link BooleanMask}) or
 * parallel per-axis coordinate lists ({@link IndexMask}). The coordinate order of
 * {@link #nonzero()} is the visiting order of a masked traversal.
 */
public sealed interface Mask permits BooleanMask, IndexMask {

    /**
     * Number of order axes the mask spans.
     */
    int ndim();

    /**
     * Selected coordinates as one index list per order axis (all of equal length).
     */
    int[][] nonzero();

    /**
     * Mask selecting every coordinate of {@code shape} that this mask does not select.
     */
    BooleanMask complement(int[] shape);

    /**
     * Number of selected rows.
     */
    default int count() {
        int[][] lists = nonzero();
        return lists.length == 0 ? 0 : lists[0].length;
    }
}
