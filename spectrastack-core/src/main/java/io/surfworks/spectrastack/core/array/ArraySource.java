package io.surfworks.spectrastack.core.array;

import io.surfworks.spectrastack.core.index.AxisIndex;

/**
 * An N-dimensional array that chunks are read from and written back to.
 *
 * <p>Indexing follows NumPy rules (see {@link Selection}): one {@link AxisIndex} per
 * dimension, where slices keep an axis, points drop it, and integer lists select
 * positions. Every source must accept a list on at most one axis at a time; sources
 * that also accept lists on several axes at once (zipped coordinates) report it through
 * {@link #supportsMultiListIndexing()}.
 *
 * <p>I/O failures of storage-backed sources surface as unchecked exceptions and are not
 * handled by the traversal engine.
 */
public interface ArraySource {

    /**
     * Dimension sizes.
     */
    int[] shape();

    /**
     * Element type of the stored data.
     */
    ScalarType dtype();

    /**
     * Read the sub-array selected by {@code index}.
     */
    NdArray get(AxisIndex... index);

    /**
     * Write {@code values} (shaped like the result of {@link #get}) to the selection.
     */
    void set(NdArray values, AxisIndex... index);

    /**
     * Whether integer lists may be applied to more than one axis in a single access.
     */
    default boolean supportsMultiListIndexing() {
        return false;
    }

    default int rank() {
        return shape().length;
    }
}
