package io.surfworks.spectrastack.core.view;

/**
 * Which part of a chunk's index a {@link ChunkKey} carries.
 */
public enum KeyMode {
    /** Full-dimensional index and shape, including the channel axis */
    ALL,
    /** Order axes only, in ascending axis order */
    SELECT
}
