package io.surfworks.spectrastack.core.view;

/**
 * How chunk data moves between an {@link io.surfworks.spectrastack.core.array.ArraySource}
 * and the shared buffer.
 */
public enum AccessStrategy {
    /** One source access per chunk, then a transpose into (rows, channels) order */
    DIRECT,
    /** One source access per row, for sources that accept a list on a single axis only */
    POINTWISE
}
