package io.surfworks.spectrastack.core.view;

/**
 * Which coordinates of the order axes a view visits.
 */
public enum TraversalStrategy {
    /** Every coordinate, in rectangular blocks */
    DENSE,
    /** The coordinates selected by a mask, in mask order */
    MASKED
}
