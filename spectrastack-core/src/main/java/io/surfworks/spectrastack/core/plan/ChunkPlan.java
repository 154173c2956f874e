package io.surfworks.spectrastack.core.plan;

/**
 * Partition of an array's order-axis space into chunks, produced by {@link ChunkPlanner}
 * and walked by {@link ChunkEnumerator}.
 */
public sealed interface ChunkPlan permits DensePlan, MaskedPlan {

    AxisLayout layout();

    /**
     * Rows a buffer needs to hold the largest chunk of this plan.
     */
    int bufferRows();

    /**
     * Number of rows covered by all chunks together.
     */
    long totalRows();
}
