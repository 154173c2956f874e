package io.surfworks.spectrastack.core.plan;

import io.surfworks.spectrastack.core.index.Slices;

import java.util.List;

/**
 * Dense partition: per order axis a list of slice pieces whose Cartesian product
 * (together with the channel slice) enumerates every chunk.
 *
 * @param layout     axis roles
 * @param candidates pieces per order axis, in {@link AxisLayout#axesOrder()} order
 * @param bufferRows rows of the largest chunk
 */
public record DensePlan(AxisLayout layout, List<List<Slices.Piece>> candidates, int bufferRows)
        implements ChunkPlan {

    public DensePlan {
        candidates = candidates.stream().map(List::copyOf).toList();
    }

    /**
     * Number of chunks the product yields.
     */
    public long chunkCount() {
        long count = 1;
        for (List<Slices.Piece> pieces : candidates) {
            count *= pieces.size();
        }
        return count;
    }

    @Override
    public long totalRows() {
        return layout.orderSize();
    }
}
