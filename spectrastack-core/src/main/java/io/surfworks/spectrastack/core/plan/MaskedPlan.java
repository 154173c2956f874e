package io.surfworks.spectrastack.core.plan;

import java.util.Arrays;

/**
 * Sparse partition: the selected coordinates in mask order, cut into consecutive batches
 * of at most {@code capacity} rows.
 *
 * @param layout       axis roles; the mask lists pair with {@code layout.axesOrder()}
 * @param coordinates  one coordinate list per order axis
 * @param capacity     rows per batch
 * @param listPosition dimension of the chunk result that enumerates rows (0 or 1)
 */
public record MaskedPlan(AxisLayout layout, int[][] coordinates, int capacity, int listPosition)
        implements ChunkPlan {

    public MaskedPlan {
        coordinates = Arrays.stream(coordinates).map(int[]::clone).toArray(int[][]::new);
    }

    @Override
    public int[][] coordinates() {
        return Arrays.stream(coordinates).map(int[]::clone).toArray(int[][]::new);
    }

    int coordinate(int axisPosition, int row) {
        return coordinates[axisPosition][row];
    }

    @Override
    public long totalRows() {
        return coordinates.length == 0 ? 0 : coordinates[0].length;
    }

    @Override
    public int bufferRows() {
        return (int) Math.min(capacity, totalRows());
    }

    /**
     * Number of batches.
     */
    public int chunkCount() {
        long rows = totalRows();
        return (int) ((rows + capacity - 1) / capacity);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MaskedPlan that)) return false;
        return capacity == that.capacity && listPosition == that.listPosition
                && layout.equals(that.layout) && Arrays.deepEquals(coordinates, that.coordinates);
    }

    @Override
    public int hashCode() {
        int result = layout.hashCode();
        result = 31 * result + Arrays.deepHashCode(coordinates);
        result = 31 * result + capacity;
        result = 31 * result + listPosition;
        return result;
    }

    @Override
    public String toString() {
        return "MaskedPlan[layout=" + layout + ", rows=" + totalRows() + ", capacity=" + capacity + "]";
    }
}
