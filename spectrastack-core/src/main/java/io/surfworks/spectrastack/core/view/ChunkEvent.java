package io.surfworks.spectrastack.core.view;

/**
 * Progress information for a chunked traversal.
 *
 * @param type        what happened
 * @param chunk       0-based ordinal of the chunk concerned (-1 for traversal-level events)
 * @param rows        rows in that chunk (0 for traversal-level events)
 * @param rowsVisited rows handed to the consumer so far, including this chunk
 * @param totalRows   rows the traversal covers in total
 * @param bufferRows  row capacity of the shared buffer
 */
public record ChunkEvent(
        Type type,
        int chunk,
        int rows,
        long rowsVisited,
        long totalRows,
        int bufferRows
) {

    /**
     * Event type.
     */
    public enum Type {
        /** Buffer allocated, first chunk about to be read */
        STARTED,
        /** A chunk was read into the buffer */
        CHUNK_READ,
        /** A chunk was written back to the source */
        CHUNK_WRITTEN,
        /** All chunks visited */
        COMPLETED
    }

    /**
     * Fraction of rows visited (0.0 to 1.0); 1.0 for an empty traversal.
     */
    public double progress() {
        if (totalRows <= 0) return 1.0;
        return (double) rowsVisited / totalRows;
    }

    static ChunkEvent started(long totalRows, int bufferRows) {
        return new ChunkEvent(Type.STARTED, -1, 0, 0, totalRows, bufferRows);
    }

    static ChunkEvent read(int chunk, int rows, long rowsVisited, long totalRows, int bufferRows) {
        return new ChunkEvent(Type.CHUNK_READ, chunk, rows, rowsVisited, totalRows, bufferRows);
    }

    static ChunkEvent written(int chunk, int rows, long rowsVisited, long totalRows, int bufferRows) {
        return new ChunkEvent(Type.CHUNK_WRITTEN, chunk, rows, rowsVisited, totalRows, bufferRows);
    }

    static ChunkEvent completed(long rowsVisited, long totalRows, int bufferRows) {
        return new ChunkEvent(Type.COMPLETED, -1, 0, rowsVisited, totalRows, bufferRows);
    }
}
