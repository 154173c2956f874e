package io.surfworks.spectrastack.core.memory;

import io.surfworks.spectrastack.core.ChunkingException;
import io.surfworks.spectrastack.core.index.Slices;

import java.util.Arrays;
import java.util.OptionalLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Converts an available-memory estimate into a maximum number of buffered rows.
 *
 * <p>The result is advisory: it is computed once, before a traversal, and the chunk
 * planner enforces whatever bound it is given.
 *
 * <pre>{@code
 * MemoryBudget budget = new MemoryBudget(MemoryProbe.heap(), 0.01);
 * // shape (rows, cols, channels), one row = one spectrum of 2048 F64 channels
 * int rows = budget.rowCapacity(new int[]{500, 400, 2048}, 8, new int[]{0, 1}, 1);
 * }</pre>
 */
public final class MemoryBudget {

    private static final Logger LOG = Logger.getLogger(MemoryBudget.class.getName());

    /** Default fraction of the available memory granted to one buffer. */
    public static final double DEFAULT_MARGIN = 0.01;

    private final MemoryProbe probe;
    private final double margin;

    public MemoryBudget(MemoryProbe probe, double margin) {
        if (!(margin > 0) || margin > 1) {
            throw new IllegalArgumentException("Memory margin must be in (0, 1]: " + margin);
        }
        this.probe = probe;
        this.margin = margin;
    }

    public static MemoryBudget defaults() {
        return new MemoryBudget(MemoryProbe.heap(), DEFAULT_MARGIN);
    }

    public double margin() {
        return margin;
    }

    /**
     * Number of rows that fit into {@code margin} of the available memory.
     *
     * <p>A row is one slice of the array with {@code excludedAxes} removed: its size is the
     * product of the remaining dimensions times {@code itemSize}.
     *
     * @param shape        array shape
     * @param itemSize     bytes per element
     * @param excludedAxes axes that do not contribute to a row (negative values allowed)
     * @param minimum      lower bound of the result, also returned when memory is unknown;
     *                     0 for none
     * @throws ChunkingException with {@code INVALID_AXES} if every axis is excluded
     */
    public int rowCapacity(int[] shape, int itemSize, int[] excludedAxes, int minimum) {
        boolean[] excluded = new boolean[shape.length];
        for (int axis : excludedAxes) {
            excluded[Slices.positiveAxis(axis, shape.length)] = true;
        }
        long itemsPerRow = 1;
        int remaining = 0;
        for (int axis = 0; axis < shape.length; axis++) {
            if (!excluded[axis]) {
                itemsPerRow *= shape[axis];
                remaining++;
            }
        }
        if (remaining == 0) {
            throw ChunkingException.invalidAxes(
                "At least one axis must remain after excluding " + Arrays.toString(excludedAxes));
        }

        OptionalLong available = queryAvailable();
        if (available.isEmpty()) {
            LOG.fine("Available memory unknown, using minimum row capacity " + minimum);
            return minimum;
        }
        long bytesPerRow = Math.max(1, itemsPerRow * itemSize);
        long rows = (long) (available.getAsLong() * margin / bytesPerRow);
        int capacity = (int) Math.min(rows, Integer.MAX_VALUE);
        return Math.max(capacity, minimum);
    }

    private OptionalLong queryAvailable() {
        try {
            return probe.availableBytes();
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Memory query failed, treating available memory as unknown", e);
            return OptionalLong.empty();
        }
    }
}
