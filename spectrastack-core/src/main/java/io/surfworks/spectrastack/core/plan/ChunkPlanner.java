package io.surfworks.spectrastack.core.plan;

import io.surfworks.spectrastack.core.ChunkingException;
import io.surfworks.spectrastack.core.index.BooleanMask;
import io.surfworks.spectrastack.core.index.IndexMask;
import io.surfworks.spectrastack.core.index.Mask;
import io.surfworks.spectrastack.core.index.Slice;
import io.surfworks.spectrastack.core.index.Slices;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

/**
 * Partitions the order-axis space of an array into chunks of at most a given number of rows.
 *
 * <p>Dense planning walks the order axes in traversal order and consumes whole axes while
 * the running product of their sizes fits the capacity. The first axis that does not fit
 * is split, and every later axis is split into single indices:
 * <pre>{@code
 * // shape (100, 10), channel axis 1, capacity 30 -> rows 0:30, 30:60, 60:90, 90:100
 * AxisLayout layout = AxisLayout.resolve(new int[]{100, 10}, 1, null, null, AxisLayout.Order.C);
 * DensePlan plan = ChunkPlanner.planDense(layout, 30);
 * }</pre>
 *
 * <p>Masked planning cuts the selected coordinates, in mask order, into consecutive batches.
 */
public final class ChunkPlanner {

    private ChunkPlanner() {
        // Utility class
    }

    /**
     * Plan a traversal of every order-axis coordinate.
     *
     * @param layout   axis roles
     * @param capacity maximum rows per chunk, values below 1 are treated as 1
     */
    public static DensePlan planDense(AxisLayout layout, int capacity) {
        long cap = Math.max(capacity, 1);
        int[] shape = layout.shape();

        List<List<Slices.Piece>> candidates = new ArrayList<>();
        long consumed = 1;
        long bufferRows = 1;
        for (int axis : layout.axesOrder()) {
            int size = shape[axis];
            long consumedNew = saturatedMultiply(consumed, size);
            List<Slices.Piece> pieces;
            if (size == 0) {
                // Nothing to visit
                pieces = List.of();
                bufferRows = 0;
            } else if (consumedNew <= cap) {
                pieces = List.of(new Slices.Piece(Slice.all(), size));
                bufferRows *= size;
            } else if (consumed > cap) {
                pieces = collect(Slices.chunked(0, size, 1));
            } else {
                int step;
                if (consumed == 1) {
                    step = (int) cap;
                } else {
                    // Equalize the pieces so the last one is not disproportionately short
                    int maxStep = (int) (cap / consumed);
                    int count = ceilDiv(size, maxStep);
                    step = ceilDiv(size, count);
                }
                pieces = collect(Slices.chunked(0, size, step));
                bufferRows *= step;
            }
            consumed = consumedNew;
            candidates.add(pieces);
        }
        return new DensePlan(layout, candidates, (int) bufferRows);
    }

    /**
     * Plan a traversal of the coordinates selected by {@code mask}, in mask order.
     *
     * @param layout   axis roles; mask dimension {@code i} pairs with {@code layout.axesOrder()[i]}
     * @param mask     selection over the order axes
     * @param capacity maximum rows per chunk, values below 1 are treated as 1
     * @throws ChunkingException with {@code MASK_MISMATCH} if the mask does not span the order
     *                           axes, or {@code INCONSISTENT_MASK} if its lists differ in length
     */
    public static MaskedPlan planMasked(AxisLayout layout, Mask mask, int capacity) {
        int cap = Math.max(capacity, 1);
        int[] orderAxes = layout.axesOrder();
        if (mask.ndim() != orderAxes.length) {
            throw ChunkingException.maskMismatch(mask.ndim(), orderAxes.length);
        }
        if (mask instanceof BooleanMask bool && !Arrays.equals(bool.shape(), layout.orderShape())) {
            throw new ChunkingException(
                "Mask shape " + Arrays.toString(bool.shape()) + " does not match order axes shape "
                + Arrays.toString(layout.orderShape()),
                ChunkingException.ErrorCode.MASK_MISMATCH);
        }
        if (mask instanceof IndexMask index) {
            index.validate();
        }
        return new MaskedPlan(layout, mask.nonzero(), cap, listPosition(layout));
    }

    /**
     * Position of the row dimension in the result of indexing with lists on every order axis
     * and a slice on the channel axis: lists on adjacent axes stay in place, lists on
     * separated axes move to the front.
     */
    static int listPosition(AxisLayout layout) {
        int[] sorted = layout.sortedOrderAxes();
        boolean adjacent = true;
        for (int i = 1; i < sorted.length; i++) {
            if (sorted[i] != sorted[i - 1] + 1) {
                adjacent = false;
                break;
            }
        }
        return adjacent && layout.channelAxis() < sorted[0] ? 1 : 0;
    }

    private static List<Slices.Piece> collect(Iterator<Slices.Piece> pieces) {
        List<Slices.Piece> result = new ArrayList<>();
        pieces.forEachRemaining(result::add);
        return result;
    }

    private static int ceilDiv(int a, int b) {
        return -Math.floorDiv(-a, b);
    }

    private static long saturatedMultiply(long a, long b) {
        long hi = Math.multiplyHigh(a, b);
        long lo = a * b;
        if ((hi == 0 && lo >= 0) || (hi == -1 && lo < 0)) {
            return lo;
        }
        return Long.MAX_VALUE;
    }
}
