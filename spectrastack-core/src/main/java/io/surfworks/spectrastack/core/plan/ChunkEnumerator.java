package io.surfworks.spectrastack.core.plan;

import io.surfworks.spectrastack.core.index.AxisIndex;
import io.surfworks.spectrastack.core.index.IndexList;
import io.surfworks.spectrastack.core.index.Slices;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy, forward-only sequence of the chunks of a {@link ChunkPlan}.
 *
 * <p>For a dense plan the chunks are the Cartesian product of the channel slice and the
 * order-axis pieces, with the first traversal axis varying fastest; nothing beyond the
 * current odometer position is materialized. For a masked plan the chunks are the
 * consecutive batches of selected coordinates.
 */
public final class ChunkEnumerator {

    private ChunkEnumerator() {
        // Utility class
    }

    public static Iterator<ChunkDescriptor> enumerate(ChunkPlan plan) {
        if (plan instanceof DensePlan dense) {
            return new DenseIterator(dense);
        }
        return new MaskedIterator((MaskedPlan) plan);
    }

    /**
     * {@link #enumerate(ChunkPlan)} as a sequential stream.
     */
    public static Stream<ChunkDescriptor> stream(ChunkPlan plan) {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(enumerate(plan), Spliterator.ORDERED | Spliterator.NONNULL),
                false);
    }

    private static final class DenseIterator implements Iterator<ChunkDescriptor> {

        private final AxisLayout layout;
        private final int[] axes;
        private final List<List<Slices.Piece>> pieces;
        private final int[] counter;
        private boolean done;

        DenseIterator(DensePlan plan) {
            this.layout = plan.layout();
            int[] order = layout.axesOrder();
            int n = order.length;
            // Product axes: channel first, then order axes reversed so the first traversal
            // axis is the innermost loop
            this.axes = new int[n + 1];
            this.axes[0] = layout.channelAxis();
            List<List<Slices.Piece>> lists = new ArrayList<>(n + 1);
            lists.add(List.of(new Slices.Piece(layout.channelSlice(), layout.channels())));
            for (int i = 0; i < n; i++) {
                axes[i + 1] = order[n - 1 - i];
                lists.add(plan.candidates().get(n - 1 - i));
            }
            this.pieces = lists;
            this.counter = new int[n + 1];
            this.done = lists.stream().anyMatch(List::isEmpty);
        }

        @Override
        public boolean hasNext() {
            return !done;
        }

        @Override
        public ChunkDescriptor next() {
            if (done) {
                throw new NoSuchElementException();
            }
            AxisIndex[] index = new AxisIndex[layout.ndim()];
            int[] shape = new int[layout.ndim()];
            int count = 1;
            for (int i = 0; i < axes.length; i++) {
                Slices.Piece piece = pieces.get(i).get(counter[i]);
                index[axes[i]] = piece.slice();
                shape[axes[i]] = piece.length();
                if (i > 0) {
                    count *= piece.length();
                }
            }
            advance();
            return new ChunkDescriptor(index, shape, count);
        }

        private void advance() {
            for (int i = counter.length - 1; i >= 0; i--) {
                if (++counter[i] < pieces.get(i).size()) {
                    return;
                }
                counter[i] = 0;
            }
            done = true;
        }
    }

    private static final class MaskedIterator implements Iterator<ChunkDescriptor> {

        private final MaskedPlan plan;
        private final AxisLayout layout;
        private final int[] orderAxes;
        private final int rows;
        private int position;

        MaskedIterator(MaskedPlan plan) {
            this.plan = plan;
            this.layout = plan.layout();
            this.orderAxes = layout.axesOrder();
            this.rows = (int) plan.totalRows();
        }

        @Override
        public boolean hasNext() {
            return position < rows;
        }

        @Override
        public ChunkDescriptor next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            int from = position;
            int to = Math.min(from + plan.capacity(), rows);
            int count = to - from;

            AxisIndex[] index = new AxisIndex[layout.ndim()];
            index[layout.channelAxis()] = layout.channelSlice();
            for (int k = 0; k < orderAxes.length; k++) {
                int[] values = new int[count];
                for (int r = 0; r < count; r++) {
                    values[r] = plan.coordinate(k, from + r);
                }
                index[orderAxes[k]] = new IndexList(values);
            }
            int[] shape = plan.listPosition() == 0
                    ? new int[]{count, layout.channels()}
                    : new int[]{layout.channels(), count};

            position = to;
            return new ChunkDescriptor(index, shape, count);
        }
    }
}
