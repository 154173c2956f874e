package io.surfworks.spectrastack.core.view;

import io.surfworks.spectrastack.core.ChunkingException;
import io.surfworks.spectrastack.core.array.ArraySource;
import io.surfworks.spectrastack.core.array.ScalarType;
import io.surfworks.spectrastack.core.index.AxisIndex;
import io.surfworks.spectrastack.core.index.BooleanMask;
import io.surfworks.spectrastack.core.index.IndexList;
import io.surfworks.spectrastack.core.index.Mask;
import io.surfworks.spectrastack.core.index.Point;
import io.surfworks.spectrastack.core.index.Slice;
import io.surfworks.spectrastack.core.index.Slices;
import io.surfworks.spectrastack.core.memory.MemoryBudget;
import io.surfworks.spectrastack.core.plan.AxisLayout;
import io.surfworks.spectrastack.core.plan.ChunkEnumerator;
import io.surfworks.spectrastack.core.plan.ChunkPlan;
import io.surfworks.spectrastack.core.plan.ChunkPlanner;
import io.surfworks.spectrastack.core.plan.MaskedPlan;

import java.util.Collections;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.logging.Logger;

/**
 * Chunked traversal of the spectra of an N-dimensional stack.
 *
 * <p>One axis of the source holds the channels of a spectrum; every other axis is an order
 * axis. A view visits either every order-axis coordinate ({@link #full}) or the coordinates
 * selected by a mask ({@link #masked}), in chunks of at most {@link #bufferRows()} spectra.
 * Each chunk is presented as a (rows, channels) {@link ChunkBuffer} over one shared buffer:
 *
 * <pre>{@code
 * StackView view = StackView.full(source, ViewOptions.writable());
 * for (ChunkEntry entry : view.items()) {
 *     entry.value().apply(v -> v * gain);
 * }
 * }</pre>
 *
 * <p>A writable view writes each chunk back to the source when the next chunk is requested
 * and after the last one. A view can be traversed once.
 */
public final class StackView {

    private static final Logger LOG = Logger.getLogger(StackView.class.getName());

    private final ArraySource source;
    private final ViewOptions options;
    private final AxisLayout layout;
    private final Mask mask;
    private final ChunkPlan plan;
    private final TraversalStrategy traversal;
    private final AccessStrategy accessStrategy;
    private final ChunkAccess access;
    private final ScalarType bufferType;
    private ViewState state = ViewState.CONSTRUCTED;

    private StackView(ArraySource source, Mask mask, ViewOptions options) {
        this.source = source;
        this.options = options;
        this.mask = mask;
        this.traversal = mask == null ? TraversalStrategy.DENSE : TraversalStrategy.MASKED;
        this.layout = AxisLayout.resolve(source.shape(), options.channelAxis(), options.channelSlice(),
            options.traversalOrder(),
            traversal == TraversalStrategy.DENSE ? AxisLayout.Order.C : AxisLayout.Order.F);
        this.bufferType = options.bufferType() == null ? source.dtype() : options.bufferType();

        int capacity = options.hasFixedCapacity() ? options.rowCapacity() : deriveCapacity();
        if (traversal == TraversalStrategy.DENSE) {
            this.plan = ChunkPlanner.planDense(layout, capacity);
            this.accessStrategy = AccessStrategy.DIRECT;
            this.access = new DirectAccess(denseTranspose());
        } else {
            MaskedPlan masked = ChunkPlanner.planMasked(layout, mask, capacity);
            this.plan = masked;
            if (layout.axesOrder().length > 1 && !source.supportsMultiListIndexing()) {
                this.accessStrategy = AccessStrategy.POINTWISE;
                this.access = new PointwiseAccess(layout.axesOrder());
            } else {
                this.accessStrategy = AccessStrategy.DIRECT;
                this.access = new DirectAccess(masked.listPosition() == 0 ? new int[]{0, 1} : new int[]{1, 0});
            }
        }
        LOG.fine(() -> "View over " + source + ": " + traversal + "/" + accessStrategy + ", "
            + plan.totalRows() + " spectra of " + layout.channels() + " channels, "
            + plan.bufferRows() + " per chunk");
    }

    /**
     * View visiting every spectrum of {@code source}.
     *
     * @throws ChunkingException with {@code INVALID_AXES} if the axis roles are invalid
     */
    public static StackView full(ArraySource source, ViewOptions options) {
        return new StackView(source, null, options);
    }

    /**
     * View visiting the spectra selected by {@code mask}, in mask order. Mask dimension
     * {@code i} indexes the {@code i}-th order axis of the traversal order, which defaults to
     * ascending axis order.
     *
     * @param mask selection over the order axes, {@code null} for a full view
     * @throws ChunkingException with {@code INVALID_AXES}, {@code MASK_MISMATCH} or
     *                           {@code INCONSISTENT_MASK}
     */
    public static StackView masked(ArraySource source, Mask mask, ViewOptions options) {
        return new StackView(source, mask, options);
    }

    public ViewOptions options() {
        return options;
    }

    public AxisLayout layout() {
        return layout;
    }

    public ChunkPlan plan() {
        return plan;
    }

    public TraversalStrategy traversal() {
        return traversal;
    }

    public AccessStrategy accessStrategy() {
        return accessStrategy;
    }

    public boolean isMasked() {
        return mask != null;
    }

    public boolean isReadOnly() {
        return options.readOnly();
    }

    public ScalarType bufferType() {
        return bufferType;
    }

    /**
     * Channels per spectrum after applying the channel slice.
     */
    public int channels() {
        return layout.channels();
    }

    /**
     * Channels per spectrum in the source.
     */
    public int originalChannels() {
        return layout.shape()[layout.channelAxis()];
    }

    /**
     * Row capacity of the shared buffer.
     */
    public int bufferRows() {
        return plan.bufferRows();
    }

    /**
     * Spectra visited by a complete traversal.
     */
    public long totalRows() {
        return plan.totalRows();
    }

    public ViewState state() {
        return state;
    }

    /**
     * Start the traversal, keyed by the full index of each chunk.
     */
    public ChunkIterator items() {
        return items(KeyMode.ALL);
    }

    /**
     * Start the traversal.
     *
     * @throws ChunkingException with {@code INVALID_STATE} if the view was traversed before
     */
    public ChunkIterator items(KeyMode keyMode) {
        if (state != ViewState.CONSTRUCTED) {
            throw ChunkingException.invalidState("View can be traversed only once (state " + state + ")");
        }
        state = ViewState.ITERATING;
        int rows = plan.bufferRows();
        LOG.fine(() -> "Iterate stack in chunks of " + rows + " spectra");
        double[] storage = new double[Math.multiplyExact(rows, layout.channels())];
        return new ChunkIterator(this, ChunkEnumerator.enumerate(plan), keyMode, storage);
    }

    /**
     * Index selecting everything this view visits.
     */
    public AxisIndex[] idxFull() {
        AxisIndex[] index = wholeAxes();
        index[layout.channelAxis()] = layout.channelSlice();
        if (mask != null) {
            applyLists(index, ((MaskedPlan) plan).coordinates());
        }
        return index;
    }

    /**
     * Indices selecting everything this view does not visit. An unmasked view yields one
     * index selecting the channels outside the channel slice; a masked view yields one index
     * per such channel, over the spectra outside the mask.
     */
    public Iterator<AxisIndex[]> idxFullComplement() {
        int[] channels = Slices.complement(layout.channelSlice(), originalChannels());
        if (mask == null) {
            AxisIndex[] index = wholeAxes();
            index[layout.channelAxis()] = new IndexList(channels);
            return Collections.singletonList(index).iterator();
        }
        BooleanMask complement = mask.complement(layout.orderShape());
        int[][] lists = complement.nonzero();
        return new Iterator<>() {
            private int next;

            @Override
            public boolean hasNext() {
                return next < channels.length;
            }

            @Override
            public AxisIndex[] next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                AxisIndex[] index = wholeAxes();
                applyLists(index, lists);
                index[layout.channelAxis()] = Point.of(channels[next++]);
                return index;
            }
        };
    }

    ArraySource source() {
        return source;
    }

    ChunkAccess access() {
        return access;
    }

    void finish() {
        state = ViewState.EXHAUSTED;
    }

    private int deriveCapacity() {
        int[] shape = layout.shape();
        shape[layout.channelAxis()] = layout.channels();
        MemoryBudget budget = new MemoryBudget(options.memoryProbe(), options.memoryMargin());
        return budget.rowCapacity(shape, bufferType.byteSize(), layout.axesOrder(), options.minimumRows());
    }

    private int[] denseTranspose() {
        int[] sorted = layout.sortedOrderAxes();
        int[] perm = new int[sorted.length + 1];
        System.arraycopy(sorted, 0, perm, 0, sorted.length);
        perm[sorted.length] = layout.channelAxis();
        return perm;
    }

    private AxisIndex[] wholeAxes() {
        AxisIndex[] index = new AxisIndex[layout.ndim()];
        for (int axis = 0; axis < index.length; axis++) {
            index[axis] = Slice.all();
        }
        return index;
    }

    private void applyLists(AxisIndex[] index, int[][] lists) {
        int[] order = layout.axesOrder();
        for (int k = 0; k < order.length; k++) {
            index[order[k]] = new IndexList(lists[k]);
        }
    }

    @Override
    public String toString() {
        return "StackView[" + traversal + ", " + layout + ", bufferRows=" + plan.bufferRows()
            + ", readOnly=" + options.readOnly() + ", state=" + state + "]";
    }
}
