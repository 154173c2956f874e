package io.surfworks.spectrastack.core.view;

import io.surfworks.spectrastack.core.array.ScalarType;
import io.surfworks.spectrastack.core.index.Slice;
import io.surfworks.spectrastack.core.memory.MemoryBudget;
import io.surfworks.spectrastack.core.memory.MemoryProbe;

import java.util.Arrays;
import java.util.Objects;

/**
 * Configuration for a {@link StackView}.
 *
 * @param channelAxis    axis holding the channels of a spectrum, negative counts from the end
 * @param channelSlice   channels to traverse
 * @param rowCapacity    rows per chunk, or 0 to derive it from the memory budget
 * @param traversalOrder order axes, first varies fastest; {@code null} for the default order
 * @param readOnly       whether modified buffers are discarded instead of written back
 * @param bufferType     scalar type of buffer values; {@code null} for the source's type
 * @param memoryMargin   fraction of available memory a chunk buffer may use
 * @param minimumRows    lower bound of a derived row capacity
 * @param memoryProbe    source of the available memory figure
 * @param listener       receives traversal events
 */
public record ViewOptions(
        int channelAxis,
        Slice channelSlice,
        int rowCapacity,
        int[] traversalOrder,
        boolean readOnly,
        ScalarType bufferType,
        double memoryMargin,
        int minimumRows,
        MemoryProbe memoryProbe,
        ChunkListener listener
) {

    public static final int DEFAULT_CHANNEL_AXIS = -1;
    public static final int DEFAULT_MINIMUM_ROWS = 1;

    public ViewOptions {
        Objects.requireNonNull(channelSlice, "channelSlice");
        Objects.requireNonNull(memoryProbe, "memoryProbe");
        Objects.requireNonNull(listener, "listener");
        if (rowCapacity < 0) {
            throw new IllegalArgumentException("rowCapacity must be >= 0, got " + rowCapacity);
        }
        if (!(memoryMargin > 0 && memoryMargin <= 1)) {
            throw new IllegalArgumentException("memoryMargin must be in (0, 1], got " + memoryMargin);
        }
        if (minimumRows < 0) {
            throw new IllegalArgumentException("minimumRows must be >= 0, got " + minimumRows);
        }
        traversalOrder = traversalOrder == null ? null : traversalOrder.clone();
    }

    /**
     * Read-only traversal over the last axis with a derived capacity.
     */
    public static ViewOptions defaults() {
        return builder().build();
    }

    /**
     * Writable traversal, otherwise default.
     */
    public static ViewOptions writable() {
        return builder().readOnly(false).build();
    }

    @Override
    public int[] traversalOrder() {
        return traversalOrder == null ? null : traversalOrder.clone();
    }

    public boolean hasFixedCapacity() {
        return rowCapacity > 0;
    }

    public ViewOptions withReadOnly(boolean readOnly) {
        return toBuilder().readOnly(readOnly).build();
    }

    public ViewOptions withRowCapacity(int rowCapacity) {
        return toBuilder().rowCapacity(rowCapacity).build();
    }

    public ViewOptions withListener(ChunkListener listener) {
        return toBuilder().listener(listener).build();
    }

    public Builder toBuilder() {
        return new Builder()
            .channelAxis(channelAxis)
            .channelSlice(channelSlice)
            .rowCapacity(rowCapacity)
            .traversalOrder(traversalOrder)
            .readOnly(readOnly)
            .bufferType(bufferType)
            .memoryMargin(memoryMargin)
            .minimumRows(minimumRows)
            .memoryProbe(memoryProbe)
            .listener(listener);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ViewOptions that)) return false;
        return channelAxis == that.channelAxis
            && rowCapacity == that.rowCapacity
            && readOnly == that.readOnly
            && Double.compare(memoryMargin, that.memoryMargin) == 0
            && minimumRows == that.minimumRows
            && channelSlice.equals(that.channelSlice)
            && Arrays.equals(traversalOrder, that.traversalOrder)
            && bufferType == that.bufferType
            && memoryProbe.equals(that.memoryProbe)
            && listener.equals(that.listener);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(channelAxis, channelSlice, rowCapacity, readOnly, bufferType,
            memoryMargin, minimumRows, memoryProbe, listener);
        return 31 * result + Arrays.hashCode(traversalOrder);
    }

    @Override
    public String toString() {
        return "ViewOptions[channelAxis=" + channelAxis
            + ", channelSlice=" + channelSlice
            + ", rowCapacity=" + rowCapacity
            + ", traversalOrder=" + Arrays.toString(traversalOrder)
            + ", readOnly=" + readOnly
            + ", bufferType=" + bufferType
            + ", memoryMargin=" + memoryMargin
            + ", minimumRows=" + minimumRows + "]";
    }

    public static class Builder {
        private int channelAxis = DEFAULT_CHANNEL_AXIS;
        private Slice channelSlice = Slice.all();
        private int rowCapacity = 0;
        private int[] traversalOrder = null;
        private boolean readOnly = true;
        private ScalarType bufferType = null;
        private double memoryMargin = MemoryBudget.DEFAULT_MARGIN;
        private int minimumRows = DEFAULT_MINIMUM_ROWS;
        private MemoryProbe memoryProbe = MemoryProbe.heap();
        private ChunkListener listener = ChunkListener.NONE;

        public Builder channelAxis(int channelAxis) {
            this.channelAxis = channelAxis;
            return this;
        }

        public Builder channelSlice(Slice channelSlice) {
            this.channelSlice = channelSlice;
            return this;
        }

        public Builder rowCapacity(int rowCapacity) {
            this.rowCapacity = rowCapacity;
            return this;
        }

        public Builder traversalOrder(int... traversalOrder) {
            this.traversalOrder = traversalOrder;
            return this;
        }

        public Builder readOnly(boolean readOnly) {
            this.readOnly = readOnly;
            return this;
        }

        public Builder bufferType(ScalarType bufferType) {
            this.bufferType = bufferType;
            return this;
        }

        public Builder memoryMargin(double memoryMargin) {
            this.memoryMargin = memoryMargin;
            return this;
        }

        public Builder minimumRows(int minimumRows) {
            this.minimumRows = minimumRows;
            return this;
        }

        public Builder memoryProbe(MemoryProbe memoryProbe) {
            this.memoryProbe = memoryProbe;
            return this;
        }

        public Builder listener(ChunkListener listener) {
            this.listener = listener;
            return this;
        }

        public ViewOptions build() {
            return new ViewOptions(channelAxis, channelSlice, rowCapacity, traversalOrder, readOnly,
                bufferType, memoryMargin, minimumRows, memoryProbe, listener);
        }
    }
}
