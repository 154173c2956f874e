package io.surfworks.spectrastack.core.plan;

import io.surfworks.spectrastack.core.ChunkingException;
import io.surfworks.spectrastack.core.index.Slice;
import io.surfworks.spectrastack.core.index.Slices;

import java.util.Arrays;

/**
 * Assignment of array axes to roles: one channel axis and the order axes in traversal order.
 *
 * @param shape        array shape
 * @param channelAxis  channel axis (non-negative)
 * @param channelSlice slice applied to the channel axis
 * @param axesOrder    order axes, first entry varies fastest during a dense traversal
 */
public record AxisLayout(int[] shape, int channelAxis, Slice channelSlice, int[] axesOrder) {

    /**
     * Default traversal order of the order axes.
     */
    public enum Order {
        /** Last index varies fastest (row-major). */
        C,
        /** First index varies fastest. */
        F
    }

    public AxisLayout {
        shape = shape.clone();
        axesOrder = axesOrder.clone();
    }

    /**
     * Resolve and validate axis roles.
     *
     * @param shape          array shape
     * @param channelAxis    channel axis, negative values count from the end
     * @param channelSlice   channel slice, {@code null} for the whole axis
     * @param traversalOrder explicit order axes, {@code null} for the default order
     * @param defaultOrder   order used when {@code traversalOrder} is null
     * @throws ChunkingException with {@code INVALID_AXES} if the roles do not partition the axes
     */
    public static AxisLayout resolve(int[] shape, int channelAxis, Slice channelSlice,
                                     int[] traversalOrder, Order defaultOrder) {
        int ndim = shape.length;
        if (ndim < 2) {
            throw ChunkingException.invalidAxes(
                "Need a channel axis and at least one order axis, got shape " + Arrays.toString(shape));
        }
        int channel = Slices.positiveAxis(channelAxis, ndim);

        int[] expected = new int[ndim - 1];
        int k = 0;
        for (int i = 0; i < ndim; i++) {
            int axis = defaultOrder == Order.C ? ndim - 1 - i : i;
            if (axis != channel) {
                expected[k++] = axis;
            }
        }

        int[] order;
        if (traversalOrder == null) {
            order = expected;
        } else {
            order = new int[traversalOrder.length];
            for (int i = 0; i < order.length; i++) {
                order[i] = Slices.positiveAxis(traversalOrder[i], ndim);
            }
            int[] sortedOrder = order.clone();
            int[] sortedExpected = expected.clone();
            Arrays.sort(sortedOrder);
            Arrays.sort(sortedExpected);
            if (!Arrays.equals(sortedOrder, sortedExpected)) {
                throw ChunkingException.traversalOrderMismatch(sortedExpected, traversalOrder);
            }
        }
        return new AxisLayout(shape, channel, channelSlice == null ? Slice.all() : channelSlice, order);
    }

    @Override
    public int[] shape() {
        return shape.clone();
    }

    @Override
    public int[] axesOrder() {
        return axesOrder.clone();
    }

    public int ndim() {
        return shape.length;
    }

    /**
     * Number of channels selected by the channel slice.
     */
    public int channels() {
        return Slices.length(channelSlice, shape[channelAxis]);
    }

    /**
     * Order axes in ascending dimension order.
     */
    public int[] sortedOrderAxes() {
        int[] sorted = axesOrder.clone();
        Arrays.sort(sorted);
        return sorted;
    }

    /**
     * Sizes of the order axes, in {@link #axesOrder()} order.
     */
    public int[] orderShape() {
        int[] result = new int[axesOrder.length];
        for (int i = 0; i < axesOrder.length; i++) {
            result[i] = shape[axesOrder[i]];
        }
        return result;
    }

    /**
     * Product of the order-axis sizes: the number of rows of a dense traversal.
     */
    public long orderSize() {
        long size = 1;
        for (int axis : axesOrder) {
            size *= shape[axis];
        }
        return size;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AxisLayout that)) return false;
        return channelAxis == that.channelAxis
                && Arrays.equals(shape, that.shape)
                && channelSlice.equals(that.channelSlice)
                && Arrays.equals(axesOrder, that.axesOrder);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(shape);
        result = 31 * result + channelAxis;
        result = 31 * result + channelSlice.hashCode();
        result = 31 * result + Arrays.hashCode(axesOrder);
        return result;
    }

    @Override
    public String toString() {
        return "AxisLayout[shape=" + Arrays.toString(shape) + ", channelAxis=" + channelAxis
                + ", channelSlice=" + channelSlice + ", axesOrder=" + Arrays.toString(axesOrder) + "]";
    }
}
