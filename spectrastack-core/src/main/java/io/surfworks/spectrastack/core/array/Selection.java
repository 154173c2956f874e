package io.surfworks.spectrastack.core.array;

import io.surfworks.spectrastack.core.index.AxisIndex;
import io.surfworks.spectrastack.core.index.IndexList;
import io.surfworks.spectrastack.core.index.Point;
import io.surfworks.spectrastack.core.index.Slice;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Resolution of a NumPy-style index against an array shape.
 *
 * <p>Slices contribute one result dimension each. Integer lists on several axes are
 * zipped into a single result dimension; when any list is present, points take part in
 * the zipping too. The zipped dimension sits where the first list axis was if all
 * advanced axes are adjacent, and in front otherwise.
 *
 * <p>{@link #offsets()} lists the flat row-major source offsets of every result element
 * in result row-major order, which is all a storage backend needs to gather or scatter.
 */
public final class Selection {

    private final int[] resultShape;
    private final long[] offsets;
    private final int listAxes;

    private Selection(int[] resultShape, long[] offsets, int listAxes) {
        this.resultShape = resultShape;
        this.offsets = offsets;
        this.listAxes = listAxes;
    }

    /**
     * Resolve {@code index} against {@code shape}.
     *
     * @throws IllegalArgumentException if the index rank is wrong or list lengths differ
     * @throws IndexOutOfBoundsException if a point or list value is out of range
     */
    public static Selection of(int[] shape, AxisIndex... index) {
        if (index.length != shape.length) {
            throw new IllegalArgumentException(
                "Expected " + shape.length + " axis indices, got " + index.length);
        }
        long[] strides = NdArray.computeRowMajorStrides(shape);

        int listAxes = 0;
        int listLength = -1;
        for (int axis = 0; axis < index.length; axis++) {
            if (index[axis] instanceof IndexList list) {
                if (listLength >= 0 && list.size() != listLength) {
                    throw new IllegalArgumentException(
                        "Index lists cannot be broadcast together: " + Arrays.toString(index));
                }
                listLength = list.size();
                listAxes++;
            }
        }
        boolean advanced = listAxes > 0;

        // Per result dimension: offset contribution of each position
        List<long[]> contributions = new ArrayList<>();
        long base = 0;
        long[] zipped = advanced ? new long[listLength] : null;
        int zippedPosition = -1;
        int firstAdvanced = -1;
        int lastAdvanced = -1;
        boolean adjacent = true;
        for (int axis = 0; axis < index.length; axis++) {
            AxisIndex idx = index[axis];
            boolean isAdvanced = idx instanceof IndexList || (advanced && idx instanceof Point);
            if (isAdvanced) {
                if (firstAdvanced < 0) {
                    firstAdvanced = axis;
                    zippedPosition = contributions.size();
                } else if (lastAdvanced != axis - 1) {
                    adjacent = false;
                }
                lastAdvanced = axis;
                int[] positions = idx.positions(shape[axis]);
                for (int j = 0; j < listLength; j++) {
                    zipped[j] += positions[idx instanceof Point ? 0 : j] * strides[axis];
                }
                continue;
            }
            if (idx instanceof Point point) {
                base += point.positions(shape[axis])[0] * strides[axis];
            } else if (idx instanceof Slice slice) {
                int[] positions = slice.positions(shape[axis]);
                long[] contribution = new long[positions.length];
                for (int j = 0; j < positions.length; j++) {
                    contribution[j] = positions[j] * strides[axis];
                }
                contributions.add(contribution);
            }
        }
        if (advanced) {
            contributions.add(adjacent ? zippedPosition : 0, zipped);
        }

        int[] resultShape = new int[contributions.size()];
        long total = 1;
        for (int d = 0; d < resultShape.length; d++) {
            resultShape[d] = contributions.get(d).length;
            total *= resultShape[d];
        }
        if (total > Integer.MAX_VALUE) {
            throw new IllegalStateException("Selection too large: " + total);
        }

        long[] offsets = new long[(int) total];
        int[] counter = new int[resultShape.length];
        for (int k = 0; k < offsets.length; k++) {
            long offset = base;
            for (int d = 0; d < counter.length; d++) {
                offset += contributions.get(d)[counter[d]];
            }
            offsets[k] = offset;
            for (int d = counter.length - 1; d >= 0; d--) {
                if (++counter[d] < resultShape[d]) {
                    break;
                }
                counter[d] = 0;
            }
        }
        return new Selection(resultShape, offsets, listAxes);
    }

    public int[] resultShape() {
        return resultShape.clone();
    }

    /**
     * Flat source offsets (in elements) of the selected elements, in result order.
     */
    public long[] offsets() {
        return offsets.clone();
    }

    public int size() {
        return offsets.length;
    }

    /**
     * Number of axes indexed with an integer list.
     */
    public int listAxes() {
        return listAxes;
    }

    long offset(int k) {
        return offsets[k];
    }
}
