package io.surfworks.spectrastack.core.view;

import io.surfworks.spectrastack.core.array.ArraySource;
import io.surfworks.spectrastack.core.array.NdArray;
import io.surfworks.spectrastack.core.array.ScalarType;
import io.surfworks.spectrastack.core.index.AxisIndex;
import io.surfworks.spectrastack.core.index.IndexList;
import io.surfworks.spectrastack.core.index.Point;
import io.surfworks.spectrastack.core.plan.ChunkDescriptor;

/**
 * Moves a masked chunk one spectrum at a time, replacing the coordinate lists on the order
 * axes by single points.
 */
final class PointwiseAccess implements ChunkAccess {

    private final int[] orderAxes;

    PointwiseAccess(int[] orderAxes) {
        this.orderAxes = orderAxes.clone();
    }

    @Override
    public void read(ArraySource source, ChunkDescriptor descriptor, ChunkBuffer buffer, ScalarType bufferType) {
        AxisIndex[] index = descriptor.index();
        int channels = buffer.channels();
        double[] storage = buffer.storage();
        for (int row = 0; row < descriptor.count(); row++) {
            NdArray spectrum = source.get(rowIndex(index, row));
            for (int c = 0; c < channels; c++) {
                storage[row * channels + c] = bufferType.coerce(spectrum.getFlat(c));
            }
        }
    }

    @Override
    public void write(ArraySource source, ChunkDescriptor descriptor, ChunkBuffer buffer) {
        AxisIndex[] index = descriptor.index();
        for (int row = 0; row < descriptor.count(); row++) {
            source.set(NdArray.of(buffer.row(row), buffer.channels()), rowIndex(index, row));
        }
    }

    private AxisIndex[] rowIndex(AxisIndex[] index, int row) {
        AxisIndex[] result = index.clone();
        for (int axis : orderAxes) {
            result[axis] = Point.of(((IndexList) index[axis]).get(row));
        }
        return result;
    }
}
