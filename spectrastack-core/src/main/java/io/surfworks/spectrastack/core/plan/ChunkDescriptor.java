package io.surfworks.spectrastack.core.plan;

import io.surfworks.spectrastack.core.index.AxisIndex;

import java.util.Arrays;

/**
 * One chunk of a traversal.
 *
 * @param index full-dimensional index applicable to the array source
 * @param shape shape of the sub-array the index selects
 * @param count number of rows (order-axis coordinates) in the chunk
 */
public record ChunkDescriptor(AxisIndex[] index, int[] shape, int count) {

    public ChunkDescriptor {
        index = index.clone();
        shape = shape.clone();
    }

    @Override
    public AxisIndex[] index() {
        return index.clone();
    }

    @Override
    public int[] shape() {
        return shape.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChunkDescriptor that)) return false;
        return count == that.count
                && Arrays.equals(index, that.index)
                && Arrays.equals(shape, that.shape);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(index);
        result = 31 * result + Arrays.hashCode(shape);
        result = 31 * result + count;
        return result;
    }

    @Override
    public String toString() {
        return "ChunkDescriptor[index=" + Arrays.toString(index)
                + ", shape=" + Arrays.toString(shape) + ", count=" + count + "]";
    }
}
