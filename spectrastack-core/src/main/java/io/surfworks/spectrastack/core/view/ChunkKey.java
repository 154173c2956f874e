package io.surfworks.spectrastack.core.view;

import io.surfworks.spectrastack.core.index.AxisIndex;

import java.util.Arrays;

/**
 * Identity of a chunk: the index applied to the source and the resulting shape.
 */
public record ChunkKey(AxisIndex[] index, int[] shape) {

    public ChunkKey {
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
        if (!(o instanceof ChunkKey that)) return false;
        return Arrays.equals(index, that.index) && Arrays.equals(shape, that.shape);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(index) + Arrays.hashCode(shape);
    }

    @Override
    public String toString() {
        return "ChunkKey[index=" + Arrays.toString(index) + ", shape=" + Arrays.toString(shape) + "]";
    }
}
