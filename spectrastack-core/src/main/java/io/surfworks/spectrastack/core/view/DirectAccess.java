package io.surfworks.spectrastack.core.view;

import io.surfworks.spectrastack.core.array.ArraySource;
import io.surfworks.spectrastack.core.array.NdArray;
import io.surfworks.spectrastack.core.array.ScalarType;
import io.surfworks.spectrastack.core.plan.ChunkDescriptor;

/**
 * Reads a chunk with a single source access and transposes it so that the channel axis
 * comes last; the leading axes then flatten into rows.
 */
final class DirectAccess implements ChunkAccess {

    private final int[] perm;
    private final int[] inverse;

    DirectAccess(int[] perm) {
        this.perm = perm.clone();
        this.inverse = new int[perm.length];
        for (int i = 0; i < perm.length; i++) {
            inverse[perm[i]] = i;
        }
    }

    @Override
    public void read(ArraySource source, ChunkDescriptor descriptor, ChunkBuffer buffer, ScalarType bufferType) {
        NdArray block = source.get(descriptor.index()).transpose(perm);
        double[] storage = buffer.storage();
        int size = block.size();
        for (int i = 0; i < size; i++) {
            storage[i] = bufferType.coerce(block.getFlat(i));
        }
    }

    @Override
    public void write(ArraySource source, ChunkDescriptor descriptor, ChunkBuffer buffer) {
        int[] shape = descriptor.shape();
        int[] transposed = new int[perm.length];
        for (int i = 0; i < perm.length; i++) {
            transposed[i] = shape[perm[i]];
        }
        int size = buffer.rows() * buffer.channels();
        double[] data = new double[size];
        System.arraycopy(buffer.storage(), 0, data, 0, size);
        source.set(NdArray.of(data, transposed).transpose(inverse), descriptor.index());
    }
}
