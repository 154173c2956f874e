package io.surfworks.spectrastack.core.view;

import io.surfworks.spectrastack.core.array.ArraySource;
import io.surfworks.spectrastack.core.array.ScalarType;
import io.surfworks.spectrastack.core.plan.ChunkDescriptor;

/**
 * Moves one chunk between a source and a buffer window of {@code descriptor.count()} rows.
 */
interface ChunkAccess {

    void read(ArraySource source, ChunkDescriptor descriptor, ChunkBuffer buffer, ScalarType bufferType);

    void write(ArraySource source, ChunkDescriptor descriptor, ChunkBuffer buffer);
}
