package io.surfworks.spectrastack.core.view;

import io.surfworks.spectrastack.core.ChunkingException;
import io.surfworks.spectrastack.core.index.AxisIndex;
import io.surfworks.spectrastack.core.plan.AxisLayout;
import io.surfworks.spectrastack.core.plan.ChunkDescriptor;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Forward-only traversal of a {@link StackView}.
 *
 * <p>Also an {@link Iterable} so it can drive a for-each loop, but only once. For writable
 * views the current chunk is written back by {@link #next()} before the following chunk is
 * read, and by the {@link #hasNext()} call that reports the end of the traversal. Other
 * {@code hasNext()} calls have no effect on the source. A consumer that stops early leaves
 * the current chunk unwritten unless it calls {@link #flush()}.
 */
public final class ChunkIterator implements Iterator<ChunkEntry>, Iterable<ChunkEntry> {

    private final StackView view;
    private final Iterator<ChunkDescriptor> chunks;
    private final KeyMode keyMode;
    private final double[] storage;
    private final int channels;
    private final long totalRows;
    private final ChunkListener listener;

    private ChunkDescriptor pending;
    private ChunkBuffer pendingBuffer;
    private int chunk = -1;
    private long rowsVisited;
    private boolean iterated;
    private boolean started;
    private boolean completed;

    ChunkIterator(StackView view, Iterator<ChunkDescriptor> chunks, KeyMode keyMode, double[] storage) {
        this.view = view;
        this.chunks = chunks;
        this.keyMode = keyMode;
        this.storage = storage;
        this.channels = view.channels();
        this.totalRows = view.totalRows();
        this.listener = view.options().listener();
    }

    @Override
    public Iterator<ChunkEntry> iterator() {
        if (iterated) {
            throw ChunkingException.invalidState("Chunk iterator already in use");
        }
        iterated = true;
        return this;
    }

    @Override
    public boolean hasNext() {
        start();
        if (chunks.hasNext()) {
            return true;
        }
        flush();
        complete();
        return false;
    }

    @Override
    public ChunkEntry next() {
        start();
        flush();
        if (!chunks.hasNext()) {
            complete();
            throw new NoSuchElementException();
        }
        iterated = true;
        ChunkDescriptor descriptor = chunks.next();
        ChunkBuffer buffer = new ChunkBuffer(storage, descriptor.count(), channels);
        view.access().read(view.source(), descriptor, buffer, view.bufferType());
        chunk++;
        rowsVisited += descriptor.count();
        listener.onEvent(ChunkEvent.read(chunk, descriptor.count(), rowsVisited, totalRows, view.bufferRows()));
        if (!view.isReadOnly()) {
            pending = descriptor;
            pendingBuffer = buffer;
        }
        return new ChunkEntry(key(descriptor), buffer);
    }

    /**
     * Write the current chunk back now. No-op for read-only views and when nothing is pending.
     */
    public void flush() {
        if (pending == null) {
            return;
        }
        ChunkDescriptor descriptor = pending;
        pending = null;
        view.access().write(view.source(), descriptor, pendingBuffer);
        pendingBuffer = null;
        listener.onEvent(ChunkEvent.written(chunk, descriptor.count(), rowsVisited, totalRows, view.bufferRows()));
    }

    private void start() {
        if (!started) {
            started = true;
            listener.onEvent(ChunkEvent.started(totalRows, view.bufferRows()));
        }
    }

    private void complete() {
        if (completed) {
            return;
        }
        completed = true;
        view.finish();
        listener.onEvent(ChunkEvent.completed(rowsVisited, totalRows, view.bufferRows()));
    }

    private ChunkKey key(ChunkDescriptor descriptor) {
        if (keyMode == KeyMode.ALL) {
            return new ChunkKey(descriptor.index(), descriptor.shape());
        }
        AxisLayout layout = view.layout();
        int[] axes = layout.sortedOrderAxes();
        AxisIndex[] full = descriptor.index();
        AxisIndex[] index = new AxisIndex[axes.length];
        for (int i = 0; i < axes.length; i++) {
            index[i] = full[axes[i]];
        }
        if (view.isMasked()) {
            return new ChunkKey(index, new int[]{descriptor.count()});
        }
        int[] fullShape = descriptor.shape();
        int[] shape = new int[axes.length];
        for (int i = 0; i < axes.length; i++) {
            shape[i] = fullShape[axes[i]];
        }
        return new ChunkKey(index, shape);
    }
}
