package io.surfworks.spectrastack.core.view;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Listener receiving {@link ChunkEvent}s from a traversal.
 *
 * <p>Called synchronously on the consuming thread, once per chunk read and once per chunk
 * written, so implementations should be cheap.
 *
 * <pre>{@code
 * ViewOptions options = ViewOptions.builder()
 *     .listener(event -> progressBar.set(event.progress()))
 *     .build();
 * }</pre>
 */
@FunctionalInterface
public interface ChunkListener {

    void onEvent(ChunkEvent event);

    /**
     * A no-op listener.
     */
    ChunkListener NONE = event -> {};

    /**
     * A listener forwarding every event to {@code java.util.logging} at FINE level.
     */
    ChunkListener LOGGING = new ChunkListener() {
        private final Logger log = Logger.getLogger(ChunkListener.class.getName());

        @Override
        public void onEvent(ChunkEvent event) {
            if (!log.isLoggable(Level.FINE)) {
                return;
            }
            switch (event.type()) {
                case STARTED -> log.fine("Traversal of " + event.totalRows()
                        + " rows started, buffer holds " + event.bufferRows());
                case CHUNK_READ -> log.fine(String.format("Chunk %d read: %d rows (%.1f%%)",
                        event.chunk(), event.rows(), event.progress() * 100));
                case CHUNK_WRITTEN -> log.fine("Chunk " + event.chunk() + " written: " + event.rows() + " rows");
                case COMPLETED -> log.fine("Traversal complete: " + event.rowsVisited() + " rows");
            }
        }
    };

    /**
     * Combine this listener with another, calling both on each event.
     */
    default ChunkListener andThen(ChunkListener other) {
        return event -> {
            this.onEvent(event);
            other.onEvent(event);
        };
    }
}
