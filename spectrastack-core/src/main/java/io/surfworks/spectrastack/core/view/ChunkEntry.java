package io.surfworks.spectrastack.core.view;

/**
 * One step of a traversal: the chunk's key and the buffer rows holding its spectra.
 *
 * <p>{@code value} aliases the view's shared buffer and is only valid until the next chunk
 * is requested.
 */
public record ChunkEntry(ChunkKey key, ChunkBuffer value) {
}
