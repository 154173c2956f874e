package io.surfworks.spectrastack.core;

import java.util.Arrays;

/**
 * Exception thrown when a chunked traversal cannot be configured or continued.
 */
public class ChunkingException extends RuntimeException {

    private final ErrorCode errorCode;

    public ChunkingException(String message) {
        super(message);
        this.errorCode = ErrorCode.UNKNOWN;
    }

    public ChunkingException(String message, ErrorCode errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public ChunkingException(String message, ErrorCode errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode errorCode() {
        return errorCode;
    }

    /**
     * Chunking error codes.
     */
    public enum ErrorCode {
        /** Unknown or unclassified error */
        UNKNOWN,

        /** Channel axis or traversal order does not partition the array dimensions */
        INVALID_AXES,

        /** Mask dimensionality or shape disagrees with the order axes */
        MASK_MISMATCH,

        /** Per-axis mask index lists have different lengths */
        INCONSISTENT_MASK,

        /** Non-integral slice bound or step */
        TYPE_MISMATCH,

        /** Operation not allowed in the current view state */
        INVALID_STATE
    }

    public static ChunkingException invalidAxes(String message) {
        return new ChunkingException(message, ErrorCode.INVALID_AXES);
    }

    public static ChunkingException traversalOrderMismatch(int[] expected, int[] actual) {
        return new ChunkingException(
                String.format("Traversal order %s does not match the non-channel axes %s",
                        Arrays.toString(actual), Arrays.toString(expected)),
                ErrorCode.INVALID_AXES);
    }

    public static ChunkingException maskMismatch(int maskDims, int orderAxes) {
        return new ChunkingException(
                String.format("Mask has %d dimensions but there are %d order axes", maskDims, orderAxes),
                ErrorCode.MASK_MISMATCH);
    }

    public static ChunkingException inconsistentMask(int[] lengths) {
        return new ChunkingException(
                "Mask index lists have different lengths: " + Arrays.toString(lengths),
                ErrorCode.INCONSISTENT_MASK);
    }

    public static ChunkingException notIntegral(Object value) {
        String type = value == null ? "null" : value.getClass().getSimpleName();
        return new ChunkingException(
                String.format("%s object cannot be interpreted as an integer: %s", type, value),
                ErrorCode.TYPE_MISMATCH);
    }

    public static ChunkingException invalidState(String message) {
        return new ChunkingException(message, ErrorCode.INVALID_STATE);
    }
}
