package io.surfworks.spectrastack.core.array;

/**
 * Scalar element types of spectral arrays.
 *
 * <p>Elements are exchanged as {@code double} values; {@link #coerce(double)} applies the
 * NumPy cast semantics of the type (truncation toward zero and wrap-around for integers).
 */
public enum ScalarType {
    F32(4, false, true),
    F64(8, false, true),

    // Integer types
    I8(1, true, false),
    I16(2, true, false),
    I32(4, true, false),
    I64(8, true, false),
    U8(1, true, false),
    U16(2, true, false),

    BOOL(1, false, false);

    private final int byteSize;
    private final boolean isInteger;
    private final boolean isFloating;

    ScalarType(int byteSize, boolean isInteger, boolean isFloating) {
        this.byteSize = byteSize;
        this.isInteger = isInteger;
        this.isFloating = isFloating;
    }

    public int byteSize() {
        return byteSize;
    }

    public boolean isInteger() {
        return isInteger;
    }

    public boolean isFloating() {
        return isFloating;
    }

    /**
     * Cast a value to this type and back to {@code double}.
     */
    public double coerce(double value) {
        return switch (this) {
            case F64 -> value;
            case F32 -> (float) value;
            case I8 -> (byte) (long) value;
            case I16 -> (short) (long) value;
            case I32 -> (int) (long) value;
            case I64 -> (long) value;
            case U8 -> ((long) value) & 0xFFL;
            case U16 -> ((long) value) & 0xFFFFL;
            case BOOL -> value != 0 ? 1 : 0;
        };
    }

    /**
     * Parse from NumPy dtype string (e.g., "<f4", ">f8", "<i4").
     */
    public static ScalarType fromNpyDtype(String dtype) {
        // Strip byte order prefix if present
        String typeStr = dtype;
        if (dtype.startsWith("<") || dtype.startsWith(">") || dtype.startsWith("|") || dtype.startsWith("=")) {
            typeStr = dtype.substring(1);
        }

        return switch (typeStr) {
            case "f4" -> F32;
            case "f8" -> F64;
            case "i1" -> I8;
            case "i2" -> I16;
            case "i4" -> I32;
            case "i8" -> I64;
            case "u1" -> U8;
            case "u2" -> U16;
            case "b1", "?" -> BOOL;
            default -> throw new IllegalArgumentException("Unknown NumPy dtype: " + dtype);
        };
    }

    /**
     * Convert to NumPy dtype string (little-endian).
     */
    public String toNpyDtype() {
        return switch (this) {
            case F32 -> "<f4";
            case F64 -> "<f8";
            case I8 -> "|i1";
            case I16 -> "<i2";
            case I32 -> "<i4";
            case I64 -> "<i8";
            case U8 -> "|u1";
            case U16 -> "<u2";
            case BOOL -> "|b1";
        };
    }
}
