package io.surfworks.spectrastack.core.index;

import io.surfworks.spectrastack.core.ChunkingException;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * A (start, stop, step) slice with NumPy semantics.
 *
 * <p>Bounds may be {@code null} (open) or negative (counted from the end of the axis).
 * They are resolved against a concrete axis length by {@link Slices#indices(Slice, int)}.
 *
 * @param start first index, or {@code null} for the natural start of the step direction
 * @param stop  exclusive end index, or {@code null} for the natural end of the step direction
 * @param step  non-zero stride
 */
public record Slice(Integer start, Integer stop, int step) implements AxisIndex {

    private static final Slice ALL = new Slice(null, null, 1);

    public Slice {
        if (step == 0) {
            throw new IllegalArgumentException("Slice step cannot be zero");
        }
    }

    /**
     * The slice selecting an entire axis ({@code ::}).
     */
    public static Slice all() {
        return ALL;
    }

    public static Slice of(Integer start, Integer stop) {
        return new Slice(start, stop, 1);
    }

    public static Slice of(Integer start, Integer stop, int step) {
        return new Slice(start, stop, step);
    }

    /**
     * Create a slice from arbitrary numbers, rejecting anything that is not integral.
     *
     * @param start start bound or {@code null}
     * @param stop  stop bound or {@code null}
     * @param step  step or {@code null} for 1
     * @throws ChunkingException with {@code TYPE_MISMATCH} for non-integral values
     */
    public static Slice ofNumbers(Number start, Number stop, Number step) {
        Integer s = start == null ? null : toInt(start);
        Integer e = stop == null ? null : toInt(stop);
        int st = step == null ? 1 : toInt(step);
        return new Slice(s, e, st);
    }

    /**
     * Parse a slice written as {@code start:stop[:step]}, where every part may be empty.
     * A bare integer {@code i} is read as {@code i:i+1}.
     */
    public static Slice parse(String text) {
        String trimmed = text.trim();
        String[] parts = trimmed.split(":", -1);
        if (parts.length > 3) {
            throw new IllegalArgumentException("Invalid slice: " + text);
        }
        if (parts.length == 1) {
            int index = parseBound(parts[0], text);
            return new Slice(index, index == -1 ? null : index + 1, 1);
        }
        Integer start = parts[0].isBlank() ? null : parseBound(parts[0], text);
        Integer stop = parts[1].isBlank() ? null : parseBound(parts[1], text);
        int step = parts.length < 3 || parts[2].isBlank() ? 1 : parseBound(parts[2], text);
        return new Slice(start, stop, step);
    }

    @Override
    public int length(int n) {
        return Slices.length(this, n);
    }

    @Override
    public int[] positions(int n) {
        return Slices.expand(this, n);
    }

    /**
     * True when the slice selects every index of any axis in ascending order.
     */
    public boolean isFull() {
        return start == null && stop == null && step == 1;
    }

    private static int parseBound(String part, String text) {
        String p = part.trim();
        try {
            return Integer.parseInt(p);
        } catch (NumberFormatException e) {
            try {
                return toInt(new BigDecimal(p));
            } catch (NumberFormatException notANumber) {
                throw new IllegalArgumentException("Invalid slice: " + text, notANumber);
            }
        }
    }

    static int toInt(Number value) {
        if (value instanceof Integer i) {
            return i;
        }
        if (value instanceof Short || value instanceof Byte) {
            return value.intValue();
        }
        try {
            if (value instanceof Long l) {
                return Math.toIntExact(l);
            }
            if (value instanceof BigInteger b) {
                return b.intValueExact();
            }
            if (value instanceof BigDecimal d) {
                return d.intValueExact();
            }
        } catch (ArithmeticException e) {
            // fractional or outside the int range
            throw ChunkingException.notIntegral(value);
        }
        // Double and Float are rejected even when integral-valued
        throw ChunkingException.notIntegral(value);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (start != null) {
            sb.append(start);
        }
        sb.append(':');
        if (stop != null) {
            sb.append(stop);
        }
        if (step != 1) {
            sb.append(':').append(step);
        }
        return sb.toString();
    }
}
