package io.surfworks.spectrastack.core.index;

import io.surfworks.spectrastack.core.ChunkingException;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Slice algebra over a bounded axis.
 *
 * <p>All functions are pure and resolve slices the way NumPy does for {@code range(n)}:
 * <pre>{@code
 * Slices.length(Slice.of(null, null, -1), 5);   // 5
 * Slices.reverse(Slice.of(null, null, -1), 5);  // 0:5, i.e. [0, 1, 2, 3, 4]
 * Slices.complement(Slice.of(1, 4), 5);         // [0, 4]
 * }</pre>
 */
public final class Slices {

    private Slices() {
        // Utility class
    }

    /**
     * Concrete start, stop and step of a slice resolved against an axis length.
     * For negative steps {@code stop} may be -1, meaning "through index 0".
     */
    public record Bounds(int start, int stop, int step) {}

    /**
     * A slice together with the number of elements it selects.
     */
    public record Piece(Slice slice, int length) {}

    /**
     * Resolve slice bounds against axis length {@code n} (Python {@code slice.indices}).
     */
    public static Bounds indices(Slice slice, int n) {
        if (n < 0) {
            throw new IllegalArgumentException("Axis length must be non-negative: " + n);
        }
        int step = slice.step();
        int lower = step < 0 ? -1 : 0;
        int upper = step < 0 ? n - 1 : n;
        int start = slice.start() == null
                ? (step < 0 ? upper : lower)
                : clamp(slice.start(), n, lower, upper);
        int stop = slice.stop() == null
                ? (step < 0 ? lower : upper)
                : clamp(slice.stop(), n, lower, upper);
        return new Bounds(start, stop, step);
    }

    /**
     * Slice with concrete non-negative bounds. With a negative step a stop that runs past
     * index 0 becomes open ({@code null}), since -1 would be read as the last index. An
     * empty selection normalizes to {@code 0:0} with the original step.
     */
    public static Slice normalize(Slice slice, int n) {
        Bounds b = indices(slice, n);
        if (length(slice, n) == 0) {
            return new Slice(0, 0, b.step());
        }
        Integer stop = b.step() < 0 && b.stop() == -1 ? null : b.stop();
        return new Slice(b.start(), stop, b.step());
    }

    /**
     * Number of elements of {@code range(n)[slice]}, computed without enumeration.
     */
    public static int length(Slice slice, int n) {
        Bounds b = indices(slice, n);
        int one = b.step() < 0 ? -1 : 1;
        long span = (long) b.stop() - b.start() + b.step() - one;
        return (int) Math.max(0, Math.floorDiv(span, b.step()));
    }

    /**
     * Slice yielding the same elements in reverse order.
     */
    public static Slice reverse(Slice slice, int n) {
        Bounds b = indices(slice, n);
        if (length(slice, n) == 0) {
            return new Slice(0, 0, -b.step());
        }
        int one = b.step() < 0 ? 1 : -1;
        int newStart = Math.floorDiv(b.stop() - b.start() + one, b.step()) * b.step() + b.start();
        int newStop = b.start() + one;
        return new Slice(newStart, newStop == -1 ? null : newStop, -b.step());
    }

    /**
     * Ascending indices of {@code range(n)} not selected by the slice.
     */
    public static int[] complement(Slice slice, int n) {
        boolean[] selected = new boolean[n];
        for (int i : expand(slice, n)) {
            selected[i] = true;
        }
        int[] result = new int[n - length(slice, n)];
        int k = 0;
        for (int i = 0; i < n; i++) {
            if (!selected[i]) {
                result[k++] = i;
            }
        }
        return result;
    }

    /**
     * Materialize the indices selected by the slice.
     */
    public static int[] expand(Slice slice, int n) {
        Bounds b = indices(slice, n);
        int[] result = new int[length(slice, n)];
        int value = b.start();
        for (int i = 0; i < result.length; i++) {
            result[i] = value;
            value += b.step();
        }
        return result;
    }

    /**
     * Pieces equivalent to {@code range(start, stop, sign(step))} given in runs of
     * {@code |step|} items; the last piece may be shorter. The sequence is lazy.
     */
    public static Iterator<Piece> chunked(int start, int stop, int step) {
        if (step == 0) {
            throw new IllegalArgumentException("Chunk step cannot be zero");
        }
        return new Iterator<>() {
            private int a = start;

            @Override
            public boolean hasNext() {
                return step > 0 ? a < stop : a > stop;
            }

            @Override
            public Piece next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                int b = step > 0 ? Math.min(a + step, stop) : Math.max(a + step, stop);
                Piece piece = new Piece(
                        new Slice(a, b == -1 ? null : b, step > 0 ? 1 : -1),
                        Math.abs(b - a));
                a += step;
                return piece;
            }
        };
    }

    /**
     * {@link #chunked(int, int, int)} for untyped bounds; {@code step} may be null.
     *
     * @throws ChunkingException with {@code TYPE_MISMATCH} for non-integral values
     */
    public static Iterator<Piece> chunked(Number start, Number stop, Number step) {
        int s = Slice.toInt(requireNumber(start));
        int e = Slice.toInt(requireNumber(stop));
        int st = step == null ? 1 : Slice.toInt(step);
        return chunked(s, e, st);
    }

    /**
     * Resolve a possibly negative axis number against {@code ndim} dimensions.
     */
    public static int positiveAxis(int axis, int ndim) {
        int resolved = axis < 0 ? axis + ndim : axis;
        if (resolved < 0 || resolved >= ndim) {
            throw ChunkingException.invalidAxes(
                    "Axis " + axis + " out of range for " + ndim + " dimensions");
        }
        return resolved;
    }

    private static Number requireNumber(Number value) {
        if (value == null) {
            throw ChunkingException.notIntegral(null);
        }
        return value;
    }

    private static int clamp(int index, int n, int lower, int upper) {
        int i = index < 0 ? index + n : index;
        if (i < lower) {
            return lower;
        }
        return Math.min(i, upper);
    }
}
