package io.surfworks.spectrastack.data.npy;

import io.surfworks.spectrastack.core.array.ScalarType;

import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Header of a NumPy .npy file: dtype, byte order, memory layout and shape.
 */
public record NpyHeader(
    int majorVersion,
    int minorVersion,
    ScalarType dtype,
    ByteOrder byteOrder,
    boolean fortranOrder,
    int[] shape
) {
    // {'descr': '<f8', 'fortran_order': False, 'shape': (100, 50, 2048), }
    private static final Pattern ENTRY = Pattern.compile(
        "'(\\w+)'\\s*:\\s*('[^']*'|True|False|\\([^)]*\\))");

    public NpyHeader {
        shape = shape.clone();
    }

    /**
     * Header for version 1.0 files written by this package.
     */
    public static NpyHeader of(ScalarType dtype, ByteOrder byteOrder, boolean fortranOrder, int[] shape) {
        return new NpyHeader(1, 0, dtype, byteOrder, fortranOrder, shape);
    }

    /**
     * Parse the header dict literal that follows the version and length fields.
     *
     * @throws IllegalArgumentException if {@code descr} or {@code shape} is missing or invalid
     */
    public static NpyHeader parse(int majorVersion, int minorVersion, String dict) {
        Map<String, String> entries = new HashMap<>();
        Matcher m = ENTRY.matcher(dict);
        while (m.find()) {
            entries.put(m.group(1), m.group(2));
        }
        String descr = entries.get("descr");
        String shape = entries.get("shape");
        if (descr == null || shape == null) {
            throw new IllegalArgumentException("Header lacks 'descr' or 'shape': " + dict);
        }
        descr = descr.substring(1, descr.length() - 1);
        return new NpyHeader(majorVersion, minorVersion,
            ScalarType.fromNpyDtype(descr),
            descr.startsWith(">") ? ByteOrder.BIG_ENDIAN : ByteOrder.LITTLE_ENDIAN,
            "True".equals(entries.get("fortran_order")),
            dimensions(shape.substring(1, shape.length() - 1)));
    }

    // "7, 3", "7," or "" (a scalar)
    private static int[] dimensions(String tuple) {
        return Arrays.stream(tuple.split(","))
            .map(String::trim)
            .filter(dim -> !dim.isEmpty())
            .mapToInt(Integer::parseInt)
            .toArray();
    }

    @Override
    public int[] shape() {
        return shape.clone();
    }

    public long elementCount() {
        long count = 1;
        for (int dim : shape) {
            count *= dim;
        }
        return count;
    }

    /**
     * Bytes of array data following the header.
     */
    public long dataSize() {
        return elementCount() * dtype.byteSize();
    }

    /**
     * The dtype descriptor with this header's byte order.
     */
    public String descr() {
        String descr = dtype.toNpyDtype();
        if (dtype.byteSize() == 1) {
            return descr;
        }
        return (byteOrder == ByteOrder.BIG_ENDIAN ? ">" : "<") + descr.substring(1);
    }

    /**
     * Generate the header dict for writing.
     */
    public String toHeaderString() {
        StringBuilder sb = new StringBuilder();
        sb.append("{'descr': '").append(descr()).append("', ");
        sb.append("'fortran_order': ").append(fortranOrder ? "True" : "False").append(", ");
        sb.append("'shape': (");
        for (int i = 0; i < shape.length; i++) {
            sb.append(shape[i]);
            if (i < shape.length - 1 || shape.length == 1) {
                sb.append(", ");
            }
        }
        sb.append("), }");
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NpyHeader that)) return false;
        return majorVersion == that.majorVersion
            && minorVersion == that.minorVersion
            && dtype == that.dtype
            && byteOrder.equals(that.byteOrder)
            && fortranOrder == that.fortranOrder
            && Arrays.equals(shape, that.shape);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(majorVersion, minorVersion, dtype, byteOrder, fortranOrder);
        return 31 * result + Arrays.hashCode(shape);
    }

    @Override
    public String toString() {
        return "NpyHeader[" + descr() + ", fortranOrder=" + fortranOrder + ", shape=" + Arrays.toString(shape) + "]";
    }
}
