package io.surfworks.spectrastack.core.array;

import io.surfworks.spectrastack.core.index.AxisIndex;

import java.util.Arrays;

/**
 * In-memory {@link ArraySource} over an {@link NdArray}.
 *
 * <p>Values written through {@link #set} are cast to the source's {@link ScalarType}.
 */
public final class HeapArraySource implements ArraySource {

    private final NdArray array;
    private final ScalarType dtype;
    private final boolean multiListIndexing;

    private HeapArraySource(NdArray array, ScalarType dtype, boolean multiListIndexing) {
        this.array = array;
        this.dtype = dtype;
        this.multiListIndexing = multiListIndexing;
    }

    /**
     * Source over a copy of {@code array} with element type F64.
     */
    public static HeapArraySource of(NdArray array) {
        return of(array, ScalarType.F64);
    }

    /**
     * Source over a copy of {@code array}, cast to {@code dtype}.
     */
    public static HeapArraySource of(NdArray array, ScalarType dtype) {
        return new HeapArraySource(cast(array, dtype), dtype, true);
    }

    /**
     * Source that, like chunked file storage, accepts an integer list on one axis per access only.
     */
    public static HeapArraySource singleListIndexing(NdArray array, ScalarType dtype) {
        return new HeapArraySource(cast(array, dtype), dtype, false);
    }

    @Override
    public int[] shape() {
        return array.shape();
    }

    @Override
    public ScalarType dtype() {
        return dtype;
    }

    @Override
    public boolean supportsMultiListIndexing() {
        return multiListIndexing;
    }

    @Override
    public NdArray get(AxisIndex... index) {
        Selection selection = select(index);
        double[] src = array.data();
        double[] out = new double[selection.size()];
        for (int k = 0; k < out.length; k++) {
            out[k] = src[(int) selection.offset(k)];
        }
        return NdArray.wrap(out, selection.resultShape());
    }

    @Override
    public void set(NdArray values, AxisIndex... index) {
        Selection selection = select(index);
        if (values.size() != selection.size()) {
            throw new IllegalArgumentException(
                "Cannot assign " + Arrays.toString(values.shape()) + " to selection of shape "
                + Arrays.toString(selection.resultShape()));
        }
        double[] dst = array.data();
        for (int k = 0; k < selection.size(); k++) {
            dst[(int) selection.offset(k)] = dtype.coerce(values.getFlat(k));
        }
    }

    /**
     * Copy of the current contents.
     */
    public NdArray snapshot() {
        return NdArray.of(array.data(), array.shape());
    }

    private Selection select(AxisIndex... index) {
        Selection selection = Selection.of(array.shape(), index);
        if (!multiListIndexing && selection.listAxes() > 1) {
            throw new UnsupportedOperationException(
                "Only one indexing list is allowed per access: " + Arrays.toString(index));
        }
        return selection;
    }

    private static NdArray cast(NdArray array, ScalarType dtype) {
        double[] data = array.toArray();
        for (int i = 0; i < data.length; i++) {
            data[i] = dtype.coerce(data[i]);
        }
        return NdArray.wrap(data, array.shape());
    }

    @Override
    public String toString() {
        return "HeapArraySource[" + dtype + " " + Arrays.toString(array.shape()) + "]";
    }
}
