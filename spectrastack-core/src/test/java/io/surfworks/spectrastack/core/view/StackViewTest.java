package io.surfworks.spectrastack.core.view;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Stream;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import io.surfworks.spectrastack.core.ChunkingException;
import io.surfworks.spectrastack.core.array.HeapArraySource;
import io.surfworks.spectrastack.core.array.NdArray;
import io.surfworks.spectrastack.core.array.ScalarType;
import io.surfworks.spectrastack.core.index.AxisIndex;
import io.surfworks.spectrastack.core.index.BooleanMask;
import io.surfworks.spectrastack.core.index.IndexList;
import io.surfworks.spectrastack.core.index.IndexMask;
import io.surfworks.spectrastack.core.index.Mask;
import io.surfworks.spectrastack.core.index.Point;
import io.surfworks.spectrastack.core.index.Slice;
import io.surfworks.spectrastack.core.memory.MemoryProbe;

@DisplayName("StackView")
class StackViewTest {

    /**
     * Spectra a chunk should hold, read straight from the source in buffer row order.
     */
    static List<double[]> expectedRows(StackView view, HeapArraySource source, ChunkKey key) {
        int[] shape = source.shape();
        int channelAxis = view.layout().channelAxis();
        int[] axes = view.layout().sortedOrderAxes();
        AxisIndex[] index = key.index();
        List<int[]> coordinates = new ArrayList<>();
        if (view.isMasked()) {
            int rows = ((IndexList) index[axes[0]]).size();
            for (int r = 0; r < rows; r++) {
                int[] coord = new int[axes.length];
                for (int k = 0; k < axes.length; k++) {
                    coord[k] = ((IndexList) index[axes[k]]).get(r);
                }
                coordinates.add(coord);
            }
        } else {
            int[][] positions = new int[axes.length][];
            int rows = 1;
            for (int k = 0; k < axes.length; k++) {
                positions[k] = index[axes[k]].positions(shape[axes[k]]);
                rows *= positions[k].length;
            }
            int[] counter = new int[axes.length];
            for (int r = 0; r < rows; r++) {
                int[] coord = new int[axes.length];
                for (int k = 0; k < axes.length; k++) {
                    coord[k] = positions[k][counter[k]];
                }
                coordinates.add(coord);
                for (int k = axes.length - 1; k >= 0; k--) {
                    if (++counter[k] < positions[k].length) {
                        break;
                    }
                    counter[k] = 0;
                }
            }
        }
        List<double[]> rows = new ArrayList<>();
        for (int[] coord : coordinates) {
            AxisIndex[] spectrum = new AxisIndex[shape.length];
            spectrum[channelAxis] = view.layout().channelSlice();
            for (int k = 0; k < axes.length; k++) {
                spectrum[axes[k]] = Point.of(coord[k]);
            }
            rows.add(source.get(spectrum).toArray());
        }
        return rows;
    }

    static ViewOptions.Builder options(int channelAxis, int rowCapacity) {
        return ViewOptions.builder().channelAxis(channelAxis).rowCapacity(rowCapacity);
    }

    static ViewOptions.Builder options(int channelAxis, int rowCapacity, int[] order) {
        return options(channelAxis, rowCapacity).traversalOrder(order);
    }

    static Stream<Arguments> layouts() {
        return Stream.of(
            Arguments.of(new int[]{12, 7}, -1, 5, null, null),
            Arguments.of(new int[]{4, 5, 6}, 2, 7, null, null),
            Arguments.of(new int[]{4, 5, 6}, 1, 3, null, null),
            Arguments.of(new int[]{4, 5, 6}, 0, 40, null, null),
            Arguments.of(new int[]{3, 4, 5, 6}, 2, 11, new int[]{0, 3, 1}, null),
            Arguments.of(new int[]{4, 5, 6}, 2, 7, null,
                IndexMask.of(new int[]{3, 0, 2, 1, 3}, new int[]{4, 4, 0, 1, 2})),
            Arguments.of(new int[]{4, 5, 6}, 1, 2, null, IndexMask.of(new int[]{3, 0, 2}, new int[]{5, 1, 0})),
            Arguments.of(new int[]{4, 5, 6}, 0, 3, null, IndexMask.of(new int[]{0, 4, 2, 1}, new int[]{5, 1, 0, 3})),
            Arguments.of(new int[]{4, 5, 6}, 0, 3, new int[]{2, 1},
                IndexMask.of(new int[]{5, 1, 0, 3}, new int[]{0, 4, 2, 1})),
            Arguments.of(new int[]{9, 6}, 1, 4, null,
                BooleanMask.of(true, false, true, true, false, false, true, true, true)));
    }

    @Nested
    @DisplayName("Reading")
    class ReadTests {

        @ParameterizedTest
        @MethodSource("io.surfworks.spectrastack.core.view.StackViewTest#layouts")
        @DisplayName("every chunk holds the spectra its key names")
        void chunksHoldSpectra(int[] shape, int channelAxis, int capacity, int[] order, Mask mask) {
            HeapArraySource source = HeapArraySource.of(NdArray.arange(shape));
            StackView view = StackView.masked(source, mask, options(channelAxis, capacity, order).build());
            long rows = 0;
            for (ChunkEntry entry : view.items()) {
                List<double[]> expected = expectedRows(view, source, entry.key());
                assertEquals(expected.size(), entry.value().rows());
                for (int r = 0; r < expected.size(); r++) {
                    assertArrayEquals(expected.get(r), entry.value().row(r));
                }
                rows += entry.value().rows();
            }
            assertEquals(view.totalRows(), rows);
            assertEquals(ViewState.EXHAUSTED, view.state());
        }

        @Test
        @DisplayName("channel slice selects and orders the channels")
        void channelSlice() {
            HeapArraySource source = HeapArraySource.of(NdArray.arange(3, 10));
            ViewOptions options = options(-1, 10).channelSlice(Slice.of(8, 1, -3)).build();
            StackView view = StackView.full(source, options);
            assertEquals(3, view.channels());
            assertEquals(10, view.originalChannels());
            ChunkEntry entry = view.items().next();
            assertArrayEquals(new double[]{18, 15, 12}, entry.value().row(1));
        }

        @Test
        @DisplayName("values are converted to the buffer type")
        void bufferType() {
            HeapArraySource source = HeapArraySource.of(NdArray.of(new double[]{1.7, -2.5, 3.2, 4.9}, 2, 2));
            StackView view = StackView.full(source, options(-1, 2).bufferType(ScalarType.I32).build());
            assertEquals(ScalarType.I32, view.bufferType());
            ChunkEntry entry = view.items().next();
            assertArrayEquals(new double[]{1, -2}, entry.value().row(0));
            assertArrayEquals(new double[]{3, 4}, entry.value().row(1));
        }

        @Test
        @DisplayName("buffer type defaults to the source type")
        void bufferTypeDefault() {
            HeapArraySource source = HeapArraySource.of(NdArray.zeros(2, 2), ScalarType.U16);
            assertEquals(ScalarType.U16, StackView.full(source, ViewOptions.defaults()).bufferType());
        }

        @Test
        @DisplayName("the buffer is shared between chunks")
        void bufferAliasing() {
            HeapArraySource source = HeapArraySource.of(NdArray.arange(4, 3));
            ChunkIterator items = StackView.full(source, options(-1, 2).build()).items();
            ChunkBuffer first = items.next().value();
            assertEquals(0.0, first.get(0, 0));
            ChunkBuffer second = items.next().value();
            assertNotSame(first, second);
            assertTrue(first.sharesStorageWith(second));
            // the earlier buffer now shows the current chunk
            assertEquals(6.0, first.get(0, 0));
        }

        @Test
        @DisplayName("capacity is derived from the memory budget when not given")
        void derivedCapacity() {
            HeapArraySource source = HeapArraySource.of(NdArray.zeros(100, 50));
            // 100000 * 0.01 = 1000 bytes, one spectrum = 50 * 8 bytes
            ViewOptions options = ViewOptions.builder().memoryProbe(MemoryProbe.fixed(100_000)).build();
            assertEquals(2, StackView.full(source, options).bufferRows());

            ViewOptions unknown = ViewOptions.builder().memoryProbe(MemoryProbe.unknown()).minimumRows(7).build();
            assertEquals(7, StackView.full(source, unknown).bufferRows());
        }

        @Test
        @DisplayName("the channel slice narrows the rows used for the budget")
        void derivedCapacityUsesSlicedChannels() {
            HeapArraySource source = HeapArraySource.of(NdArray.zeros(100, 50));
            ViewOptions options = ViewOptions.builder()
                .memoryProbe(MemoryProbe.fixed(100_000))
                .channelSlice(Slice.of(0, 25))
                .build();
            assertEquals(5, StackView.full(source, options).bufferRows());
        }
    }

    @Nested
    @DisplayName("Writing")
    class WriteTests {

        @ParameterizedTest
        @MethodSource("io.surfworks.spectrastack.core.view.StackViewTest#layouts")
        @DisplayName("an unmodified writable traversal leaves the source bit-identical")
        void roundTrip(int[] shape, int channelAxis, int capacity, int[] order, Mask mask) {
            NdArray original = NdArray.arange(shape);
            HeapArraySource source = HeapArraySource.of(original);
            StackView view = StackView.masked(source, mask, options(channelAxis, capacity, order).readOnly(false).build());
            for (ChunkEntry ignored : view.items()) {
                // touch nothing
            }
            assertTrue(original.contentEquals(source.snapshot()));
        }

        @ParameterizedTest
        @MethodSource("io.surfworks.spectrastack.core.view.StackViewTest#layouts")
        @DisplayName("modifications reach exactly the visited spectra")
        void modificationsPropagate(int[] shape, int channelAxis, int capacity, int[] order, Mask mask) {
            NdArray original = NdArray.arange(shape);
            HeapArraySource source = HeapArraySource.of(original);
            StackView view = StackView.masked(source, mask, options(channelAxis, capacity, order).readOnly(false).build());
            for (ChunkEntry entry : view.items()) {
                entry.value().apply(v -> -v - 1);
            }
            NdArray result = source.snapshot();
            int visited = 0;
            for (int i = 0; i < result.size(); i++) {
                if (result.getFlat(i) < 0) {
                    assertEquals(-original.getFlat(i) - 1, result.getFlat(i));
                    visited++;
                } else {
                    assertEquals(original.getFlat(i), result.getFlat(i));
                }
            }
            assertEquals(view.totalRows() * view.channels(), visited);
        }

        @Test
        @DisplayName("read-only views discard modifications")
        void readOnlyDiscards() {
            NdArray original = NdArray.arange(5, 4);
            HeapArraySource source = HeapArraySource.of(original);
            for (ChunkEntry entry : StackView.full(source, options(-1, 2).build()).items()) {
                entry.value().fill(0);
            }
            assertTrue(original.contentEquals(source.snapshot()));
        }

        @Test
        @DisplayName("writes respect the channel slice")
        void writeWithChannelSlice() {
            HeapArraySource source = HeapArraySource.of(NdArray.zeros(2, 6));
            ViewOptions options = options(1, 2).channelSlice(Slice.of(1, 6, 2)).readOnly(false).build();
            for (ChunkEntry entry : StackView.full(source, options).items()) {
                entry.value().fill(1);
            }
            assertArrayEquals(new double[]{0, 1, 0, 1, 0, 1, 0, 1, 0, 1, 0, 1}, source.snapshot().toArray());
        }

        @Test
        @DisplayName("written values are cast to the source type")
        void writeCastsToSourceType() {
            HeapArraySource source = HeapArraySource.of(NdArray.zeros(2, 2), ScalarType.I16);
            ViewOptions options = options(-1, 2).bufferType(ScalarType.F64).readOnly(false).build();
            for (ChunkEntry entry : StackView.full(source, options).items()) {
                entry.value().fill(2.75);
            }
            assertArrayEquals(new double[]{2, 2, 2, 2}, source.snapshot().toArray());
        }

        @Test
        @DisplayName("checking for more chunks does not write the current one early")
        void hasNextInsideLoop() {
            HeapArraySource source = HeapArraySource.of(NdArray.zeros(4, 3));
            ChunkIterator items = StackView.full(source, options(-1, 2).readOnly(false).build()).items();
            while (items.hasNext()) {
                ChunkEntry entry = items.next();
                boolean last = !items.hasNext();
                assertEquals(items.hasNext(), !last);
                entry.value().fill(last ? 2 : 1);
            }
            assertArrayEquals(new double[]{1, 1, 1, 1, 1, 1, 2, 2, 2, 2, 2, 2}, source.snapshot().toArray());
        }

        @Test
        @DisplayName("next past the end still writes the last chunk back")
        void nextPastTheEnd() {
            HeapArraySource source = HeapArraySource.of(NdArray.zeros(2, 2));
            ChunkIterator items = StackView.full(source, options(-1, 2).readOnly(false).build()).items();
            items.next().value().fill(5);
            assertThrows(NoSuchElementException.class, items::next);
            assertArrayEquals(new double[]{5, 5, 5, 5}, source.snapshot().toArray());
        }

        @Test
        @DisplayName("an abandoned traversal leaves its current chunk unwritten until flushed")
        void abandonedTraversal() {
            HeapArraySource source = HeapArraySource.of(NdArray.zeros(6, 2));
            ChunkIterator items = StackView.full(source, options(-1, 2).readOnly(false).build()).items();
            items.next().value().fill(1);
            items.next().value().fill(2);
            // first chunk was written when the second was requested
            NdArray partial = source.snapshot();
            assertEquals(1.0, partial.get(1, 1));
            assertEquals(0.0, partial.get(2, 0));

            items.flush();
            assertEquals(2.0, source.snapshot().get(3, 1));
            assertEquals(0.0, source.snapshot().get(4, 0));
        }
    }

    @Nested
    @DisplayName("Access strategies")
    class AccessStrategyTests {

        @Test
        @DisplayName("sources without zipped list support are accessed spectrum by spectrum")
        void pointwiseSelected() {
            Mask mask = IndexMask.of(new int[]{0, 1}, new int[]{2, 3});
            StackView direct = StackView.masked(
                HeapArraySource.of(NdArray.zeros(3, 4, 5)), mask, ViewOptions.defaults());
            StackView pointwise = StackView.masked(
                HeapArraySource.singleListIndexing(NdArray.zeros(3, 4, 5), ScalarType.F64), mask, ViewOptions.defaults());
            assertEquals(AccessStrategy.DIRECT, direct.accessStrategy());
            assertEquals(AccessStrategy.POINTWISE, pointwise.accessStrategy());
            assertEquals(TraversalStrategy.MASKED, pointwise.traversal());
        }

        @Test
        @DisplayName("single order axis needs no pointwise access")
        void singleAxisStaysDirect() {
            StackView view = StackView.masked(
                HeapArraySource.singleListIndexing(NdArray.zeros(6, 5), ScalarType.F64),
                IndexMask.of(new int[]{4, 1}), ViewOptions.defaults());
            assertEquals(AccessStrategy.DIRECT, view.accessStrategy());
        }

        @ParameterizedTest
        @MethodSource("io.surfworks.spectrastack.core.view.StackViewTest#layouts")
        @DisplayName("pointwise and direct access see and write the same data")
        void pointwiseEqualsDirect(int[] shape, int channelAxis, int capacity, int[] order, Mask mask) {
            NdArray original = NdArray.arange(shape);
            HeapArraySource multi = HeapArraySource.of(original);
            HeapArraySource single = HeapArraySource.singleListIndexing(original, ScalarType.F64);
            ViewOptions options = options(channelAxis, capacity, order).readOnly(false).build();

            Iterator<ChunkEntry> a = StackView.masked(multi, mask, options).items();
            Iterator<ChunkEntry> b = StackView.masked(single, mask, options).items();
            while (a.hasNext()) {
                assertTrue(b.hasNext());
                ChunkEntry ea = a.next();
                ChunkEntry eb = b.next();
                assertEquals(ea.key(), eb.key());
                assertArrayEquals(ea.value().toArray(), eb.value().toArray());
                ea.value().apply(v -> v * 3);
                eb.value().apply(v -> v * 3);
            }
            assertFalse(b.hasNext());
            assertTrue(multi.snapshot().contentEquals(single.snapshot()));
        }
    }

    @Nested
    @DisplayName("Keys")
    class KeyTests {

        @Test
        @DisplayName("ALL keys carry the full index and chunk shape")
        void allKeys() {
            StackView view = StackView.full(HeapArraySource.of(NdArray.zeros(4, 5, 6)), options(1, 8).build());
            // axis 2 fits whole, axis 0 is split into single rows
            ChunkKey key = view.items(KeyMode.ALL).next().key();
            assertArrayEquals(new AxisIndex[]{Slice.of(0, 1), Slice.all(), Slice.all()}, key.index());
            assertArrayEquals(new int[]{1, 5, 6}, key.shape());
        }

        @Test
        @DisplayName("SELECT keys of dense views carry the order axes only")
        void selectDense() {
            StackView view = StackView.full(HeapArraySource.of(NdArray.zeros(4, 5, 6)), options(1, 12).build());
            ChunkKey key = view.items(KeyMode.SELECT).next().key();
            assertArrayEquals(new AxisIndex[]{Slice.of(0, 2), Slice.all()}, key.index());
            assertArrayEquals(new int[]{2, 6}, key.shape());
        }

        @Test
        @DisplayName("SELECT keys of masked views carry the coordinate lists and row count")
        void selectMasked() {
            Mask mask = IndexMask.of(new int[]{3, 1, 0}, new int[]{2, 2, 5});
            StackView view = StackView.masked(HeapArraySource.of(NdArray.zeros(4, 5, 6)), mask,
                options(1, 2).build());
            ChunkKey key = view.items(KeyMode.SELECT).next().key();
            assertEquals(IndexList.of(3, 1), key.index()[0]);
            assertEquals(IndexList.of(2, 2), key.index()[1]);
            assertArrayEquals(new int[]{2}, key.shape());
        }
    }

    @Nested
    @DisplayName("Full and complement indices")
    class IndexTests {

        @Test
        @DisplayName("unmasked view: channel slice and its complement")
        void unmasked() {
            StackView view = StackView.full(HeapArraySource.of(NdArray.zeros(3, 10)),
                options(1, 4).channelSlice(Slice.of(2, 8)).build());
            assertArrayEquals(new AxisIndex[]{Slice.all(), Slice.of(2, 8)}, view.idxFull());

            Iterator<AxisIndex[]> complement = view.idxFullComplement();
            assertArrayEquals(new AxisIndex[]{Slice.all(), IndexList.of(0, 1, 8, 9)}, complement.next());
            assertFalse(complement.hasNext());
        }

        @Test
        @DisplayName("masked view: mask lists, and one complement index per excluded channel")
        void masked() {
            BooleanMask mask = BooleanMask.of(true, false, true, false);
            StackView view = StackView.masked(HeapArraySource.of(NdArray.zeros(4, 5)), mask,
                options(1, 4).channelSlice(Slice.of(0, 3)).build());
            assertArrayEquals(new AxisIndex[]{IndexList.of(0, 2), Slice.of(0, 3)}, view.idxFull());

            List<AxisIndex[]> complement = new ArrayList<>();
            view.idxFullComplement().forEachRemaining(complement::add);
            assertEquals(2, complement.size());
            assertArrayEquals(new AxisIndex[]{IndexList.of(1, 3), Point.of(3)}, complement.get(0));
            assertArrayEquals(new AxisIndex[]{IndexList.of(1, 3), Point.of(4)}, complement.get(1));
        }

        @Test
        @DisplayName("full and complement indices together cover the whole array")
        void coverWholeArray() {
            HeapArraySource source = HeapArraySource.of(NdArray.zeros(4, 5, 6));
            Mask mask = IndexMask.of(new int[]{0, 3, 2}, new int[]{1, 1, 4});
            StackView view = StackView.masked(source, mask,
                options(-1, 4).channelSlice(Slice.of(1, 5)).build());

            source.set(NdArray.of(filled(3 * 4, 1), 3, 4), view.idxFull());
            view.idxFullComplement().forEachRemaining(index ->
                source.set(NdArray.of(filled(20 - 3, 1), 20 - 3), index));
            NdArray result = source.snapshot();
            int ones = 0;
            for (int i = 0; i < result.size(); i++) {
                if (result.getFlat(i) == 1) {
                    ones++;
                }
            }
            // masked spectra outside the channel slice are in neither index
            assertEquals(4 * 5 * 6 - 3 * 2, ones);
        }

        private double[] filled(int n, double value) {
            double[] out = new double[n];
            Arrays.fill(out, value);
            return out;
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("a view is traversed only once")
        void singleUse() {
            StackView view = StackView.full(HeapArraySource.of(NdArray.zeros(3, 2)), ViewOptions.defaults());
            assertEquals(ViewState.CONSTRUCTED, view.state());
            view.items();
            assertEquals(ViewState.ITERATING, view.state());
            ChunkingException e = assertThrows(ChunkingException.class, view::items);
            assertEquals(ChunkingException.ErrorCode.INVALID_STATE, e.errorCode());
        }

        @Test
        @DisplayName("the chunk iterator serves one for-each loop")
        void iterableOnce() {
            ChunkIterator items = StackView.full(HeapArraySource.of(NdArray.zeros(3, 2)), ViewOptions.defaults()).items();
            items.iterator();
            assertThrows(ChunkingException.class, items::iterator);
        }

        @Test
        @DisplayName("an empty mask exhausts immediately")
        void emptyMask() {
            StackView view = StackView.masked(HeapArraySource.of(NdArray.zeros(3, 2)),
                BooleanMask.of(false, false, false), ViewOptions.writable());
            ChunkIterator items = view.items();
            assertFalse(items.hasNext());
            assertEquals(ViewState.EXHAUSTED, view.state());
        }

        @Test
        @DisplayName("mask errors surface at construction")
        void maskErrors() {
            HeapArraySource source = HeapArraySource.of(NdArray.zeros(3, 4, 2));
            ChunkingException e = assertThrows(ChunkingException.class,
                () -> StackView.masked(source, BooleanMask.of(true, false, true), ViewOptions.defaults()));
            assertEquals(ChunkingException.ErrorCode.MASK_MISMATCH, e.errorCode());
        }

        @Test
        @DisplayName("listeners see every chunk read and written")
        void listenerEvents() {
            List<ChunkEvent> events = new ArrayList<>();
            ViewOptions options = options(-1, 2).readOnly(false).listener(events::add).build();
            for (ChunkEntry ignored : StackView.full(HeapArraySource.of(NdArray.zeros(5, 3)), options).items()) {
                // consume
            }
            List<ChunkEvent.Type> types = events.stream().map(ChunkEvent::type).toList();
            assertEquals(List.of(
                ChunkEvent.Type.STARTED,
                ChunkEvent.Type.CHUNK_READ, ChunkEvent.Type.CHUNK_WRITTEN,
                ChunkEvent.Type.CHUNK_READ, ChunkEvent.Type.CHUNK_WRITTEN,
                ChunkEvent.Type.CHUNK_READ, ChunkEvent.Type.CHUNK_WRITTEN,
                ChunkEvent.Type.COMPLETED), types);
            ChunkEvent last = events.get(events.size() - 1);
            assertEquals(5, last.rowsVisited());
            assertEquals(1.0, last.progress());
            assertEquals(1, events.get(5).rows());
        }

        @Test
        @DisplayName("composed listeners each see every event")
        void composedListeners() {
            List<ChunkEvent> first = new ArrayList<>();
            List<ChunkEvent> second = new ArrayList<>();
            ChunkListener listener = ChunkListener.LOGGING.andThen(first::add).andThen(second::add);
            ViewOptions options = options(-1, 4).listener(listener).build();
            StackView.full(HeapArraySource.of(NdArray.zeros(0, 3)), options).items().forEachRemaining(e -> { });
            assertEquals(2, first.size());
            assertEquals(first, second);
            assertEquals(1.0, first.get(1).progress());
        }
    }
}
