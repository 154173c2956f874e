package io.surfworks.spectrastack.core.plan;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Iterator;
import java.util.NoSuchElementException;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import io.surfworks.spectrastack.core.index.IndexMask;
import io.surfworks.spectrastack.core.index.Slice;

@DisplayName("ChunkEnumerator")
class ChunkEnumeratorTest {

    @Test
    @Timeout(5)
    @DisplayName("enumeration is lazy even for astronomically many chunks")
    void lazyProduct() {
        AxisLayout layout = AxisLayout.resolve(new int[]{50_000, 50_000, 4}, 2, null, null, AxisLayout.Order.C);
        DensePlan plan = ChunkPlanner.planDense(layout, 1);
        assertEquals(2_500_000_000L, plan.chunkCount());

        Iterator<ChunkDescriptor> chunks = ChunkEnumerator.enumerate(plan);
        ChunkDescriptor first = chunks.next();
        ChunkDescriptor second = chunks.next();
        assertEquals(Slice.of(0, 1), first.index()[1]);
        assertEquals(Slice.of(1, 2), second.index()[1]);
        assertEquals(Slice.of(0, 1), second.index()[0]);
        assertEquals(1, second.count());
    }

    @Test
    @DisplayName("channel slice is carried into every chunk")
    void channelSlice() {
        AxisLayout layout = AxisLayout.resolve(new int[]{6, 10}, 1, Slice.of(2, 8, 3), null, AxisLayout.Order.C);
        ChunkEnumerator.stream(ChunkPlanner.planDense(layout, 4)).forEach(chunk -> {
            assertEquals(Slice.of(2, 8, 3), chunk.index()[1]);
            assertEquals(2, chunk.shape()[1]);
        });
    }

    @Test
    @DisplayName("stream and iterator yield the same sequence")
    void streamMatchesIterator() {
        AxisLayout layout = AxisLayout.resolve(new int[]{5, 3, 2}, 0, null, null, AxisLayout.Order.C);
        DensePlan plan = ChunkPlanner.planDense(layout, 2);
        Iterator<ChunkDescriptor> it = ChunkEnumerator.enumerate(plan);
        ChunkEnumerator.stream(plan).forEach(chunk -> assertEquals(chunk, it.next()));
        assertFalse(it.hasNext());
    }

    @Test
    @DisplayName("masked enumeration stops after the last batch")
    void maskedExhaustion() {
        AxisLayout layout = AxisLayout.resolve(new int[]{10, 4}, 1, null, null, AxisLayout.Order.F);
        MaskedPlan plan = ChunkPlanner.planMasked(layout, IndexMask.of(new int[]{1, 4, 7, 9, 0}), 2);
        Iterator<ChunkDescriptor> it = ChunkEnumerator.enumerate(plan);
        int batches = 0;
        while (it.hasNext()) {
            it.next();
            batches++;
        }
        assertEquals(3, batches);
        assertEquals(3, plan.chunkCount());
        assertThrows(NoSuchElementException.class, it::next);
    }

    @Test
    @DisplayName("descriptors do not expose their internal arrays")
    void descriptorsAreImmutable() {
        AxisLayout layout = AxisLayout.resolve(new int[]{3, 4}, 1, null, null, AxisLayout.Order.C);
        ChunkDescriptor chunk = ChunkEnumerator.enumerate(ChunkPlanner.planDense(layout, 3)).next();
        chunk.shape()[0] = 99;
        chunk.index()[0] = null;
        assertArrayEquals(new int[]{3, 4}, chunk.shape());
        assertTrue(chunk.index()[0] != null);
    }
}
