package io.surfworks.spectrastack.core.index;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import io.surfworks.spectrastack.core.ChunkingException;

@DisplayName("Masks")
class MaskTest {

    @Nested
    @DisplayName("BooleanMask")
    class BooleanMaskTests {

        @Test
        @DisplayName("nonzero lists coordinates in row-major order")
        void nonzeroRowMajor() {
            BooleanMask mask = BooleanMask.of(new boolean[][]{
                {false, true, false},
                {true, false, true}
            });
            int[][] coords = mask.nonzero();
            assertArrayEquals(new int[]{0, 1, 1}, coords[0]);
            assertArrayEquals(new int[]{1, 0, 2}, coords[1]);
            assertEquals(3, mask.count());
            assertEquals(2, mask.ndim());
        }

        @Test
        @DisplayName("complement inverts every element")
        void complement() {
            BooleanMask mask = BooleanMask.of(true, false, false, true);
            BooleanMask complement = mask.complement(new int[]{4});
            assertArrayEquals(new int[]{1, 2}, complement.nonzero()[0]);
        }

        @Test
        @DisplayName("complement over a different shape is a mask mismatch")
        void complementShapeMismatch() {
            BooleanMask mask = BooleanMask.of(true, false);
            ChunkingException e = assertThrows(ChunkingException.class, () -> mask.complement(new int[]{3}));
            assertEquals(ChunkingException.ErrorCode.MASK_MISMATCH, e.errorCode());
        }

        @Test
        @DisplayName("value count must match shape")
        void valueCountMismatch() {
            assertThrows(IllegalArgumentException.class,
                () -> new BooleanMask(new boolean[3], new int[]{2, 2}));
        }

        @Test
        void equalityByContent() {
            assertEquals(BooleanMask.of(true, false), BooleanMask.of(true, false));
            assertFalse(BooleanMask.of(true, false).equals(BooleanMask.of(false, true)));
        }
    }

    @Nested
    @DisplayName("IndexMask")
    class IndexMaskTests {

        @Test
        @DisplayName("nonzero keeps the given order")
        void nonzeroKeepsOrder() {
            IndexMask mask = IndexMask.of(new int[]{3, 0, 2}, new int[]{1, 1, 0});
            int[][] coords = mask.nonzero();
            assertArrayEquals(new int[]{3, 0, 2}, coords[0]);
            assertArrayEquals(new int[]{1, 1, 0}, coords[1]);
            assertEquals(3, mask.count());
        }

        @Test
        @DisplayName("lists of different lengths are inconsistent")
        void inconsistentLengths() {
            IndexMask mask = IndexMask.of(new int[]{0, 1}, new int[]{0});
            ChunkingException e = assertThrows(ChunkingException.class, mask::validate);
            assertEquals(ChunkingException.ErrorCode.INCONSISTENT_MASK, e.errorCode());
        }

        @Test
        @DisplayName("complement marks every unlisted coordinate")
        void complement() {
            IndexMask mask = IndexMask.of(new int[]{0, 1}, new int[]{1, -1});
            BooleanMask complement = mask.complement(new int[]{2, 3});
            boolean[] expected = {true, false, true, true, true, false};
            assertArrayEquals(expected, complement.values());
        }

        @Test
        @DisplayName("lists are copied on construction")
        void defensiveCopy() {
            int[] rows = {1, 2};
            IndexMask mask = IndexMask.of(rows);
            rows[0] = 9;
            assertTrue(mask.nonzero()[0][0] == 1);
        }
    }
}
