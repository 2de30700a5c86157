package org.sweep.search;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Search Infrastructure Tests")
class SearchInfrastructureTest {

    @Nested
    @DisplayName("1. SweepState")
    class StateTests {

        @Test
        @DisplayName("States are equal by position and mask")
        void testEquality() {
            assertEquals(new SweepState(1, 2, 0b101), new SweepState(1, 2, 0b101));
            assertNotEquals(new SweepState(1, 0, 0), new SweepState(0, 1, 0));
            assertNotEquals(new SweepState(1, 2, 1L << 40), new SweepState(1, 2, 0));
        }

        @Test
        @DisplayName("Full collection compares the whole long mask")
        void testCollectedAll() {
            long fullMask = (1L << 63) - 1;
            assertTrue(new SweepState(0, 0, fullMask).collectedAll(fullMask));
            assertFalse(new SweepState(0, 0, fullMask >>> 1).collectedAll(fullMask));
            assertTrue(new SweepState(0, 0, 0).collectedAll(0));
        }
    }

    @Nested
    @DisplayName("2. SweepFrontier")
    class FrontierTests {

        @Test
        @DisplayName("Entries leave in insertion order")
        void testFifoOrder() {
            SweepFrontier frontier = new SweepFrontier();
            frontier.offer(new FrontierEntry(new SweepState(0, 0, 0), 5, 0, 0));
            frontier.offer(new FrontierEntry(new SweepState(0, 1, 0), 4, 1, 1));
            frontier.offer(new FrontierEntry(new SweepState(1, 0, 0), 4, 1, 2));

            assertEquals(3, frontier.size());
            assertEquals(0, frontier.poll().labelId());
            assertEquals(1, frontier.poll().labelId());
            assertEquals(2, frontier.poll().labelId());
            assertTrue(frontier.isEmpty());
        }

        @Test
        @DisplayName("Peak size tracks the high-water mark")
        void testPeakSize() {
            SweepFrontier frontier = new SweepFrontier();
            frontier.offer(new FrontierEntry(new SweepState(0, 0, 0), 1, 0, 0));
            frontier.offer(new FrontierEntry(new SweepState(0, 0, 0), 1, 0, 1));
            frontier.poll();
            frontier.poll();
            frontier.offer(new FrontierEntry(new SweepState(0, 0, 0), 1, 0, 2));
            assertEquals(2, frontier.peakSize());
        }

        @Test
        @DisplayName("Polling an empty frontier fails fast")
        void testEmptyPoll() {
            SweepFrontier frontier = new SweepFrontier();
            assertThrows(EmptyFrontierException.class, frontier::poll);
            assertThrows(IllegalArgumentException.class, () -> frontier.offer(null));
        }
    }

    @Nested
    @DisplayName("3. PathLabelStore")
    class LabelStoreTests {

        @Test
        @DisplayName("Predecessor chains rebuild paths from the root")
        void testCellPath() {
            PathLabelStore store = new PathLabelStore();
            int root = store.add(2, PathLabelStore.NO_LABEL);
            int a = store.add(5, root);
            int b = store.add(2, a);
            store.add(1, root);
            int c = store.add(1, b);

            assertEquals(5, store.size());
            assertArrayEquals(new int[]{2, 5, 2, 1}, store.cellPath(c));
            assertArrayEquals(new int[]{2}, store.cellPath(root));
            assertEquals(a, store.predecessorLabelId(b));
        }
    }
}
