package com.acme.finops.slots.window;

import com.acme.finops.slots.util.SlotPoolConfig;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.PrimitiveIterator;
import java.util.Random;
import java.util.stream.LongStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SequenceWindowTest {

    @Test
    void shouldAcceptEveryIndexOfASequentialFill() {
        SequenceWindow window = new SequenceWindow(2);
        for (long i = 0; i < 128; i++) {
            assertTrue(window.insert(i), "index " + i);
        }
        assertEquals(0L, window.firstIndex());
    }

    @Test
    void shouldFillLargeWindowWithoutSliding() {
        SequenceWindow window = new SequenceWindow(10);
        for (long i = 0; i < 10 * 64; i++) {
            assertTrue(window.insert(i));
        }
        assertEquals(0L, window.firstIndex());
    }

    @Test
    void shouldSlideForwardOnSequentialOverflow() {
        SequenceWindow window = new SequenceWindow(3);
        for (long i = 0; i < 10 * 64; i++) {
            assertTrue(window.insert(i), "index " + i);
        }
        assertTrue(window.firstIndex() > 0);
        assertFalse(window.insert(10 * 64 - 1));
    }

    @Test
    void shouldSlideForEvenWordCounts() {
        for (int words : new int[]{1, 2, 4}) {
            SequenceWindow window = new SequenceWindow(words);
            for (long i = 0; i < 20 * 64; i += 7) {
                assertTrue(window.insert(i), words + " words, index " + i);
                assertFalse(window.insert(i), words + " words, repeat " + i);
            }
        }
    }

    @Test
    void shouldRejectRepeatsWhileSkipping() {
        SequenceWindow window = new SequenceWindow(5);
        for (long i = 0; i < 100 * 64; i += 100) {
            assertTrue(window.insert(i));
            assertFalse(window.insert(i));
        }
    }

    @Test
    void shouldRememberNeighboursAcrossBigSkips() {
        SequenceWindow window = new SequenceWindow(5);
        for (long i = 0; i < 1000 * 64; i += 1000) {
            assertTrue(window.insert(i), "" + i);
            assertFalse(window.insert(i), "" + i);
            assertTrue(window.insert(i + 1), "" + i);
            assertFalse(window.insert(i + 1), "" + i);
            assertTrue(window.insert(i + 128), "" + i);
            assertFalse(window.insert(i + 128), "" + i);
            // the slide for i + 128 keeps i and i + 1 inside the window
            assertFalse(window.insert(i), window + " " + i);
            assertFalse(window.insert(i + 1), "" + i);
        }
    }

    @Test
    void shouldAgreeWithCanInsertOnSortedRandomStream() {
        SequenceWindow window = new SequenceWindow(5);
        long[] nums = new Random(42).longs(100_000, 0, 1_000_000).sorted().distinct().toArray();

        for (int from = 0; from < nums.length; from += 5000) {
            int to = Math.min(nums.length, from + 5000);
            for (int i = from; i < to; i++) {
                long n = nums[i];
                assertTrue(window.canInsert(n), () -> window + " " + n);
                assertTrue(window.insert(n), () -> window + " " + n);
                assertFalse(window.canInsert(n), () -> window + " " + n);
                assertFalse(window.insert(n), () -> window + " " + n);
            }
            for (int i = from; i < to; i++) {
                assertFalse(window.canInsert(nums[i]));
                assertFalse(window.insert(nums[i]));
            }
        }
        for (long n : nums) {
            assertFalse(window.canInsert(n));
            assertFalse(window.insert(n));
        }
    }

    @Test
    void shouldRejectIndicesBelowTheWindow() {
        SequenceWindow window = new SequenceWindow(1);
        assertTrue(window.insert(1000));
        assertTrue(window.firstIndex() > 5);
        // never seen, but already slid past
        assertFalse(window.canInsert(5));
        assertFalse(window.insert(5));
        assertTrue(window.canInsert(window.firstIndex() + 64 * 100));
    }

    @Test
    void shouldIterateRecordedIndicesInOrder() {
        SequenceWindow window = new SequenceWindow(3);
        long[] inserted = {3, 64, 65, 130, 191};
        for (long n : inserted) {
            window.insert(n);
        }

        List<Long> seen = new ArrayList<>();
        window.forEach(seen::add);
        assertEquals(LongStream.of(inserted).boxed().toList(), seen);

        PrimitiveIterator.OfLong it = window.iterator();
        while (it.hasNext()) {
            it.nextLong();
        }
        assertThrows(NoSuchElementException.class, it::nextLong);
        assertEquals("SequenceWindow{seen=[3, 64, 65, 130, 191], firstIndex=0}", window.toString());
    }

    @Test
    void shouldTreatIndicesAsUnsigned() {
        SequenceWindow window = new SequenceWindow(2);
        long high = -10L; // 2^64 - 10
        assertTrue(window.insert(high));
        assertFalse(window.insert(high));
        assertFalse(window.canInsert(5L));
    }

    @Test
    void shouldRejectNonPositiveWordCount() {
        assertThrows(IllegalArgumentException.class, () -> new SequenceWindow(0));
    }

    @Test
    void shouldSizeFromConfig() {
        SequenceWindow window = SequenceWindow.fromConfig(SlotPoolConfig.fromEnv(Map.of("SLOTS_WINDOW_WORDS", "4")));
        assertEquals(256, window.span());
        assertEquals(SequenceWindow.DEFAULT_WORDS * 64, new SequenceWindow().span());
    }
}
