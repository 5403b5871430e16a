package com.acme.finops.slots.window;

import com.acme.finops.slots.util.SlotPoolConfig;

import java.util.Arrays;
import java.util.NoSuchElementException;
import java.util.PrimitiveIterator;
import java.util.StringJoiner;

/**
 * Fixed-size bitmap of recently seen indices, for dropping duplicates from a
 * best-effort stream whose indices mostly increase.
 *
 * <p>The window tracks {@code words * 64} consecutive indices starting at
 * {@link #firstIndex()}. Inserting an index past the end slides the window forward
 * so the new index lands in its upper half; bits that fall off the bottom are
 * forgotten, and indices below the window are rejected as if already seen.
 *
 * <p>Indices are unsigned 64-bit values. Not thread-safe.
 */
public final class SequenceWindow implements Iterable<Long> {
    public static final int DEFAULT_WORDS = 3;

    private final long[] map;
    private final int words;
    /** Word position a sliding insert lands on. */
    private final int slideTarget;
    private long firstIndex;

    public SequenceWindow() {
        this(DEFAULT_WORDS);
    }

    public SequenceWindow(int words) {
        if (words <= 0) {
            throw new IllegalArgumentException("words must be positive, got " + words);
        }
        this.words = words;
        this.map = new long[words];
        this.slideTarget = Math.min(words - words / 2, words - 1);
    }

    public static SequenceWindow fromConfig(SlotPoolConfig config) {
        return new SequenceWindow(config.windowWords());
    }

    /** Number of indices tracked at once. */
    public int span() {
        return words * Long.SIZE;
    }

    public long firstIndex() {
        return firstIndex;
    }

    /**
     * Whether {@link #insert} would accept {@code index} right now. Indices beyond
     * the window are accepted.
     */
    public boolean canInsert(long index) {
        if (Long.compareUnsigned(index, firstIndex) < 0) {
            return false;
        }
        long offset = index - firstIndex;
        long wordIdx = offset >>> 6;
        if (Long.compareUnsigned(wordIdx, words) >= 0) {
            return true;
        }
        return (map[(int) wordIdx] & (1L << offset)) == 0;
    }

    /**
     * Records {@code index}.
     *
     * @return {@code true} if the index was new; {@code false} if it was seen before
     *         or lies below the window, even when that lower index never arrived
     */
    public boolean insert(long index) {
        if (Long.compareUnsigned(index, firstIndex) < 0) {
            return false;
        }
        long offset = index - firstIndex;
        long wordIdx = offset >>> 6;
        if (Long.compareUnsigned(wordIdx, words) >= 0) {
            long shift = wordIdx - slideTarget;
            slide(shift);
            wordIdx = slideTarget;
        }

        int w = (int) wordIdx;
        long mask = 1L << offset;
        boolean fresh = (map[w] & mask) == 0;
        map[w] |= mask;
        return fresh;
    }

    private void slide(long shiftWords) {
        if (Long.compareUnsigned(shiftWords, words) >= 0) {
            Arrays.fill(map, 0L);
        } else {
            int s = (int) shiftWords;
            System.arraycopy(map, s, map, 0, words - s);
            Arrays.fill(map, words - s, words, 0L);
        }
        firstIndex += shiftWords * Long.SIZE;
    }

    /** Recorded indices still inside the window, ascending. */
    @Override
    public PrimitiveIterator.OfLong iterator() {
        return new PrimitiveIterator.OfLong() {
            private int bit = nextSetBit(0);

            @Override
            public boolean hasNext() {
                return bit >= 0;
            }

            @Override
            public long nextLong() {
                if (bit < 0) {
                    throw new NoSuchElementException();
                }
                long index = firstIndex + bit;
                bit = nextSetBit(bit + 1);
                return index;
            }
        };
    }

    private int nextSetBit(int from) {
        int span = span();
        if (from >= span) {
            return -1;
        }
        int w = from >>> 6;
        long word = map[w] & (-1L << from);
        while (true) {
            if (word != 0) {
                return (w << 6) + Long.numberOfTrailingZeros(word);
            }
            if (++w == words) {
                return -1;
            }
            word = map[w];
        }
    }

    @Override
    public String toString() {
        StringJoiner seen = new StringJoiner(", ", "[", "]");
        PrimitiveIterator.OfLong it = iterator();
        while (it.hasNext()) {
            seen.add(Long.toUnsignedString(it.nextLong()));
        }
        return "SequenceWindow{seen=" + seen + ", firstIndex=" + Long.toUnsignedString(firstIndex) + '}';
    }
}
