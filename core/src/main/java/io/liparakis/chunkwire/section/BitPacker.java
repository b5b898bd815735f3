package io.liparakis.chunkwire.section;

/**
 * Packs fixed-width unsigned entries into 64-bit words and back.
 * <p>
 * Entries are placed low bits first. An entry never straddles two words: when the next entry
 * does not fit in what is left of the current word, the rest of that word stays zero and the
 * entry starts the next one. For {@code n} entries of {@code b} bits this gives
 * {@code ceil(n / floor(64 / b))} words.
 */
public final class BitPacker {

    public static final int MIN_BITS = 1;
    public static final int MAX_BITS = 64;

    private BitPacker() {
    }

    /**
     * Entries held by one word at the given width.
     */
    public static int entriesPerWord(int bitsPerEntry) {
        checkBits(bitsPerEntry);
        return Long.SIZE / bitsPerEntry;
    }

    /**
     * Words needed for {@code entryCount} entries at the given width.
     */
    public static int wordCount(int entryCount, int bitsPerEntry) {
        int perWord = entriesPerWord(bitsPerEntry);
        return (entryCount + perWord - 1) / perWord;
    }

    /**
     * Packs {@code values}, each masked to {@code bitsPerEntry} bits.
     */
    public static long[] pack(int[] values, int bitsPerEntry) {
        long mask = mask(bitsPerEntry);
        int perWord = entriesPerWord(bitsPerEntry);
        long[] words = new long[wordCount(values.length, bitsPerEntry)];

        long current = 0;
        int inCurrent = 0;
        int wordIndex = 0;
        for (int value : values) {
            current |= (value & mask) << (bitsPerEntry * inCurrent);
            inCurrent++;

            if (inCurrent == perWord) {
                words[wordIndex++] = current;
                current = 0;
                inCurrent = 0;
            }
        }

        if (inCurrent > 0) {
            words[wordIndex] = current;
        }
        return words;
    }

    /**
     * Packs 64-bit {@code values}, each masked to {@code bitsPerEntry} bits.
     */
    public static long[] pack(long[] values, int bitsPerEntry) {
        long mask = mask(bitsPerEntry);
        int perWord = entriesPerWord(bitsPerEntry);
        long[] words = new long[wordCount(values.length, bitsPerEntry)];

        long current = 0;
        int inCurrent = 0;
        int wordIndex = 0;
        for (long value : values) {
            current |= (value & mask) << (bitsPerEntry * inCurrent);
            inCurrent++;

            if (inCurrent == perWord) {
                words[wordIndex++] = current;
                current = 0;
                inCurrent = 0;
            }
        }

        if (inCurrent > 0) {
            words[wordIndex] = current;
        }
        return words;
    }

    /**
     * Unpacks {@code entryCount} entries as ints. Widths above 31 bits must hold values that
     * fit an int.
     *
     * @throws IllegalArgumentException if {@code words} is too short for {@code entryCount}
     */
    public static int[] unpack(long[] words, int bitsPerEntry, int entryCount) {
        long mask = mask(bitsPerEntry);
        int perWord = checkLength(words, bitsPerEntry, entryCount);
        int[] values = new int[entryCount];
        for (int i = 0; i < entryCount; i++) {
            long word = words[i / perWord];
            values[i] = (int) ((word >>> (bitsPerEntry * (i % perWord))) & mask);
        }
        return values;
    }

    /**
     * Unpacks {@code entryCount} entries as longs.
     *
     * @throws IllegalArgumentException if {@code words} is too short for {@code entryCount}
     */
    public static long[] unpackLongs(long[] words, int bitsPerEntry, int entryCount) {
        long mask = mask(bitsPerEntry);
        int perWord = checkLength(words, bitsPerEntry, entryCount);
        long[] values = new long[entryCount];
        for (int i = 0; i < entryCount; i++) {
            long word = words[i / perWord];
            values[i] = (word >>> (bitsPerEntry * (i % perWord))) & mask;
        }
        return values;
    }

    /**
     * Largest value an entry of the given width can hold, as an unsigned mask.
     */
    public static long mask(int bitsPerEntry) {
        checkBits(bitsPerEntry);
        return bitsPerEntry == MAX_BITS ? -1L : (1L << bitsPerEntry) - 1;
    }

    static void checkBits(int bitsPerEntry) {
        if (bitsPerEntry < MIN_BITS || bitsPerEntry > MAX_BITS) {
            throw new IllegalArgumentException(
                    "Bits per entry must be in " + MIN_BITS + ".." + MAX_BITS + ", got " + bitsPerEntry);
        }
    }

    private static int checkLength(long[] words, int bitsPerEntry, int entryCount) {
        int perWord = entriesPerWord(bitsPerEntry);
        int needed = wordCount(entryCount, bitsPerEntry);
        if (words.length < needed) {
            throw new IllegalArgumentException(
                    entryCount + " entries of " + bitsPerEntry + " bits need " + needed + " words, got " + words.length);
        }
        return perWord;
    }
}
