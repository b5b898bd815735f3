package io.liparakis.chunkwire.section;

import io.liparakis.chunkwire.core.DataKind;

/**
 * Chooses the width of every packed entry in a container from its palette size.
 * <p>
 * The packer and the emitted bits-per-entry byte both come from this single decision, so
 * they always agree. A policy may also switch the container to a different
 * {@link PaletteFormat}; the simple policies always use {@link PaletteFormat#INDIRECT}.
 */
@FunctionalInterface
public interface BitsPerEntryPolicy {

    /**
     * Width in bits of each packed entry for a palette of {@code paletteSize} entries.
     */
    int bitsPerEntry(int paletteSize, DataKind kind);

    /**
     * Layout used for a palette of {@code paletteSize} entries.
     */
    default PaletteFormat format(int paletteSize, DataKind kind) {
        return PaletteFormat.INDIRECT;
    }

    /**
     * Layout a reader should expect after reading {@code bitsPerEntry} from the wire.
     */
    default PaletteFormat formatForBits(int bitsPerEntry, DataKind kind) {
        return bitsPerEntry == 0 ? PaletteFormat.SINGLE_VALUED : PaletteFormat.INDIRECT;
    }

    /**
     * The same width for every container, whatever its palette size.
     */
    static BitsPerEntryPolicy fixed(int bits) {
        BitPacker.checkBits(bits);
        return (paletteSize, kind) -> bits;
    }

    /**
     * {@code max(minimum, ceil(log2(paletteSize)))}.
     */
    static BitsPerEntryPolicy log2(int minimum) {
        BitPacker.checkBits(minimum);
        return (paletteSize, kind) -> Math.max(minimum, ceilLog2(paletteSize));
    }

    /**
     * The thresholds the game client uses: single-valued palettes take no bits, block states
     * use 4..8 bits with a palette and 15 bits direct above that, biomes use 1..3 bits with a
     * palette and 6 bits direct above that.
     */
    static BitsPerEntryPolicy vanilla() {
        return VanillaBitsPolicy.INSTANCE;
    }

    /**
     * Delegates to one policy for block states and another for biomes.
     */
    static BitsPerEntryPolicy perKind(BitsPerEntryPolicy blockStates, BitsPerEntryPolicy biomes) {
        return new BitsPerEntryPolicy() {
            @Override
            public int bitsPerEntry(int paletteSize, DataKind kind) {
                return pick(kind).bitsPerEntry(paletteSize, kind);
            }

            @Override
            public PaletteFormat format(int paletteSize, DataKind kind) {
                return pick(kind).format(paletteSize, kind);
            }

            @Override
            public PaletteFormat formatForBits(int bitsPerEntry, DataKind kind) {
                return pick(kind).formatForBits(bitsPerEntry, kind);
            }

            private BitsPerEntryPolicy pick(DataKind kind) {
                return kind == DataKind.BLOCK_STATES ? blockStates : biomes;
            }
        };
    }

    /**
     * Smallest {@code b} with {@code 2^b >= n}; 0 for {@code n <= 1}.
     */
    static int ceilLog2(int n) {
        return n <= 1 ? 0 : 32 - Integer.numberOfLeadingZeros(n - 1);
    }
}
