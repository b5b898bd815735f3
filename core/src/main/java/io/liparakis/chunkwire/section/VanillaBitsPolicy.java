package io.liparakis.chunkwire.section;

import io.liparakis.chunkwire.core.DataKind;

/**
 * Palette-size driven widths with the client's indirect/direct thresholds.
 */
final class VanillaBitsPolicy implements BitsPerEntryPolicy {
    static final VanillaBitsPolicy INSTANCE = new VanillaBitsPolicy();

    static final int MIN_BLOCK_BITS = 4;
    static final int MAX_INDIRECT_BLOCK_BITS = 8;
    static final int DIRECT_BLOCK_BITS = 15;

    static final int MIN_BIOME_BITS = 1;
    static final int MAX_INDIRECT_BIOME_BITS = 3;
    static final int DIRECT_BIOME_BITS = 6;

    private VanillaBitsPolicy() {
    }

    @Override
    public int bitsPerEntry(int paletteSize, DataKind kind) {
        PaletteFormat format = format(paletteSize, kind);
        if (format == PaletteFormat.SINGLE_VALUED) {
            return 0;
        }
        if (format == PaletteFormat.DIRECT) {
            return kind == DataKind.BLOCK_STATES ? DIRECT_BLOCK_BITS : DIRECT_BIOME_BITS;
        }
        int min = kind == DataKind.BLOCK_STATES ? MIN_BLOCK_BITS : MIN_BIOME_BITS;
        return Math.max(min, BitsPerEntryPolicy.ceilLog2(paletteSize));
    }

    @Override
    public PaletteFormat format(int paletteSize, DataKind kind) {
        if (paletteSize <= 1) {
            return PaletteFormat.SINGLE_VALUED;
        }
        return BitsPerEntryPolicy.ceilLog2(paletteSize) > maxIndirect(kind)
                ? PaletteFormat.DIRECT
                : PaletteFormat.INDIRECT;
    }

    @Override
    public PaletteFormat formatForBits(int bitsPerEntry, DataKind kind) {
        if (bitsPerEntry == 0) {
            return PaletteFormat.SINGLE_VALUED;
        }
        return bitsPerEntry > maxIndirect(kind) ? PaletteFormat.DIRECT : PaletteFormat.INDIRECT;
    }

    private static int maxIndirect(DataKind kind) {
        return kind == DataKind.BLOCK_STATES ? MAX_INDIRECT_BLOCK_BITS : MAX_INDIRECT_BIOME_BITS;
    }
}
