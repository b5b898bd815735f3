package io.liparakis.chunkwire.section;

import io.liparakis.chunkwire.core.DataKind;

/**
 * A decoded paletted container as it appeared on the wire.
 *
 * @param kind         block states or biomes
 * @param bitsPerEntry width of each packed entry (0 for single-valued)
 * @param format       layout that was read
 * @param paletteIds   registry ids of the palette; one id for single-valued, empty for direct
 * @param words        the raw data words
 * @param values       unpacked entries: palette indices, or registry ids for direct
 */
public record PalettedPayload(
        DataKind kind,
        int bitsPerEntry,
        PaletteFormat format,
        int[] paletteIds,
        long[] words,
        int[] values) {

    /**
     * Registry id of the entry at a flat position.
     */
    public int idAt(int position) {
        if (format == PaletteFormat.SINGLE_VALUED) {
            return paletteIds[0];
        }
        if (format == PaletteFormat.DIRECT) {
            return values[position];
        }
        return paletteIds[values[position]];
    }
}
