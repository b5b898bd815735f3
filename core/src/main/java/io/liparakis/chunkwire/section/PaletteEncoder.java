package io.liparakis.chunkwire.section;

import io.liparakis.chunkwire.core.BlockState;
import io.liparakis.chunkwire.core.DataKind;
import io.liparakis.chunkwire.core.PalettedContainer;
import io.liparakis.chunkwire.registry.IdResolver;
import io.liparakis.chunkwire.wire.VarInts;
import io.liparakis.chunkwire.wire.WireCodec;
import io.liparakis.chunkwire.wire.WireException;

import java.io.DataOutput;
import java.io.IOException;
import java.util.List;

/**
 * Writes a paletted container: the bits-per-entry byte, the palette as registry ids and the
 * packed data array.
 * <p>
 * The {@link BitsPerEntryPolicy} picks the width and layout; the resolvers turn palette
 * names into ids. The encoder holds no per-call state and may be shared between threads.
 */
public final class PaletteEncoder {
    private final BitsPerEntryPolicy policy;
    private final IdResolver blockStateIds;
    private final IdResolver biomeIds;

    public PaletteEncoder(BitsPerEntryPolicy policy, IdResolver blockStateIds, IdResolver biomeIds) {
        this.policy = policy;
        this.blockStateIds = blockStateIds;
        this.biomeIds = biomeIds;
    }

    public void encodeBlockStates(DataOutput out, PalettedContainer<BlockState> container) throws IOException {
        List<BlockState> palette = container.palette();
        int[] ids = new int[palette.size()];
        for (int i = 0; i < ids.length; i++) {
            ids[i] = blockStateIds.resolve(palette.get(i).name());
        }
        encode(out, DataKind.BLOCK_STATES, ids, container);
    }

    public void encodeBiomes(DataOutput out, PalettedContainer<String> container) throws IOException {
        List<String> palette = container.palette();
        int[] ids = new int[palette.size()];
        for (int i = 0; i < ids.length; i++) {
            ids[i] = biomeIds.resolve(palette.get(i));
        }
        encode(out, DataKind.BIOMES, ids, container);
    }

    /**
     * Writes a container whose palette has already been resolved to {@code paletteIds}.
     */
    void encode(DataOutput out, DataKind kind, int[] paletteIds, PalettedContainer<?> container)
            throws IOException {
        PaletteFormat format = policy.format(paletteIds.length, kind);
        int bits = policy.bitsPerEntry(paletteIds.length, kind);

        if (format == PaletteFormat.SINGLE_VALUED) {
            writeSingleValued(out, kind, bits, paletteIds);
        } else if (format == PaletteFormat.DIRECT) {
            writeDirect(out, kind, bits, paletteIds, container);
        } else {
            writeIndirect(out, kind, bits, paletteIds, container);
        }
    }

    private static void writeSingleValued(DataOutput out, DataKind kind, int bits, int[] paletteIds)
            throws WireException, IOException {
        if (bits != 0 || paletteIds.length != 1) {
            throw new WireException(WireException.Kind.INVALID_ENTRY, kind + ": single-valued layout needs "
                    + "0 bits and one palette entry, got " + bits + " bits and " + paletteIds.length + " entries");
        }
        out.writeByte(0);
        VarInts.writeVarInt(out, paletteIds[0]);
        VarInts.writeVarInt(out, 0);
    }

    private static void writeIndirect(DataOutput out, DataKind kind, int bits, int[] paletteIds,
                                      PalettedContainer<?> container) throws IOException {
        checkWidth(kind, bits, paletteIds.length - 1L);

        out.writeByte(bits);
        VarInts.writeVarInt(out, paletteIds.length);
        for (int id : paletteIds) {
            VarInts.writeVarInt(out, id);
        }
        WireCodec.writeLongArray(out, BitPacker.pack(container.indices(), bits));
    }

    private static void writeDirect(DataOutput out, DataKind kind, int bits, int[] paletteIds,
                                    PalettedContainer<?> container) throws IOException {
        int[] values = new int[kind.entryCount()];
        int maxId = 0;
        for (int i = 0; i < values.length; i++) {
            values[i] = paletteIds[container.indexAt(i)];
            maxId = Math.max(maxId, values[i]);
        }
        checkWidth(kind, bits, maxId);

        out.writeByte(bits);
        WireCodec.writeLongArray(out, BitPacker.pack(values, bits));
    }

    private static void checkWidth(DataKind kind, int bits, long largest) throws WireException {
        if (bits < BitPacker.MIN_BITS || bits > BitPacker.MAX_BITS) {
            throw new WireException(WireException.Kind.INVALID_ENTRY,
                    kind + ": bits per entry " + bits + " outside " + BitPacker.MIN_BITS + ".." + BitPacker.MAX_BITS);
        }
        if (bits < Long.SIZE && largest > BitPacker.mask(bits)) {
            throw new WireException(WireException.Kind.INVALID_ENTRY,
                    kind + ": value " + largest + " does not fit in " + bits + " bits");
        }
    }
}
