package io.liparakis.chunkwire.section;

import io.liparakis.chunkwire.core.DataKind;
import io.liparakis.chunkwire.wire.ByteArraySource;
import io.liparakis.chunkwire.wire.ByteSource;
import io.liparakis.chunkwire.wire.VarInts;
import io.liparakis.chunkwire.wire.WireCodec;
import io.liparakis.chunkwire.wire.WireException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads section payloads written by {@link SectionSerializer}.
 * <p>
 * The reader needs the same {@link BitsPerEntryPolicy} as the writer to tell an indirect
 * container from a direct one by its width.
 */
public final class SectionPayloadReader {

    /** Palettes longer than this are rejected as corrupt. */
    static final int MAX_PALETTE_SIZE = 4096;

    private final BitsPerEntryPolicy policy;

    public SectionPayloadReader(BitsPerEntryPolicy policy) {
        this.policy = policy;
    }

    /**
     * Reads {@code sectionCount} sections from a complete payload.
     *
     * @throws WireException {@code INVALID_LENGTH} if bytes remain after the last section
     */
    public List<DecodedSection> readAll(byte[] payload, int sectionCount) throws IOException {
        ByteArraySource in = new ByteArraySource(payload);
        List<DecodedSection> sections = new ArrayList<>(sectionCount);
        for (int i = 0; i < sectionCount; i++) {
            sections.add(readSection(in));
        }
        if (in.remaining() != 0) {
            throw new WireException(WireException.Kind.INVALID_LENGTH,
                    in.remaining() + " trailing bytes after " + sectionCount + " sections");
        }
        return sections;
    }

    public DecodedSection readSection(ByteSource in) throws IOException {
        short nonAirCount = WireCodec.readShort(in);
        PalettedPayload blockStates = readContainer(in, DataKind.BLOCK_STATES);
        PalettedPayload biomes = readContainer(in, DataKind.BIOMES);
        return new DecodedSection(nonAirCount, blockStates, biomes);
    }

    public PalettedPayload readContainer(ByteSource in, DataKind kind) throws IOException {
        int bits = WireCodec.readUnsignedByte(in);
        if (bits > BitPacker.MAX_BITS) {
            throw new WireException(WireException.Kind.INVALID_ENTRY, kind + ": bits per entry " + bits);
        }
        PaletteFormat format = policy.formatForBits(bits, kind);

        int[] paletteIds;
        if (format == PaletteFormat.SINGLE_VALUED) {
            paletteIds = new int[] {VarInts.readVarInt(in)};
        } else if (format == PaletteFormat.INDIRECT) {
            int size = VarInts.readVarInt(in);
            if (size <= 0 || size > MAX_PALETTE_SIZE) {
                throw new WireException(WireException.Kind.INVALID_LENGTH, kind + ": palette size " + size);
            }
            paletteIds = new int[size];
            for (int i = 0; i < size; i++) {
                paletteIds[i] = VarInts.readVarInt(in);
            }
        } else {
            paletteIds = new int[0];
        }

        int maxWords = bits == 0 ? 0 : BitPacker.wordCount(kind.entryCount(), bits);
        long[] words = WireCodec.readLongArray(in, Math.max(maxWords, kind.entryCount()));
        if (format == PaletteFormat.SINGLE_VALUED) {
            return new PalettedPayload(kind, bits, format, paletteIds, words, new int[kind.entryCount()]);
        }
        if (words.length < maxWords) {
            throw new WireException(WireException.Kind.INVALID_LENGTH,
                    kind + ": " + words.length + " data words, expected " + maxWords);
        }

        int[] values = BitPacker.unpack(words, bits, kind.entryCount());
        if (format == PaletteFormat.INDIRECT) {
            for (int value : values) {
                if (value >= paletteIds.length) {
                    throw new WireException(WireException.Kind.INVALID_ENTRY,
                            kind + ": index " + value + " outside palette of " + paletteIds.length);
                }
            }
        }
        return new PalettedPayload(kind, bits, format, paletteIds, words, values);
    }
}
