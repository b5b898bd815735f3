package io.liparakis.chunkwire.section;

import io.liparakis.chunkwire.core.BlockState;
import io.liparakis.chunkwire.core.ChunkConstants;
import io.liparakis.chunkwire.core.PalettedContainer;
import io.liparakis.chunkwire.core.Section;
import io.liparakis.chunkwire.wire.WireException;

import java.io.ByteArrayOutputStream;
import java.io.DataOutput;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.List;

/**
 * Serializes sections into the chunk data payload: for each section, the non-air block
 * count, the block-state container and the biome container.
 */
public final class SectionSerializer {

    /**
     * Non-air count sent for every section. The client recomputes it, so it is not derived
     * from the block data.
     */
    public static final short NON_AIR_COUNT = (short) ChunkConstants.SECTION_VOLUME;

    private static final int INITIAL_PAYLOAD_CAPACITY = 16384;

    private final PaletteEncoder encoder;

    public SectionSerializer(PaletteEncoder encoder) {
        this.encoder = encoder;
    }

    /**
     * Serializes all sections in order into one payload.
     *
     * @throws WireException {@code MISSING_SECTION_DATA} if any section lacks block states
     *                       or biomes; nothing is returned in that case
     */
    public byte[] serialize(List<Section> sections) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(INITIAL_PAYLOAD_CAPACITY);
        DataOutputStream out = new DataOutputStream(buffer);
        for (Section section : sections) {
            writeSection(out, section);
        }
        out.flush();
        return buffer.toByteArray();
    }

    /**
     * Writes one section.
     */
    public void writeSection(DataOutput out, Section section) throws IOException {
        PalettedContainer<BlockState> blockStates = section.blockStates();
        if (blockStates == null) {
            throw new WireException(WireException.Kind.MISSING_SECTION_DATA,
                    "Section " + section.y() + " has no block states");
        }
        PalettedContainer<String> biomes = section.biomes();
        if (biomes == null) {
            throw new WireException(WireException.Kind.MISSING_SECTION_DATA,
                    "Section " + section.y() + " has no biomes");
        }

        out.writeShort(NON_AIR_COUNT);
        encoder.encodeBlockStates(out, blockStates);
        encoder.encodeBiomes(out, biomes);
    }
}
