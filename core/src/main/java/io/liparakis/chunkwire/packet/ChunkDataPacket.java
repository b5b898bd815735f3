package io.liparakis.chunkwire.packet;

import io.liparakis.chunkwire.light.LightData;

import java.util.List;

/**
 * The outgoing "chunk data and update light" packet, field for field in wire order.
 *
 * @param packetId      always {@link #PACKET_ID}
 * @param chunkX        chunk x coordinate
 * @param chunkZ        chunk z coordinate
 * @param heightmaps    heightmap tag
 * @param data          concatenated section payloads
 * @param blockEntities block entities in the column
 * @param light         light masks and arrays
 * @param <N>           The NBT type
 */
public record ChunkDataPacket<N>(
        int packetId,
        int chunkX,
        int chunkZ,
        N heightmaps,
        byte[] data,
        List<BlockEntity<N>> blockEntities,
        LightData light) {

    public static final int PACKET_ID = 0x24;

    public ChunkDataPacket {
        data = data.clone();
        blockEntities = List.copyOf(blockEntities);
    }

    /** A copy of the section payload. */
    @Override
    public byte[] data() {
        return data.clone();
    }
}
