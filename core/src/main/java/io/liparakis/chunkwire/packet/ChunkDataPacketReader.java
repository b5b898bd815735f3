package io.liparakis.chunkwire.packet;

import io.liparakis.chunkwire.core.ChunkConstants;
import io.liparakis.chunkwire.light.LightData;
import io.liparakis.chunkwire.spi.NbtAdapter;
import io.liparakis.chunkwire.wire.ByteSource;
import io.liparakis.chunkwire.wire.VarInts;
import io.liparakis.chunkwire.wire.WireCodec;
import io.liparakis.chunkwire.wire.WireException;

import java.io.DataInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/**
 * Reads chunk data packets written by {@link ChunkDataPacketAssembler}, the way a client does.
 *
 * @param <N> The NBT type
 */
public final class ChunkDataPacketReader<N> {

    /** Upper bound on the section payload; larger values are treated as corrupt. */
    static final int MAX_DATA_BYTES = 2 * 1024 * 1024;

    /** Upper bound on block entities in one column. */
    static final int MAX_BLOCK_ENTITIES = 65536;

    /** Words a light mask may use. */
    static final int MAX_MASK_WORDS = 16;

    private final NbtAdapter<N> nbtAdapter;

    public ChunkDataPacketReader(NbtAdapter<N> nbtAdapter) {
        this.nbtAdapter = nbtAdapter;
    }

    /**
     * Reads one packet, starting at its packet id.
     *
     * @throws WireException {@code INVALID_ENTRY} if the packet id is not a chunk data packet
     */
    public ChunkDataPacket<N> read(ByteSource in) throws IOException {
        int packetId = VarInts.readVarInt(in);
        if (packetId != ChunkDataPacket.PACKET_ID) {
            throw new WireException(WireException.Kind.INVALID_ENTRY,
                    String.format("Unexpected packet id 0x%02X (expected: 0x%02X)", packetId, ChunkDataPacket.PACKET_ID));
        }
        int chunkX = WireCodec.readInt(in);
        int chunkZ = WireCodec.readInt(in);

        DataInputStream tagInput = new DataInputStream(in.asInputStream());
        N heightmaps = nbtAdapter.read(tagInput);
        byte[] data = WireCodec.readByteArray(in, MAX_DATA_BYTES);

        int blockEntityCount = readCount(in, MAX_BLOCK_ENTITIES, "block entity");
        List<BlockEntity<N>> blockEntities = new ArrayList<>(blockEntityCount);
        for (int i = 0; i < blockEntityCount; i++) {
            byte packedXz = WireCodec.readByte(in);
            short y = WireCodec.readShort(in);
            int typeId = VarInts.readVarInt(in);
            N tag = nbtAdapter.read(tagInput);
            blockEntities.add(new BlockEntity<>(packedXz, y, typeId, tag));
        }

        BitSet skyMask = WireCodec.readBitSet(in, MAX_MASK_WORDS);
        BitSet blockMask = WireCodec.readBitSet(in, MAX_MASK_WORDS);
        BitSet emptySkyMask = WireCodec.readBitSet(in, MAX_MASK_WORDS);
        BitSet emptyBlockMask = WireCodec.readBitSet(in, MAX_MASK_WORDS);
        List<byte[]> skyArrays = readLightArrays(in);
        List<byte[]> blockArrays = readLightArrays(in);

        LightData light;
        try {
            light = new LightData(skyMask, blockMask, emptySkyMask, emptyBlockMask, skyArrays, blockArrays);
        } catch (IllegalArgumentException e) {
            throw new WireException(WireException.Kind.INVALID_ENTRY, e.getMessage(), e);
        }
        return new ChunkDataPacket<>(packetId, chunkX, chunkZ, heightmaps, data, blockEntities, light);
    }

    private static List<byte[]> readLightArrays(ByteSource in) throws IOException {
        int count = readCount(in, MAX_MASK_WORDS * Long.SIZE, "light array");
        List<byte[]> arrays = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            byte[] array = WireCodec.readByteArray(in, ChunkConstants.LIGHT_ARRAY_BYTES);
            if (array.length != ChunkConstants.LIGHT_ARRAY_BYTES) {
                throw new WireException(WireException.Kind.INVALID_LENGTH,
                        "Light array of " + array.length + " bytes, expected " + ChunkConstants.LIGHT_ARRAY_BYTES);
            }
            arrays.add(array);
        }
        return arrays;
    }

    private static int readCount(ByteSource in, int max, String what) throws IOException {
        int count = VarInts.readVarInt(in);
        if (count < 0 || count > max) {
            throw new WireException(WireException.Kind.INVALID_LENGTH,
                    "Invalid " + what + " count: " + count);
        }
        return count;
    }
}
