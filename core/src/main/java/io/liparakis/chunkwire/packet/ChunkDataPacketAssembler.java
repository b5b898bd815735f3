package io.liparakis.chunkwire.packet;

import io.liparakis.chunkwire.ChunkWire;
import io.liparakis.chunkwire.config.ChunkWireConfig;
import io.liparakis.chunkwire.core.Chunk;
import io.liparakis.chunkwire.core.ChunkPos;
import io.liparakis.chunkwire.light.LightBuilder;
import io.liparakis.chunkwire.light.LightData;
import io.liparakis.chunkwire.light.LightMode;
import io.liparakis.chunkwire.registry.IdResolver;
import io.liparakis.chunkwire.registry.Registries;
import io.liparakis.chunkwire.section.PaletteEncoder;
import io.liparakis.chunkwire.section.SectionSerializer;
import io.liparakis.chunkwire.spi.ChunkSource;
import io.liparakis.chunkwire.spi.HeightmapTagFactory;
import io.liparakis.chunkwire.spi.NbtAdapter;
import io.liparakis.chunkwire.wire.VarInts;
import io.liparakis.chunkwire.wire.WireCodec;

import java.io.ByteArrayOutputStream;
import java.io.DataOutput;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Builds and writes chunk data packets.
 * <p>
 * Each call loads a chunk, serializes its sections, builds its light and composes the packet.
 * A failure in any step aborts the whole packet; callers' outputs are only written once the
 * packet is complete. The assembler keeps no per-packet state, so concurrent builds are safe
 * as long as each writes to its own output.
 *
 * @param <N> The NBT type
 */
public final class ChunkDataPacketAssembler<N> {
    private static final int INITIAL_PACKET_CAPACITY = 32768;

    private final ChunkSource chunkSource;
    private final SectionSerializer sectionSerializer;
    private final LightMode lightMode;
    private final HeightmapTagFactory<N> heightmapTags;
    private final NbtAdapter<N> nbtAdapter;

    public ChunkDataPacketAssembler(
            ChunkSource chunkSource,
            SectionSerializer sectionSerializer,
            LightMode lightMode,
            HeightmapTagFactory<N> heightmapTags,
            NbtAdapter<N> nbtAdapter) {
        this.chunkSource = chunkSource;
        this.sectionSerializer = sectionSerializer;
        this.lightMode = lightMode;
        this.heightmapTags = heightmapTags;
        this.nbtAdapter = nbtAdapter;
    }

    /**
     * Wires an assembler from the config and registries.
     */
    public static <N> ChunkDataPacketAssembler<N> create(
            ChunkWireConfig config,
            Registries registries,
            ChunkSource chunkSource,
            HeightmapTagFactory<N> heightmapTags,
            NbtAdapter<N> nbtAdapter) {
        PaletteEncoder encoder = new PaletteEncoder(
                config.bitsPolicy(),
                new IdResolver("block state", registries.blockStates(), config.registryLookupPolicy()),
                new IdResolver("biome", registries.biomes(), config.registryLookupPolicy()));
        return new ChunkDataPacketAssembler<>(
                chunkSource, new SectionSerializer(encoder), config.lightMode, heightmapTags, nbtAdapter);
    }

    /**
     * Loads the chunk at {@code pos} and composes its packet.
     *
     * @throws io.liparakis.chunkwire.wire.WireException {@code MISSING_SECTION_DATA} if a
     *         section lacks block states or biomes
     */
    public ChunkDataPacket<N> assemble(ChunkPos pos) throws IOException {
        Chunk chunk = chunkSource.load(pos);
        byte[] data = sectionSerializer.serialize(chunk.sections());
        LightData light = LightBuilder.build(chunk.sections(), lightMode);

        ChunkDataPacket<N> packet = new ChunkDataPacket<>(
                ChunkDataPacket.PACKET_ID,
                pos.x(),
                pos.z(),
                heightmapTags.toTag(chunk.heightmaps()),
                data,
                List.of(),
                light);

        ChunkWire.LOGGER.debug("Assembled chunk packet at {} ({} sections, {} bytes of section data)",
                pos, chunk.sections().size(), data.length);
        return packet;
    }

    /**
     * Writes a composed packet.
     */
    public void write(ChunkDataPacket<N> packet, DataOutput out) throws IOException {
        VarInts.writeVarInt(out, packet.packetId());
        out.writeInt(packet.chunkX());
        out.writeInt(packet.chunkZ());
        nbtAdapter.write(packet.heightmaps(), out);
        WireCodec.writeByteArray(out, packet.data());

        VarInts.writeVarInt(out, packet.blockEntities().size());
        for (BlockEntity<N> blockEntity : packet.blockEntities()) {
            out.writeByte(blockEntity.packedXz());
            out.writeShort(blockEntity.y());
            VarInts.writeVarInt(out, blockEntity.typeId());
            nbtAdapter.write(blockEntity.data(), out);
        }

        LightData light = packet.light();
        WireCodec.writeBitSet(out, light.skyLightMask());
        WireCodec.writeBitSet(out, light.blockLightMask());
        WireCodec.writeBitSet(out, light.emptySkyLightMask());
        WireCodec.writeBitSet(out, light.emptyBlockLightMask());
        writeLightArrays(out, light.skyLightArrays());
        writeLightArrays(out, light.blockLightArrays());
    }

    private static void writeLightArrays(DataOutput out, List<byte[]> arrays) throws IOException {
        VarInts.writeVarInt(out, arrays.size());
        for (byte[] array : arrays) {
            WireCodec.writeByteArray(out, array);
        }
    }

    /**
     * Assembles and writes the packet for {@code pos} into a new array.
     */
    public byte[] encode(ChunkPos pos) throws IOException {
        ChunkDataPacket<N> packet = assemble(pos);
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(INITIAL_PACKET_CAPACITY);
        DataOutputStream out = new DataOutputStream(buffer);
        write(packet, out);
        out.flush();
        return buffer.toByteArray();
    }

    /**
     * Assembles the packet for {@code pos} and copies it to {@code out}. Nothing is written
     * if assembly fails.
     */
    public void encodeTo(ChunkPos pos, OutputStream out) throws IOException {
        out.write(encode(pos));
    }

    /**
     * Runs {@link #encode(ChunkPos)} on {@code executor}. An {@link IOException} completes the
     * future exceptionally with an {@link UncheckedIOException} wrapping it.
     */
    public CompletableFuture<byte[]> encodeAsync(ChunkPos pos, Executor executor) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return encode(pos);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, executor);
    }
}
