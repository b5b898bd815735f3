package io.liparakis.chunkwire.section;

import io.liparakis.chunkwire.core.BlockState;
import io.liparakis.chunkwire.core.DataKind;
import io.liparakis.chunkwire.core.PalettedContainer;
import io.liparakis.chunkwire.registry.IdResolver;
import io.liparakis.chunkwire.registry.JsonRegistry;
import io.liparakis.chunkwire.registry.RegistryLookupPolicy;
import io.liparakis.chunkwire.wire.ByteArraySource;
import io.liparakis.chunkwire.wire.VarInts;
import io.liparakis.chunkwire.wire.WireCodec;
import io.liparakis.chunkwire.wire.WireException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link PaletteEncoder} covering each layout and the registry lookup modes.
 */
class PaletteEncoderTest {

    private static final BlockState STONE = BlockState.of("minecraft:stone");
    private static final BlockState DIRT = BlockState.of("minecraft:dirt");

    private static final JsonRegistry BLOCKS = JsonRegistry.of("block_states",
            Map.of("minecraft:air", 0, "minecraft:stone", 1, "minecraft:dirt", 10));
    private static final JsonRegistry BIOMES = biomeRegistry(12);

    private static JsonRegistry biomeRegistry(int count) {
        Map<String, Integer> ids = new HashMap<>();
        for (int i = 0; i < count; i++) {
            ids.put(biome(i), i);
        }
        return JsonRegistry.of("biomes", ids);
    }

    private static String biome(int i) {
        return "test:biome_" + i;
    }

    private static PaletteEncoder encoder(BitsPerEntryPolicy policy, RegistryLookupPolicy lookup) {
        return new PaletteEncoder(policy,
                new IdResolver("block state", BLOCKS, lookup),
                new IdResolver("biome", BIOMES, lookup));
    }

    private static byte[] encodeBlocks(PaletteEncoder encoder, PalettedContainer<BlockState> container)
            throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        encoder.encodeBlockStates(new DataOutputStream(bytes), container);
        return bytes.toByteArray();
    }

    private static byte[] encodeBiomes(PaletteEncoder encoder, PalettedContainer<String> container)
            throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        encoder.encodeBiomes(new DataOutputStream(bytes), container);
        return bytes.toByteArray();
    }

    // ========== Indirect Tests ==========

    @Test
    void encodeBlockStates_airAndStone_fixedFifteenBits() throws IOException {
        PalettedContainer<BlockState> container =
                PalettedContainer.filled(DataKind.BLOCK_STATES, List.of(BlockState.AIR, STONE), 1);

        byte[] encoded = encodeBlocks(encoder(BitsPerEntryPolicy.fixed(15), RegistryLookupPolicy.FALLBACK_TO_ZERO),
                container);

        ByteArraySource in = new ByteArraySource(encoded);
        assertThat(WireCodec.readUnsignedByte(in)).isEqualTo(15);
        assertThat(VarInts.readVarInt(in)).isEqualTo(2);
        assertThat(VarInts.readVarInt(in)).isEqualTo(0);
        assertThat(VarInts.readVarInt(in)).isEqualTo(1);
        long[] words = WireCodec.readLongArray(in, 4096);
        assertThat(words).hasSize(1024);
        assertThat(words).containsOnly(1L | 1L << 15 | 1L << 30 | 1L << 45);
        assertThat(in.remaining()).isZero();
        // 1 + 1 + 1 + 1 + VarInt(1024) + 1024 longs
        assertThat(encoded).hasSize(4 + 2 + 1024 * 8);
    }

    @Test
    void encodeBiomes_singleBiome_logTwoPolicyUsesOneWord() throws IOException {
        PalettedContainer<String> container =
                PalettedContainer.filled(DataKind.BIOMES, List.of(biome(1)), 0);

        byte[] encoded = encodeBiomes(encoder(BitsPerEntryPolicy.log2(1), RegistryLookupPolicy.FALLBACK_TO_ZERO),
                container);

        assertThat(encoded).containsExactly(1, 1, 1, 1, 0, 0, 0, 0, 0, 0, 0, 0);
    }

    @Test
    void encode_indexTooWideForPolicy_throwsInvalidEntry() {
        int[] indices = new int[DataKind.BLOCK_STATES.entryCount()];
        indices[0] = 2;
        PalettedContainer<BlockState> container = new PalettedContainer<>(DataKind.BLOCK_STATES,
                List.of(BlockState.AIR, STONE, DIRT), indices);

        assertThatThrownBy(() -> encodeBlocks(
                encoder(BitsPerEntryPolicy.fixed(1), RegistryLookupPolicy.FALLBACK_TO_ZERO), container))
                .isInstanceOf(WireException.class)
                .satisfies(e -> assertThat(((WireException) e).getKind())
                        .isEqualTo(WireException.Kind.INVALID_ENTRY));
    }

    // ========== Registry Lookup Tests ==========

    @Test
    void unknownBlock_fallbackPolicy_sendsIdZero() throws IOException {
        PalettedContainer<BlockState> container = PalettedContainer.filled(DataKind.BLOCK_STATES,
                List.of(BlockState.of("mod:unknown"), STONE), 0);

        byte[] encoded = encodeBlocks(encoder(BitsPerEntryPolicy.fixed(15), RegistryLookupPolicy.FALLBACK_TO_ZERO),
                container);

        ByteArraySource in = new ByteArraySource(encoded);
        WireCodec.readUnsignedByte(in);
        VarInts.readVarInt(in);
        assertThat(VarInts.readVarInt(in)).isZero();
        assertThat(VarInts.readVarInt(in)).isEqualTo(1);
    }

    @Test
    void unknownBlock_strictPolicy_throwsUnknownRegistryEntry() {
        PalettedContainer<BlockState> container = PalettedContainer.filled(DataKind.BLOCK_STATES,
                List.of(BlockState.of("mod:unknown")), 0);

        assertThatThrownBy(() -> encodeBlocks(
                encoder(BitsPerEntryPolicy.fixed(15), RegistryLookupPolicy.STRICT), container))
                .isInstanceOf(WireException.class)
                .hasMessageContaining("mod:unknown")
                .satisfies(e -> assertThat(((WireException) e).getKind())
                        .isEqualTo(WireException.Kind.UNKNOWN_REGISTRY_ENTRY));
    }

    @Test
    void blockStateProperties_doNotAffectRegistryName() throws IOException {
        BlockState log = BlockState.of("minecraft:dirt", Map.of("snowy", "true"));
        PalettedContainer<BlockState> container =
                PalettedContainer.filled(DataKind.BLOCK_STATES, List.of(log), 0);

        byte[] encoded = encodeBlocks(encoder(BitsPerEntryPolicy.vanilla(), RegistryLookupPolicy.STRICT), container);

        assertThat(encoded).containsExactly(0, 10, 0);
    }

    // ========== Vanilla Layout Tests ==========

    @Test
    void vanilla_singleValued_writesZeroBitsIdAndEmptyArray() throws IOException {
        PalettedContainer<String> container = PalettedContainer.filled(DataKind.BIOMES, List.of(biome(7)), 0);

        byte[] encoded = encodeBiomes(encoder(BitsPerEntryPolicy.vanilla(), RegistryLookupPolicy.STRICT), container);

        assertThat(encoded).containsExactly(0, 7, 0);
    }

    @Test
    void vanilla_manyBiomes_writesDirectGlobalIds() throws IOException {
        List<String> palette = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            palette.add(biome(i + 2));
        }
        int[] indices = new int[DataKind.BIOMES.entryCount()];
        for (int i = 0; i < indices.length; i++) {
            indices[i] = i % palette.size();
        }
        PalettedContainer<String> container = new PalettedContainer<>(DataKind.BIOMES, palette, indices);

        byte[] encoded = encodeBiomes(encoder(BitsPerEntryPolicy.vanilla(), RegistryLookupPolicy.STRICT), container);

        PalettedPayload payload = new SectionPayloadReader(BitsPerEntryPolicy.vanilla())
                .readContainer(new ByteArraySource(encoded), DataKind.BIOMES);
        assertThat(payload.format()).isEqualTo(PaletteFormat.DIRECT);
        assertThat(payload.bitsPerEntry()).isEqualTo(6);
        assertThat(payload.paletteIds()).isEmpty();
        assertThat(payload.words()).hasSize(7);
        for (int i = 0; i < indices.length; i++) {
            assertThat(payload.idAt(i)).isEqualTo(indices[i] + 2);
        }
    }

    @Test
    void vanilla_fewBlocks_usesFourBitIndirect() throws IOException {
        int[] indices = new int[DataKind.BLOCK_STATES.entryCount()];
        indices[PalettedContainer.blockIndex(3, 2, 1)] = 2;
        PalettedContainer<BlockState> container = new PalettedContainer<>(DataKind.BLOCK_STATES,
                List.of(BlockState.AIR, STONE, DIRT), indices);

        byte[] encoded = encodeBlocks(encoder(BitsPerEntryPolicy.vanilla(), RegistryLookupPolicy.STRICT), container);

        PalettedPayload payload = new SectionPayloadReader(BitsPerEntryPolicy.vanilla())
                .readContainer(new ByteArraySource(encoded), DataKind.BLOCK_STATES);
        assertThat(payload.format()).isEqualTo(PaletteFormat.INDIRECT);
        assertThat(payload.bitsPerEntry()).isEqualTo(4);
        assertThat(payload.paletteIds()).containsExactly(0, 1, 10);
        assertThat(payload.words()).hasSize(256);
        assertThat(payload.idAt(PalettedContainer.blockIndex(3, 2, 1))).isEqualTo(10);
        assertThat(payload.idAt(0)).isZero();
    }
}
