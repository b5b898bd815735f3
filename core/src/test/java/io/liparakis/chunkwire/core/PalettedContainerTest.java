package io.liparakis.chunkwire.core;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PalettedContainerTest {

    private static final BlockState STONE = BlockState.of("minecraft:stone");

    @Test
    void filled_everyPositionUsesIndex() {
        PalettedContainer<BlockState> container =
                PalettedContainer.filled(DataKind.BLOCK_STATES, List.of(BlockState.AIR, STONE), 1);

        assertThat(container.indices()).hasSize(4096).containsOnly(1);
        assertThat(container.get(0)).isEqualTo(STONE);
        assertThat(container.get(4095)).isEqualTo(STONE);
    }

    @Test
    void constructor_wrongIndexCount_throws() {
        assertThatThrownBy(() -> new PalettedContainer<>(DataKind.BIOMES, List.of("minecraft:plains"), new int[63]))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("needs 64 indices");
    }

    @Test
    void constructor_indexOutsidePalette_throws() {
        int[] indices = new int[64];
        indices[10] = 1;

        assertThatThrownBy(() -> new PalettedContainer<>(DataKind.BIOMES, List.of("minecraft:plains"), indices))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at 10");
    }

    @Test
    void constructor_emptyPalette_throws() {
        assertThatThrownBy(() -> PalettedContainer.filled(DataKind.BIOMES, List.of(), 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must not be empty");
    }

    @Test
    void container_copiesIndicesInAndOut() {
        int[] indices = new int[64];
        PalettedContainer<String> container =
                new PalettedContainer<>(DataKind.BIOMES, List.of("a", "b"), indices);

        indices[0] = 1;
        container.indices()[1] = 1;

        assertThat(container.indexAt(0)).isZero();
        assertThat(container.indexAt(1)).isZero();
    }

    @Test
    void of_usesPaletteEntriesInOrder() {
        Palette<BlockState> palette = Palette.of(BlockState.AIR, STONE);
        int[] indices = new int[4096];
        indices[PalettedContainer.blockIndex(15, 15, 15)] = 1;

        PalettedContainer<BlockState> container = PalettedContainer.of(DataKind.BLOCK_STATES, palette, indices);

        assertThat(container.palette()).containsExactly(BlockState.AIR, STONE);
        assertThat(container.get(4095)).isEqualTo(STONE);
        assertThat(container.kind()).isEqualTo(DataKind.BLOCK_STATES);
    }

    @Test
    void blockIndex_ordersYThenZThenX() {
        assertThat(PalettedContainer.blockIndex(0, 0, 0)).isZero();
        assertThat(PalettedContainer.blockIndex(1, 0, 0)).isEqualTo(1);
        assertThat(PalettedContainer.blockIndex(0, 0, 1)).isEqualTo(16);
        assertThat(PalettedContainer.blockIndex(0, 1, 0)).isEqualTo(256);
    }

    @Test
    void blockState_toStringListsSortedProperties() {
        BlockState log = BlockState.of("minecraft:oak_log", Map.of("axis", "y", "age", "2"));

        assertThat(log).hasToString("minecraft:oak_log[age=2,axis=y]");
        assertThat(BlockState.AIR).hasToString("minecraft:air");
        assertThatThrownBy(() -> BlockState.of("")).isInstanceOf(IllegalArgumentException.class);
    }
}
