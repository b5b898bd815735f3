package io.liparakis.chunkwire.world;

import io.liparakis.chunkwire.core.BlockState;
import io.liparakis.chunkwire.core.Chunk;
import io.liparakis.chunkwire.core.ChunkConstants;
import io.liparakis.chunkwire.core.ChunkPos;
import io.liparakis.chunkwire.core.DataKind;
import io.liparakis.chunkwire.core.Heightmaps;
import io.liparakis.chunkwire.core.Palette;
import io.liparakis.chunkwire.core.PalettedContainer;
import io.liparakis.chunkwire.core.Section;
import io.liparakis.chunkwire.light.LightBuilder;
import io.liparakis.chunkwire.spi.ChunkSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Produces the same solid terrain for every position: each section is filled with one block
 * over a palette of air plus that block, in a single biome, fully lit. Filling with air
 * gives a one-entry palette.
 */
public final class StubChunkSource implements ChunkSource {
    public static final BlockState STONE = BlockState.of("minecraft:stone");
    public static final String PLAINS = "minecraft:plains";

    private final BlockState fill;
    private final String biome;

    public StubChunkSource() {
        this(STONE, PLAINS);
    }

    public StubChunkSource(BlockState fill, String biome) {
        this.fill = fill;
        this.biome = biome;
    }

    @Override
    public Chunk load(ChunkPos pos) {
        Palette<BlockState> blockPalette = Palette.of(BlockState.AIR);
        int[] blockIndices = new int[DataKind.BLOCK_STATES.entryCount()];
        Arrays.fill(blockIndices, blockPalette.getOrAdd(fill));
        Palette<String> biomePalette = Palette.of(biome);
        int[] biomeIndices = new int[DataKind.BIOMES.entryCount()];

        List<Section> sections = new ArrayList<>(ChunkConstants.SECTION_COUNT);
        for (int y = ChunkConstants.MIN_SECTION_Y; y <= ChunkConstants.MAX_SECTION_Y; y++) {
            sections.add(new Section(
                    y,
                    PalettedContainer.of(DataKind.BLOCK_STATES, blockPalette, blockIndices),
                    PalettedContainer.of(DataKind.BIOMES, biomePalette, biomeIndices),
                    LightBuilder.fullBrightArray(),
                    LightBuilder.fullBrightArray()));
        }

        return new Chunk(
                pos,
                ChunkConstants.STATUS_FULL,
                ChunkConstants.DATA_VERSION,
                ChunkConstants.MIN_SECTION_Y,
                sections,
                Heightmaps.flat(),
                0L,
                0L,
                true);
    }
}
