package io.liparakis.chunkwire.core;

import org.jetbrains.annotations.Nullable;

/**
 * One 16x16x16 slab of a chunk column.
 * <p>
 * The block-state and biome containers are nullable because sections read from an external
 * source may lack them; serialization rejects such sections. Light arrays are 2048 bytes,
 * two 4-bit levels per byte, or {@code null} when the section carries no light.
 */
public final class Section {
    private final int y;
    private final @Nullable PalettedContainer<BlockState> blockStates;
    private final @Nullable PalettedContainer<String> biomes;
    private final byte @Nullable [] skyLight;
    private final byte @Nullable [] blockLight;

    public Section(int y,
                   @Nullable PalettedContainer<BlockState> blockStates,
                   @Nullable PalettedContainer<String> biomes,
                   byte @Nullable [] skyLight,
                   byte @Nullable [] blockLight) {
        if (blockStates != null && blockStates.kind() != DataKind.BLOCK_STATES) {
            throw new IllegalArgumentException("Block-state container has kind " + blockStates.kind());
        }
        if (biomes != null && biomes.kind() != DataKind.BIOMES) {
            throw new IllegalArgumentException("Biome container has kind " + biomes.kind());
        }
        checkLight(skyLight, "sky");
        checkLight(blockLight, "block");
        this.y = y;
        this.blockStates = blockStates;
        this.biomes = biomes;
        this.skyLight = skyLight;
        this.blockLight = blockLight;
    }

    private static void checkLight(byte[] light, String name) {
        if (light != null && light.length != ChunkConstants.LIGHT_ARRAY_BYTES) {
            throw new IllegalArgumentException(
                    name + " light must be " + ChunkConstants.LIGHT_ARRAY_BYTES + " bytes, got " + light.length);
        }
    }

    public int y() {
        return y;
    }

    public @Nullable PalettedContainer<BlockState> blockStates() {
        return blockStates;
    }

    public @Nullable PalettedContainer<String> biomes() {
        return biomes;
    }

    public byte @Nullable [] skyLight() {
        return skyLight;
    }

    public byte @Nullable [] blockLight() {
        return blockLight;
    }
}
