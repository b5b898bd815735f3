package io.liparakis.chunkwire.core;

/**
 * The two kinds of paletted data a section carries.
 */
public enum DataKind {
    BLOCK_STATES(ChunkConstants.SECTION_VOLUME),
    BIOMES(ChunkConstants.BIOME_VOLUME);

    private final int entryCount;

    DataKind(int entryCount) {
        this.entryCount = entryCount;
    }

    /** Number of per-voxel indices a container of this kind holds. */
    public int entryCount() {
        return entryCount;
    }
}
