package io.liparakis.chunkwire.core;

/**
 * Geometry and metadata constants of the chunk model.
 */
public final class ChunkConstants {

    // ==================== Section Geometry ====================

    /**
     * Size of one dimension of a section (16 blocks).
     */
    public static final int SECTION_SIZE = 16;

    /**
     * Blocks in one section (16x16x16).
     */
    public static final int SECTION_VOLUME = SECTION_SIZE * SECTION_SIZE * SECTION_SIZE;

    /**
     * Biome cells in one section (4x4x4).
     */
    public static final int BIOME_VOLUME = 64;

    /**
     * Lowest section index (-4 for a world starting at Y=-64).
     */
    public static final int MIN_SECTION_Y = -4;

    /**
     * Highest section index (19 for a world ending at Y=319).
     */
    public static final int MAX_SECTION_Y = 19;

    /**
     * Sections in one column.
     */
    public static final int SECTION_COUNT = MAX_SECTION_Y - MIN_SECTION_Y + 1;

    // ==================== Light ====================

    /**
     * Bytes in one light array: 4096 nibbles, two per byte.
     */
    public static final int LIGHT_ARRAY_BYTES = SECTION_VOLUME / 2;

    /**
     * Maximum light level of a nibble.
     */
    public static final int MAX_LIGHT_LEVEL = 15;

    // ==================== Metadata ====================

    /**
     * Data version stamped on generated chunks.
     */
    public static final int DATA_VERSION = 3465;

    /**
     * Status of a chunk that is ready to send.
     */
    public static final String STATUS_FULL = "full";

    /**
     * Words in a heightmap for the 384-block-tall world (256 entries of 9 bits, 7 per word).
     */
    public static final int HEIGHTMAP_WORDS = 37;

    private ChunkConstants() {
    }
}
