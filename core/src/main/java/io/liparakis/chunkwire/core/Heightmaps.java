package io.liparakis.chunkwire.core;

import org.jetbrains.annotations.Nullable;

/**
 * The heightmaps of a chunk column as packed long arrays. Absent maps are {@code null}.
 * The arrays are copied in and out.
 *
 * @param motionBlocking         highest motion-blocking block per column
 * @param motionBlockingNoLeaves same, ignoring leaves
 * @param oceanFloor             highest non-fluid block
 * @param worldSurface           highest non-air block
 */
public record Heightmaps(
        long @Nullable [] motionBlocking,
        long @Nullable [] motionBlockingNoLeaves,
        long @Nullable [] oceanFloor,
        long @Nullable [] worldSurface) {

    public static final String MOTION_BLOCKING = "MOTION_BLOCKING";
    public static final String MOTION_BLOCKING_NO_LEAVES = "MOTION_BLOCKING_NO_LEAVES";
    public static final String OCEAN_FLOOR = "OCEAN_FLOOR";
    public static final String WORLD_SURFACE = "WORLD_SURFACE";

    public Heightmaps {
        motionBlocking = copy(motionBlocking);
        motionBlockingNoLeaves = copy(motionBlockingNoLeaves);
        oceanFloor = copy(oceanFloor);
        worldSurface = copy(worldSurface);
    }

    /**
     * Zeroed {@code MOTION_BLOCKING} and {@code WORLD_SURFACE} maps, as sent for generated
     * terrain without height data.
     */
    public static Heightmaps flat() {
        return new Heightmaps(
                new long[ChunkConstants.HEIGHTMAP_WORDS],
                null,
                null,
                new long[ChunkConstants.HEIGHTMAP_WORDS]);
    }

    @Override
    public long @Nullable [] motionBlocking() {
        return copy(motionBlocking);
    }

    @Override
    public long @Nullable [] motionBlockingNoLeaves() {
        return copy(motionBlockingNoLeaves);
    }

    @Override
    public long @Nullable [] oceanFloor() {
        return copy(oceanFloor);
    }

    @Override
    public long @Nullable [] worldSurface() {
        return copy(worldSurface);
    }

    private static long @Nullable [] copy(long @Nullable [] words) {
        return words == null ? null : words.clone();
    }
}
