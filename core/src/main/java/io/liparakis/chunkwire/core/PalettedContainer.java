package io.liparakis.chunkwire.core;

import java.util.Arrays;
import java.util.List;

/**
 * A palette plus one palette index per voxel (or per biome cell).
 * <p>
 * Every index is guaranteed to be {@code < palette().size()} and the index array is
 * exactly {@link DataKind#entryCount()} long.
 *
 * @param <T> the palette entry type
 */
public final class PalettedContainer<T> {
    private final DataKind kind;
    private final List<T> palette;
    private final int[] indices;

    public PalettedContainer(DataKind kind, List<T> palette, int[] indices) {
        if (palette.isEmpty()) {
            throw new IllegalArgumentException(kind + " palette must not be empty");
        }
        if (indices.length != kind.entryCount()) {
            throw new IllegalArgumentException(
                    kind + " needs " + kind.entryCount() + " indices, got " + indices.length);
        }
        for (int i = 0; i < indices.length; i++) {
            if (indices[i] < 0 || indices[i] >= palette.size()) {
                throw new IllegalArgumentException(
                        "Index " + indices[i] + " at " + i + " outside palette of " + palette.size());
            }
        }
        this.kind = kind;
        this.palette = List.copyOf(palette);
        this.indices = indices.clone();
    }

    /**
     * A container where every voxel uses the palette entry at {@code index}.
     */
    public static <T> PalettedContainer<T> filled(DataKind kind, List<T> palette, int index) {
        int[] indices = new int[kind.entryCount()];
        Arrays.fill(indices, index);
        return new PalettedContainer<>(kind, palette, indices);
    }

    public static <T> PalettedContainer<T> of(DataKind kind, Palette<T> palette, int[] indices) {
        return new PalettedContainer<>(kind, palette.entries(), indices);
    }

    public DataKind kind() {
        return kind;
    }

    public List<T> palette() {
        return palette;
    }

    /**
     * Returns a copy of the per-voxel indices.
     */
    public int[] indices() {
        return indices.clone();
    }

    /** Index at a flat position without copying. */
    public int indexAt(int position) {
        return indices[position];
    }

    public T get(int position) {
        return palette.get(indices[position]);
    }

    /**
     * Block index within a section, ordered y, then z, then x.
     */
    public static int blockIndex(int x, int y, int z) {
        return (y << 8) | (z << 4) | x;
    }
}
