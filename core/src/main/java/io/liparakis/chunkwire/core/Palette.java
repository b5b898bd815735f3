package io.liparakis.chunkwire.core;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.ArrayList;
import java.util.List;

/**
 * An insertion-ordered set of distinct entries, each addressed by its index.
 * <p>
 * Sections store one small index per voxel instead of the entry itself; the index is
 * the position of the entry in this palette. Entries are compared with
 * {@code equals}, so two equal block states share one index.
 * <p>
 * Implementation details:
 * <ul>
 *   <li>Indices are assigned sequentially starting from 0 and never change</li>
 *   <li>Lookups in both directions are O(1)</li>
 *   <li>Not thread-safe; a palette belongs to the single build that creates it</li>
 * </ul>
 *
 * @param <T> the entry type, a {@link BlockState} or a biome name
 */
public class Palette<T> {
    private static final int INITIAL_CAPACITY = 8;
    private static final int MISSING = -1;

    private final List<T> idToEntry = new ArrayList<>(INITIAL_CAPACITY);
    private final Object2IntOpenHashMap<T> entryToId = new Object2IntOpenHashMap<>(INITIAL_CAPACITY);

    public Palette() {
        entryToId.defaultReturnValue(MISSING);
    }

    /**
     * Creates a palette holding {@code entries} in order, dropping duplicates.
     */
    @SafeVarargs
    public static <T> Palette<T> of(T... entries) {
        Palette<T> palette = new Palette<>();
        for (T entry : entries) {
            palette.getOrAdd(entry);
        }
        return palette;
    }

    /**
     * Returns the index of {@code entry}, adding it at the end if absent.
     *
     * @throws IllegalArgumentException if entry is null
     */
    public int getOrAdd(T entry) {
        if (entry == null) {
            throw new IllegalArgumentException("Cannot add null to Palette");
        }

        int existingId = entryToId.getInt(entry);
        if (existingId != MISSING) {
            return existingId;
        }

        int id = idToEntry.size();
        idToEntry.add(entry);
        entryToId.put(entry, id);
        return id;
    }

    /**
     * Returns the index of {@code entry}, or -1 if it is not in the palette.
     */
    public int indexOf(T entry) {
        return entryToId.getInt(entry);
    }

    /**
     * Returns the entry at {@code id}, or {@code null} if the index is out of range.
     */
    public T get(int id) {
        return (id >= 0 && id < idToEntry.size()) ? idToEntry.get(id) : null;
    }

    public int size() {
        return idToEntry.size();
    }

    /**
     * Returns an immutable snapshot of the entries in index order.
     */
    public List<T> entries() {
        return List.copyOf(idToEntry);
    }
}
