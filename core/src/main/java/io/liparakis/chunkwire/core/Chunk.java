package io.liparakis.chunkwire.core;

import java.util.List;

/**
 * A column of sections at one chunk position, lowest section first.
 * <p>
 * Built for a single outgoing packet and dropped after serialization.
 *
 * @param pos           chunk coordinates
 * @param status        generation status, {@code "full"} for sendable chunks
 * @param dataVersion   world data version the chunk was produced for
 * @param minSectionY   index of the lowest section
 * @param sections      sections in ascending y order
 * @param heightmaps    heightmaps of the column
 * @param inhabitedTime ticks players have spent in the chunk
 * @param lastUpdate    game time of the last update
 * @param lightOn       whether light has been computed
 */
public record Chunk(
        ChunkPos pos,
        String status,
        int dataVersion,
        int minSectionY,
        List<Section> sections,
        Heightmaps heightmaps,
        long inhabitedTime,
        long lastUpdate,
        boolean lightOn) {

    public Chunk {
        sections = List.copyOf(sections);
        for (int i = 0; i < sections.size(); i++) {
            if (sections.get(i).y() != minSectionY + i) {
                throw new IllegalArgumentException(
                        "Section " + i + " has y " + sections.get(i).y() + ", expected " + (minSectionY + i));
            }
        }
    }
}
