package io.liparakis.chunkwire.spi;

import io.liparakis.chunkwire.core.Heightmaps;

/**
 * Converts heightmaps into the tag written into the chunk packet.
 *
 * @param <N> The NBT type
 */
@FunctionalInterface
public interface HeightmapTagFactory<N> {

    N toTag(Heightmaps heightmaps);
}
