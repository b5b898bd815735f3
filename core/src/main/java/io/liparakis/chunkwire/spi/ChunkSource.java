package io.liparakis.chunkwire.spi;

import io.liparakis.chunkwire.core.Chunk;
import io.liparakis.chunkwire.core.ChunkPos;

import java.io.IOException;

/**
 * Supplies the chunk to serialize for a position.
 */
@FunctionalInterface
public interface ChunkSource {

    Chunk load(ChunkPos pos) throws IOException;
}
