package io.liparakis.chunkwire.core;

/**
 * Position of a chunk column in chunk coordinates.
 *
 * @param x The chunk X coordinate
 * @param z The chunk Z coordinate
 */
public record ChunkPos(int x, int z) {}
