package io.liparakis.chunkwire.section;

/**
 * One section read back from a chunk data payload.
 *
 * @param nonAirCount the non-air block count field
 * @param blockStates block-state container
 * @param biomes      biome container
 */
public record DecodedSection(short nonAirCount, PalettedPayload blockStates, PalettedPayload biomes) {}
