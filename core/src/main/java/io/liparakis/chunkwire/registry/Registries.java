package io.liparakis.chunkwire.registry;

import io.liparakis.chunkwire.ChunkWire;
import io.liparakis.chunkwire.spi.Registry;

import java.io.IOException;

/**
 * The block-state and biome registries used to resolve palette names.
 *
 * @param blockStates block name to block-state id
 * @param biomes      biome name to biome id
 */
public record Registries(Registry blockStates, Registry biomes) {

    public static final String BLOCK_STATES_RESOURCE = "/registries/block_states.json";
    public static final String BIOMES_RESOURCE = "/registries/biomes.json";

    /**
     * Loads the registries bundled with the library.
     */
    public static Registries loadDefault() throws IOException {
        Registries registries = new Registries(
                JsonRegistry.loadResource("block_states", BLOCK_STATES_RESOURCE),
                JsonRegistry.loadResource("biomes", BIOMES_RESOURCE));
        ChunkWire.LOGGER.debug("Loaded {} block states and {} biomes",
                registries.blockStates().size(), registries.biomes().size());
        return registries;
    }
}
