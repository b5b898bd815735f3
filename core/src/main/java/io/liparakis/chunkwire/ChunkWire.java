package io.liparakis.chunkwire;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared name and logger for the Chunkwire core.
 * Server-agnostic.
 */
public class ChunkWire {
    public static final String NAME = "chunkwire";
    public static final Logger LOGGER = LoggerFactory.getLogger(NAME);
}
