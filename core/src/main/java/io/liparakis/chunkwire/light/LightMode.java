package io.liparakis.chunkwire.light;

/**
 * Where the light sent with a chunk comes from.
 */
public enum LightMode {
    /** Every section fully lit, whatever the sections carry. */
    FULL_BRIGHT,
    /** The sections' own light arrays; missing arrays are reported as empty. */
    SECTION_DATA
}
