package io.liparakis.chunkwire.section;

/**
 * How a paletted container is laid out on the wire.
 */
public enum PaletteFormat {
    /** Zero bits per entry: one id for the whole container, no data words. */
    SINGLE_VALUED,
    /** A local palette of ids followed by packed palette indices. */
    INDIRECT,
    /** No palette; the packed data holds registry ids directly. */
    DIRECT
}
