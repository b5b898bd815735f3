package io.liparakis.chunkwire.spi;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;

/**
 * Adapter interface for tag-tree (NBT) I/O, used for heightmaps and block-entity data.
 *
 * @param <N> The NBT type
 */
public interface NbtAdapter<N> {

    /** Writes the tag to the output in network form. */
    void write(N tag, DataOutput output) throws IOException;

    /** Reads a tag written by {@link #write}. */
    N read(DataInput input) throws IOException;
}
