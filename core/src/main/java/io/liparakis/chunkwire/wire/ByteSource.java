package io.liparakis.chunkwire.wire;

import java.io.IOException;
import java.io.InputStream;

/**
 * Readable, seekable byte source that decoders pull from.
 * <p>
 * Reads block until data is available or the source ends. A source is used by one decoder
 * at a time; interleaving reads from two decoders corrupts the position. If a decode is
 * interrupted part way, the position is undefined and the source must be discarded.
 */
public interface ByteSource {

    /**
     * Reads one byte.
     *
     * @return the byte as 0..255, or -1 at end of stream
     */
    int read() throws IOException;

    /**
     * Reads up to {@code length} bytes.
     *
     * @return the number of bytes read, or -1 at end of stream
     */
    int read(byte[] buffer, int offset, int length) throws IOException;

    /** Current absolute position in bytes. */
    long position();

    /** Moves to an absolute position. */
    void seek(long position) throws IOException;

    /**
     * A stream view over this source, for handing to {@link java.io.DataInput}-based readers.
     * Reads through the view advance this source.
     */
    default InputStream asInputStream() {
        ByteSource source = this;
        return new InputStream() {
            @Override
            public int read() throws IOException {
                return source.read();
            }

            @Override
            public int read(byte[] buffer, int offset, int length) throws IOException {
                return source.read(buffer, offset, length);
            }
        };
    }
}
