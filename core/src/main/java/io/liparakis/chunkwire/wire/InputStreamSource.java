package io.liparakis.chunkwire.wire;

import java.io.IOException;
import java.io.InputStream;

/**
 * {@link ByteSource} over a stream such as a socket input.
 * <p>
 * Streams cannot rewind, so {@link #seek(long)} only moves forward by skipping bytes.
 */
public final class InputStreamSource implements ByteSource {
    private final InputStream in;
    private long position;

    public InputStreamSource(InputStream in) {
        this.in = in;
    }

    @Override
    public int read() throws IOException {
        int b = in.read();
        if (b >= 0) {
            position++;
        }
        return b;
    }

    @Override
    public int read(byte[] buffer, int offset, int length) throws IOException {
        int n = in.read(buffer, offset, length);
        if (n > 0) {
            position += n;
        }
        return n;
    }

    @Override
    public long position() {
        return position;
    }

    @Override
    public void seek(long target) throws IOException {
        if (target < position) {
            throw new IOException("Cannot seek backwards on a stream (at " + position + ", requested " + target + ")");
        }
        while (position < target) {
            long skipped = in.skip(target - position);
            if (skipped <= 0) {
                if (in.read() < 0) {
                    throw WireException.shortRead("stream while seeking to " + target, null);
                }
                skipped = 1;
            }
            position += skipped;
        }
    }
}
