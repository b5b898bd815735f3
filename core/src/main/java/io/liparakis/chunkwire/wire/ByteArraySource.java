package io.liparakis.chunkwire.wire;

import java.io.IOException;

/**
 * {@link ByteSource} over an in-memory array. Fully seekable.
 */
public final class ByteArraySource implements ByteSource {
    private final byte[] data;
    private final int start;
    private final int end;
    private int index;

    public ByteArraySource(byte[] data) {
        this(data, 0, data.length);
    }

    public ByteArraySource(byte[] data, int offset, int length) {
        if (offset < 0 || length < 0 || offset + length > data.length) {
            throw new IllegalArgumentException("Invalid range " + offset + "+" + length + " for " + data.length + " bytes");
        }
        this.data = data;
        this.start = offset;
        this.end = offset + length;
        this.index = offset;
    }

    @Override
    public int read() {
        return index < end ? data[index++] & 0xFF : -1;
    }

    @Override
    public int read(byte[] buffer, int offset, int length) {
        if (length == 0) {
            return 0;
        }
        int available = end - index;
        if (available <= 0) {
            return -1;
        }
        int n = Math.min(length, available);
        System.arraycopy(data, index, buffer, offset, n);
        index += n;
        return n;
    }

    @Override
    public long position() {
        return index - start;
    }

    @Override
    public void seek(long position) throws IOException {
        if (position < 0 || position > end - start) {
            throw new IOException("Seek position " + position + " outside 0.." + (end - start));
        }
        index = start + (int) position;
    }

    /** Bytes left before the end. */
    public int remaining() {
        return end - index;
    }
}
