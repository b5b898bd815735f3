package io.liparakis.chunkwire.wire;

import java.io.DataOutput;
import java.io.IOException;

/**
 * Variable-length integer codec.
 * <p>
 * Seven payload bits per byte, least-significant group first; the high bit of each byte is
 * set when another byte follows. A VarInt takes at most 5 bytes, a VarLong at most 10.
 * Values are treated as unsigned bit patterns, so negative numbers always use the maximum
 * length.
 */
public final class VarInts {

    /** Maximum encoded size of a VarInt. */
    public static final int MAX_VARINT_BYTES = 5;

    /** Maximum encoded size of a VarLong. */
    public static final int MAX_VARLONG_BYTES = 10;

    private static final int SEGMENT_BITS = 0x7F;
    private static final int CONTINUE_BIT = 0x80;

    private VarInts() {
    }

    /**
     * Number of bytes {@code value} takes as a VarInt.
     */
    public static int sizeOf(int value) {
        int size = 1;
        while ((value & ~SEGMENT_BITS) != 0) {
            value >>>= 7;
            size++;
        }
        return size;
    }

    /**
     * Number of bytes {@code value} takes as a VarLong.
     */
    public static int sizeOfLong(long value) {
        int size = 1;
        while ((value & ~(long) SEGMENT_BITS) != 0) {
            value >>>= 7;
            size++;
        }
        return size;
    }

    public static void writeVarInt(DataOutput out, int value) throws IOException {
        while ((value & ~SEGMENT_BITS) != 0) {
            out.writeByte((value & SEGMENT_BITS) | CONTINUE_BIT);
            value >>>= 7;
        }
        out.writeByte(value);
    }

    public static void writeVarLong(DataOutput out, long value) throws IOException {
        while ((value & ~(long) SEGMENT_BITS) != 0) {
            out.writeByte((int) (value & SEGMENT_BITS) | CONTINUE_BIT);
            value >>>= 7;
        }
        out.writeByte((int) value);
    }

    /**
     * Reads a VarInt one byte at a time; the value may arrive split across reads.
     *
     * @throws WireException {@code SHORT_READ} if the source ends mid-value,
     *                       {@code VARINT_TOO_BIG} past five groups
     */
    public static int readVarInt(ByteSource in) throws IOException {
        int value = 0;
        int groups = 0;
        int b;
        do {
            if (groups == MAX_VARINT_BYTES) {
                throw new WireException(WireException.Kind.VARINT_TOO_BIG, "VarInt is too big");
            }
            b = readGroup(in, "VarInt");
            value |= (b & SEGMENT_BITS) << (7 * groups);
            groups++;
        } while ((b & CONTINUE_BIT) != 0);
        return value;
    }

    /**
     * Reads a VarLong one byte at a time.
     *
     * @throws WireException {@code SHORT_READ} if the source ends mid-value,
     *                       {@code VARLONG_TOO_BIG} past ten groups
     */
    public static long readVarLong(ByteSource in) throws IOException {
        long value = 0;
        int groups = 0;
        int b;
        do {
            if (groups == MAX_VARLONG_BYTES) {
                throw new WireException(WireException.Kind.VARLONG_TOO_BIG, "VarLong is too big");
            }
            b = readGroup(in, "VarLong");
            value |= (long) (b & SEGMENT_BITS) << (7 * groups);
            groups++;
        } while ((b & CONTINUE_BIT) != 0);
        return value;
    }

    private static int readGroup(ByteSource in, String what) throws WireException {
        int b;
        try {
            b = in.read();
        } catch (WireException e) {
            throw e;
        } catch (IOException e) {
            throw WireException.shortRead(what, e);
        }
        if (b < 0) {
            throw WireException.shortRead(what, null);
        }
        return b;
    }
}
