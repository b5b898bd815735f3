package io.liparakis.chunkwire.wire;

import java.io.DataOutput;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.BitSet;

/**
 * Encode/decode functions for every fixed-width wire primitive, plus the length-prefixed
 * forms built on them.
 * <p>
 * All multi-byte scalars are big-endian. Decoders pull from a {@link ByteSource} and fail
 * with {@link WireException.Kind#SHORT_READ} when the source ends early; encoders write to a
 * {@link DataOutput}. Each primitive kind has its own pair of methods; the caller picks one
 * by the type it expects.
 */
public final class WireCodec {

    /** Upper bound on the UTF-8 length of a protocol string (32767 chars, 3 bytes each). */
    public static final int DEFAULT_MAX_STRING_BYTES = 32767 * 3;

    private WireCodec() {
    }

    // ===== Decode =====

    public static boolean readBoolean(ByteSource in) throws IOException {
        return readFully(in, 1, "boolean")[0] != 0;
    }

    public static byte readByte(ByteSource in) throws IOException {
        return readFully(in, 1, "byte")[0];
    }

    public static int readUnsignedByte(ByteSource in) throws IOException {
        return readFully(in, 1, "unsigned byte")[0] & 0xFF;
    }

    public static short readShort(ByteSource in) throws IOException {
        byte[] b = readFully(in, 2, "short");
        return (short) ((b[0] & 0xFF) << 8 | (b[1] & 0xFF));
    }

    public static int readUnsignedShort(ByteSource in) throws IOException {
        byte[] b = readFully(in, 2, "unsigned short");
        return (b[0] & 0xFF) << 8 | (b[1] & 0xFF);
    }

    public static int readInt(ByteSource in) throws IOException {
        return toInt(readFully(in, 4, "int"));
    }

    public static long readUnsignedInt(ByteSource in) throws IOException {
        return Integer.toUnsignedLong(toInt(readFully(in, 4, "unsigned int")));
    }

    public static long readLong(ByteSource in) throws IOException {
        return toLong(readFully(in, 8, "long"));
    }

    /**
     * Reads an unsigned 64-bit value. Java has no unsigned long, so the bit pattern is
     * returned as-is; use {@link Long#toUnsignedString(long)} and friends to interpret it.
     */
    public static long readUnsignedLong(ByteSource in) throws IOException {
        return toLong(readFully(in, 8, "unsigned long"));
    }

    public static float readFloat(ByteSource in) throws IOException {
        return Float.intBitsToFloat(toInt(readFully(in, 4, "float")));
    }

    public static double readDouble(ByteSource in) throws IOException {
        return Double.longBitsToDouble(toLong(readFully(in, 8, "double")));
    }

    public static String readString(ByteSource in) throws IOException {
        return readString(in, DEFAULT_MAX_STRING_BYTES);
    }

    /**
     * Reads a VarInt byte length then exactly that many bytes, then validates them as UTF-8.
     * The declared length is always consumed before validation, so an invalid string leaves
     * the source positioned after it.
     *
     * @throws WireException {@code INVALID_LENGTH} for a negative or oversized length,
     *                       {@code SHORT_READ} if fewer bytes arrive,
     *                       {@code INVALID_UTF8} if the bytes are not UTF-8
     */
    public static String readString(ByteSource in, int maxBytes) throws IOException {
        int length = VarInts.readVarInt(in);
        if (length < 0 || length > maxBytes) {
            throw new WireException(WireException.Kind.INVALID_LENGTH,
                    "String length " + length + " outside 0.." + maxBytes);
        }
        byte[] bytes = readFully(in, length, "string of " + length + " bytes");
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new WireException(WireException.Kind.INVALID_UTF8, "String is not valid UTF-8", e);
        }
    }

    /**
     * Reads a VarInt length followed by that many raw bytes.
     */
    public static byte[] readByteArray(ByteSource in, int maxBytes) throws IOException {
        int length = VarInts.readVarInt(in);
        if (length < 0 || length > maxBytes) {
            throw new WireException(WireException.Kind.INVALID_LENGTH,
                    "Byte array length " + length + " outside 0.." + maxBytes);
        }
        return readFully(in, length, "byte array of " + length + " bytes");
    }

    /**
     * Reads a VarInt word count followed by that many big-endian int64 words.
     */
    public static long[] readLongArray(ByteSource in, int maxWords) throws IOException {
        int count = VarInts.readVarInt(in);
        if (count < 0 || count > maxWords) {
            throw new WireException(WireException.Kind.INVALID_LENGTH,
                    "Long array length " + count + " outside 0.." + maxWords);
        }
        long[] words = new long[count];
        for (int i = 0; i < count; i++) {
            words[i] = readLong(in);
        }
        return words;
    }

    public static BitSet readBitSet(ByteSource in, int maxWords) throws IOException {
        return BitSet.valueOf(readLongArray(in, maxWords));
    }

    /**
     * Reads exactly {@code length} bytes, looping over partial reads.
     */
    public static byte[] readFully(ByteSource in, int length, String what) throws IOException {
        byte[] buffer = new byte[length];
        int read = 0;
        try {
            while (read < length) {
                int n = in.read(buffer, read, length - read);
                if (n < 0) {
                    throw WireException.shortRead(what + " (got " + read + " of " + length + " bytes)", null);
                }
                read += n;
            }
        } catch (WireException e) {
            throw e;
        } catch (IOException e) {
            throw WireException.shortRead(what, e);
        }
        return buffer;
    }

    // ===== Encode =====

    public static void writeBoolean(DataOutput out, boolean value) throws IOException {
        out.writeByte(value ? 1 : 0);
    }

    public static void writeByte(DataOutput out, byte value) throws IOException {
        out.writeByte(value);
    }

    public static void writeUnsignedByte(DataOutput out, int value) throws IOException {
        checkUnsigned(value, 0xFF, "unsigned byte");
        out.writeByte(value);
    }

    public static void writeShort(DataOutput out, short value) throws IOException {
        out.writeShort(value);
    }

    public static void writeUnsignedShort(DataOutput out, int value) throws IOException {
        checkUnsigned(value, 0xFFFF, "unsigned short");
        out.writeShort(value);
    }

    public static void writeInt(DataOutput out, int value) throws IOException {
        out.writeInt(value);
    }

    public static void writeUnsignedInt(DataOutput out, long value) throws IOException {
        checkUnsigned(value, 0xFFFFFFFFL, "unsigned int");
        out.writeInt((int) value);
    }

    public static void writeLong(DataOutput out, long value) throws IOException {
        out.writeLong(value);
    }

    /** Writes the bit pattern of an unsigned 64-bit value. */
    public static void writeUnsignedLong(DataOutput out, long value) throws IOException {
        out.writeLong(value);
    }

    public static void writeFloat(DataOutput out, float value) throws IOException {
        out.writeInt(Float.floatToRawIntBits(value));
    }

    public static void writeDouble(DataOutput out, double value) throws IOException {
        out.writeLong(Double.doubleToRawLongBits(value));
    }

    /**
     * Writes a VarInt UTF-8 byte length followed by the UTF-8 bytes.
     */
    public static void writeString(DataOutput out, String value) throws IOException {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        VarInts.writeVarInt(out, bytes.length);
        out.write(bytes);
    }

    public static void writeByteArray(DataOutput out, byte[] bytes) throws IOException {
        VarInts.writeVarInt(out, bytes.length);
        out.write(bytes);
    }

    public static void writeLongArray(DataOutput out, long[] words) throws IOException {
        VarInts.writeVarInt(out, words.length);
        for (long word : words) {
            out.writeLong(word);
        }
    }

    /**
     * Writes a bit set as a VarInt word count then the words, word 0 holding bits 0..63.
     * An empty set is the single byte 0x00.
     */
    public static void writeBitSet(DataOutput out, BitSet bits) throws IOException {
        writeLongArray(out, bits.toLongArray());
    }

    private static void checkUnsigned(long value, long max, String what) {
        if (value < 0 || value > max) {
            throw new IllegalArgumentException(value + " does not fit in an " + what);
        }
    }

    private static int toInt(byte[] b) {
        return (b[0] & 0xFF) << 24 | (b[1] & 0xFF) << 16 | (b[2] & 0xFF) << 8 | (b[3] & 0xFF);
    }

    private static long toLong(byte[] b) {
        long value = 0;
        for (int i = 0; i < 8; i++) {
            value = (value << 8) | (b[i] & 0xFF);
        }
        return value;
    }
}
