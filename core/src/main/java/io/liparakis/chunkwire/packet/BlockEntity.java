package io.liparakis.chunkwire.packet;

/**
 * A block entity carried in a chunk packet.
 *
 * @param packedXz section-relative x in the high nibble, z in the low nibble
 * @param y        absolute block y
 * @param typeId   block-entity type id
 * @param data     tag payload
 * @param <N>      The NBT type
 */
public record BlockEntity<N>(byte packedXz, short y, int typeId, N data) {

    public static <N> BlockEntity<N> of(int x, int y, int z, int typeId, N data) {
        return new BlockEntity<>(packXz(x, z), (short) y, typeId, data);
    }

    public static byte packXz(int x, int z) {
        return (byte) (((x & 15) << 4) | (z & 15));
    }

    public int x() {
        return (packedXz >> 4) & 15;
    }

    public int z() {
        return packedXz & 15;
    }
}
