package io.liparakis.chunkwire.light;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;

/**
 * Light masks and arrays for one chunk column.
 * <p>
 * Bit {@code i} of a mask refers to the {@code i}-th section from the bottom. The arrays hold
 * one entry per set bit of the matching mask, in ascending bit order. Masks and arrays are
 * copied on the way in and on the way out, so that pairing cannot be broken afterwards.
 *
 * @param skyLightMask        sections that carry a sky-light array
 * @param blockLightMask      sections that carry a block-light array
 * @param emptySkyLightMask   sections whose sky light is known to be all zero
 * @param emptyBlockLightMask sections whose block light is known to be all zero
 * @param skyLightArrays      2048-byte sky-light arrays
 * @param blockLightArrays    2048-byte block-light arrays
 */
public record LightData(
        BitSet skyLightMask,
        BitSet blockLightMask,
        BitSet emptySkyLightMask,
        BitSet emptyBlockLightMask,
        List<byte[]> skyLightArrays,
        List<byte[]> blockLightArrays) {

    public LightData {
        if (skyLightMask.cardinality() != skyLightArrays.size()) {
            throw new IllegalArgumentException("Sky mask has " + skyLightMask.cardinality()
                    + " bits but " + skyLightArrays.size() + " arrays");
        }
        if (blockLightMask.cardinality() != blockLightArrays.size()) {
            throw new IllegalArgumentException("Block mask has " + blockLightMask.cardinality()
                    + " bits but " + blockLightArrays.size() + " arrays");
        }
        skyLightMask = (BitSet) skyLightMask.clone();
        blockLightMask = (BitSet) blockLightMask.clone();
        emptySkyLightMask = (BitSet) emptySkyLightMask.clone();
        emptyBlockLightMask = (BitSet) emptyBlockLightMask.clone();
        skyLightArrays = copyArrays(skyLightArrays);
        blockLightArrays = copyArrays(blockLightArrays);
    }

    @Override
    public BitSet skyLightMask() {
        return (BitSet) skyLightMask.clone();
    }

    @Override
    public BitSet blockLightMask() {
        return (BitSet) blockLightMask.clone();
    }

    @Override
    public BitSet emptySkyLightMask() {
        return (BitSet) emptySkyLightMask.clone();
    }

    @Override
    public BitSet emptyBlockLightMask() {
        return (BitSet) emptyBlockLightMask.clone();
    }

    @Override
    public List<byte[]> skyLightArrays() {
        return copyArrays(skyLightArrays);
    }

    @Override
    public List<byte[]> blockLightArrays() {
        return copyArrays(blockLightArrays);
    }

    private static List<byte[]> copyArrays(List<byte[]> arrays) {
        List<byte[]> copies = new ArrayList<>(arrays.size());
        for (byte[] array : arrays) {
            copies.add(array.clone());
        }
        return Collections.unmodifiableList(copies);
    }
}
