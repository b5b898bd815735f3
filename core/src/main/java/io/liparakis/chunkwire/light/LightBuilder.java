package io.liparakis.chunkwire.light;

import io.liparakis.chunkwire.core.ChunkConstants;
import io.liparakis.chunkwire.core.Section;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;

/**
 * Builds the light masks and arrays of a chunk column.
 * <p>
 * No light is propagated here. {@link LightMode#FULL_BRIGHT} marks every section as lit at
 * level 15; {@link LightMode#SECTION_DATA} forwards whatever arrays the sections hold.
 */
public final class LightBuilder {

    /** A byte holding two voxels at the maximum light level. */
    public static final byte FULL_BRIGHT_BYTE = (byte) (ChunkConstants.MAX_LIGHT_LEVEL << 4 | ChunkConstants.MAX_LIGHT_LEVEL);

    private LightBuilder() {
    }

    public static LightData build(List<Section> sections, LightMode mode) {
        return mode == LightMode.SECTION_DATA ? fromSections(sections) : fullBright(sections.size());
    }

    /**
     * Every section lit: both masks have the first {@code sectionCount} bits set, the empty
     * masks have none, and each array is 2048 bytes of {@code 0xFF}.
     */
    public static LightData fullBright(int sectionCount) {
        BitSet lit = new BitSet(sectionCount);
        lit.set(0, sectionCount);

        List<byte[]> skyArrays = new ArrayList<>(sectionCount);
        List<byte[]> blockArrays = new ArrayList<>(sectionCount);
        for (int i = 0; i < sectionCount; i++) {
            skyArrays.add(fullBrightArray());
            blockArrays.add(fullBrightArray());
        }
        return new LightData(lit, lit, new BitSet(), new BitSet(), skyArrays, blockArrays);
    }

    /**
     * Light taken from the sections: a section with an array sets its bit in the light mask
     * and contributes a copy of the array; a section without one sets its bit in the empty
     * mask.
     */
    public static LightData fromSections(List<Section> sections) {
        BitSet skyMask = new BitSet(sections.size());
        BitSet blockMask = new BitSet(sections.size());
        BitSet emptySky = new BitSet(sections.size());
        BitSet emptyBlock = new BitSet(sections.size());
        List<byte[]> skyArrays = new ArrayList<>();
        List<byte[]> blockArrays = new ArrayList<>();

        for (int i = 0; i < sections.size(); i++) {
            Section section = sections.get(i);
            byte[] sky = section.skyLight();
            if (sky != null) {
                skyMask.set(i);
                skyArrays.add(sky.clone());
            } else {
                emptySky.set(i);
            }

            byte[] block = section.blockLight();
            if (block != null) {
                blockMask.set(i);
                blockArrays.add(block.clone());
            } else {
                emptyBlock.set(i);
            }
        }
        return new LightData(skyMask, blockMask, emptySky, emptyBlock, skyArrays, blockArrays);
    }

    public static byte[] fullBrightArray() {
        byte[] array = new byte[ChunkConstants.LIGHT_ARRAY_BYTES];
        Arrays.fill(array, FULL_BRIGHT_BYTE);
        return array;
    }
}
