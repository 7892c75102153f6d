/*
 * TI Envelope — Regional Field Statistics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tienvelope.group;

import ai.evacortex.tienvelope.core.field.ImageVolume;
import net.jpountz.xxhash.StreamingXXHash64;
import net.jpountz.xxhash.XXHashFactory;

import java.nio.ByteBuffer;
import java.util.HexFormat;

/**
 * Content hashes of images, used as cache keys for per-image derived values.
 */
public final class ImageHashing {

    private static final XXHashFactory XX_HASH = XXHashFactory.fastestInstance();
    private static final int SEED = 0x9747b28c;
    private static final int CHUNK_DOUBLES = 8192;

    private ImageHashing() {
    }

    /** xxHash64 over shape, affine and voxel values. */
    public static long contentHash(ImageVolume image) {
        try (StreamingXXHash64 hash = XX_HASH.newStreamingHash64(SEED)) {
            ByteBuffer header = ByteBuffer.allocate(4 * image.shape().length + 8 * 16);
            for (int s : image.shape()) header.putInt(s);
            for (double a : image.affine()) header.putDouble(a);
            hash.update(header.array(), 0, header.position());

            double[] data = image.data();
            ByteBuffer chunk = ByteBuffer.allocate(8 * CHUNK_DOUBLES);
            for (int from = 0; from < data.length; from += CHUNK_DOUBLES) {
                int to = Math.min(from + CHUNK_DOUBLES, data.length);
                chunk.clear();
                for (int i = from; i < to; i++) chunk.putDouble(data[i]);
                hash.update(chunk.array(), 0, chunk.position());
            }
            return hash.getValue();
        }
    }

    public static String contentHashHex(ImageVolume image) {
        return HexFormat.of().toHexDigits(contentHash(image));
    }
}
