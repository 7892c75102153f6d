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
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ImageHashingTest {

    @Test
    void contentHash_isDeterministicAndContentSensitive() {
        ImageVolume a = GroupTestUtils.randomImage(30, 5);
        ImageVolume same = new ImageVolume(a.shape().clone(), a.affine().clone(), a.data().clone());
        assertEquals(ImageHashing.contentHash(a), ImageHashing.contentHash(same));
        assertEquals(16, ImageHashing.contentHashHex(a).length());

        double[] changed = a.data().clone();
        changed[changed.length - 1] += 1e-9;
        assertNotEquals(ImageHashing.contentHash(a), ImageHashing.contentHash(a.withData(changed)));

        double[] moved = a.affine().clone();
        moved[3] = 1.0;
        assertNotEquals(ImageHashing.contentHash(a), ImageHashing.contentHash(new ImageVolume(a.shape(), moved, a.data())));
    }

    @Test
    void windowCache_reusesWindowsForSameContent() {
        HighValueWindowCache cache = new HighValueWindowCache(8);
        ImageVolume a = GroupTestUtils.randomImage(8, 9);
        double[] first = cache.window(a, 95.0, 99.9);
        double[] second = cache.window(a.withData(a.data().clone()), 95.0, 99.9);
        assertArrayEquals(first, second, 0.0);
        assertEquals(1, cache.hitCount());

        cache.window(a, 90.0, 99.9);
        assertEquals(1, cache.hitCount());

        cache.clear();
        cache.window(a, 95.0, 99.9);
        assertEquals(1, cache.hitCount());
    }
}
