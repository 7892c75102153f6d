/*
 * TI Envelope — Regional Field Statistics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tienvelope.core.field;

import ai.evacortex.tienvelope.core.exceptions.InvalidFieldException;
import ai.evacortex.tienvelope.core.math.Vec3;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ImageVolumeTest {

    private static double[] scaledAffine(double sx, double sy, double sz, double tx) {
        return new double[]{
                sx, 0, 0, tx,
                0, sy, 0, 0,
                0, 0, sz, 0,
                0, 0, 0, 1
        };
    }

    @Test
    void rejectsWrongDataLength() {
        assertThrows(InvalidFieldException.class,
                () -> new ImageVolume(new int[]{2, 2, 2}, ImageVolume.identityAffine(), new double[7]));
        assertThrows(InvalidFieldException.class,
                () -> new ImageVolume(new int[]{2, 2}, ImageVolume.identityAffine(), new double[4]));
    }

    @Test
    void voxelVolume_isDeterminant() {
        ImageVolume image = new ImageVolume(new int[]{1, 1, 1}, scaledAffine(2, 1.5, -1, 0), new double[1]);
        assertEquals(3.0, image.voxelVolume(), 1e-12);
    }

    @Test
    void toSampleModel_usesAffinePositionsAndUniformWeights() {
        double[] data = {1, 2, 3, 4, 5, 6, 7, 8};
        ImageVolume image = new ImageVolume(new int[]{2, 2, 2}, scaledAffine(2, 2, 2, -10), data);
        FieldSampleModel model = image.toSampleModel("TI_max");

        assertEquals(FieldKind.VOXEL, model.kind());
        assertEquals(8, model.size());
        assertEquals(8.0, model.weights()[0], 1e-12);
        // index (1, 0, 1) in row-major order
        int idx = image.index(1, 0, 1);
        assertEquals(data[idx], model.scalarField("TI_max")[idx], 0.0);
        assertEquals(new Vec3(-8, 0, 2), model.positions()[idx]);
    }

    @Test
    void squeezed_dropsTrailingSingletonAxis() {
        ImageVolume image = new ImageVolume(new int[]{2, 1, 2, 1}, ImageVolume.identityAffine(), new double[4]);
        assertArrayEquals(new int[]{2, 1, 2}, image.squeezed().shape());
        ImageVolume multi = new ImageVolume(new int[]{2, 1, 1, 2}, ImageVolume.identityAffine(), new double[4]);
        assertSame(multi, multi.squeezed());
    }

    @Test
    void affineMatches_withinTolerance() {
        ImageVolume a = new ImageVolume(new int[]{1, 1, 1}, scaledAffine(1, 1, 1, 0), new double[1]);
        ImageVolume b = new ImageVolume(new int[]{1, 1, 1}, scaledAffine(1 + 1e-7, 1, 1, 0), new double[1]);
        ImageVolume c = new ImageVolume(new int[]{1, 1, 1}, scaledAffine(1, 1, 1, 0.01), new double[1]);
        assertTrue(b.affineMatches(a, ImageVolume.AFFINE_ATOL));
        assertFalse(c.affineMatches(a, ImageVolume.AFFINE_ATOL));
    }
}
