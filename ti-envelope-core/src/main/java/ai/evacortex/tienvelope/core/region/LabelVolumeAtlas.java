/*
 * TI Envelope — Regional Field Statistics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tienvelope.core.region;

import ai.evacortex.tienvelope.core.exceptions.InvalidFieldException;
import ai.evacortex.tienvelope.core.field.ImageVolume;
import ai.evacortex.tienvelope.core.math.Vec3;

/**
 * Atlas backed by a 3D label image. World positions map to the nearest voxel through the
 * inverse affine; positions outside the grid have label 0.
 */
public final class LabelVolumeAtlas implements AtlasLookup {

    private final ImageVolume labels;
    private final double[] inverse;

    public LabelVolumeAtlas(ImageVolume labels) {
        this.labels = labels.squeezed();
        if (this.labels.shape().length != 3) {
            throw new InvalidFieldException("label atlas must be 3D");
        }
        this.inverse = invertAffine(this.labels.affine());
    }

    @Override
    public int labelAt(Vec3 p) {
        if (!p.isFinite()) return 0;
        long i = Math.round(inverse[0] * p.x + inverse[1] * p.y + inverse[2] * p.z + inverse[3]);
        long j = Math.round(inverse[4] * p.x + inverse[5] * p.y + inverse[6] * p.z + inverse[7]);
        long k = Math.round(inverse[8] * p.x + inverse[9] * p.y + inverse[10] * p.z + inverse[11]);
        int[] shape = labels.shape();
        if (i < 0 || j < 0 || k < 0 || i >= shape[0] || j >= shape[1] || k >= shape[2]) {
            return 0;
        }
        return (int) Math.round(labels.value((int) i, (int) j, (int) k));
    }

    /** Inverts the linear 3×3 block and translation of a row-major 4×4 affine. */
    static double[] invertAffine(double[] m) {
        double a = m[0], b = m[1], c = m[2];
        double d = m[4], e = m[5], f = m[6];
        double g = m[8], h = m[9], k = m[10];
        double det = a * (e * k - f * h) - b * (d * k - f * g) + c * (d * h - e * g);
        if (det == 0.0) {
            throw new InvalidFieldException("affine is singular");
        }
        double[] r = new double[16];
        r[0] = (e * k - f * h) / det;
        r[1] = (c * h - b * k) / det;
        r[2] = (b * f - c * e) / det;
        r[4] = (f * g - d * k) / det;
        r[5] = (a * k - c * g) / det;
        r[6] = (c * d - a * f) / det;
        r[8] = (d * h - e * g) / det;
        r[9] = (b * g - a * h) / det;
        r[10] = (a * e - b * d) / det;
        double tx = m[3], ty = m[7], tz = m[11];
        r[3] = -(r[0] * tx + r[1] * ty + r[2] * tz);
        r[7] = -(r[4] * tx + r[5] * ty + r[6] * tz);
        r[11] = -(r[8] * tx + r[9] * ty + r[10] * tz);
        r[15] = 1.0;
        return r;
    }
}
