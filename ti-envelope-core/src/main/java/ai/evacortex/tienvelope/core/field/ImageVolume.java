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

import java.util.Arrays;
import java.util.Objects;

/**
 * A 3D or 4D scalar image on a regular grid with a 4×4 voxel-to-world affine (row-major).
 *
 * <p>Data is flattened in row-major order: the last axis varies fastest, so voxel
 * {@code (i, j, k)} of a 3D image lives at {@code (i * ny + j) * nz + k}.</p>
 */
public record ImageVolume(int[] shape, double[] affine, double[] data) {

    /** Relative tolerance applied on top of the absolute one when comparing affines. */
    public static final double AFFINE_RTOL = 1e-5;
    public static final double AFFINE_ATOL = 1e-6;

    public ImageVolume {
        Objects.requireNonNull(shape, "shape must not be null");
        Objects.requireNonNull(affine, "affine must not be null");
        Objects.requireNonNull(data, "data must not be null");
        if (shape.length < 3 || shape.length > 4) {
            throw new InvalidFieldException("only 3D and 4D images are supported, got " + shape.length + "D");
        }
        if (affine.length != 16) {
            throw new InvalidFieldException("affine must have 16 entries, got " + affine.length);
        }
        long expected = 1;
        for (int d : shape) {
            if (d <= 0) throw new InvalidFieldException("non-positive dimension in shape " + Arrays.toString(shape));
            expected *= d;
        }
        if (expected != data.length) {
            throw new InvalidFieldException("shape " + Arrays.toString(shape) + " needs " + expected
                    + " values, got " + data.length);
        }
    }

    public static double[] identityAffine() {
        return new double[]{
                1, 0, 0, 0,
                0, 1, 0, 0,
                0, 0, 1, 0,
                0, 0, 0, 1
        };
    }

    public int voxelCount() {
        return data.length;
    }

    public int index(int i, int j, int k) {
        if (shape.length != 3) throw new IllegalStateException("3D index on a " + shape.length + "D image");
        return (i * shape[1] + j) * shape[2] + k;
    }

    public double value(int i, int j, int k) {
        return data[index(i, j, k)];
    }

    public boolean sameShape(ImageVolume other) {
        return Arrays.equals(shape, other.shape);
    }

    /**
     * Element-wise {@code |a - b| <= atol + rtol * |b|} over the 16 affine entries.
     */
    public boolean affineMatches(ImageVolume reference, double atol) {
        for (int i = 0; i < 16; i++) {
            double a = affine[i];
            double b = reference.affine[i];
            if (!(Math.abs(a - b) <= atol + AFFINE_RTOL * Math.abs(b))) {
                return false;
            }
        }
        return true;
    }

    /** Volume of one voxel in mm³, the absolute determinant of the affine's linear part. */
    public double voxelVolume() {
        double a = affine[0], b = affine[1], c = affine[2];
        double d = affine[4], e = affine[5], f = affine[6];
        double g = affine[8], h = affine[9], k = affine[10];
        return Math.abs(a * (e * k - f * h) - b * (d * k - f * g) + c * (d * h - e * g));
    }

    public Vec3 worldPosition(double i, double j, double k) {
        return new Vec3(
                affine[0] * i + affine[1] * j + affine[2] * k + affine[3],
                affine[4] * i + affine[5] * j + affine[6] * k + affine[7],
                affine[8] * i + affine[9] * j + affine[10] * k + affine[11]);
    }

    /** Same geometry, new values. */
    public ImageVolume withData(double[] newData) {
        return new ImageVolume(shape.clone(), affine.clone(), newData);
    }

    /** Drops a trailing singleton fourth axis, as loaders do for single-frame 4D NIfTIs. */
    public ImageVolume squeezed() {
        if (shape.length == 4 && shape[3] == 1) {
            return new ImageVolume(new int[]{shape[0], shape[1], shape[2]}, affine, data);
        }
        return this;
    }

    /**
     * Converts a 3D image into a voxel sample model: one sample per voxel at its world-space center,
     * uniform weight equal to {@link #voxelVolume()}, region tag 0.
     */
    public FieldSampleModel toSampleModel(String fieldName) {
        ImageVolume image = squeezed();
        if (image.shape.length != 3) {
            throw new InvalidFieldException("only 3D images convert to samples, got " + Arrays.toString(image.shape));
        }
        int nx = image.shape[0], ny = image.shape[1], nz = image.shape[2];
        Vec3[] positions = new Vec3[image.data.length];
        int idx = 0;
        for (int i = 0; i < nx; i++) {
            for (int j = 0; j < ny; j++) {
                for (int k = 0; k < nz; k++) {
                    positions[idx++] = image.worldPosition(i, j, k);
                }
            }
        }
        return FieldSampleModel.builder(FieldKind.VOXEL)
                .positions(positions)
                .uniformWeight(image.voxelVolume())
                .regionTags(new int[positions.length])
                .scalarField(fieldName, image.data)
                .build();
    }
}
