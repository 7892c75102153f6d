/*
 * TI Envelope — Regional Field Statistics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tienvelope.core.region;

import ai.evacortex.tienvelope.core.math.Vec3;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Reproducible point cloud inside a sphere, used to probe the field around a target coordinate.
 * Point 0 is always the center; the rest come from rejection sampling in the unit ball with a
 * fixed seed, scaled by the radius.
 */
public final class SphereSampler {

    public static final double DEFAULT_RADIUS = 3.0;
    public static final int DEFAULT_POINTS = 20;
    public static final long DEFAULT_SEED = 42L;

    private SphereSampler() {
    }

    public static List<Vec3> sample(Vec3 center) {
        return sample(center, DEFAULT_RADIUS, DEFAULT_POINTS, DEFAULT_SEED);
    }

    public static List<Vec3> sample(Vec3 center, double radius, int count, long seed) {
        Objects.requireNonNull(center, "center must not be null");
        if (!(radius >= 0.0) || Double.isInfinite(radius)) {
            throw new IllegalArgumentException("radius must be finite and >= 0, got " + radius);
        }
        if (count < 1) throw new IllegalArgumentException("count must be >= 1, got " + count);

        List<Vec3> points = new ArrayList<>(count);
        points.add(center);
        Random rnd = new Random(seed);
        while (points.size() < count) {
            double x = 2.0 * rnd.nextDouble() - 1.0;
            double y = 2.0 * rnd.nextDouble() - 1.0;
            double z = 2.0 * rnd.nextDouble() - 1.0;
            if (x * x + y * y + z * z > 1.0) continue;
            points.add(new Vec3(center.x + x * radius, center.y + y * radius, center.z + z * radius));
        }
        return List.copyOf(points);
    }
}
