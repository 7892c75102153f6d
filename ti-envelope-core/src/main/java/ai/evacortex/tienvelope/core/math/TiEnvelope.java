/*
 * TI Envelope — Regional Field Statistics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tienvelope.core.math;

/**
 * Per-sample temporal-interference envelope algebra (Grossman et al., 2017).
 *
 * <p>For two sinusoidal fields E1·cos(2πf₁t) and E2·cos(2πf₂t) the envelope of the summed field
 * oscillates at |f₁ − f₂|. The vector returned by {@link #tiVector(Vec3, Vec3)} has the magnitude of
 * the largest envelope amplitude reachable over all relative phases, and points along the axis of
 * that oscillation.</p>
 *
 * <pre>
 *     1. order so that |E1| ≥ |E2|
 *     2. flip E2 if E1·E2 &lt; 0
 *     3. |E2| ≤ |E1|·cos α  →  TI = 2·E2
 *     4. otherwise          →  TI = 2·(E2 × (E1 − E2)) / |E1 − E2|
 * </pre>
 */
public final class TiEnvelope {

    private TiEnvelope() {}

    public static Vec3 tiVector(Vec3 e1, Vec3 e2) {
        Vec3 strong = e1;
        Vec3 weak = e2;
        double strongNorm = e1.norm();
        double weakNorm = e2.norm();
        if (weakNorm > strongNorm) {
            strong = e2;
            weak = e1;
            double t = strongNorm;
            strongNorm = weakNorm;
            weakNorm = t;
        }

        double dot = strong.dot(weak);
        if (dot < 0.0) {
            weak = weak.negate();
            dot = -dot;
        }

        // |E2| <= |E1|·cosα rewritten as |E2|² <= E1·E2, exact for identical inputs and zero vectors
        if (weakNorm * weakNorm <= dot) {
            return weak.scale(2.0);
        }

        Vec3 h = strong.subtract(weak);
        double hNorm = h.norm();
        if (hNorm == 0.0) {
            return weak.scale(2.0);
        }
        return weak.cross(h).scale(2.0 / hNorm);
    }

    public static double maxTiAmplitude(Vec3 e1, Vec3 e2) {
        return tiVector(e1, e2).norm();
    }

    /**
     * Envelope amplitude along a fixed direction n, e.g. the cortical surface normal:
     * {@code | |(E1 + E2)·n| − |(E1 − E2)·n| |}. A zero direction yields 0.
     */
    public static double directionalAmplitude(Vec3 e1, Vec3 e2, Vec3 direction) {
        double len = direction.norm();
        if (len == 0.0) return 0.0;
        Vec3 n = direction.scale(1.0 / len);
        double sum = Math.abs(e1.add(e2).dot(n));
        double diff = Math.abs(e1.subtract(e2).dot(n));
        return Math.abs(sum - diff);
    }
}
