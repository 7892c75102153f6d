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

import java.util.function.DoublePredicate;

/**
 * Parallel arrays of the scalar values, weights and positions of the samples inside a region.
 */
public record SelectedSamples(double[] values, double[] weights, Vec3[] positions) {

    private static final SelectedSamples EMPTY = new SelectedSamples(new double[0], new double[0], new Vec3[0]);

    public SelectedSamples {
        if (values.length != weights.length || values.length != positions.length) {
            throw new IllegalArgumentException("Mismatched lengths: values=" + values.length
                    + ", weights=" + weights.length + ", positions=" + positions.length);
        }
    }

    public static SelectedSamples empty() {
        return EMPTY;
    }

    public int size() {
        return values.length;
    }

    public boolean isEmpty() {
        return values.length == 0;
    }

    /** Copy with non-finite values removed. Returns {@code this} when all values are finite. */
    public SelectedSamples finiteOnly() {
        return keep(Double::isFinite);
    }

    /** Copy restricted to finite values {@code > 0}. Returns {@code this} when nothing is dropped. */
    public SelectedSamples positiveOnly() {
        return keep(v -> Double.isFinite(v) && v > 0.0);
    }

    private SelectedSamples keep(DoublePredicate accept) {
        int kept = 0;
        for (double v : values) if (accept.test(v)) kept++;
        if (kept == values.length) return this;

        double[] v = new double[kept];
        double[] w = new double[kept];
        Vec3[] p = new Vec3[kept];
        int j = 0;
        for (int i = 0; i < values.length; i++) {
            if (!accept.test(values[i])) continue;
            v[j] = values[i];
            w[j] = weights[i];
            p[j] = positions[i];
            j++;
        }
        return new SelectedSamples(v, w, p);
    }

    public double totalWeight() {
        double sum = 0.0;
        for (double w : weights) sum += w;
        return sum;
    }
}
