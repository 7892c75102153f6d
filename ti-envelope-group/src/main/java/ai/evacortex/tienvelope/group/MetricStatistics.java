/*
 * TI Envelope — Regional Field Statistics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tienvelope.group;

/**
 * Mean and sample standard deviation ({@code n - 1} denominator) of one metric across subjects.
 * {@code mean} is null for no values, {@code std} for fewer than two.
 */
public record MetricStatistics(Double mean, Double std, int n) {

    public static MetricStatistics of(double[] values) {
        int n = values.length;
        if (n == 0) return new MetricStatistics(null, null, 0);
        double sum = 0.0;
        for (double v : values) sum += v;
        double mean = sum / n;
        if (n < 2) return new MetricStatistics(mean, null, 1);
        double ss = 0.0;
        for (double v : values) ss += (v - mean) * (v - mean);
        return new MetricStatistics(mean, Math.sqrt(ss / (n - 1)), n);
    }
}
