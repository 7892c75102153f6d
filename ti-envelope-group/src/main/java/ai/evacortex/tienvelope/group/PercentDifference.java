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
 * Symmetric percent difference {@code |a - b| / ((a + b) / 2) * 100}. When the pair mean is zero
 * there is no value and {@link #bothZero()} is true.
 */
public record PercentDifference(Double value) {

    private static final PercentDifference BOTH_ZERO = new PercentDifference(null);

    public static PercentDifference of(double a, double b) {
        if (!Double.isFinite(a) || !Double.isFinite(b)) {
            throw new IllegalArgumentException("values must be finite: " + a + ", " + b);
        }
        double mean = (a + b) / 2.0;
        if (mean == 0.0) return BOTH_ZERO;
        return new PercentDifference(Math.abs(a - b) / mean * 100.0);
    }

    public static PercentDifference bothZeroResult() {
        return BOTH_ZERO;
    }

    public boolean bothZero() {
        return value == null;
    }

    @Override
    public String toString() {
        return bothZero() ? "n/a (both zero)" : String.format("%.2f%%", value);
    }
}
