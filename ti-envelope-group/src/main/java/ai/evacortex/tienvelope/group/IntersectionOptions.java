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
 * Parameters of a high-value intersection. {@code minOverlap == null} requires every image.
 */
public record IntersectionOptions(double pLow, double pHigh, Integer minOverlap, double fillValue) {

    public static final double DEFAULT_P_LOW = 95.0;
    public static final double DEFAULT_P_HIGH = 99.9;

    public IntersectionOptions {
        if (!(pLow >= 0.0 && pHigh <= 100.0)) {
            throw new IllegalArgumentException("percentiles must lie in [0, 100]: " + pLow + ", " + pHigh);
        }
        if (!(pLow < pHigh)) {
            throw new IllegalArgumentException("pLow must be below pHigh: " + pLow + " >= " + pHigh);
        }
        if (minOverlap != null && minOverlap < 1) {
            throw new IllegalArgumentException("minOverlap must be >= 1, got " + minOverlap);
        }
    }

    public static IntersectionOptions defaultOptions() {
        return new IntersectionOptions(DEFAULT_P_LOW, DEFAULT_P_HIGH, null, 0.0);
    }

    public IntersectionOptions withMinOverlap(int overlap) {
        return new IntersectionOptions(pLow, pHigh, overlap, fillValue);
    }

    /** Effective overlap threshold for {@code imageCount} images. */
    public int minOverlapFor(int imageCount) {
        int overlap = minOverlap == null ? imageCount : minOverlap;
        if (overlap < 1 || overlap > imageCount) {
            throw new IllegalArgumentException(
                    "minOverlap must be within [1, " + imageCount + "], got " + overlap);
        }
        return overlap;
    }
}
