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
 * Percent differences of mean, max and min between two subjects' metrics for the same region.
 * {@code min} is null when either subject has no minimum.
 */
public record PairwiseComparison(String subjectA,
                                 String subjectB,
                                 String roiName,
                                 PercentDifference mean,
                                 PercentDifference max,
                                 PercentDifference min) {
}
