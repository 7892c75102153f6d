/*
 * TI Envelope — Regional Field Statistics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tienvelope.core.stats;

import ai.evacortex.tienvelope.core.math.Vec3;

/**
 * Value of one volume-weighted percentile with the weighted centroid and spread of the samples
 * at or above it.
 */
public record PercentileResult(double percentile, double value, Vec3 centroid, Vec3 spread) {
}
