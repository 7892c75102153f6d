/*
 * TI Envelope — Regional Field Statistics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tienvelope.group;

import ai.evacortex.tienvelope.core.field.ImageVolume;

/**
 * Intersection image plus the number of voxels where at least {@code minOverlap} of
 * {@code imageCount} images were in their high-value window.
 */
public record IntersectionResult(ImageVolume image, int voxelCount, int minOverlap, int imageCount) {
}
