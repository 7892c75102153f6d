/*
 * TI Envelope — Regional Field Statistics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tienvelope.core.field;

import ai.evacortex.tienvelope.core.math.Vec3;

/**
 * Geometry of a single sample: element barycenter or voxel center, its volume weight and tissue tag.
 */
public record FieldSample(Vec3 position, double weight, int regionTag) {
}
