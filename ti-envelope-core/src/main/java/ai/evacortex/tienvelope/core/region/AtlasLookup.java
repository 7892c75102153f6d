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

/**
 * Label of an atlas or mask volume at a world-space position.
 */
@FunctionalInterface
public interface AtlasLookup {
    int labelAt(Vec3 position);
}
