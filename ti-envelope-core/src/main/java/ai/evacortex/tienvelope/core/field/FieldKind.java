/*
 * TI Envelope — Regional Field Statistics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tienvelope.core.field;

/**
 * Origin of the samples in a {@link FieldSampleModel}.
 * - MESH: one sample per tetrahedron, weight is the element volume in mm³.
 * - VOXEL: one sample per voxel, weight is the (uniform) voxel volume in mm³.
 */
public enum FieldKind {
    MESH,
    VOXEL
}
