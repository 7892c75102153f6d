/*
 * TI Envelope — Regional Field Statistics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tienvelope.core.field;

import ai.evacortex.tienvelope.core.FieldTestUtils;
import ai.evacortex.tienvelope.core.exceptions.FieldNotFoundException;
import ai.evacortex.tienvelope.core.exceptions.InvalidFieldException;
import ai.evacortex.tienvelope.core.math.Vec3;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FieldSampleModelTest {

    private static Vec3[] positions(int n) {
        return FieldTestUtils.randomVectors(n, 7);
    }

    @Test
    void builderRejectsLengthMismatch() {
        assertThrows(InvalidFieldException.class, () -> FieldSampleModel.builder(FieldKind.MESH)
                .positions(positions(4))
                .weights(new double[]{1, 1, 1})
                .build());
        assertThrows(InvalidFieldException.class, () -> FieldSampleModel.builder(FieldKind.MESH)
                .positions(positions(4))
                .uniformWeight(1.0)
                .scalarField("v", new double[5])
                .build());
    }

    @Test
    void builderRejectsBadWeights() {
        assertThrows(InvalidFieldException.class, () -> FieldSampleModel.builder(FieldKind.MESH)
                .positions(positions(2))
                .weights(new double[]{1.0, -0.1})
                .build());
        assertThrows(InvalidFieldException.class, () -> FieldSampleModel.builder(FieldKind.MESH)
                .positions(positions(2))
                .weights(new double[]{Double.NaN, 1.0})
                .build());
        assertThrows(InvalidFieldException.class, () -> FieldSampleModel.builder(FieldKind.MESH)
                .positions(positions(2))
                .weights(new double[]{Double.POSITIVE_INFINITY, 1.0})
                .build());
    }

    @Test
    void uniformWeightNeedsPositions() {
        assertThrows(IllegalStateException.class,
                () -> FieldSampleModel.builder(FieldKind.VOXEL).uniformWeight(1.0));
    }

    @Test
    void fieldsAreLookedUpByName() {
        FieldSampleModel model = FieldTestUtils.lineModel("magnE", 5);
        assertEquals(5, model.size());
        assertEquals(5.0, model.totalWeight(), 1e-12);
        assertTrue(model.hasScalarField("magnE"));
        assertEquals(3.0, model.scalarField("magnE")[3], 0.0);
        assertEquals(new FieldSample(new Vec3(2, 0, 0), 1.0, 0), model.sample(2));
        assertThrows(FieldNotFoundException.class, () -> model.scalarField("TI_max"));
        assertThrows(FieldNotFoundException.class, () -> model.vectorField("E"));
    }

    @Test
    void withScalarField_checksLength() {
        FieldSampleModel model = FieldTestUtils.lineModel("magnE", 5);
        assertThrows(InvalidFieldException.class, () -> model.withScalarField("x", new double[4]));
        FieldSampleModel extended = model.withScalarField("x", new double[5]);
        assertTrue(extended.scalarFieldNames().contains("x"));
        assertFalse(model.scalarFieldNames().contains("x"));
    }

    @Test
    void fieldPairRequiresEqualLengths() {
        assertThrows(InvalidFieldException.class,
                () -> new FieldPair(FieldTestUtils.randomVectors(3, 1), FieldTestUtils.randomVectors(4, 2)));
    }
}
