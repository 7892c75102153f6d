/*
 * TI Envelope — Regional Field Statistics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tienvelope.core.math;

import ai.evacortex.tienvelope.core.FieldTestUtils;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static ai.evacortex.tienvelope.core.FieldTestUtils.assertVecEquals;
import static org.junit.jupiter.api.Assertions.*;

class TiEnvelopeTest {

    private static final double EPS = 1e-12;

    @Test
    @DisplayName("Equal fields give twice the field magnitude")
    void equalFields_doubleMagnitude() {
        Vec3 e = new Vec3(0.3, -0.4, 1.2);
        assertEquals(2.0 * e.norm(), TiEnvelope.maxTiAmplitude(e, e), EPS);
        assertVecEquals(e.scale(2.0), TiEnvelope.tiVector(e, e), EPS, "TI of identical fields");
    }

    @Test
    void orthogonalUnitVectors() {
        Vec3 ti = TiEnvelope.tiVector(new Vec3(1, 0, 0), new Vec3(0, 1, 0));
        assertVecEquals(new Vec3(0, 0, -Math.sqrt(2.0)), ti, EPS, "orthogonal unit fields");
    }

    @Test
    void collinearFields_followWeakerField() {
        Vec3 ti = TiEnvelope.tiVector(new Vec3(2, 0, 0), new Vec3(1, 0, 0));
        assertVecEquals(new Vec3(2, 0, 0), ti, EPS, "collinear fields");
    }

    @Test
    void antiParallelWeakField_isFlipped() {
        Vec3 ti = TiEnvelope.tiVector(new Vec3(2, 0, 0), new Vec3(-1, 0, 0));
        assertVecEquals(new Vec3(2, 0, 0), ti, EPS, "flipped weak field");
    }

    @Test
    void zeroInputs_giveZeroVector() {
        assertEquals(Vec3.ZERO.norm(), TiEnvelope.tiVector(Vec3.ZERO, Vec3.ZERO).norm(), 0.0);
        assertEquals(0.0, TiEnvelope.maxTiAmplitude(new Vec3(1, 2, 3), Vec3.ZERO), 0.0);
        assertEquals(0.0, TiEnvelope.maxTiAmplitude(Vec3.ZERO, new Vec3(1, 2, 3)), 0.0);
    }

    @Test
    void argumentOrderDoesNotMatter() {
        Vec3[] a = FieldTestUtils.randomVectors(500, 11);
        Vec3[] b = FieldTestUtils.randomVectors(500, 12);
        for (int i = 0; i < a.length; i++) {
            assertEquals(TiEnvelope.maxTiAmplitude(a[i], b[i]), TiEnvelope.maxTiAmplitude(b[i], a[i]), 1e-12,
                    "amplitude must be symmetric at " + i);
        }
    }

    @Test
    @DisplayName("Amplitude matches both regimes of the closed-form envelope maximum")
    void matchesClosedFormRegimes() {
        Vec3[] a = FieldTestUtils.randomVectors(2000, 21);
        Vec3[] b = FieldTestUtils.randomVectors(2000, 22);
        for (int i = 0; i < a.length; i++) {
            Vec3 e1 = a[i], e2 = b[i];
            if (e2.norm() > e1.norm()) {
                Vec3 t = e1;
                e1 = e2;
                e2 = t;
            }
            if (e1.dot(e2) < 0) e2 = e2.negate();

            double cos = e1.dot(e2) / (e1.norm() * e2.norm());
            double expected;
            if (e2.norm() <= e1.norm() * cos) {
                expected = 2.0 * e2.norm();
            } else {
                Vec3 h = e1.subtract(e2);
                Vec3 projection = h.scale(e2.dot(h) / h.normSquared());
                expected = 2.0 * e2.subtract(projection).norm();
            }
            assertEquals(expected, TiEnvelope.maxTiAmplitude(a[i], b[i]), 1e-9, "sample " + i);
        }
    }

    @Test
    void amplitudeNeverExceedsTwiceWeakerField() {
        Vec3[] a = FieldTestUtils.randomVectors(1000, 31);
        Vec3[] b = FieldTestUtils.randomVectors(1000, 32);
        for (int i = 0; i < a.length; i++) {
            double weak = Math.min(a[i].norm(), b[i].norm());
            assertTrue(TiEnvelope.maxTiAmplitude(a[i], b[i]) <= 2.0 * weak + 1e-12, "sample " + i);
        }
    }

    @Test
    void directionalAmplitude_alongAxis() {
        Vec3 e1 = new Vec3(1, 0, 0);
        Vec3 e2 = new Vec3(0.5, 0, 0);
        Vec3 n = new Vec3(2, 0, 0);
        // |(1.5) - (0.5)| = 1
        assertEquals(1.0, TiEnvelope.directionalAmplitude(e1, e2, n), EPS);
        assertEquals(0.0, TiEnvelope.directionalAmplitude(e1, e2, new Vec3(0, 1, 0)), EPS);
        assertEquals(0.0, TiEnvelope.directionalAmplitude(e1, e2, Vec3.ZERO), 0.0);
    }
}
