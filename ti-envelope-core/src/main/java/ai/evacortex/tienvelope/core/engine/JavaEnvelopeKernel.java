/*
 * TI Envelope — Regional Field Statistics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tienvelope.core.engine;

import ai.evacortex.tienvelope.core.field.MultipolarFieldSet;
import ai.evacortex.tienvelope.core.math.TiEnvelope;
import ai.evacortex.tienvelope.core.math.Vec3;

import java.util.Objects;

public final class JavaEnvelopeKernel implements EnvelopeKernel {

    @Override
    public Vec3[] tiVectors(Vec3[] e1, Vec3[] e2) {
        checkPair(e1, e2);
        Vec3[] out = new Vec3[e1.length];
        for (int i = 0; i < e1.length; i++) {
            out[i] = TiEnvelope.tiVector(e1[i], e2[i]);
        }
        return out;
    }

    @Override
    public double[] maxTiAmplitude(Vec3[] e1, Vec3[] e2) {
        checkPair(e1, e2);
        double[] out = new double[e1.length];
        for (int i = 0; i < e1.length; i++) {
            out[i] = TiEnvelope.maxTiAmplitude(e1[i], e2[i]);
        }
        return out;
    }

    @Override
    public Vec3[] mtiVectors(MultipolarFieldSet fields) {
        Objects.requireNonNull(fields, "field set must not be null");
        Vec3[] tiA = tiVectors(fields.pairA().first(), fields.pairA().second());
        Vec3[] tiB = tiVectors(fields.pairB().first(), fields.pairB().second());
        return tiVectors(tiA, tiB);
    }

    @Override
    public double[] mtiAmplitude(MultipolarFieldSet fields) {
        Objects.requireNonNull(fields, "field set must not be null");
        Vec3[] tiA = tiVectors(fields.pairA().first(), fields.pairA().second());
        Vec3[] tiB = tiVectors(fields.pairB().first(), fields.pairB().second());
        return maxTiAmplitude(tiA, tiB);
    }

    @Override
    public double[] directionalAmplitude(Vec3[] e1, Vec3[] e2, Vec3[] directions) {
        checkPair(e1, e2);
        Objects.requireNonNull(directions, "directions must not be null");
        if (directions.length != e1.length) {
            throw new IllegalArgumentException("Mismatched lengths: " + e1.length + " vs " + directions.length);
        }
        double[] out = new double[e1.length];
        for (int i = 0; i < e1.length; i++) {
            out[i] = TiEnvelope.directionalAmplitude(e1[i], e2[i], directions[i]);
        }
        return out;
    }

    static void checkPair(Vec3[] e1, Vec3[] e2) {
        if (e1 == null || e2 == null) {
            throw new NullPointerException("fields must not be null");
        }
        if (e1.length != e2.length) {
            throw new IllegalArgumentException("Mismatched lengths: " + e1.length + " vs " + e2.length);
        }
    }
}
