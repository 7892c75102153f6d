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

/**
 * {@code EnvelopeKernel} evaluates the temporal-interference envelope over whole sample arrays.
 *
 * <p>Every operation is a pure per-sample map: index {@code i} of the output depends only on index
 * {@code i} of the inputs, so implementations are free to split the work. All implementations must
 * produce bit-identical results to {@link TiEnvelope} applied sample by sample.</p>
 *
 * <p>The multipolar (mTI) envelope composes the bipolar algorithm with itself:</p>
 * <pre>
 *     TI_A = ti(Ea1, Ea2)
 *     TI_B = ti(Eb1, Eb2)
 *     mTI  = |ti(TI_A, TI_B)|
 * </pre>
 *
 * @see JavaEnvelopeKernel
 * @see ParallelEnvelopeKernel
 */
public interface EnvelopeKernel {

    /**
     * Computes the envelope vector for each sample.
     *
     * @param e1 field of the first electrode pair
     * @param e2 field of the second electrode pair
     * @return one envelope vector per sample
     * @throws IllegalArgumentException if the arrays differ in length
     * @throws NullPointerException if either array is {@code null}
     */
    Vec3[] tiVectors(Vec3[] e1, Vec3[] e2);

    /**
     * Computes the envelope amplitude {@code |ti(E1, E2)|} for each sample.
     *
     * @throws IllegalArgumentException if the arrays differ in length
     * @throws NullPointerException if either array is {@code null}
     */
    double[] maxTiAmplitude(Vec3[] e1, Vec3[] e2);

    /**
     * Computes the multipolar envelope vector {@code ti(ti(Ea1, Ea2), ti(Eb1, Eb2))}.
     *
     * @throws NullPointerException if the field set is {@code null}
     */
    Vec3[] mtiVectors(MultipolarFieldSet fields);

    /**
     * Computes the multipolar envelope amplitude.
     *
     * @throws NullPointerException if the field set is {@code null}
     */
    double[] mtiAmplitude(MultipolarFieldSet fields);

    /**
     * Computes the envelope amplitude along a per-sample direction (e.g. surface normals).
     *
     * @throws IllegalArgumentException if the arrays differ in length
     * @throws NullPointerException if any array is {@code null}
     */
    double[] directionalAmplitude(Vec3[] e1, Vec3[] e2, Vec3[] directions);
}
