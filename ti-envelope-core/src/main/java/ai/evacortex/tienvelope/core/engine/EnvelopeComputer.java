/*
 * TI Envelope — Regional Field Statistics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tienvelope.core.engine;

import ai.evacortex.tienvelope.core.field.FieldPair;
import ai.evacortex.tienvelope.core.field.FieldSampleModel;
import ai.evacortex.tienvelope.core.field.MultipolarFieldSet;
import ai.evacortex.tienvelope.core.math.Vec3;
import org.jboss.logging.Logger;

import java.util.Locale;
import java.util.Objects;

/**
 * Derives envelope fields on a {@link FieldSampleModel} from its per-pair vector fields.
 *
 * <p>The kernel is chosen once from the {@code tienvelope.kernel} system property
 * ({@code java} or {@code parallel}, default {@code java}) unless one is passed explicitly.</p>
 */
public final class EnvelopeComputer {

    private static final Logger LOG = Logger.getLogger(EnvelopeComputer.class);

    public static final String TI_MAX = "TI_max";
    public static final String MTI_MAX = "TI_Max";
    public static final String TI_NORMAL = "TI_normal";

    private final EnvelopeKernel kernel;

    public EnvelopeComputer() {
        this(defaultKernel());
    }

    public EnvelopeComputer(EnvelopeKernel kernel) {
        this.kernel = Objects.requireNonNull(kernel, "kernel must not be null");
    }

    public static EnvelopeKernel defaultKernel() {
        return kernelFor(System.getProperty("tienvelope.kernel", "java"));
    }

    public static EnvelopeKernel kernelFor(String name) {
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "java":
                return new JavaEnvelopeKernel();
            case "parallel":
                return new ParallelEnvelopeKernel();
            default:
                throw new IllegalArgumentException("Unknown envelope kernel: " + name);
        }
    }

    public EnvelopeKernel kernel() {
        return kernel;
    }

    public Vec3[] tiVectors(FieldPair pair) {
        Objects.requireNonNull(pair, "pair must not be null");
        return kernel.tiVectors(pair.first(), pair.second());
    }

    public double[] maxTiAmplitude(FieldPair pair) {
        Objects.requireNonNull(pair, "pair must not be null");
        return kernel.maxTiAmplitude(pair.first(), pair.second());
    }

    public Vec3[] mtiVectors(MultipolarFieldSet fields) {
        return kernel.mtiVectors(fields);
    }

    public double[] mtiAmplitude(MultipolarFieldSet fields) {
        return kernel.mtiAmplitude(fields);
    }

    /**
     * Adds the bipolar envelope amplitude of two vector fields as a new scalar field.
     */
    public FieldSampleModel deriveMaxTi(FieldSampleModel model, String firstField, String secondField, String outputField) {
        FieldPair pair = FieldPair.of(model, firstField, secondField);
        double[] amplitude = kernel.maxTiAmplitude(pair.first(), pair.second());
        LOG.debugf("Derived %s from %s/%s over %d samples", outputField, firstField, secondField, pair.size());
        return model.withScalarField(outputField, amplitude);
    }

    /**
     * Adds the multipolar envelope amplitude of four vector fields, grouped as (a1, a2) and (b1, b2).
     */
    public FieldSampleModel deriveMti(FieldSampleModel model,
                                      String a1, String a2,
                                      String b1, String b2,
                                      String outputField) {
        MultipolarFieldSet fields = new MultipolarFieldSet(
                FieldPair.of(model, a1, a2),
                FieldPair.of(model, b1, b2));
        double[] amplitude = kernel.mtiAmplitude(fields);
        LOG.debugf("Derived %s from (%s, %s) x (%s, %s) over %d samples", outputField, a1, a2, b1, b2, fields.size());
        return model.withScalarField(outputField, amplitude);
    }

    /**
     * Adds the envelope amplitude along a per-sample direction field (e.g. surface normals).
     */
    public FieldSampleModel deriveDirectional(FieldSampleModel model,
                                              String firstField, String secondField,
                                              String directionField, String outputField) {
        double[] amplitude = kernel.directionalAmplitude(
                model.vectorField(firstField),
                model.vectorField(secondField),
                model.vectorField(directionField));
        return model.withScalarField(outputField, amplitude);
    }
}
