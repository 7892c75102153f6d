/*
 * TI Envelope — Regional Field Statistics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tienvelope.core.field;

import ai.evacortex.tienvelope.core.exceptions.FieldNotFoundException;
import ai.evacortex.tienvelope.core.exceptions.InvalidFieldException;
import ai.evacortex.tienvelope.core.math.Vec3;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable set of field samples handed over by a mesh or voxel loader.
 *
 * <p>Geometry (positions, weights, region tags) is stored as parallel arrays and shared by every
 * named field. Index {@code i} refers to the same spatial location in all arrays. Arrays are not
 * copied; callers must not mutate them after handing them to the builder.</p>
 */
public final class FieldSampleModel {

    private final FieldKind kind;
    private final Vec3[] positions;
    private final double[] weights;
    private final int[] regionTags;
    private final Map<String, double[]> scalarFields;
    private final Map<String, Vec3[]> vectorFields;

    private FieldSampleModel(FieldKind kind,
                             Vec3[] positions,
                             double[] weights,
                             int[] regionTags,
                             Map<String, double[]> scalarFields,
                             Map<String, Vec3[]> vectorFields) {
        this.kind = kind;
        this.positions = positions;
        this.weights = weights;
        this.regionTags = regionTags;
        this.scalarFields = Collections.unmodifiableMap(scalarFields);
        this.vectorFields = Collections.unmodifiableMap(vectorFields);
    }

    public static Builder builder(FieldKind kind) {
        return new Builder(kind);
    }

    public FieldKind kind() {
        return kind;
    }

    public int size() {
        return positions.length;
    }

    public Vec3[] positions() {
        return positions;
    }

    public double[] weights() {
        return weights;
    }

    public int[] regionTags() {
        return regionTags;
    }

    public FieldSample sample(int index) {
        return new FieldSample(positions[index], weights[index], regionTags[index]);
    }

    public double totalWeight() {
        double sum = 0.0;
        for (double w : weights) sum += w;
        return sum;
    }

    public boolean hasScalarField(String name) {
        return scalarFields.containsKey(name);
    }

    public boolean hasVectorField(String name) {
        return vectorFields.containsKey(name);
    }

    public Set<String> scalarFieldNames() {
        return scalarFields.keySet();
    }

    public Set<String> vectorFieldNames() {
        return vectorFields.keySet();
    }

    public double[] scalarField(String name) {
        double[] values = scalarFields.get(name);
        if (values == null) throw new FieldNotFoundException(name);
        return values;
    }

    public Vec3[] vectorField(String name) {
        Vec3[] values = vectorFields.get(name);
        if (values == null) throw new FieldNotFoundException(name);
        return values;
    }

    /**
     * Returns a model sharing this geometry with one more scalar field, e.g. a derived TI_max field.
     */
    public FieldSampleModel withScalarField(String name, double[] values) {
        checkLength(name, values.length, size());
        Map<String, double[]> scalars = new LinkedHashMap<>(scalarFields);
        scalars.put(name, values);
        return new FieldSampleModel(kind, positions, weights, regionTags, scalars, new LinkedHashMap<>(vectorFields));
    }

    public FieldSampleModel withVectorField(String name, Vec3[] values) {
        checkLength(name, values.length, size());
        Map<String, Vec3[]> vectors = new LinkedHashMap<>(vectorFields);
        vectors.put(name, values);
        return new FieldSampleModel(kind, positions, weights, regionTags, new LinkedHashMap<>(scalarFields), vectors);
    }

    private static void checkLength(String name, int actual, int expected) {
        if (actual != expected) {
            throw new InvalidFieldException("field '" + name + "' has " + actual
                    + " samples, geometry has " + expected);
        }
    }

    public static final class Builder {

        private final FieldKind kind;
        private Vec3[] positions;
        private double[] weights;
        private int[] regionTags;
        private final Map<String, double[]> scalarFields = new LinkedHashMap<>();
        private final Map<String, Vec3[]> vectorFields = new LinkedHashMap<>();

        private Builder(FieldKind kind) {
            this.kind = Objects.requireNonNull(kind, "kind must not be null");
        }

        public Builder positions(Vec3[] positions) {
            this.positions = positions;
            return this;
        }

        public Builder weights(double[] weights) {
            this.weights = weights;
            return this;
        }

        /** Assigns the same weight to every sample, as for a voxel grid. */
        public Builder uniformWeight(double weight) {
            if (positions == null) {
                throw new IllegalStateException("positions must be set before a uniform weight");
            }
            double[] w = new double[positions.length];
            Arrays.fill(w, weight);
            this.weights = w;
            return this;
        }

        public Builder regionTags(int[] regionTags) {
            this.regionTags = regionTags;
            return this;
        }

        public Builder scalarField(String name, double[] values) {
            scalarFields.put(Objects.requireNonNull(name, "field name must not be null"), values);
            return this;
        }

        public Builder vectorField(String name, Vec3[] values) {
            vectorFields.put(Objects.requireNonNull(name, "field name must not be null"), values);
            return this;
        }

        public FieldSampleModel build() {
            if (positions == null) throw new InvalidFieldException("positions are required");
            int n = positions.length;
            if (weights == null) throw new InvalidFieldException("weights are required");
            if (regionTags == null) regionTags = new int[n];

            checkLength("weights", weights.length, n);
            checkLength("regionTags", regionTags.length, n);
            for (int i = 0; i < n; i++) {
                if (positions[i] == null) {
                    throw new InvalidFieldException("null position at index " + i);
                }
                if (!(weights[i] >= 0.0) || Double.isInfinite(weights[i])) {
                    throw new InvalidFieldException("weight at index " + i + " must be finite and >= 0, got " + weights[i]);
                }
            }
            scalarFields.forEach((name, values) -> checkLength(name, values.length, n));
            vectorFields.forEach((name, values) -> checkLength(name, values.length, n));

            return new FieldSampleModel(kind, positions, weights, regionTags,
                    new LinkedHashMap<>(scalarFields), new LinkedHashMap<>(vectorFields));
        }
    }
}
