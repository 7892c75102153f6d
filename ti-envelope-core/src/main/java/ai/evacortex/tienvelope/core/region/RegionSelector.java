/*
 * TI Envelope — Regional Field Statistics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tienvelope.core.region;

import ai.evacortex.tienvelope.core.exceptions.AtlasUnavailableException;
import ai.evacortex.tienvelope.core.field.FieldSampleModel;
import ai.evacortex.tienvelope.core.math.Vec3;
import org.jboss.logging.Logger;

import java.util.BitSet;
import java.util.Objects;

/**
 * Evaluates a {@link RegionSpec} against the samples of a model and extracts the selected
 * values of a scalar field.
 */
public final class RegionSelector {

    private static final Logger LOG = Logger.getLogger(RegionSelector.class);

    private final AtlasResolver atlasResolver;

    public RegionSelector() {
        this(AtlasResolver.NONE);
    }

    public RegionSelector(AtlasResolver atlasResolver) {
        this.atlasResolver = Objects.requireNonNull(atlasResolver, "atlasResolver must not be null");
    }

    public RoiMask select(FieldSampleModel model, RegionSpec region) {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(region, "region must not be null");
        RoiMask mask = evaluate(model, region);
        LOG.debugf("Region %s selected %d of %d samples", region.describe(), mask.cardinality(), model.size());
        return mask;
    }

    public SelectedSamples extract(FieldSampleModel model, RoiMask mask, String fieldName) {
        if (mask.domainSize() != model.size()) {
            throw new IllegalArgumentException(
                    "Mask covers " + mask.domainSize() + " samples, model has " + model.size());
        }
        double[] field = model.scalarField(fieldName);
        if (mask.isEmpty()) return SelectedSamples.empty();

        int[] idx = mask.indices();
        double[] values = new double[idx.length];
        double[] weights = new double[idx.length];
        Vec3[] positions = new Vec3[idx.length];
        double[] modelWeights = model.weights();
        Vec3[] modelPositions = model.positions();
        for (int n = 0; n < idx.length; n++) {
            int i = idx[n];
            values[n] = field[i];
            weights[n] = modelWeights[i];
            positions[n] = modelPositions[i];
        }
        return new SelectedSamples(values, weights, positions);
    }

    public SelectedSamples select(FieldSampleModel model, RegionSpec region, String fieldName) {
        // fail on a missing field before evaluating the region
        model.scalarField(fieldName);
        return extract(model, select(model, region), fieldName);
    }

    private RoiMask evaluate(FieldSampleModel model, RegionSpec region) {
        int n = model.size();
        if (region instanceof RegionSpec.Sphere sphere) {
            return sphere(model, sphere);
        }
        if (region instanceof RegionSpec.TagSet tagSet) {
            int[] tags = model.regionTags();
            BitSet bits = new BitSet(n);
            for (int i = 0; i < n; i++) {
                if (tagSet.tags().contains(tags[i])) bits.set(i);
            }
            return new RoiMask(bits, n, region);
        }
        if (region instanceof RegionSpec.AtlasMask atlas) {
            AtlasLookup lookup = resolve(atlas.atlasPath());
            Vec3[] positions = model.positions();
            BitSet bits = new BitSet(n);
            for (int i = 0; i < n; i++) {
                if (lookup.labelAt(positions[i]) == atlas.label()) bits.set(i);
            }
            return new RoiMask(bits, n, region);
        }
        if (region instanceof RegionSpec.Combined combined) {
            RoiMask left = evaluate(model, combined.left());
            RoiMask right = evaluate(model, combined.right());
            return left.combine(combined.operator(), right);
        }
        if (region instanceof RegionSpec.Complement complement) {
            RoiMask outside = evaluate(model, complement.region()).complement();
            if (complement.within() == null) return outside;
            return evaluate(model, complement.within()).combine(SetOperator.INTERSECTION, outside);
        }
        throw new IllegalArgumentException("Unsupported region: " + region.getClass().getName());
    }

    private static RoiMask sphere(FieldSampleModel model, RegionSpec.Sphere sphere) {
        Vec3[] positions = model.positions();
        double r2 = sphere.radius() * sphere.radius();
        Vec3 c = sphere.center();
        BitSet bits = new BitSet(positions.length);
        for (int i = 0; i < positions.length; i++) {
            Vec3 p = positions[i];
            double dx = p.x - c.x, dy = p.y - c.y, dz = p.z - c.z;
            if (dx * dx + dy * dy + dz * dz <= r2) bits.set(i);
        }
        return new RoiMask(bits, positions.length, sphere);
    }

    private AtlasLookup resolve(String atlasPath) {
        AtlasLookup lookup;
        try {
            lookup = atlasResolver.resolve(atlasPath);
        } catch (AtlasUnavailableException e) {
            throw e;
        } catch (Exception e) {
            throw new AtlasUnavailableException(atlasPath, e);
        }
        if (lookup == null) throw new AtlasUnavailableException(atlasPath);
        return lookup;
    }
}
