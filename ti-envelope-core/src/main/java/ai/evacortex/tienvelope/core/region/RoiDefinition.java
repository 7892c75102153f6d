/*
 * TI Envelope — Regional Field Statistics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tienvelope.core.region;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Objects;

/**
 * A named region with its objective weight. A weight of {@code -1} marks a non-ROI whose field
 * should be minimized by focality-style optimizers; this engine only carries the flag.
 */
public record RoiDefinition(String name, RegionSpec region, double weight) {

    public static final double TARGET_WEIGHT = 1.0;
    public static final double NON_ROI_WEIGHT = -1.0;

    public RoiDefinition {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(region, "region must not be null");
    }

    public static RoiDefinition target(String name, RegionSpec region) {
        return new RoiDefinition(name, region, TARGET_WEIGHT);
    }

    /** "Everything else" relative to {@code roi}, restricted to {@code within} when given. */
    public static RoiDefinition everythingElse(String name, RegionSpec roi, RegionSpec within) {
        return new RoiDefinition(name, new RegionSpec.Complement(roi, within), NON_ROI_WEIGHT);
    }

    @JsonIgnore
    public boolean isNonRoi() {
        return weight < 0.0;
    }
}
