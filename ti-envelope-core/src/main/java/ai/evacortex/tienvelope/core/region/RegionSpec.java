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
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Region-of-interest definition. Each variant carries only the fields it needs.
 *
 * <ul>
 *     <li>{@link Sphere}: samples within {@code radius} mm of {@code center}</li>
 *     <li>{@link TagSet}: samples whose tissue tag is one of {@code tags}</li>
 *     <li>{@link AtlasMask}: samples whose atlas label equals {@code label}</li>
 *     <li>{@link Combined}: union, intersection or difference of two regions</li>
 *     <li>{@link Complement}: everything outside a region, optionally within a parent region</li>
 * </ul>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = RegionSpec.Sphere.class, name = "sphere"),
        @JsonSubTypes.Type(value = RegionSpec.TagSet.class, name = "tags"),
        @JsonSubTypes.Type(value = RegionSpec.AtlasMask.class, name = "atlas"),
        @JsonSubTypes.Type(value = RegionSpec.Combined.class, name = "combined"),
        @JsonSubTypes.Type(value = RegionSpec.Complement.class, name = "complement")
})
public sealed interface RegionSpec {

    /** Tissue tag of grey matter in head meshes. */
    int GREY_MATTER_TAG = 2;

    String describe();

    static TagSet greyMatter() {
        return new TagSet(Set.of(GREY_MATTER_TAG));
    }

    record Sphere(Vec3 center, double radius) implements RegionSpec {
        public Sphere {
            Objects.requireNonNull(center, "center must not be null");
            if (!(radius >= 0.0) || Double.isInfinite(radius)) {
                throw new IllegalArgumentException("radius must be finite and >= 0, got " + radius);
            }
        }

        @Override
        public String describe() {
            return String.format("sphere_x%.2f_y%.2f_z%.2f_r%.1f", center.x, center.y, center.z, radius);
        }
    }

    record TagSet(Set<Integer> tags) implements RegionSpec {
        public TagSet {
            Objects.requireNonNull(tags, "tags must not be null");
            if (tags.isEmpty()) throw new IllegalArgumentException("at least one tag is required");
            tags = Set.copyOf(tags);
        }

        @Override
        public String describe() {
            return "tags" + new TreeSet<>(tags);
        }
    }

    record AtlasMask(String atlasPath, int label) implements RegionSpec {
        public AtlasMask {
            Objects.requireNonNull(atlasPath, "atlasPath must not be null");
        }

        @Override
        public String describe() {
            return "atlas[" + atlasPath + "]#" + label;
        }
    }

    record Combined(RegionSpec left, SetOperator operator, RegionSpec right) implements RegionSpec {
        public Combined {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(operator, "operator must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }

        @Override
        public String describe() {
            return "(" + left.describe() + " " + operator.name().toLowerCase() + " " + right.describe() + ")";
        }
    }

    /** Samples outside {@code region}, restricted to {@code within} when it is not null. */
    record Complement(RegionSpec region,
                      @JsonInclude(JsonInclude.Include.NON_NULL) RegionSpec within) implements RegionSpec {
        @JsonCreator
        public Complement {
            Objects.requireNonNull(region, "region must not be null");
        }

        public Complement(RegionSpec region) {
            this(region, null);
        }

        @Override
        public String describe() {
            return within == null
                    ? "not " + region.describe()
                    : within.describe() + " not " + region.describe();
        }
    }
}
