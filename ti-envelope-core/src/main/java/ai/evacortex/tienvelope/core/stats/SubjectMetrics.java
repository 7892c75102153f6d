/*
 * TI Envelope — Regional Field Statistics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tienvelope.core.stats;

import ai.evacortex.tienvelope.core.math.Vec3;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-subject, per-region result of a regional analysis. Serialized with snake_case names.
 *
 * <p>An empty region yields the sentinel {@code mean_value = 0}, {@code max_value = 0},
 * {@code min_value = null} with no percentiles; see {@link #isEmpty()}.</p>
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record SubjectMetrics(
        @JsonProperty("subject_id") String subjectId,
        @JsonProperty("field_name") String fieldName,
        @JsonProperty("roi_name") String roiName,
        @JsonProperty("n_elements") int elementCount,
        @JsonProperty("total_volume") double totalVolume,
        @JsonProperty("mean_value") double meanValue,
        @JsonProperty("max_value") double maxValue,
        @JsonProperty("min_value") Double minValue,
        @JsonProperty("focality") Double focality,
        @JsonProperty("reference_mean") Double referenceMean,
        @JsonProperty("percentiles") List<Double> percentiles,
        @JsonProperty("percentile_values") List<Double> percentileValues,
        @JsonProperty("xyz_max") Vec3 xyzMax,
        @JsonProperty("xyz_percentiles") List<Vec3> xyzPercentiles,
        @JsonProperty("xyz_std_percentiles") List<Vec3> xyzStdPercentiles,
        @JsonProperty("focality_volumes") Map<String, Double> focalityVolumes) {

    public SubjectMetrics {
        percentiles = percentiles == null ? List.of() : List.copyOf(percentiles);
        percentileValues = percentileValues == null ? List.of() : List.copyOf(percentileValues);
        xyzPercentiles = xyzPercentiles == null ? List.of() : List.copyOf(xyzPercentiles);
        xyzStdPercentiles = xyzStdPercentiles == null ? List.of() : List.copyOf(xyzStdPercentiles);
        focalityVolumes = focalityVolumes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(focalityVolumes));
    }

    public static SubjectMetrics of(String subjectId, String fieldName, String roiName,
                                    RegionSummary summary, Double referenceMean) {
        List<Double> ps = new ArrayList<>();
        List<Double> values = new ArrayList<>();
        List<Vec3> centroids = new ArrayList<>();
        List<Vec3> spreads = new ArrayList<>();
        for (PercentileResult r : summary.percentiles()) {
            ps.add(r.percentile());
            values.add(r.value());
            centroids.add(r.centroid());
            spreads.add(r.spread());
        }
        Map<String, Double> volumes = new LinkedHashMap<>();
        summary.focalityVolumes().forEach((cutoff, cm3) -> volumes.put(cutoffKey(cutoff), cm3));

        Double focality = summary.isEmpty() || referenceMean == null
                ? null
                : StatisticsEngine.focalityRatio(summary.mean(), referenceMean);
        return new SubjectMetrics(subjectId, fieldName, roiName, summary.count(), summary.totalWeight(),
                summary.mean(), summary.max(), summary.min(), focality, referenceMean,
                ps, values, summary.argmax(), centroids, spreads, volumes);
    }

    public static SubjectMetrics empty(String subjectId, String fieldName, String roiName) {
        return of(subjectId, fieldName, roiName, RegionSummary.empty(), null);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return elementCount == 0;
    }

    /** "50", "99.9": cutoff without trailing zeros. */
    static String cutoffKey(double cutoff) {
        return BigDecimal.valueOf(cutoff).stripTrailingZeros().toPlainString();
    }
}
