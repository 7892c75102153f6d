/*
 * TI Envelope — Regional Field Statistics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tienvelope.core.stats;

import ai.evacortex.tienvelope.core.region.RegionSpec;
import ai.evacortex.tienvelope.core.region.RoiDefinition;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One regional analysis: which subject, which scalar field, which region, optionally which
 * reference region for the focality ratio.
 */
public record AnalysisRequest(
        @JsonProperty("subject_id") String subjectId,
        @JsonProperty("field_name") String fieldName,
        @JsonProperty("roi") RoiDefinition roi,
        @JsonProperty("reference_region") @JsonInclude(JsonInclude.Include.NON_NULL) RegionSpec referenceRegion,
        @JsonProperty("options") StatisticsOptions options) {

    public AnalysisRequest {
        Objects.requireNonNull(subjectId, "subjectId must not be null");
        Objects.requireNonNull(fieldName, "fieldName must not be null");
        Objects.requireNonNull(roi, "roi must not be null");
        if (options == null) options = StatisticsOptions.defaultOptions();
    }

    public static AnalysisRequest of(String subjectId, String fieldName, RoiDefinition roi) {
        return new AnalysisRequest(subjectId, fieldName, roi, null, StatisticsOptions.defaultOptions());
    }

    public AnalysisRequest withReference(RegionSpec reference) {
        return new AnalysisRequest(subjectId, fieldName, roi, reference, options);
    }

    public AnalysisRequest withOptions(StatisticsOptions newOptions) {
        return new AnalysisRequest(subjectId, fieldName, roi, referenceRegion, newOptions);
    }
}
