/*
 * TI Envelope — Regional Field Statistics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tienvelope.core.stats;

import ai.evacortex.tienvelope.core.field.FieldSampleModel;
import ai.evacortex.tienvelope.core.region.RegionSelector;
import ai.evacortex.tienvelope.core.region.RegionSpec;
import ai.evacortex.tienvelope.core.region.RoiDefinition;
import ai.evacortex.tienvelope.core.region.RoiMask;
import ai.evacortex.tienvelope.core.region.SelectedSamples;
import org.jboss.logging.Logger;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Runs {@link AnalysisRequest}s against a sample model: select, subset, summarize.
 */
public final class RegionalAnalyzer {

    private static final Logger LOG = Logger.getLogger(RegionalAnalyzer.class);

    private final RegionSelector selector;
    private final StatisticsEngine engine;

    public RegionalAnalyzer() {
        this(new RegionSelector(), new StatisticsEngine());
    }

    public RegionalAnalyzer(RegionSelector selector, StatisticsEngine engine) {
        this.selector = Objects.requireNonNull(selector, "selector must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
    }

    public SubjectMetrics analyze(FieldSampleModel model, AnalysisRequest request) {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(request, "request must not be null");
        String fieldName = request.fieldName();
        RoiDefinition roi = request.roi();

        StatisticsOptions options = request.options();
        SelectedSamples samples = restrict(selector.select(model, roi.region(), fieldName), options);
        RegionSummary summary = engine.summarize(samples, options);
        if (summary.isEmpty()) {
            LOG.warnf("Subject %s: region '%s' (%s) contains no samples with %s %s values",
                    request.subjectId(), roi.name(), roi.region().describe(),
                    options.positiveOnly() ? "positive" : "finite", fieldName);
            return SubjectMetrics.empty(request.subjectId(), fieldName, roi.name());
        }

        Double referenceMean = null;
        if (request.referenceRegion() != null) {
            SelectedSamples reference = restrict(selector.select(model, request.referenceRegion(), fieldName), options)
                    .finiteOnly();
            if (reference.isEmpty()) {
                LOG.warnf("Subject %s: reference region %s is empty, focality not computed",
                        request.subjectId(), request.referenceRegion().describe());
            } else {
                referenceMean = StatisticsEngine.weightedMean(reference.values(), reference.weights());
            }
        }

        LOG.debugf("Subject %s: %s over '%s' n=%d mean=%.6f", request.subjectId(), fieldName, roi.name(),
                summary.count(), summary.mean());
        return SubjectMetrics.of(request.subjectId(), fieldName, roi.name(), summary, referenceMean);
    }

    /**
     * Analyzes every labelled region of an atlas. A region that fails is logged and left out;
     * an empty region yields sentinel metrics.
     */
    public Map<String, SubjectMetrics> analyzeAtlas(FieldSampleModel model, String subjectId, String fieldName,
                                                    String atlasPath, Map<String, Integer> labels,
                                                    StatisticsOptions options) {
        Map<String, SubjectMetrics> results = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> e : labels.entrySet()) {
            RoiDefinition roi = RoiDefinition.target(e.getKey(), new RegionSpec.AtlasMask(atlasPath, e.getValue()));
            try {
                results.put(e.getKey(), analyze(model, new AnalysisRequest(subjectId, fieldName, roi, null, options)));
            } catch (RuntimeException ex) {
                LOG.errorf(ex, "Subject %s: analysis of region '%s' failed", subjectId, e.getKey());
            }
        }
        LOG.infof("Subject %s: analyzed %d of %d atlas regions", subjectId, results.size(), labels.size());
        return results;
    }

    private static SelectedSamples restrict(SelectedSamples samples, StatisticsOptions options) {
        return options.positiveOnly() ? samples.positiveOnly() : samples;
    }

    public RoiMask mask(FieldSampleModel model, RegionSpec region) {
        return selector.select(model, region);
    }
}
