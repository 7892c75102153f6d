/*
 * TI Envelope — Regional Field Statistics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tienvelope.group;

import ai.evacortex.tienvelope.core.stats.SubjectMetrics;

import java.util.Collection;
import java.util.List;
import java.util.function.Function;

/**
 * Group summary of mean, max, min and focality over subjects with a non-empty region.
 * Empty-region sentinels are counted in {@code excluded}.
 */
public record GroupStatistics(int subjects,
                              int excluded,
                              MetricStatistics mean,
                              MetricStatistics max,
                              MetricStatistics min,
                              MetricStatistics focality) {

    public static GroupStatistics of(Collection<SubjectMetrics> metrics) {
        List<SubjectMetrics> included = metrics.stream().filter(m -> !m.isEmpty()).toList();
        return new GroupStatistics(
                included.size(),
                metrics.size() - included.size(),
                collect(included, SubjectMetrics::meanValue),
                collect(included, SubjectMetrics::maxValue),
                collect(included, SubjectMetrics::minValue),
                collect(included, SubjectMetrics::focality));
    }

    private static MetricStatistics collect(List<SubjectMetrics> metrics, Function<SubjectMetrics, Double> metric) {
        return MetricStatistics.of(metrics.stream()
                .map(metric)
                .filter(v -> v != null && Double.isFinite(v))
                .mapToDouble(Double::doubleValue)
                .toArray());
    }
}
