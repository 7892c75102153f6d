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

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Statistics of one scalar field over one region. An empty summary has {@code count == 0},
 * zero mean and max, and no minimum, argmax or percentiles.
 */
public record RegionSummary(int count,
                            double totalWeight,
                            double mean,
                            double max,
                            Double min,
                            Vec3 argmax,
                            List<PercentileResult> percentiles,
                            Map<Double, Double> focalityVolumes) {

    private static final RegionSummary EMPTY = new RegionSummary(0, 0.0, 0.0, 0.0, null, null, List.of(), Map.of());

    public RegionSummary {
        percentiles = List.copyOf(percentiles);
        focalityVolumes = Collections.unmodifiableMap(new TreeMap<>(focalityVolumes));
    }

    public static RegionSummary empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return count == 0;
    }
}
