/*
 * TI Envelope — Regional Field Statistics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tienvelope.core.stats;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;

/**
 * Percentiles and focality cutoffs for one analysis. The last percentile is the reference for
 * focality volumes. With {@code positiveOnly} (the default) samples whose value is not strictly
 * positive are left out of the region and of the reference region.
 */
public record StatisticsOptions(double[] percentiles,
                                double[] focalityCutoffs,
                                @JsonProperty("positive_only") boolean positiveOnly) {

    public static final double[] DEFAULT_PERCENTILES = {95.0, 99.0, 99.9};
    public static final double[] DEFAULT_FOCALITY_CUTOFFS = {50.0, 75.0, 90.0, 95.0};

    public StatisticsOptions {
        if (percentiles == null || percentiles.length == 0) {
            throw new IllegalArgumentException("at least one percentile is required");
        }
        for (int i = 0; i < percentiles.length; i++) {
            double p = percentiles[i];
            if (!(p > 0.0 && p <= 100.0)) {
                throw new IllegalArgumentException("percentile out of (0, 100]: " + p);
            }
            if (i > 0 && p <= percentiles[i - 1]) {
                throw new IllegalArgumentException("percentiles must be strictly increasing: "
                        + Arrays.toString(percentiles));
            }
        }
        if (focalityCutoffs == null) focalityCutoffs = new double[0];
        for (double c : focalityCutoffs) {
            if (!(c > 0.0 && c <= 100.0)) {
                throw new IllegalArgumentException("focality cutoff out of (0, 100]: " + c);
            }
        }
        percentiles = percentiles.clone();
        focalityCutoffs = focalityCutoffs.clone();
    }

    public StatisticsOptions(double[] percentiles, double[] focalityCutoffs) {
        this(percentiles, focalityCutoffs, true);
    }

    @JsonCreator
    static StatisticsOptions fromJson(@JsonProperty("percentiles") double[] percentiles,
                                      @JsonProperty("focality_cutoffs") double[] focalityCutoffs,
                                      @JsonProperty("positive_only") Boolean positiveOnly) {
        return new StatisticsOptions(percentiles, focalityCutoffs, positiveOnly == null || positiveOnly);
    }

    public static StatisticsOptions defaultOptions() {
        return new StatisticsOptions(DEFAULT_PERCENTILES, DEFAULT_FOCALITY_CUTOFFS, true);
    }

    public StatisticsOptions withPositiveOnly(boolean enabled) {
        return new StatisticsOptions(percentiles, focalityCutoffs, enabled);
    }

    @Override
    @JsonProperty("percentiles")
    public double[] percentiles() {
        return percentiles.clone();
    }

    @Override
    @JsonProperty("focality_cutoffs")
    public double[] focalityCutoffs() {
        return focalityCutoffs.clone();
    }

    public double referencePercentile() {
        return percentiles[percentiles.length - 1];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StatisticsOptions that)) return false;
        return positiveOnly == that.positiveOnly
                && Arrays.equals(percentiles, that.percentiles)
                && Arrays.equals(focalityCutoffs, that.focalityCutoffs);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * Arrays.hashCode(percentiles) + Arrays.hashCode(focalityCutoffs)) + Boolean.hashCode(positiveOnly);
    }

    @Override
    public String toString() {
        return "StatisticsOptions{percentiles=" + Arrays.toString(percentiles)
                + ", focalityCutoffs=" + Arrays.toString(focalityCutoffs)
                + ", positiveOnly=" + positiveOnly + "}";
    }
}
