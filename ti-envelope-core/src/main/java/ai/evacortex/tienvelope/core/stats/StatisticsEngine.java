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
import ai.evacortex.tienvelope.core.region.SelectedSamples;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.IntStream;

/**
 * Volume-weighted statistics of a scalar field over selected samples.
 *
 * <p>Weights are element volumes in mm³ (tetrahedra or voxels). When every weight is zero the
 * samples are treated as equally weighted.</p>
 */
public final class StatisticsEngine {

    private static final Logger LOG = Logger.getLogger(StatisticsEngine.class);

    private static final double MM3_PER_CM3 = 1000.0;

    public RegionSummary summarize(SelectedSamples selected, StatisticsOptions options) {
        SelectedSamples samples = selected.finiteOnly();
        if (samples.size() < selected.size()) {
            LOG.debugf("Dropped %d non-finite values", selected.size() - samples.size());
        }
        if (samples.isEmpty()) return RegionSummary.empty();

        double[] values = samples.values();
        double[] weights = effectiveWeights(samples.weights());

        double max = Double.NEGATIVE_INFINITY;
        double min = Double.POSITIVE_INFINITY;
        int argmax = 0;
        for (int i = 0; i < values.length; i++) {
            if (values[i] > max) {
                max = values[i];
                argmax = i;
            }
            if (values[i] < min) min = values[i];
        }

        List<PercentileResult> percentiles = weightedPercentiles(samples, options.percentiles());
        double reference = percentiles.get(percentiles.size() - 1).value();
        Map<Double, Double> volumes = focalityVolumes(values, samples.weights(), reference, options.focalityCutoffs());

        double mean = weightedMean(values, weights);
        LOG.debugf("n=%d mean=%.6f max=%.6f min=%.6f", values.length, mean, max, min);
        return new RegionSummary(values.length, samples.totalWeight(), mean, max, min,
                samples.positions()[argmax], percentiles, volumes);
    }

    /** {@code Σ(v·w) / Σw}; NaN for no samples. */
    public static double weightedMean(double[] values, double[] weights) {
        if (values.length != weights.length) {
            throw new IllegalArgumentException("Mismatched lengths: " + values.length + " vs " + weights.length);
        }
        if (values.length == 0) return Double.NaN;
        double[] w = effectiveWeights(weights);
        double sum = 0.0, total = 0.0;
        for (int i = 0; i < values.length; i++) {
            sum += values[i] * w[i];
            total += w[i];
        }
        return sum / total;
    }

    /**
     * For each percentile {@code p}, the value of the first sample in ascending order whose
     * cumulative weight fraction reaches {@code p/100}, with the centroid and spread of the
     * samples at or above that value.
     */
    public static List<PercentileResult> weightedPercentiles(SelectedSamples samples, double[] percentiles) {
        int n = samples.size();
        if (n == 0) return List.of();
        double[] values = samples.values();
        double[] weights = effectiveWeights(samples.weights());
        Vec3[] positions = samples.positions();

        Integer[] boxed = IntStream.range(0, n).boxed().toArray(Integer[]::new);
        Arrays.sort(boxed, Comparator.comparingDouble(i -> values[i]));

        double[] cumulative = new double[n];
        double running = 0.0;
        for (int k = 0; k < n; k++) {
            running += weights[boxed[k]];
            cumulative[k] = running;
        }
        double total = cumulative[n - 1];

        List<PercentileResult> out = new ArrayList<>(percentiles.length);
        for (double p : percentiles) {
            double target = p / 100.0;
            int k = 0;
            while (k < n - 1 && cumulative[k] / total < target) k++;
            double value = values[boxed[k]];
            out.add(centroidAbove(values, weights, positions, p, value));
        }
        return out;
    }

    private static PercentileResult centroidAbove(double[] values, double[] weights, Vec3[] positions,
                                                  double percentile, double threshold) {
        double sw = 0.0, sx = 0.0, sy = 0.0, sz = 0.0;
        for (int i = 0; i < values.length; i++) {
            if (values[i] < threshold) continue;
            Vec3 p = positions[i];
            sw += weights[i];
            sx += weights[i] * p.x;
            sy += weights[i] * p.y;
            sz += weights[i] * p.z;
        }
        Vec3 mean = new Vec3(sx / sw, sy / sw, sz / sw);

        double vx = 0.0, vy = 0.0, vz = 0.0;
        for (int i = 0; i < values.length; i++) {
            if (values[i] < threshold) continue;
            Vec3 p = positions[i];
            vx += weights[i] * (p.x - mean.x) * (p.x - mean.x);
            vy += weights[i] * (p.y - mean.y) * (p.y - mean.y);
            vz += weights[i] * (p.z - mean.z) * (p.z - mean.z);
        }
        Vec3 spread = new Vec3(Math.sqrt(vx / sw), Math.sqrt(vy / sw), Math.sqrt(vz / sw));
        return new PercentileResult(percentile, threshold, mean, spread);
    }

    /**
     * Volume in cm³ of the samples whose value is at least {@code cutoff}% of {@code reference},
     * keyed by cutoff.
     */
    public static Map<Double, Double> focalityVolumes(double[] values, double[] weights,
                                                      double reference, double[] cutoffs) {
        Map<Double, Double> out = new TreeMap<>();
        for (double c : cutoffs) {
            double threshold = c / 100.0 * reference;
            double volume = 0.0;
            for (int i = 0; i < values.length; i++) {
                if (values[i] >= threshold) volume += weights[i];
            }
            out.put(c, volume / MM3_PER_CM3);
        }
        return out;
    }

    /**
     * Percentile of a grid image over its non-zero finite values, interpolating linearly between
     * the closest ranks. NaN when the image has no such value.
     */
    public static double gridPercentile(double[] data, double percentile) {
        if (!(percentile >= 0.0 && percentile <= 100.0)) {
            throw new IllegalArgumentException("percentile out of [0, 100]: " + percentile);
        }
        double[] nonZero = Arrays.stream(data).filter(v -> v != 0.0 && Double.isFinite(v)).sorted().toArray();
        if (nonZero.length == 0) return Double.NaN;
        return interpolate(nonZero, percentile);
    }

    /** Same as {@link #gridPercentile(double[], double)} for several percentiles with one sort. */
    public static double[] gridPercentiles(double[] data, double... percentiles) {
        double[] nonZero = Arrays.stream(data).filter(v -> v != 0.0 && Double.isFinite(v)).sorted().toArray();
        double[] out = new double[percentiles.length];
        for (int i = 0; i < percentiles.length; i++) {
            out[i] = nonZero.length == 0 ? Double.NaN : interpolate(nonZero, percentiles[i]);
        }
        return out;
    }

    private static double interpolate(double[] sorted, double percentile) {
        double rank = (sorted.length - 1) * percentile / 100.0;
        int lo = (int) Math.floor(rank);
        int hi = Math.min(lo + 1, sorted.length - 1);
        double frac = rank - lo;
        return sorted[lo] + (sorted[hi] - sorted[lo]) * frac;
    }

    /** Ratio of two region means; null when the reference mean is zero or not finite. */
    public static Double focalityRatio(double roiMean, double referenceMean) {
        if (referenceMean == 0.0 || !Double.isFinite(referenceMean) || !Double.isFinite(roiMean)) return null;
        return roiMean / referenceMean;
    }

    private static double[] effectiveWeights(double[] weights) {
        for (double w : weights) {
            if (w > 0.0) return weights;
        }
        double[] uniform = new double[weights.length];
        Arrays.fill(uniform, 1.0);
        return uniform;
    }
}
