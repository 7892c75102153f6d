/*
 * TI Envelope — Regional Field Statistics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tienvelope.core.stats;

import ai.evacortex.tienvelope.core.FieldTestUtils;
import ai.evacortex.tienvelope.core.field.FieldSampleModel;
import ai.evacortex.tienvelope.core.math.Vec3;
import ai.evacortex.tienvelope.core.region.SelectedSamples;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class StatisticsEngineTest {

    private final StatisticsEngine engine = new StatisticsEngine();

    private static SelectedSamples samples(double[] values, double[] weights) {
        Vec3[] positions = new Vec3[values.length];
        for (int i = 0; i < values.length; i++) positions[i] = new Vec3(i, 0, 0);
        return new SelectedSamples(values, weights, positions);
    }

    /** Values 0..9 at x = 0..9 with unit weights. */
    private static SelectedSamples line() {
        FieldSampleModel model = FieldTestUtils.lineModel("v", 10);
        return new SelectedSamples(model.scalarField("v"), model.weights(), model.positions());
    }

    @Test
    void weightedMean_usesVolumes() {
        assertEquals(2.5, StatisticsEngine.weightedMean(new double[]{1, 2, 3, 4}, new double[]{1, 1, 1, 1}), 1e-12);
        assertEquals(1.5, StatisticsEngine.weightedMean(new double[]{1, 3}, new double[]{3, 1}), 1e-12);
        // all-zero weights fall back to equal weighting
        assertEquals(2.0, StatisticsEngine.weightedMean(new double[]{1, 3}, new double[]{0, 0}), 1e-12);
        assertTrue(Double.isNaN(StatisticsEngine.weightedMean(new double[0], new double[0])));
    }

    @Test
    void weightedPercentile_firstSampleReachingFraction() {
        SelectedSamples equal = samples(new double[]{4, 2, 1, 3}, new double[]{1, 1, 1, 1});
        List<PercentileResult> r = StatisticsEngine.weightedPercentiles(equal, new double[]{25, 50, 95, 100});
        assertEquals(1.0, r.get(0).value(), 0.0);
        assertEquals(2.0, r.get(1).value(), 0.0);
        assertEquals(4.0, r.get(2).value(), 0.0);
        assertEquals(4.0, r.get(3).value(), 0.0);

        SelectedSamples skewed = samples(new double[]{1, 2, 3, 4}, new double[]{3, 1, 1, 1});
        assertEquals(1.0, StatisticsEngine.weightedPercentiles(skewed, new double[]{50}).get(0).value(), 0.0);
    }

    @Test
    void percentileCentroid_isWeightedMeanOfPositionsAbove() {
        List<PercentileResult> r = StatisticsEngine.weightedPercentiles(line(), new double[]{50, 95});
        PercentileResult median = r.get(0);
        assertEquals(4.0, median.value(), 0.0);
        assertEquals(6.5, median.centroid().x, 1e-12);
        assertEquals(Math.sqrt(35.0 / 12.0), median.spread().x, 1e-12);
        assertEquals(0.0, median.spread().y, 0.0);

        PercentileResult top = r.get(1);
        assertEquals(9.0, top.value(), 0.0);
        assertEquals(new Vec3(9, 0, 0), top.centroid());
    }

    @Test
    void summarize_lineModel() {
        RegionSummary s = engine.summarize(line(), StatisticsOptions.defaultOptions());
        assertEquals(10, s.count());
        assertEquals(10.0, s.totalWeight(), 1e-12);
        assertEquals(4.5, s.mean(), 1e-12);
        assertEquals(9.0, s.max(), 0.0);
        assertEquals(0.0, s.min(), 0.0);
        assertEquals(new Vec3(9, 0, 0), s.argmax());
        assertEquals(3, s.percentiles().size());

        Map<Double, Double> volumes = s.focalityVolumes();
        assertEquals(0.005, volumes.get(50.0), 1e-12);
        assertEquals(0.003, volumes.get(75.0), 1e-12);
        assertEquals(0.001, volumes.get(90.0), 1e-12);
        assertEquals(0.001, volumes.get(95.0), 1e-12);
    }

    @Test
    void summarize_dropsNonFiniteValues() {
        SelectedSamples withNan = samples(new double[]{1, Double.NaN, 3, Double.POSITIVE_INFINITY},
                new double[]{1, 1, 1, 1});
        RegionSummary s = engine.summarize(withNan, StatisticsOptions.defaultOptions());
        assertEquals(2, s.count());
        assertEquals(2.0, s.mean(), 1e-12);
        assertEquals(3.0, s.max(), 0.0);
    }

    @Test
    void summarize_emptyGivesSentinel() {
        RegionSummary s = engine.summarize(SelectedSamples.empty(), StatisticsOptions.defaultOptions());
        assertTrue(s.isEmpty());
        assertEquals(0.0, s.mean(), 0.0);
        assertEquals(0.0, s.max(), 0.0);
        assertNull(s.min());
        assertTrue(s.percentiles().isEmpty());

        SelectedSamples allNan = samples(new double[]{Double.NaN}, new double[]{1});
        assertTrue(engine.summarize(allNan, StatisticsOptions.defaultOptions()).isEmpty());
    }

    @Test
    @DisplayName("Percentiles are non-decreasing and focality volumes non-increasing")
    void monotonicity() {
        Random r = new Random(2024);
        int n = 5000;
        double[] values = new double[n];
        double[] weights = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = Math.abs(r.nextGaussian());
            weights[i] = 0.1 + r.nextDouble();
        }
        SelectedSamples s = samples(values, weights);
        double[] ps = {10, 25, 50, 75, 90, 95, 99, 99.9};
        List<PercentileResult> results = StatisticsEngine.weightedPercentiles(s, ps);
        for (int i = 1; i < results.size(); i++) {
            assertTrue(results.get(i).value() >= results.get(i - 1).value(), "percentile " + ps[i]);
        }

        double reference = results.get(results.size() - 1).value();
        Map<Double, Double> volumes = StatisticsEngine.focalityVolumes(values, weights, reference,
                new double[]{10, 30, 50, 75, 90, 95, 100});
        List<Double> ordered = new ArrayList<>(volumes.values());
        for (int i = 1; i < ordered.size(); i++) {
            assertTrue(ordered.get(i) <= ordered.get(i - 1), "volume at cutoff index " + i);
        }
    }

    @Test
    void gridPercentile_interpolatesOverNonZeroFiniteValues() {
        double[] data = {0, 4, Double.NaN, 1, 3, 2, 0};
        assertEquals(2.5, StatisticsEngine.gridPercentile(data, 50), 1e-12);
        assertEquals(1.0, StatisticsEngine.gridPercentile(data, 0), 1e-12);
        assertEquals(4.0, StatisticsEngine.gridPercentile(data, 100), 1e-12);
        assertEquals(3.85, StatisticsEngine.gridPercentile(data, 95), 1e-12);
        assertTrue(Double.isNaN(StatisticsEngine.gridPercentile(new double[]{0, 0}, 50)));
        assertArrayEquals(new double[]{2.5, 4.0}, StatisticsEngine.gridPercentiles(data, 50, 100), 1e-12);
    }

    @Test
    void focalityRatio() {
        assertEquals(2.0, StatisticsEngine.focalityRatio(0.4, 0.2), 1e-12);
        assertNull(StatisticsEngine.focalityRatio(0.4, 0.0));
    }

    @Test
    void optionsValidation() {
        assertThrows(IllegalArgumentException.class, () -> new StatisticsOptions(new double[]{99, 95}, null));
        assertThrows(IllegalArgumentException.class, () -> new StatisticsOptions(new double[]{0}, null));
        assertThrows(IllegalArgumentException.class, () -> new StatisticsOptions(new double[]{101}, null));
        assertThrows(IllegalArgumentException.class, () -> new StatisticsOptions(new double[0], null));
        assertThrows(IllegalArgumentException.class, () -> new StatisticsOptions(new double[]{50}, new double[]{0}));
        assertEquals(99.9, StatisticsOptions.defaultOptions().referencePercentile(), 0.0);
    }
}
