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
import ai.evacortex.tienvelope.core.field.FieldKind;
import ai.evacortex.tienvelope.core.field.FieldSampleModel;
import ai.evacortex.tienvelope.core.math.Vec3;
import ai.evacortex.tienvelope.core.region.RegionSelector;
import ai.evacortex.tienvelope.core.region.RegionSpec;
import ai.evacortex.tienvelope.core.region.RoiDefinition;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RegionalAnalyzerTest {

    private static final String FIELD = "TI_max";

    private final FieldSampleModel model = FieldTestUtils.lineModel(FIELD, 10);

    @Test
    void analyze_sphereWithReference() {
        RegionalAnalyzer analyzer = new RegionalAnalyzer();
        RoiDefinition roi = RoiDefinition.target("target", new RegionSpec.Sphere(new Vec3(8, 0, 0), 1.0));
        AnalysisRequest request = AnalysisRequest.of("101", FIELD, roi)
                .withReference(new RegionSpec.Sphere(new Vec3(4.5, 0, 0), 100.0));

        SubjectMetrics m = analyzer.analyze(model, request);
        assertEquals("101", m.subjectId());
        assertEquals(FIELD, m.fieldName());
        assertEquals("target", m.roiName());
        assertEquals(3, m.elementCount());
        assertEquals(8.0, m.meanValue(), 1e-12);
        assertEquals(9.0, m.maxValue(), 0.0);
        assertEquals(7.0, m.minValue(), 0.0);
        // the zero-valued sample at x = 0 is not part of the reference
        assertEquals(5.0, m.referenceMean(), 1e-12);
        assertEquals(8.0 / 5.0, m.focality(), 1e-12);
        assertEquals(new Vec3(9, 0, 0), m.xyzMax());
        assertEquals(3, m.percentileValues().size());
        assertEquals(3, m.xyzPercentiles().size());
        assertEquals(3, m.xyzStdPercentiles().size());
        assertEquals(4, m.focalityVolumes().size());
        assertTrue(m.focalityVolumes().containsKey("50"));
        assertFalse(m.isEmpty());
    }

    @Test
    void analyze_withoutReference_hasNoFocality() {
        RoiDefinition roi = RoiDefinition.target("all", new RegionSpec.Sphere(new Vec3(0, 0, 0), 100.0));
        SubjectMetrics m = new RegionalAnalyzer().analyze(model, AnalysisRequest.of("s", FIELD, roi));
        assertNull(m.focality());
        assertNull(m.referenceMean());
        assertEquals(5.0, m.meanValue(), 1e-12);
    }

    @Test
    void analyze_excludesNonPositiveSamplesByDefault() {
        FieldSampleModel withZeros = FieldSampleModel.builder(FieldKind.MESH)
                .positions(new Vec3[]{new Vec3(0, 0, 0), new Vec3(1, 0, 0), new Vec3(2, 0, 0),
                        new Vec3(3, 0, 0), new Vec3(20, 0, 0)})
                .uniformWeight(1.0)
                .scalarField(FIELD, new double[]{0.0, 2.0, 0.0, 4.0, 1.0})
                .build();
        RoiDefinition roi = RoiDefinition.target("sphere", new RegionSpec.Sphere(new Vec3(1.5, 0, 0), 2.0));
        AnalysisRequest request = AnalysisRequest.of("s", FIELD, roi)
                .withReference(new RegionSpec.Sphere(Vec3.ZERO, 100.0));

        SubjectMetrics positive = new RegionalAnalyzer().analyze(withZeros, request);
        assertEquals(2, positive.elementCount());
        assertEquals(3.0, positive.meanValue(), 1e-12);
        assertEquals(2.0, positive.minValue(), 0.0);
        assertEquals(7.0 / 3.0, positive.referenceMean(), 1e-12);
        assertEquals(3.0 / (7.0 / 3.0), positive.focality(), 1e-12);

        SubjectMetrics all = new RegionalAnalyzer().analyze(withZeros,
                request.withOptions(StatisticsOptions.defaultOptions().withPositiveOnly(false)));
        assertEquals(4, all.elementCount());
        assertEquals(1.5, all.meanValue(), 1e-12);
        assertEquals(0.0, all.minValue(), 0.0);
        assertEquals(7.0 / 5.0, all.referenceMean(), 1e-12);
    }

    @Test
    void analyze_regionWithOnlyZerosIsEmpty() {
        RoiDefinition roi = RoiDefinition.target("origin", new RegionSpec.Sphere(Vec3.ZERO, 0.5));
        SubjectMetrics m = new RegionalAnalyzer().analyze(model, AnalysisRequest.of("s", FIELD, roi));
        assertTrue(m.isEmpty());
        assertNull(m.minValue());
    }

    @Test
    void analyze_emptyRegionGivesSentinel() {
        RoiDefinition roi = RoiDefinition.target("nowhere", new RegionSpec.Sphere(new Vec3(50, 50, 50), 1.0));
        SubjectMetrics m = new RegionalAnalyzer().analyze(model, AnalysisRequest.of("s", FIELD, roi)
                .withReference(new RegionSpec.Sphere(Vec3.ZERO, 100.0)));
        assertTrue(m.isEmpty());
        assertEquals(0.0, m.meanValue(), 0.0);
        assertEquals(0.0, m.maxValue(), 0.0);
        assertNull(m.minValue());
        assertNull(m.focality());
        assertTrue(m.percentileValues().isEmpty());
    }

    @Test
    void analyze_emptyReferenceSkipsFocality() {
        RoiDefinition roi = RoiDefinition.target("all", new RegionSpec.Sphere(Vec3.ZERO, 100.0));
        SubjectMetrics m = new RegionalAnalyzer().analyze(model, AnalysisRequest.of("s", FIELD, roi)
                .withReference(new RegionSpec.Sphere(new Vec3(50, 50, 50), 1.0)));
        assertNull(m.focality());
        assertFalse(m.isEmpty());
    }

    @Test
    void analyzeAtlas_keepsGoingAfterFailures() {
        RegionalAnalyzer analyzer = new RegionalAnalyzer(
                new RegionSelector(path -> p -> p.x < 5 ? 1 : 2), new StatisticsEngine());
        Map<String, Integer> labels = new LinkedHashMap<>();
        labels.put("left", 1);
        labels.put("right", 2);
        labels.put("absent", 3);

        Map<String, SubjectMetrics> results = analyzer.analyzeAtlas(model, "s", FIELD, "atlas.nii.gz", labels,
                StatisticsOptions.defaultOptions());
        assertEquals(3, results.size());
        assertEquals(2.5, results.get("left").meanValue(), 1e-12);
        assertEquals(7.0, results.get("right").meanValue(), 1e-12);
        assertTrue(results.get("absent").isEmpty());

        Map<String, SubjectMetrics> missingField = analyzer.analyzeAtlas(model, "s", "magnE", "atlas.nii.gz", labels,
                StatisticsOptions.defaultOptions());
        assertTrue(missingField.isEmpty());
    }

    @Test
    void nonRoiDefinitions() {
        RoiDefinition rest = RoiDefinition.everythingElse("rest", new RegionSpec.Sphere(Vec3.ZERO, 2.0), null);
        assertTrue(rest.isNonRoi());
        assertEquals(7, new RegionalAnalyzer().mask(model, rest.region()).cardinality());
    }
}
