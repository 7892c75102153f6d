/*
 * TI Envelope — Regional Field Statistics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tienvelope.group;

import ai.evacortex.tienvelope.core.exceptions.AffineMismatchException;
import ai.evacortex.tienvelope.core.exceptions.ShapeMismatchException;
import ai.evacortex.tienvelope.core.field.ImageVolume;
import ai.evacortex.tienvelope.core.stats.SubjectMetrics;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Combines per-subject results across a group: voxelwise averages, high-value intersections and
 * pairwise percent differences. Images must share shape and affine.
 */
public final class GroupAggregator {

    private static final Logger LOG = Logger.getLogger(GroupAggregator.class);

    private final HighValueWindowCache windows;

    public GroupAggregator() {
        this(new HighValueWindowCache());
    }

    public GroupAggregator(HighValueWindowCache windows) {
        this.windows = Objects.requireNonNull(windows, "windows must not be null");
    }

    /**
     * Voxelwise mean.
     *
     * @throws ShapeMismatchException  if any image differs in shape from the first
     * @throws AffineMismatchException if any affine differs from the first beyond tolerance
     */
    public ImageVolume average(List<ImageVolume> images) {
        List<ImageVolume> checked = checkCompatible(images);
        ImageVolume reference = checked.get(0);
        int n = reference.voxelCount();
        double[] sum = new double[n];
        for (ImageVolume image : checked) {
            double[] data = image.data();
            for (int v = 0; v < n; v++) sum[v] += data[v];
        }
        int count = checked.size();
        for (int v = 0; v < n; v++) sum[v] /= count;
        LOG.debugf("Averaged %d images of %d voxels", count, n);
        return reference.withData(sum);
    }

    /**
     * Non-zero voxels that lie within the {@code [pLow, pHigh]} grid-percentile window of at least
     * {@code minOverlap} images. Those voxels carry the mean over the images that contributed;
     * all others carry {@code fillValue}.
     */
    public IntersectionResult intersectHighValues(List<ImageVolume> images, IntersectionOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        List<ImageVolume> checked = checkCompatible(images);
        int imageCount = checked.size();
        int minOverlap = options.minOverlapFor(imageCount);

        ImageVolume reference = checked.get(0);
        int n = reference.voxelCount();
        double[] sum = new double[n];
        int[] count = new int[n];
        for (int idx = 0; idx < imageCount; idx++) {
            ImageVolume image = checked.get(idx);
            double[] window = windows.window(image, options.pLow(), options.pHigh());
            double low = window[0];
            double high = window[1];
            LOG.debugf("Image %d: %.1f-%.1f percentile window [%.6f, %.6f]",
                    idx, options.pLow(), options.pHigh(), low, high);
            double[] data = image.data();
            for (int v = 0; v < n; v++) {
                double value = data[v];
                if (value != 0.0 && value >= low && value <= high) {
                    sum[v] += value;
                    count[v]++;
                }
            }
        }

        double[] out = new double[n];
        int voxels = 0;
        for (int v = 0; v < n; v++) {
            if (count[v] >= minOverlap) {
                out[v] = sum[v] / count[v];
                voxels++;
            } else {
                out[v] = options.fillValue();
            }
        }
        LOG.infof("High-value intersection: %d voxels in >= %d of %d images", voxels, minOverlap, imageCount);
        return new IntersectionResult(reference.withData(out), voxels, minOverlap, imageCount);
    }

    public PercentDifference percentDifference(double a, double b) {
        return PercentDifference.of(a, b);
    }

    /**
     * Every subject pair {@code (i, j), i < j}, in input order. Subjects whose region was empty
     * are skipped.
     *
     * @throws IllegalArgumentException if fewer than 2 subjects have a non-empty region
     */
    public List<PairwiseComparison> compareSubjects(List<SubjectMetrics> all) {
        List<SubjectMetrics> metrics = new ArrayList<>(all.size());
        for (SubjectMetrics m : all) {
            if (m.isEmpty()) {
                LOG.warnf("Skipping subject %s: region '%s' is empty", m.subjectId(), m.roiName());
            } else {
                metrics.add(m);
            }
        }
        if (metrics.size() < 2) {
            throw new IllegalArgumentException("At least 2 subjects with data are required, got " + metrics.size());
        }
        List<PairwiseComparison> out = new ArrayList<>();
        for (int i = 0; i < metrics.size(); i++) {
            for (int j = i + 1; j < metrics.size(); j++) {
                SubjectMetrics a = metrics.get(i);
                SubjectMetrics b = metrics.get(j);
                if (!Objects.equals(a.roiName(), b.roiName())) {
                    LOG.warnf("Comparing different regions: '%s' (%s) vs '%s' (%s)",
                            a.roiName(), a.subjectId(), b.roiName(), b.subjectId());
                }
                PercentDifference min = a.minValue() == null || b.minValue() == null
                        ? null
                        : PercentDifference.of(a.minValue(), b.minValue());
                out.add(new PairwiseComparison(a.subjectId(), b.subjectId(), a.roiName(),
                        PercentDifference.of(a.meanValue(), b.meanValue()),
                        PercentDifference.of(a.maxValue(), b.maxValue()),
                        min));
            }
        }
        return out;
    }

    private static List<ImageVolume> checkCompatible(List<ImageVolume> images) {
        Objects.requireNonNull(images, "images must not be null");
        if (images.isEmpty()) {
            throw new IllegalArgumentException("At least one image is required");
        }
        List<ImageVolume> squeezed = new ArrayList<>(images.size());
        for (ImageVolume image : images) squeezed.add(Objects.requireNonNull(image, "image").squeezed());

        ImageVolume reference = squeezed.get(0);
        for (int i = 1; i < squeezed.size(); i++) {
            ImageVolume image = squeezed.get(i);
            if (!image.sameShape(reference)) {
                throw new ShapeMismatchException("image[" + i + "]", image.shape(), reference.shape());
            }
            if (!image.affineMatches(reference, ImageVolume.AFFINE_ATOL)) {
                throw new AffineMismatchException("image[" + i + "]", ImageVolume.AFFINE_ATOL);
            }
        }
        return squeezed;
    }
}
