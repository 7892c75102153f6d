/*
 * TI Envelope — Regional Field Statistics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tienvelope.group;

import ai.evacortex.tienvelope.core.field.ImageVolume;
import ai.evacortex.tienvelope.core.stats.SubjectMetrics;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Group-level workflows: load or analyze every subject through the batch runner, drop the ones
 * that failed, then aggregate the rest.
 */
public final class GroupAnalysis {

    private static final Logger LOG = Logger.getLogger(GroupAnalysis.class);

    static final int MIN_GROUP_SIZE = 2;

    private final GroupBatchRunner runner;
    private final GroupAggregator aggregator;

    public GroupAnalysis(GroupBatchRunner runner, GroupAggregator aggregator) {
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator must not be null");
    }

    public ImageVolume averageGroup(List<String> subjectIds, Function<String, ImageVolume> loader) {
        List<ImageVolume> images = load(subjectIds, loader);
        return aggregator.average(images);
    }

    public IntersectionResult intersectGroup(List<String> subjectIds, Function<String, ImageVolume> loader,
                                             IntersectionOptions options) {
        List<ImageVolume> images = load(subjectIds, loader);
        return aggregator.intersectHighValues(images, options);
    }

    public GroupStatistics summarize(List<String> subjectIds, Function<String, SubjectMetrics> analysis) {
        List<SubjectMetrics> metrics = GroupBatchRunner.successes(runner.run(subjectIds, analysis));
        GroupStatistics stats = GroupStatistics.of(metrics);
        LOG.infof("Group of %d: %d with data, %d empty", subjectIds.size(), stats.subjects(), stats.excluded());
        return stats;
    }

    public List<PairwiseComparison> compare(List<String> subjectIds, Function<String, SubjectMetrics> analysis) {
        return aggregator.compareSubjects(GroupBatchRunner.successes(runner.run(subjectIds, analysis)));
    }

    private List<ImageVolume> load(List<String> subjectIds, Function<String, ImageVolume> loader) {
        List<ImageVolume> images = GroupBatchRunner.successes(runner.run(subjectIds, loader));
        if (images.size() < MIN_GROUP_SIZE) {
            throw new IllegalStateException("Need at least " + MIN_GROUP_SIZE
                    + " loaded images for a group result, got " + images.size());
        }
        return images;
    }
}
