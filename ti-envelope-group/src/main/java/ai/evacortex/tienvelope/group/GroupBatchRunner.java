/*
 * TI Envelope — Regional Field Statistics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tienvelope.group;

import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Runs one task per subject on a worker pool. A failing subject is logged and recorded; the rest
 * of the batch continues. Outcomes are returned in submission order.
 */
public final class GroupBatchRunner implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(GroupBatchRunner.class);

    private final ExecutorService executor;
    private final boolean ownsExecutor;

    public GroupBatchRunner() {
        this(Executors.newWorkStealingPool(), true);
    }

    public GroupBatchRunner(ExecutorService executor) {
        this(executor, false);
    }

    private GroupBatchRunner(ExecutorService executor, boolean ownsExecutor) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.ownsExecutor = ownsExecutor;
    }

    public <R> List<SubjectOutcome<R>> run(List<String> subjectIds, Function<String, R> task) {
        Objects.requireNonNull(task, "task must not be null");
        List<CompletableFuture<R>> futures = new ArrayList<>(subjectIds.size());
        for (String id : subjectIds) {
            futures.add(CompletableFuture.supplyAsync(() -> task.apply(id), executor));
        }

        List<SubjectOutcome<R>> outcomes = new ArrayList<>(subjectIds.size());
        int failed = 0;
        for (int i = 0; i < subjectIds.size(); i++) {
            String id = subjectIds.get(i);
            try {
                outcomes.add(SubjectOutcome.success(id, futures.get(i).join()));
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                LOG.warnf(cause, "Subject %s failed, skipping: %s", id, cause.getMessage());
                outcomes.add(SubjectOutcome.failed(id, cause));
                failed++;
            }
        }
        LOG.infof("Batch finished: %d succeeded, %d failed", subjectIds.size() - failed, failed);
        return outcomes;
    }

    /** Successful results in submission order. */
    public static <R> List<R> successes(List<SubjectOutcome<R>> outcomes) {
        return outcomes.stream().filter(SubjectOutcome::isSuccess).map(SubjectOutcome::result).toList();
    }

    @Override
    public void close() {
        if (!ownsExecutor) return;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) executor.shutdownNow();
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
