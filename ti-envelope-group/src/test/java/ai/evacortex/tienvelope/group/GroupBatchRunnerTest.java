/*
 * TI Envelope — Regional Field Statistics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tienvelope.group;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class GroupBatchRunnerTest {

    @Test
    void failuresAreRecordedAndBatchContinues() {
        List<String> subjects = List.of("101", "102", "bad", "104", "105");
        try (GroupBatchRunner runner = new GroupBatchRunner()) {
            List<SubjectOutcome<Integer>> outcomes = runner.run(subjects, id -> {
                if (id.equals("bad")) throw new IllegalStateException("mesh missing for " + id);
                return Integer.parseInt(id);
            });

            assertEquals(subjects.size(), outcomes.size());
            for (int i = 0; i < subjects.size(); i++) {
                assertEquals(subjects.get(i), outcomes.get(i).subjectId(), "order must follow submission");
            }
            SubjectOutcome<Integer> failed = outcomes.get(2);
            assertFalse(failed.isSuccess());
            assertInstanceOf(IllegalStateException.class, failed.failure());
            assertNull(failed.result());

            assertEquals(List.of(101, 102, 104, 105), GroupBatchRunner.successes(outcomes));
        }
    }

    @Test
    void externalExecutorIsNotShutDown() {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            try (GroupBatchRunner runner = new GroupBatchRunner(executor)) {
                assertEquals(List.of("A", "B"),
                        GroupBatchRunner.successes(runner.run(List.of("a", "b"), String::toUpperCase)));
            }
            assertFalse(executor.isShutdown());
        } finally {
            executor.shutdownNow();
        }
    }
}
