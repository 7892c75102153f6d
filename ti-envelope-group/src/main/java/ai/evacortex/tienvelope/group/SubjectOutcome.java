/*
 * TI Envelope — Regional Field Statistics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tienvelope.group;

/**
 * Result of one subject's task in a batch: either a value or the failure that stopped it.
 */
public record SubjectOutcome<R>(String subjectId, R result, Throwable failure) {

    public static <R> SubjectOutcome<R> success(String subjectId, R result) {
        return new SubjectOutcome<>(subjectId, result, null);
    }

    public static <R> SubjectOutcome<R> failed(String subjectId, Throwable failure) {
        return new SubjectOutcome<>(subjectId, null, failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }
}
