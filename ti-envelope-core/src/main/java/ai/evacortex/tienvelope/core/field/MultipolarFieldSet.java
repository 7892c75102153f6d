/*
 * TI Envelope — Regional Field Statistics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tienvelope.core.field;

import ai.evacortex.tienvelope.core.exceptions.InvalidFieldException;

import java.util.Objects;

/**
 * Four electrode-pair fields grouped by the caller into two bipolar pairs A and B.
 * The grouping is a configuration choice and is never derived here.
 */
public record MultipolarFieldSet(FieldPair pairA, FieldPair pairB) {

    public MultipolarFieldSet {
        Objects.requireNonNull(pairA, "pairA must not be null");
        Objects.requireNonNull(pairB, "pairB must not be null");
        if (pairA.size() != pairB.size()) {
            throw new InvalidFieldException("multipolar pairs differ in length: " + pairA.size() + " vs " + pairB.size());
        }
    }

    public int size() {
        return pairA.size();
    }
}
