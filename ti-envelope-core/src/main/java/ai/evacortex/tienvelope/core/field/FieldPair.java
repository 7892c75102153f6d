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
import ai.evacortex.tienvelope.core.math.Vec3;

import java.util.Objects;

/**
 * Electric-field vectors of two electrode pairs sampled on the same mesh or grid.
 */
public record FieldPair(Vec3[] first, Vec3[] second) {

    public FieldPair {
        Objects.requireNonNull(first, "first field must not be null");
        Objects.requireNonNull(second, "second field must not be null");
        if (first.length != second.length) {
            throw new InvalidFieldException("pair fields differ in length: " + first.length + " vs " + second.length);
        }
    }

    public static FieldPair of(FieldSampleModel model, String firstField, String secondField) {
        return new FieldPair(model.vectorField(firstField), model.vectorField(secondField));
    }

    public int size() {
        return first.length;
    }
}
