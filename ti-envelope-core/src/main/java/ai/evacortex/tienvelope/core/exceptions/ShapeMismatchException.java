/*
 * TI Envelope — Regional Field Statistics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tienvelope.core.exceptions;

import java.util.Arrays;

/**
 * Two images or fields that must share dimensions do not.
 */
public class ShapeMismatchException extends RuntimeException {

    public ShapeMismatchException(String message) {
        super(message);
    }

    public ShapeMismatchException(String source, int[] shape, int[] referenceShape) {
        super("Shape mismatch: " + source + " has shape " + Arrays.toString(shape)
                + ", but reference has shape " + Arrays.toString(referenceShape));
    }
}
