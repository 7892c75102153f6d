/*
 * TI Envelope — Regional Field Statistics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tienvelope.core.exceptions;

/**
 * Two images live in different physical spaces.
 */
public class AffineMismatchException extends RuntimeException {

    public AffineMismatchException(String source, double tolerance) {
        super("Affine mismatch: " + source + " differs from the reference affine by more than " + tolerance);
    }
}
