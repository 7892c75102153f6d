/*
 * TI Envelope — Regional Field Statistics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tienvelope.core.exceptions;

public class FieldNotFoundException extends RuntimeException {
    public FieldNotFoundException(String fieldName) {
        super("Field '" + fieldName + "' was not found in the sample model.");
    }
}
