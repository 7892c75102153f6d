/*
 * TI Envelope — Regional Field Statistics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tienvelope.core.exceptions;

public class AtlasUnavailableException extends RuntimeException {
    public AtlasUnavailableException(String atlasPath) {
        super("Atlas '" + atlasPath + "' could not be resolved.");
    }

    public AtlasUnavailableException(String atlasPath, Throwable cause) {
        super("Atlas '" + atlasPath + "' could not be resolved.", cause);
    }
}
