/*
 * TI Envelope — Regional Field Statistics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tienvelope.core.region;

/**
 * Resolves an atlas path to a lookup. Supplied by the loader layer, which owns file formats.
 */
@FunctionalInterface
public interface AtlasResolver {

    AtlasResolver NONE = path -> {
        throw new UnsupportedOperationException("No atlas resolver configured");
    };

    AtlasLookup resolve(String atlasPath) throws Exception;
}
