/*
 * TI Envelope — Regional Field Statistics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tienvelope.core.region;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum SetOperator {
    @JsonProperty("union") UNION,
    @JsonProperty("intersection") INTERSECTION,
    @JsonProperty("difference") DIFFERENCE
}
