/*
 * TI Envelope — Regional Field Statistics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tienvelope.core.region;

import java.util.BitSet;
import java.util.Objects;

/**
 * Boolean selection over the samples of one model, tagged with the region that produced it.
 * Instances are immutable; set operations return new masks.
 */
public final class RoiMask {

    private final BitSet bits;
    private final int domainSize;
    private final RegionSpec provenance;

    RoiMask(BitSet bits, int domainSize, RegionSpec provenance) {
        this.bits = bits;
        this.domainSize = domainSize;
        this.provenance = Objects.requireNonNull(provenance, "provenance must not be null");
    }

    public static RoiMask all(int domainSize, RegionSpec provenance) {
        BitSet bits = new BitSet(domainSize);
        bits.set(0, domainSize);
        return new RoiMask(bits, domainSize, provenance);
    }

    public RegionSpec provenance() {
        return provenance;
    }

    public int domainSize() {
        return domainSize;
    }

    public int cardinality() {
        return bits.cardinality();
    }

    public boolean isEmpty() {
        return bits.isEmpty();
    }

    public boolean contains(int index) {
        return bits.get(index);
    }

    public int[] indices() {
        return bits.stream().toArray();
    }

    public RoiMask combine(SetOperator operator, RoiMask other) {
        if (other.domainSize != domainSize) {
            throw new IllegalArgumentException(
                    "Masks cover different domains: " + domainSize + " vs " + other.domainSize);
        }
        BitSet result = (BitSet) bits.clone();
        switch (operator) {
            case UNION -> result.or(other.bits);
            case INTERSECTION -> result.and(other.bits);
            case DIFFERENCE -> result.andNot(other.bits);
        }
        return new RoiMask(result, domainSize, new RegionSpec.Combined(provenance, operator, other.provenance));
    }

    public RoiMask complement() {
        BitSet result = (BitSet) bits.clone();
        result.flip(0, domainSize);
        return new RoiMask(result, domainSize, new RegionSpec.Complement(provenance));
    }

    @Override
    public String toString() {
        return "RoiMask{" + provenance.describe() + ", " + cardinality() + "/" + domainSize + "}";
    }
}
