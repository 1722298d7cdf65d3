package com.cloudcost.awspricing.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of SKU change a recommendation proposes.
 *
 * Each kind carries a fixed confidence score: same-architecture swaps are
 * drop-in, architecture migrations need application validation.
 */
public enum ModificationType {
    GENERATION_UPGRADE("generation_upgrade", 0.9),
    GRAVITON_MIGRATION("graviton_migration", 0.7),
    VOLUME_TYPE_UPGRADE("volume_type_upgrade", 0.9);

    private final String value;
    private final double confidence;

    ModificationType(String value, double confidence) {
        this.value = value;
        this.confidence = confidence;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public double getConfidence() {
        return confidence;
    }
}
