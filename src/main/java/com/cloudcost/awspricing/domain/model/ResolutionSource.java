package com.cloudcost.awspricing.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where the boundaries of an actual-cost window came from.
 */
public enum ResolutionSource {
    /** Both start and end supplied by the caller. */
    EXPLICIT("explicit"),
    /** Start taken from the pulumi:created tag, end defaulted to now. */
    PULUMI_CREATED("pulumi:created"),
    /** One boundary explicit, the other derived. */
    MIXED("mixed");

    private final String value;

    ResolutionSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
