package com.cloudcost.awspricing.domain.model;

/**
 * Action a recommendation asks the caller to perform.
 */
public enum RecommendationActionType {
    /**
     * Change the SKU or configuration of an existing resource in place.
     */
    MODIFY("Modify resource", "Switch to a cheaper equivalent configuration");

    private final String displayName;
    private final String description;

    RecommendationActionType(String displayName, String description) {
        this.displayName = displayName;
        this.description = description;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }
}
