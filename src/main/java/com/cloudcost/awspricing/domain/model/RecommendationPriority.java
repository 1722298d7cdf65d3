package com.cloudcost.awspricing.domain.model;

public enum RecommendationPriority {
    LOW,
    MEDIUM,
    HIGH
}
