package com.cloudcost.awspricing.domain.model;

public enum RecommendationCategory {
    COST
}
