package com.cloudcost.awspricing.domain.model;

import java.util.Map;

public record RecommendationSummary(
        int totalRecommendations,
        double totalEstimatedSavings,
        String currency,
        String projectionPeriod,
        Map<String, Integer> countByCategory,
        Map<String, Integer> countByActionType
) {}
