package com.cloudcost.awspricing.domain.model;

import lombok.Builder;

import java.util.List;
import java.util.Map;

/**
 * A costed SKU modification suggestion.
 *
 * Created fresh per matching resource per request and never cached.
 * The candidate SKU is only ever cheaper than or equal in price to
 * the current one.
 */
@Builder
public record Recommendation(
        String id,
        RecommendationCategory category,
        RecommendationActionType actionType,
        ResourceRecommendationInfo resource,
        ModifyAction modify,
        RecommendationImpact impact,
        RecommendationPriority priority,
        Double confidenceScore,
        String description,
        List<String> reasoning,
        Map<String, String> metadata,
        String source
) {
    public Recommendation withResource(ResourceRecommendationInfo newResource) {
        return new Recommendation(id, category, actionType, newResource, modify, impact,
                priority, confidenceScore, description, reasoning, metadata, source);
    }
}
