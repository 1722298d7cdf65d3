package com.cloudcost.awspricing.domain.model;

/**
 * Identifies the resource a recommendation applies to.
 * id and name are correlation fields copied from the request.
 */
public record ResourceRecommendationInfo(
        String provider,
        String resourceType,
        String region,
        String sku,
        String id,
        String name
) {
    public ResourceRecommendationInfo withCorrelation(String newId, String newName) {
        return new ResourceRecommendationInfo(provider, resourceType, region, sku, newId, newName);
    }
}
