package com.cloudcost.awspricing.domain.model;

import java.util.List;

/**
 * How a resource is billed, without computing a cost.
 */
public record PricingSpec(
        String provider,
        String resourceType,
        String sku,
        String region,
        String billingMode,
        double ratePerUnit,
        String currency,
        String unit,
        String description,
        String source,
        List<String> assumptions
) {
    public static final String SOURCE = "aws-public";

    public PricingSpec {
        assumptions = assumptions == null ? List.of() : List.copyOf(assumptions);
    }

    /**
     * Spec for a resource, copying its provider, type and region.
     */
    public static PricingSpec forResource(ResourceDescriptor resource, String sku, String billingMode,
                                          double ratePerUnit, String unit, String description,
                                          List<String> assumptions) {
        return new PricingSpec(resource.provider(), resource.resourceType(), sku, resource.region(),
                billingMode, ratePerUnit, CostEstimate.USD, unit, description, SOURCE, assumptions);
    }

    public static PricingSpec unsupported(ResourceDescriptor resource) {
        return forResource(resource, resource.sku(), "unknown", 0, null,
                String.format("Resource type \"%s\" not supported for pricing specification", resource.resourceType()),
                List.of());
    }
}
