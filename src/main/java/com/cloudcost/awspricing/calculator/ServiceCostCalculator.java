package com.cloudcost.awspricing.calculator;

import com.cloudcost.awspricing.domain.model.CostEstimate;
import com.cloudcost.awspricing.domain.model.PricingSpec;
import com.cloudcost.awspricing.domain.model.ResourceDescriptor;
import com.cloudcost.awspricing.domain.model.ServiceIdentifier;
import com.cloudcost.awspricing.normalization.AttributeExtractor;

import java.util.Set;

/**
 * Computes the projected monthly cost of one or more AWS services.
 *
 * CONTRACT:
 * - A SKU or rate missing from the pricing data yields a $0 estimate with
 *   an explanation, never an exception
 * - InvalidResourceException is reserved for malformed values the caller
 *   explicitly supplied
 * - Implementations are stateless and shared across requests
 *
 * The resource passed in already carries its effective region.
 */
public interface ServiceCostCalculator {

    /**
     * Services this calculator handles. Each service has exactly one calculator.
     */
    Set<ServiceIdentifier> getServices();

    CostEstimate estimate(ResourceDescriptor resource, EstimationContext context);

    /**
     * Billing-mode metadata for the resource, without computing a cost.
     */
    default PricingSpec pricingSpec(ResourceDescriptor resource) {
        return PricingSpec.unsupported(resource);
    }

    /**
     * SKU from the descriptor, falling back to the SKU tags.
     */
    static String resolveSku(ResourceDescriptor resource) {
        if (resource.sku() != null && !resource.sku().isBlank()) {
            return resource.sku();
        }
        return AttributeExtractor.extractSku(resource.tags()).orElse("");
    }
}
