package com.cloudcost.awspricing.domain.model;

import lombok.Builder;

import java.time.Instant;

/**
 * FinOps FOCUS 1.2 cost line for public-pricing estimates.
 *
 * Billed, effective and list cost are always equal: public pricing
 * carries no discounts. Billing-account fields are not populated.
 */
@Builder
public record FocusCostRecord(
        double billedCost,
        double effectiveCost,
        double listCost,
        double listUnitPrice,
        String serviceCategory,
        String serviceName,
        String chargeCategory,
        String chargeClass,
        String chargeFrequency,
        String pricingCategory,
        String pricingUnit,
        Instant chargePeriodStart,
        Instant chargePeriodEnd,
        String regionId,
        String billingCurrency,
        String resourceType,
        String skuId,
        String serviceProviderName,
        String chargeDescription
) {}
