package com.cloudcost.awspricing.actual;

import com.cloudcost.awspricing.domain.model.CostEstimate;
import com.cloudcost.awspricing.domain.model.FocusCostRecord;
import com.cloudcost.awspricing.domain.model.ResourceDescriptor;
import com.cloudcost.awspricing.domain.model.ServiceIdentifier;

import java.time.Instant;

/**
 * Builds FOCUS 1.2 cost lines for actual-cost results.
 */
public final class FocusRecordBuilder {

    static final String CHARGE_CATEGORY = "Usage";
    static final String CHARGE_CLASS = "Regular";
    static final String CHARGE_FREQUENCY = "Usage-Based";
    static final String PRICING_CATEGORY = "Standard";
    static final String PROVIDER_NAME = "AWS";

    private FocusRecordBuilder() {
        // Utility class
    }

    public static FocusCostRecord build(ServiceIdentifier service, ResourceDescriptor resource,
                                        double cost, double unitPrice, String pricingUnit,
                                        Instant start, Instant end) {
        return FocusCostRecord.builder()
                .billedCost(cost)
                .effectiveCost(cost)
                .listCost(cost)
                .listUnitPrice(unitPrice)
                .serviceCategory(service.getCategory().getFocusName())
                .serviceName(service.getServiceName())
                .chargeCategory(CHARGE_CATEGORY)
                .chargeClass(CHARGE_CLASS)
                .chargeFrequency(CHARGE_FREQUENCY)
                .pricingCategory(PRICING_CATEGORY)
                .pricingUnit(pricingUnit)
                .chargePeriodStart(start)
                .chargePeriodEnd(end)
                .regionId(resource.region())
                .billingCurrency(CostEstimate.USD)
                .resourceType(resource.resourceType())
                .skuId(resource.sku())
                .serviceProviderName(PROVIDER_NAME)
                .chargeDescription(String.format("Public pricing estimate for %s in %s",
                        resource.resourceType(), resource.region()))
                .build();
    }
}
