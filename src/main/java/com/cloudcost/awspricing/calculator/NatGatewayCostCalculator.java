package com.cloudcost.awspricing.calculator;

import com.cloudcost.awspricing.domain.model.CostEstimate;
import com.cloudcost.awspricing.domain.model.PricingSpec;
import com.cloudcost.awspricing.domain.model.ResourceDescriptor;
import com.cloudcost.awspricing.domain.model.ServiceIdentifier;
import com.cloudcost.awspricing.pricing.NatGatewayRate;
import com.cloudcost.awspricing.pricing.PricingSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * NAT gateways: hourly charge x 730 plus data processed per GB.
 *
 * "data_processed_gb" is validated strictly: a present but malformed value
 * rejects the request instead of silently dropping the data charge.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NatGatewayCostCalculator implements ServiceCostCalculator {

    static final String DATA_PROCESSED_TAG = "data_processed_gb";

    private final PricingSource pricing;

    @Override
    public Set<ServiceIdentifier> getServices() {
        return Set.of(ServiceIdentifier.NATGW);
    }

    @Override
    public CostEstimate estimate(ResourceDescriptor resource, EstimationContext context) {
        Optional<NatGatewayRate> rate = pricing.natGatewayRate();
        if (rate.isEmpty()) {
            log.warn("NAT Gateway pricing unavailable for region {}", resource.region());
            return CostEstimate.zero(CostConstants.pricingUnavailable("NAT Gateway", resource.region()));
        }

        OptionalDouble dataProcessed = UsageTagParser.nonNegative(resource.tags(), DATA_PROCESSED_TAG);
        double gb = dataProcessed.orElse(0.0);
        NatGatewayRate rates = rate.get();

        double cost = rates.hourly() * CostConstants.HOURS_PER_MONTH + gb * rates.dataPerGb();

        StringBuilder detail = new StringBuilder(String.format("NAT Gateway, %d hrs/month ($%.3f/hr)",
                CostConstants.HOURS_PER_MONTH, rates.hourly()));
        if (gb > 0) {
            detail.append(String.format(" + %.2f GB data processed ($%.3f/GB)", gb, rates.dataPerGb()));
        } else if (dataProcessed.isPresent()) {
            detail.append(" (0 GB data processed)");
        } else {
            detail.append(" (data processing cost not included; use '" + DATA_PROCESSED_TAG + "' tag to estimate)");
        }

        return CostEstimate.of(cost, rates.hourly(), detail.toString());
    }

    @Override
    public PricingSpec pricingSpec(ResourceDescriptor resource) {
        Optional<NatGatewayRate> rate = pricing.natGatewayRate();
        if (rate.isEmpty()) {
            return PricingSpec.forResource(resource, resource.sku(), "per_hour_plus_data", 0, null,
                    "NAT Gateway pricing not found in embedded data",
                    List.of("NAT Gateway pricing data not available"));
        }
        return PricingSpec.forResource(resource, resource.sku(), "per_hour_plus_data", rate.get().hourly(), "hour",
                "NAT Gateway",
                List.of(String.format("Hourly rate: $%.4f", rate.get().hourly()),
                        String.format("Data processing: $%.4f per GB", rate.get().dataPerGb()),
                        "Data transfer OUT to internet billed separately",
                        "Cross-AZ data transfer costs not included"));
    }
}
