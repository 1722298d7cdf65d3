package com.cloudcost.awspricing.calculator;

import com.cloudcost.awspricing.domain.model.CostEstimate;
import com.cloudcost.awspricing.domain.model.PricingSpec;
import com.cloudcost.awspricing.domain.model.ResourceDescriptor;
import com.cloudcost.awspricing.domain.model.ServiceIdentifier;
import com.cloudcost.awspricing.normalization.AttributeExtractor;
import com.cloudcost.awspricing.pricing.PricingSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Application and Network Load Balancers: fixed hourly charge plus
 * capacity units (LCU for ALB, NLCU for NLB) per hour.
 *
 * Capacity units come from "lcu_per_hour" / "nlcu_per_hour", falling back
 * to "capacity_units". Values above 1000 are accepted with a warning.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LoadBalancerCostCalculator implements ServiceCostCalculator {

    static final double CAPACITY_UNIT_WARNING_THRESHOLD = 1000;

    private final PricingSource pricing;

    enum LoadBalancerType {
        ALB("alb", "ALB", "LCU", "lcu_per_hour", "per_hour_plus_lcu", "Application Load Balancer"),
        NLB("nlb", "NLB", "NLCU", "nlcu_per_hour", "per_hour_plus_nlcu", "Network Load Balancer");

        final String sku;
        final String label;
        final String unitLabel;
        final String capacityTag;
        final String billingMode;
        final String displayName;

        LoadBalancerType(String sku, String label, String unitLabel, String capacityTag,
                         String billingMode, String displayName) {
            this.sku = sku;
            this.label = label;
            this.unitLabel = unitLabel;
            this.capacityTag = capacityTag;
            this.billingMode = billingMode;
            this.displayName = displayName;
        }
    }

    @Override
    public Set<ServiceIdentifier> getServices() {
        return Set.of(ServiceIdentifier.ELB);
    }

    @Override
    public CostEstimate estimate(ResourceDescriptor resource, EstimationContext context) {
        LoadBalancerType type = typeOf(resource);

        OptionalDouble units = AttributeExtractor.nonNegativeDouble(resource.tags(), type.capacityTag);
        if (units.isEmpty()) {
            units = AttributeExtractor.nonNegativeDouble(resource.tags(), "capacity_units");
        }
        double capacityUnits = units.orElse(0.0);
        if (capacityUnits > CAPACITY_UNIT_WARNING_THRESHOLD) {
            log.warn("Unusually high {} value: {} per hour", type.unitLabel, capacityUnits);
        }

        OptionalDouble fixedRate = type == LoadBalancerType.NLB ? pricing.nlbHourly() : pricing.albHourly();
        OptionalDouble unitRate = type == LoadBalancerType.NLB ? pricing.nlbNlcuHourly() : pricing.albLcuHourly();
        if (fixedRate.isEmpty() || unitRate.isEmpty()) {
            log.warn("{} pricing unavailable for region {}", type.label, resource.region());
            return CostEstimate.zero(CostConstants.pricingUnavailable(type.label, resource.region()));
        }

        double fixedMonthly = CostConstants.HOURS_PER_MONTH * fixedRate.getAsDouble();
        double capacityMonthly = CostConstants.HOURS_PER_MONTH * capacityUnits * unitRate.getAsDouble();
        return CostEstimate.of(fixedMonthly + capacityMonthly, fixedRate.getAsDouble(),
                String.format("%s, %d hrs/month, %.1f %s avg/hr",
                        type.label, CostConstants.HOURS_PER_MONTH, capacityUnits, type.unitLabel));
    }

    @Override
    public PricingSpec pricingSpec(ResourceDescriptor resource) {
        LoadBalancerType type = typeOf(resource);
        OptionalDouble fixedRate = type == LoadBalancerType.NLB ? pricing.nlbHourly() : pricing.albHourly();
        OptionalDouble unitRate = type == LoadBalancerType.NLB ? pricing.nlbNlcuHourly() : pricing.albLcuHourly();
        if (fixedRate.isEmpty() || unitRate.isEmpty()) {
            return PricingSpec.forResource(resource, type.sku, type.billingMode, 0, null,
                    type.label + " pricing not found in embedded data",
                    List.of(type.label + " pricing data not available"));
        }
        String lastAssumption = type == LoadBalancerType.NLB
                ? "Cross-zone data transfer may incur additional costs"
                : "SSL/TLS termination included";
        return PricingSpec.forResource(resource, type.sku, type.billingMode, fixedRate.getAsDouble(), "hour",
                type.displayName,
                List.of(String.format("Fixed hourly rate: $%.4f", fixedRate.getAsDouble()),
                        String.format("%s rate: $%.4f per %s-hour", type.unitLabel, unitRate.getAsDouble(), type.unitLabel),
                        "Data transfer costs not included",
                        lastAssumption));
    }

    static LoadBalancerType typeOf(ResourceDescriptor resource) {
        String sku = resource.sku() == null ? "" : resource.sku().toLowerCase(Locale.ROOT);
        return sku.contains("nlb") || sku.contains("network") ? LoadBalancerType.NLB : LoadBalancerType.ALB;
    }
}
