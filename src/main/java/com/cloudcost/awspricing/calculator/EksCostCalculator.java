package com.cloudcost.awspricing.calculator;

import com.cloudcost.awspricing.domain.model.CostEstimate;
import com.cloudcost.awspricing.domain.model.PricingSpec;
import com.cloudcost.awspricing.domain.model.ResourceDescriptor;
import com.cloudcost.awspricing.domain.model.ServiceIdentifier;
import com.cloudcost.awspricing.pricing.PricingSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * EKS control plane: a flat hourly rate per cluster, higher under extended
 * support. Worker nodes are billed as EC2 and not included here.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EksCostCalculator implements ServiceCostCalculator {

    private final PricingSource pricing;

    @Override
    public Set<ServiceIdentifier> getServices() {
        return Set.of(ServiceIdentifier.EKS);
    }

    @Override
    public CostEstimate estimate(ResourceDescriptor resource, EstimationContext context) {
        boolean extended = isExtendedSupport(resource);
        OptionalDouble hourly = pricing.eksClusterHourly(extended);
        if (hourly.isEmpty()) {
            log.warn("EKS pricing unavailable for region {}", resource.region());
            return CostEstimate.zero(CostConstants.pricingUnavailable("EKS", resource.region()));
        }

        double rate = hourly.getAsDouble();
        return CostEstimate.of(rate * CostConstants.HOURS_PER_MONTH, rate,
                String.format("EKS cluster (%s support), %d hrs/month (control plane only, excludes worker nodes)",
                        extended ? "extended" : "standard", CostConstants.HOURS_PER_MONTH));
    }

    @Override
    public PricingSpec pricingSpec(ResourceDescriptor resource) {
        boolean extended = isExtendedSupport(resource);
        String supportType = extended ? "extended" : "standard";
        OptionalDouble hourly = pricing.eksClusterHourly(extended);
        if (hourly.isEmpty()) {
            return PricingSpec.forResource(resource, resource.sku(), "per_hour", 0, "hour",
                    "EKS pricing not found in embedded data", List.of("EKS pricing data not available"));
        }
        return PricingSpec.forResource(resource, resource.sku(), "per_hour", hourly.getAsDouble(), "hour",
                String.format("EKS cluster with %s support", supportType),
                List.of("Control plane costs only",
                        "Worker node EC2 instances billed separately",
                        "EKS add-ons may incur additional costs",
                        "Data transfer costs not included"));
    }

    static boolean isExtendedSupport(ResourceDescriptor resource) {
        return "cluster-extended".equals(resource.sku())
                || "extended".equalsIgnoreCase(resource.tag("support_type"));
    }
}
