package com.cloudcost.awspricing.calculator;

import com.cloudcost.awspricing.carbon.CarbonEstimator;
import com.cloudcost.awspricing.domain.model.CostEstimate;
import com.cloudcost.awspricing.domain.model.ImpactMetric;
import com.cloudcost.awspricing.domain.model.PricingSpec;
import com.cloudcost.awspricing.domain.model.ResourceDescriptor;
import com.cloudcost.awspricing.domain.model.ServiceIdentifier;
import com.cloudcost.awspricing.normalization.AttributeExtractor;
import com.cloudcost.awspricing.normalization.Ec2Attributes;
import com.cloudcost.awspricing.pricing.PricingSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * On-demand EC2 instances: hourly rate by (instance type, OS, tenancy) x 730.
 *
 * Attaches a carbon footprint metric when the instance type has a known
 * power profile.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Ec2CostCalculator implements ServiceCostCalculator {

    private final PricingSource pricing;
    private final CarbonEstimator carbonEstimator;

    @Override
    public Set<ServiceIdentifier> getServices() {
        return Set.of(ServiceIdentifier.EC2);
    }

    @Override
    public CostEstimate estimate(ResourceDescriptor resource, EstimationContext context) {
        String instanceType = ServiceCostCalculator.resolveSku(resource);
        Ec2Attributes attributes = AttributeExtractor.ec2FromTags(resource.tags());

        OptionalDouble hourly = pricing.ec2OnDemandHourly(
                instanceType, attributes.operatingSystem(), attributes.tenancy());
        if (hourly.isEmpty()) {
            log.debug("EC2 pricing not found: instanceType={}, os={}, tenancy={}",
                    instanceType, attributes.operatingSystem(), attributes.tenancy());
            return CostEstimate.zero(CostConstants.pricingNotFound("EC2 instance type", instanceType));
        }

        double rate = hourly.getAsDouble();
        CostEstimate estimate = CostEstimate.of(
                rate * CostConstants.HOURS_PER_MONTH,
                rate,
                String.format("On-demand %s, %s tenancy, %d hrs/month",
                        attributes.operatingSystem(), attributes.tenancy(), CostConstants.HOURS_PER_MONTH));

        OptionalDouble carbon = carbonEstimator.estimateGrams(instanceType, resource.region(),
                context.utilizationFor(resource), CostConstants.HOURS_PER_MONTH);
        if (carbon.isPresent()) {
            estimate = estimate.withImpact(ImpactMetric.carbonGrams(carbon.getAsDouble()));
        }
        return estimate;
    }

    @Override
    public PricingSpec pricingSpec(ResourceDescriptor resource) {
        String instanceType = ServiceCostCalculator.resolveSku(resource);
        Ec2Attributes attributes = Ec2Attributes.defaults();

        OptionalDouble hourly = pricing.ec2OnDemandHourly(
                instanceType, attributes.operatingSystem(), attributes.tenancy());
        if (hourly.isEmpty()) {
            return PricingSpec.forResource(resource, instanceType, "per_hour", 0, "hour",
                    CostConstants.pricingNotFound("EC2 instance type", instanceType),
                    List.of("Instance type not found in embedded pricing data"));
        }

        return PricingSpec.forResource(resource, instanceType, "per_hour", hourly.getAsDouble(), "hour",
                String.format("On-demand %s EC2 instance with %s tenancy",
                        attributes.operatingSystem(), attributes.tenancy()),
                List.of(
                        "Operating System: " + attributes.operatingSystem(),
                        "Tenancy: " + attributes.tenancy(),
                        "Pre-installed software: None",
                        "Capacity Status: Used"));
    }
}
