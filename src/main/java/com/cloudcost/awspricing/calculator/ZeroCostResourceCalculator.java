package com.cloudcost.awspricing.calculator;

import com.cloudcost.awspricing.domain.model.CostEstimate;
import com.cloudcost.awspricing.domain.model.PricingSpec;
import com.cloudcost.awspricing.domain.model.ResourceDescriptor;
import com.cloudcost.awspricing.domain.model.ServiceIdentifier;
import com.cloudcost.awspricing.normalization.ResourceTypeNormalizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resources AWS does not bill directly. Always $0 with an explanation.
 */
@Component
@RequiredArgsConstructor
public class ZeroCostResourceCalculator implements ServiceCostCalculator {

    private static final Map<ServiceIdentifier, String> DESCRIPTIONS = Map.of(
            ServiceIdentifier.VPC,
            "VPC has no direct hourly or monthly charge. Costs may apply for associated resources (NAT Gateway, VPN, etc.)",
            ServiceIdentifier.SECURITY_GROUP,
            "Security Groups have no direct charge. They are a free networking feature.",
            ServiceIdentifier.SUBNET,
            "Subnets have no direct charge. Costs may apply for data transfer between AZs.",
            ServiceIdentifier.IAM,
            "IAM resources (users, roles, policies) have no direct charge. They are a free AWS feature."
    );

    private final ResourceTypeNormalizer normalizer;

    @Override
    public Set<ServiceIdentifier> getServices() {
        return DESCRIPTIONS.keySet();
    }

    @Override
    public CostEstimate estimate(ResourceDescriptor resource, EstimationContext context) {
        return CostEstimate.zero(describe(resource));
    }

    @Override
    public PricingSpec pricingSpec(ResourceDescriptor resource) {
        return PricingSpec.forResource(resource, resource.sku(), "free", 0, null, describe(resource),
                List.of("No direct AWS charge"));
    }

    private String describe(ResourceDescriptor resource) {
        String description = DESCRIPTIONS.get(normalizer.resolve(resource.resourceType()).service());
        return description != null ? description : String.format("%s has no direct AWS charge", resource.resourceType());
    }
}
