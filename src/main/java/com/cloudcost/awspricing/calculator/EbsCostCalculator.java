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
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.Set;

/**
 * EBS volumes: rate per GB-month x provisioned size.
 *
 * Size comes from the "size" tag, then "volume_size", and defaults to 8 GB.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EbsCostCalculator implements ServiceCostCalculator {

    static final int DEFAULT_SIZE_GB = 8;

    private final PricingSource pricing;

    @Override
    public Set<ServiceIdentifier> getServices() {
        return Set.of(ServiceIdentifier.EBS);
    }

    @Override
    public CostEstimate estimate(ResourceDescriptor resource, EstimationContext context) {
        String volumeType = ServiceCostCalculator.resolveSku(resource);

        OptionalInt size = resource.hasTag("size")
                ? AttributeExtractor.positiveInt(resource.tags(), "size")
                : AttributeExtractor.positiveInt(resource.tags(), "volume_size");
        boolean defaulted = size.isEmpty();
        int sizeGb = size.orElse(DEFAULT_SIZE_GB);

        OptionalDouble rate = pricing.ebsPerGbMonth(volumeType);
        if (rate.isEmpty()) {
            log.debug("EBS pricing not found: volumeType={}", volumeType);
            return CostEstimate.zero(CostConstants.pricingNotFound("EBS volume type", volumeType));
        }

        String detail = defaulted
                ? String.format("%s volume, %d GB (defaulted), $%.4f/GB-month", volumeType, sizeGb, rate.getAsDouble())
                : String.format("%s volume, %d GB, $%.4f/GB-month", volumeType, sizeGb, rate.getAsDouble());
        return CostEstimate.of(rate.getAsDouble() * sizeGb, rate.getAsDouble(), detail);
    }

    @Override
    public PricingSpec pricingSpec(ResourceDescriptor resource) {
        String volumeType = ServiceCostCalculator.resolveSku(resource);
        OptionalDouble rate = pricing.ebsPerGbMonth(volumeType);
        if (rate.isEmpty()) {
            return PricingSpec.forResource(resource, volumeType, "per_gb_month", 0, "GB-month",
                    CostConstants.pricingNotFound("EBS volume type", volumeType),
                    List.of("Volume type not found in embedded pricing data"));
        }
        return PricingSpec.forResource(resource, volumeType, "per_gb_month", rate.getAsDouble(), "GB-month",
                String.format("EBS %s storage", volumeType),
                List.of("Storage only (IOPS/throughput not included)", "Standard provisioned capacity"));
    }
}
