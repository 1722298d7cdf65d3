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
import java.util.Set;

/**
 * S3 storage: rate per GB-month by storage class x stored GB.
 * Requests and data transfer are not estimated.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class S3CostCalculator implements ServiceCostCalculator {

    static final double DEFAULT_SIZE_GB = 1.0;
    static final String DEFAULT_STORAGE_CLASS = "STANDARD";

    private final PricingSource pricing;

    @Override
    public Set<ServiceIdentifier> getServices() {
        return Set.of(ServiceIdentifier.S3);
    }

    @Override
    public CostEstimate estimate(ResourceDescriptor resource, EstimationContext context) {
        String storageClass = storageClassOf(resource);
        OptionalDouble size = AttributeExtractor.positiveDouble(resource.tags(), "size");
        double sizeGb = size.orElse(DEFAULT_SIZE_GB);

        OptionalDouble rate = pricing.s3PerGbMonth(storageClass);
        if (rate.isEmpty()) {
            log.debug("S3 pricing not found: storageClass={}", storageClass);
            return CostEstimate.zero(CostConstants.pricingNotFound("S3 storage class", storageClass));
        }

        String detail = size.isEmpty()
                ? String.format("S3 %s storage, %.0f GB (defaulted), $%.4f/GB-month", storageClass, sizeGb, rate.getAsDouble())
                : String.format("S3 %s storage, %.0f GB, $%.4f/GB-month", storageClass, sizeGb, rate.getAsDouble());
        return CostEstimate.of(rate.getAsDouble() * sizeGb, rate.getAsDouble(), detail);
    }

    @Override
    public PricingSpec pricingSpec(ResourceDescriptor resource) {
        String storageClass = storageClassOf(resource);
        OptionalDouble rate = pricing.s3PerGbMonth(storageClass);
        if (rate.isEmpty()) {
            return PricingSpec.forResource(resource, storageClass, "per_gb_month", 0, "GB-month",
                    CostConstants.pricingNotFound("S3 storage class", storageClass),
                    List.of("Storage class not found in embedded pricing data"));
        }
        return PricingSpec.forResource(resource, storageClass, "per_gb_month", rate.getAsDouble(), "GB-month",
                String.format("S3 %s storage", storageClass),
                List.of("Storage cost only",
                        "Requests and data transfer billed separately",
                        "Lifecycle transitions not included"));
    }

    private static String storageClassOf(ResourceDescriptor resource) {
        String sku = resource.sku();
        return sku == null || sku.isBlank() ? DEFAULT_STORAGE_CLASS : sku;
    }
}
