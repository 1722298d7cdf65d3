package com.cloudcost.awspricing.estimation;

import com.cloudcost.awspricing.calculator.CalculatorRegistry;
import com.cloudcost.awspricing.calculator.ServiceCostCalculator;
import com.cloudcost.awspricing.domain.model.PricingSpec;
import com.cloudcost.awspricing.domain.model.ResourceDescriptor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Billing-mode metadata for a resource, without computing a cost.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PricingSpecService {

    private final RequestValidator validator;
    private final CalculatorRegistry calculators;

    public PricingSpec getPricingSpec(ResourceDescriptor resource) {
        long start = System.currentTimeMillis();
        ValidatedResource validated = validator.validate(resource);

        PricingSpec spec = calculators.forService(validated.service())
                .map(calculator -> calculator.pricingSpec(validated.resource()))
                .orElseGet(() -> PricingSpec.unsupported(validated.resource()));

        log.info("GetPricingSpec completed: resourceType={}, region={}, billingMode={}, durationMs={}",
                resource.resourceType(), validated.resource().region(), spec.billingMode(),
                System.currentTimeMillis() - start);
        return spec;
    }
}
