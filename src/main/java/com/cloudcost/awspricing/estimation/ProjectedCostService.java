package com.cloudcost.awspricing.estimation;

import com.cloudcost.awspricing.calculator.CalculatorRegistry;
import com.cloudcost.awspricing.calculator.CostConstants;
import com.cloudcost.awspricing.calculator.EstimationContext;
import com.cloudcost.awspricing.calculator.ServiceCostCalculator;
import com.cloudcost.awspricing.config.EngineSettings;
import com.cloudcost.awspricing.domain.model.CostEstimate;
import com.cloudcost.awspricing.domain.model.ResourceDescriptor;
import com.cloudcost.awspricing.domain.model.ServiceIdentifier;
import com.cloudcost.awspricing.exception.InvalidResourceException;
import com.cloudcost.awspricing.normalization.AttributeExtractor;
import com.cloudcost.awspricing.normalization.Ec2Attributes;
import com.cloudcost.awspricing.normalization.PulumiResourceType;
import com.cloudcost.awspricing.normalization.TagSanitizer;
import com.cloudcost.awspricing.pricing.PricingSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Projected monthly cost of a single resource.
 *
 * FLOW:
 * 1. Validate the descriptor and resolve its type once
 * 2. Dispatch to the calculator registered for the service
 * 3. Stamp the service's growth hint on the result
 *
 * Unknown services are not errors: they return $0 with an explanation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProjectedCostService {

    static final int DEFAULT_EBS_SIZE_GB = 8;
    static final String DEFAULT_EBS_TYPE = "gp2";

    private final RequestValidator validator;
    private final CalculatorRegistry calculators;
    private final PricingSource pricing;
    private final EngineSettings settings;

    public CostEstimate getProjectedCost(ResourceDescriptor resource, Double utilizationPercentage) {
        long start = System.currentTimeMillis();
        ValidatedResource validated = validator.validate(resource);

        if (settings.testMode()) {
            log.info("Test mode: GetProjectedCost request resourceType={}, sku={}, region={}, tags={}",
                    resource.resourceType(), resource.sku(), validated.resource().region(),
                    TagSanitizer.forLogging(resource.tags()));
        }

        CostEstimate estimate = estimate(validated, new EstimationContext(utilizationPercentage));

        log.info("GetProjectedCost completed: resourceType={}, service={}, region={}, costPerMonth={}, durationMs={}",
                resource.resourceType(), validated.service().getCode(), validated.resource().region(),
                estimate.costPerMonth(), System.currentTimeMillis() - start);
        return estimate;
    }

    /**
     * Estimate for an already validated resource. Shared with actual-cost queries.
     */
    public CostEstimate estimate(ValidatedResource validated, EstimationContext context) {
        ServiceIdentifier service = validated.service();
        Optional<ServiceCostCalculator> calculator = calculators.forService(service);
        if (calculator.isEmpty()) {
            log.debug("No calculator for resource type {}", validated.type().original());
            return CostEstimate.zero(String.format("Resource type \"%s\" not supported for cost estimation",
                    validated.type().original()));
        }

        CostEstimate estimate = calculator.get()
                .estimate(validated.resource(), context)
                .withGrowthType(service.getGrowthType());

        if (settings.testMode()) {
            log.info("Test mode: {} estimate costPerMonth={}, unitPrice={}, detail={}",
                    service.getCode(), estimate.costPerMonth(), estimate.unitPrice(), estimate.billingDetail());
        }
        return estimate;
    }

    /**
     * Monthly cost from a Pulumi type token and its raw resource attributes.
     *
     * Only EC2 instances and EBS volumes are priced; everything else, a
     * non-aws provider, and a resource in another region estimate to 0.
     *
     * @throws InvalidResourceException when the type token is missing or malformed
     */
    public double estimateFromAttributes(String resourceType, Map<String, Object> attributes) {
        if (resourceType == null || resourceType.isBlank()) {
            throw new InvalidResourceException("resource_type is required");
        }
        PulumiResourceType type;
        try {
            type = PulumiResourceType.parse(resourceType);
        } catch (InvalidResourceException e) {
            throw new InvalidResourceException("invalid resource_type format: " + e.getMessage(), e);
        }

        if (!RequestValidator.AWS.equals(type.provider())) {
            log.debug("EstimateCost: provider {} not supported", type.provider());
            return 0;
        }

        String region = AttributeExtractor.regionFromAttributes(attributes).orElse(settings.region());
        if (!settings.region().equals(region)) {
            log.debug("EstimateCost: resource region {} differs from engine region {}", region, settings.region());
            return 0;
        }

        double cost = 0;
        if (type.is("ec2", "Instance")) {
            cost = estimateInstance(attributes);
        } else if (type.is("ebs", "Volume")) {
            cost = estimateVolume(attributes);
        }

        log.info("EstimateCost completed: resourceType={}, region={}, costMonthly={}", resourceType, region, cost);
        return cost;
    }

    private double estimateInstance(Map<String, Object> attributes) {
        Optional<String> instanceType = AttributeExtractor.stringAttr(attributes, "instanceType");
        if (instanceType.isEmpty()) {
            log.debug("EstimateCost: EC2 instance without instanceType attribute");
            return 0;
        }
        Ec2Attributes ec2 = AttributeExtractor.ec2FromAttributes(attributes);
        OptionalDouble hourly = pricing.ec2OnDemandHourly(instanceType.get(), ec2.operatingSystem(), ec2.tenancy());
        return hourly.isPresent() ? hourly.getAsDouble() * CostConstants.HOURS_PER_MONTH : 0;
    }

    private double estimateVolume(Map<String, Object> attributes) {
        String volumeType = AttributeExtractor.stringAttr(attributes, "type").orElse(DEFAULT_EBS_TYPE);
        OptionalDouble size = AttributeExtractor.numberAttr(attributes, "size");
        double sizeGb = size.isPresent() && size.getAsDouble() > 0 ? size.getAsDouble() : DEFAULT_EBS_SIZE_GB;
        OptionalDouble rate = pricing.ebsPerGbMonth(volumeType);
        return rate.isPresent() ? rate.getAsDouble() * sizeGb : 0;
    }
}
