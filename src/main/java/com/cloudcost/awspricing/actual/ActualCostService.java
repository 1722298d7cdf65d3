package com.cloudcost.awspricing.actual;

import com.cloudcost.awspricing.calculator.CostConstants;
import com.cloudcost.awspricing.calculator.EstimationContext;
import com.cloudcost.awspricing.config.EngineSettings;
import com.cloudcost.awspricing.domain.model.ActualCostResult;
import com.cloudcost.awspricing.domain.model.ConfidenceLevel;
import com.cloudcost.awspricing.domain.model.CostEstimate;
import com.cloudcost.awspricing.domain.model.FocusCostRecord;
import com.cloudcost.awspricing.domain.model.ResourceDescriptor;
import com.cloudcost.awspricing.domain.model.TimestampResolution;
import com.cloudcost.awspricing.estimation.ProjectedCostService;
import com.cloudcost.awspricing.estimation.RequestValidator;
import com.cloudcost.awspricing.estimation.ValidatedResource;
import com.cloudcost.awspricing.exception.InvalidResourceException;
import com.cloudcost.awspricing.normalization.TagSanitizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cost of a resource over a historical window, derived from its projected
 * monthly cost.
 *
 * FORMULA:
 *   actual = projected monthly cost x runtime hours / 730
 *
 * The window is resolved before the resource so that a request without any
 * usable start time fails fast. A zero-length window costs $0 without
 * touching a calculator.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ActualCostService {

    static final String USAGE_UNIT = "hours";
    static final String HOURLY_PRICING_UNIT = "Hours";

    private final TimestampResolver timestampResolver;
    private final ActualResourceResolver resourceResolver;
    private final RequestValidator validator;
    private final ProjectedCostService projectedCostService;
    private final EngineSettings settings;

    public List<ActualCostResult> getActualCost(ActualCostRequest request) {
        long startMillis = System.currentTimeMillis();
        if (request == null) {
            throw new InvalidResourceException("request is required");
        }

        TimestampResolution window = timestampResolver.resolve(
                mergeTags(request), request.start(), request.end());
        ValidatedResource validated = validator.validate(resourceResolver.resolve(request));
        ResourceDescriptor resource = validated.resource();

        ConfidenceLevel confidence = TimestampResolver.confidenceOf(window);
        String source = TimestampResolver.formatSource(confidence, window.imported());
        double runtimeHours = runtimeHours(window.start(), window.end());

        if (settings.testMode()) {
            log.info("Test mode: GetActualCost request resourceType={}, sku={}, region={}, runtimeHours={}",
                    resource.resourceType(), resource.sku(), resource.region(), runtimeHours);
        }

        if (runtimeHours == 0) {
            FocusCostRecord focus = FocusRecordBuilder.build(validated.service(), resource, 0, 0,
                    validated.service().getPricingUnit(), window.start(), window.end());
            logCompletion(resource, 0, runtimeHours, confidence, window, startMillis);
            return List.of(new ActualCostResult(window.start(), 0, 0, null, source, focus));
        }

        CostEstimate projected = projectedCostService.estimate(
                validated, new EstimationContext(request.utilizationPercentage()));
        double actualCost = projected.costPerMonth() * (runtimeHours / CostConstants.HOURS_PER_MONTH);

        if (settings.testMode()) {
            log.info("Test mode: GetActualCost calculation projectedMonthly={}, runtimeHours={}, actualCost={}",
                    projected.costPerMonth(), runtimeHours, actualCost);
        }

        String detail = String.format("Fallback estimate: %s × %.2f hours / 730 = $%.4f",
                projected.billingDetail(), runtimeHours, actualCost);
        FocusCostRecord focus = FocusRecordBuilder.build(validated.service(), resource, actualCost,
                projected.unitPrice(), HOURLY_PRICING_UNIT, window.start(), window.end());

        logCompletion(resource, actualCost, runtimeHours, confidence, window, startMillis);
        return List.of(new ActualCostResult(window.start(), actualCost, runtimeHours, USAGE_UNIT,
                source + " | " + detail, focus));
    }

    /**
     * Tags from a JSON resourceId overlaid by the request tags.
     */
    Map<String, String> mergeTags(ActualCostRequest request) {
        Map<String, String> merged = new LinkedHashMap<>(resourceResolver.embeddedTags(request.resourceId()));
        merged.putAll(request.tags());
        return merged;
    }

    static double runtimeHours(Instant from, Instant to) {
        Duration duration = Duration.between(from, to);
        if (duration.isNegative()) {
            throw new InvalidResourceException(String.format(
                    "invalid time range: from (%s) is after to (%s)", from, to));
        }
        return duration.toNanos() / 3_600_000_000_000.0;
    }

    private void logCompletion(ResourceDescriptor resource, double cost, double runtimeHours,
                               ConfidenceLevel confidence, TimestampResolution window, long startMillis) {
        log.info("GetActualCost completed: resourceType={}, region={}, tags={}, cost={}, usageHours={}, "
                        + "confidence={}, resolutionSource={}, durationMs={}",
                resource.resourceType(), resource.region(), TagSanitizer.forLogging(resource.tags()), cost,
                runtimeHours, confidence, window.source().getValue(), System.currentTimeMillis() - startMillis);
    }
}
