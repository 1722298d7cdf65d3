package com.cloudcost.awspricing.api;

import com.cloudcost.awspricing.actual.ActualCostRequest;
import com.cloudcost.awspricing.actual.ActualCostService;
import com.cloudcost.awspricing.config.EngineSettings;
import com.cloudcost.awspricing.domain.model.ActualCostResult;
import com.cloudcost.awspricing.domain.model.CostEstimate;
import com.cloudcost.awspricing.domain.model.PricingSpec;
import com.cloudcost.awspricing.domain.model.ResourceDescriptor;
import com.cloudcost.awspricing.domain.model.SupportsResult;
import com.cloudcost.awspricing.estimation.PricingSpecService;
import com.cloudcost.awspricing.estimation.ProjectedCostService;
import com.cloudcost.awspricing.estimation.SupportsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * REST API for single-resource cost queries.
 *
 * ENDPOINT DESIGN:
 * - One endpoint per engine operation, all JSON over POST
 * - Malformed input answers 400, a resource in another region answers 412
 * - Missing pricing is never an error: the body carries $0 and an explanation
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Cost API", description = "Projected and actual cost estimation from AWS public pricing")
public class CostController {

    static final String ENGINE_NAME = "aws-public-pricing";

    private final ProjectedCostService projectedCostService;
    private final ActualCostService actualCostService;
    private final PricingSpecService pricingSpecService;
    private final SupportsService supportsService;
    private final EngineSettings settings;

    @PostMapping("/costs/projected")
    @Operation(summary = "Projected monthly cost",
               description = "Estimates the monthly cost of a resource from public on-demand pricing")
    public ResponseEntity<CostEstimate> getProjectedCost(@Valid @RequestBody ProjectedCostRequest request) {
        return ResponseEntity.ok(projectedCostService.getProjectedCost(
                request.resource(), request.utilizationPercentage()));
    }

    @PostMapping("/costs/actual")
    @Operation(summary = "Actual cost over a window",
               description = "Scales the projected monthly cost to the runtime of an explicit or tag-derived window")
    public ResponseEntity<ActualCostResponse> getActualCost(@Valid @RequestBody ActualCostBody request) {
        var results = actualCostService.getActualCost(new ActualCostRequest(
                request.arn(),
                request.resourceId(),
                request.tags(),
                request.start(),
                request.end(),
                request.utilizationPercentage()
        ));
        return ResponseEntity.ok(new ActualCostResponse(results));
    }

    @PostMapping("/costs/estimate")
    @Operation(summary = "Estimate from resource attributes",
               description = "Monthly cost of a Pulumi resource from its type token and attribute document")
    public ResponseEntity<EstimateResponse> estimateCost(@Valid @RequestBody EstimateRequest request) {
        double cost = projectedCostService.estimateFromAttributes(request.resourceType(), request.attributes());
        return ResponseEntity.ok(new EstimateResponse(cost));
    }

    @PostMapping("/pricing-spec")
    @Operation(summary = "Pricing specification",
               description = "Billing mode and unit rate of a resource without computing a cost")
    public ResponseEntity<PricingSpec> getPricingSpec(@Valid @RequestBody ResourceRequest request) {
        return ResponseEntity.ok(pricingSpecService.getPricingSpec(request.resource()));
    }

    @PostMapping("/supports")
    @Operation(summary = "Supports check",
               description = "Whether this engine instance can price the resource, with a reason when it cannot")
    public ResponseEntity<SupportsResult> supports(@RequestBody SupportsRequest request) {
        return ResponseEntity.ok(supportsService.supports(request.resource()));
    }

    @GetMapping("/info")
    @Operation(summary = "Engine info", description = "Name, version and region of this engine instance")
    public ResponseEntity<EngineInfo> info() {
        log.info("Providing engine info: region={}, version={}", settings.region(), settings.version());
        return ResponseEntity.ok(new EngineInfo(
                ENGINE_NAME,
                settings.version(),
                List.of("aws"),
                Map.of("region", settings.region(), "type", "public-pricing-fallback")
        ));
    }

    // DTOs

    public record ProjectedCostRequest(
            @NotNull ResourceDescriptor resource,
            @DecimalMin("0.0") @DecimalMax("1.0") Double utilizationPercentage
    ) {}

    public record ResourceRequest(
            @NotNull ResourceDescriptor resource
    ) {}

    public record SupportsRequest(
            ResourceDescriptor resource
    ) {}

    public record ActualCostBody(
            String arn,
            String resourceId,
            Map<String, String> tags,
            Instant start,
            Instant end,
            @DecimalMin("0.0") @DecimalMax("1.0") Double utilizationPercentage
    ) {}

    public record ActualCostResponse(
            List<ActualCostResult> results
    ) {}

    public record EstimateRequest(
            @NotBlank String resourceType,
            Map<String, Object> attributes
    ) {}

    public record EstimateResponse(
            double costMonthly
    ) {}

    public record EngineInfo(
            String name,
            String version,
            List<String> providers,
            Map<String, String> metadata
    ) {}
}
