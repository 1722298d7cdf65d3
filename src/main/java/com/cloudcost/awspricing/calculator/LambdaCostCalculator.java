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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Lambda functions: per-request charge plus compute billed per GB-second.
 *
 * cost = requests x requestPrice + (memoryGB x durationSec x requests) x gbSecondPrice
 *
 * Memory comes from the SKU (MB), usage from the requests_per_month and
 * avg_duration_ms tags. The GB-second rate depends on the architecture.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LambdaCostCalculator implements ServiceCostCalculator {

    static final int DEFAULT_MEMORY_MB = 128;
    static final int DEFAULT_DURATION_MS = 100;
    static final String X86_64 = "x86_64";
    static final String ARM64 = "arm64";

    private final PricingSource pricing;

    @Override
    public Set<ServiceIdentifier> getServices() {
        return Set.of(ServiceIdentifier.LAMBDA);
    }

    @Override
    public CostEstimate estimate(ResourceDescriptor resource, EstimationContext context) {
        List<String> notes = new ArrayList<>();

        OptionalInt memory = parsePositiveInt(resource.sku());
        int memoryMb = memory.orElse(DEFAULT_MEMORY_MB);
        if (memory.isEmpty()) {
            notes.add("memory defaulted");
        }

        OptionalLong requests = AttributeExtractor.nonNegativeLong(resource.tags(), "requests_per_month");
        if (requests.isEmpty()) {
            notes.add("requests defaulted");
        }
        OptionalInt duration = AttributeExtractor.positiveInt(resource.tags(), "avg_duration_ms");
        if (duration.isEmpty()) {
            notes.add("duration defaulted");
        }

        String rawArch = firstNonBlank(resource.tag("arch"), resource.tag("architecture"));
        if (rawArch == null) {
            notes.add("arch defaulted to " + X86_64);
        }
        String architecture = normalizeArchitecture(rawArch);

        OptionalDouble requestPrice = pricing.lambdaRequestPrice();
        OptionalDouble gbSecondPrice = pricing.lambdaGbSecondPrice(architecture);
        if (requestPrice.isEmpty() || gbSecondPrice.isEmpty()) {
            log.warn("Lambda pricing unavailable for region {} ({})", resource.region(), architecture);
            return CostEstimate.zero(CostConstants.pricingUnavailable("Lambda", resource.region()));
        }

        long requestCount = requests.orElse(0L);
        int durationMs = duration.orElse(DEFAULT_DURATION_MS);
        double gbSeconds = (memoryMb / 1024.0) * (durationMs / 1000.0) * requestCount;
        double cost = requestCount * requestPrice.getAsDouble() + gbSeconds * gbSecondPrice.getAsDouble();

        StringBuilder detail = new StringBuilder(String.format(
                "Lambda %dMB (%s), %d requests/month, %dms avg duration",
                memoryMb, architecture, requestCount, durationMs));
        if (!notes.isEmpty()) {
            detail.append(" (").append(String.join(", ", notes)).append(")");
        }
        detail.append(String.format(", %.0f GB-seconds", gbSeconds));

        return CostEstimate.of(cost, gbSecondPrice.getAsDouble(), detail.toString());
    }

    @Override
    public PricingSpec pricingSpec(ResourceDescriptor resource) {
        String rawArch = resource.sku() != null && !resource.sku().isBlank()
                ? resource.sku() : resource.tag("architecture");
        String architecture = normalizeArchitecture(rawArch);

        OptionalDouble requestPrice = pricing.lambdaRequestPrice();
        OptionalDouble gbSecondPrice = pricing.lambdaGbSecondPrice(architecture);
        if (requestPrice.isEmpty() || gbSecondPrice.isEmpty()) {
            return PricingSpec.forResource(resource, architecture, "per_request_and_gb_second", 0, "GB-second",
                    "Lambda pricing not found in embedded data", List.of("Lambda pricing data not available"));
        }
        return PricingSpec.forResource(resource, architecture, "per_request_and_gb_second",
                gbSecondPrice.getAsDouble(), "GB-second",
                String.format("Lambda %s architecture", architecture),
                List.of(String.format("Request rate: $%.10f per request", requestPrice.getAsDouble()),
                        String.format("Compute rate: $%.10f per GB-second (%s)", gbSecondPrice.getAsDouble(), architecture),
                        "Provisioned concurrency not included",
                        "Lambda@Edge pricing differs"));
    }

    /**
     * "arm" and "arm64" are Graviton; anything else bills as x86_64.
     */
    static String normalizeArchitecture(String raw) {
        if (raw == null) {
            return X86_64;
        }
        String lower = raw.trim().toLowerCase(Locale.ROOT);
        return lower.equals("arm") || lower.equals(ARM64) ? ARM64 : X86_64;
    }

    private static OptionalInt parsePositiveInt(String raw) {
        if (raw == null || raw.isBlank()) {
            return OptionalInt.empty();
        }
        try {
            int value = Integer.parseInt(raw.trim());
            return value > 0 ? OptionalInt.of(value) : OptionalInt.empty();
        } catch (NumberFormatException e) {
            log.debug("Lambda SKU '{}' is not a memory size in MB", raw);
            return OptionalInt.empty();
        }
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        return second != null && !second.isBlank() ? second : null;
    }
}
