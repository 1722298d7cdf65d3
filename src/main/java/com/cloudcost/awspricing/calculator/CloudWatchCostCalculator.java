package com.cloudcost.awspricing.calculator;

import com.cloudcost.awspricing.domain.model.CostEstimate;
import com.cloudcost.awspricing.domain.model.PricingSpec;
import com.cloudcost.awspricing.domain.model.ResourceDescriptor;
import com.cloudcost.awspricing.domain.model.ServiceIdentifier;
import com.cloudcost.awspricing.exception.InvalidResourceException;
import com.cloudcost.awspricing.pricing.PricingSource;
import com.cloudcost.awspricing.pricing.TierRate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * CloudWatch logs and custom metrics.
 *
 * SKU selects what is charged: "logs" (default), "metrics" or "combined".
 * - logs: tiered ingestion on log_ingestion_gb + log_storage_gb x storage rate
 * - metrics: tiered per-metric charge on custom_metrics
 *
 * Usage tags are validated strictly. Each component whose rates are
 * missing is reported in the detail instead of being charged.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CloudWatchCostCalculator implements ServiceCostCalculator {

    static final double MAX_CUSTOM_METRICS = 1_000_000;

    private final PricingSource pricing;

    @Override
    public Set<ServiceIdentifier> getServices() {
        return Set.of(ServiceIdentifier.CLOUDWATCH);
    }

    @Override
    public CostEstimate estimate(ResourceDescriptor resource, EstimationContext context) {
        String sku = skuOf(resource);
        boolean includeLogs = sku.equals("logs") || sku.equals("combined");
        boolean includeMetrics = sku.equals("metrics") || sku.equals("combined");

        OptionalDouble ingestionGb = UsageTagParser.optionalNonNegative(resource.tags(), "log_ingestion_gb");
        OptionalDouble storageGb = UsageTagParser.optionalNonNegative(resource.tags(), "log_storage_gb");
        OptionalDouble customMetrics = parseCustomMetrics(resource);

        List<String> parts = new ArrayList<>();
        double total = 0.0;

        if (includeLogs && ingestionGb.isPresent() && ingestionGb.getAsDouble() > 0) {
            List<TierRate> tiers = pricing.cloudWatchLogsIngestionTiers();
            if (tiers.isEmpty()) {
                log.warn("CloudWatch Logs ingestion pricing unavailable for region {}", resource.region());
                parts.add(CostConstants.pricingUnavailable("CloudWatch Logs ingestion", resource.region()));
            } else {
                double cost = TieredCostCalculator.calculate(ingestionGb.getAsDouble(), tiers);
                total += cost;
                parts.add(String.format("%.2f GB logs ingested ($%.2f)", ingestionGb.getAsDouble(), cost));
            }
        }

        if (includeLogs && storageGb.isPresent() && storageGb.getAsDouble() > 0) {
            OptionalDouble storageRate = pricing.cloudWatchLogsStoragePerGbMonth();
            if (storageRate.isEmpty()) {
                log.warn("CloudWatch Logs storage pricing unavailable for region {}", resource.region());
                parts.add(CostConstants.pricingUnavailable("CloudWatch Logs storage", resource.region()));
            } else {
                double cost = storageGb.getAsDouble() * storageRate.getAsDouble();
                total += cost;
                parts.add(String.format("%.2f GB logs stored @ $%.4f/GB-mo ($%.2f)",
                        storageGb.getAsDouble(), storageRate.getAsDouble(), cost));
            }
        }

        if (includeMetrics && customMetrics.isPresent() && customMetrics.getAsDouble() > 0) {
            List<TierRate> tiers = pricing.cloudWatchMetricsTiers();
            if (tiers.isEmpty()) {
                log.warn("CloudWatch Metrics pricing unavailable for region {}", resource.region());
                parts.add(CostConstants.pricingUnavailable("CloudWatch Metrics", resource.region()));
            } else {
                double cost = TieredCostCalculator.calculate(customMetrics.getAsDouble(), tiers);
                total += cost;
                parts.add(String.format("%.0f custom metrics ($%.2f)", customMetrics.getAsDouble(), cost));
            }
        }

        String detail = parts.isEmpty()
                ? "CloudWatch: No usage specified (use tags: log_ingestion_gb, log_storage_gb, custom_metrics)"
                : "CloudWatch: " + String.join(", ", parts);
        return CostEstimate.of(total, 0, detail);
    }

    @Override
    public PricingSpec pricingSpec(ResourceDescriptor resource) {
        String sku = skuOf(resource);
        if (sku.equals("metrics")) {
            List<TierRate> tiers = pricing.cloudWatchMetricsTiers();
            if (tiers.isEmpty()) {
                return PricingSpec.forResource(resource, sku, "tiered_per_metric", 0, null,
                        "CloudWatch metrics pricing not found", List.of("Metrics pricing data not available"));
            }
            List<String> assumptions = new ArrayList<>();
            assumptions.add("Tiered pricing based on metric count:");
            assumptions.addAll(describeTiers(tiers, "metrics", "metric"));
            return PricingSpec.forResource(resource, sku, "tiered_per_metric", tiers.get(0).rate(), "metric-month",
                    "CloudWatch custom metrics", assumptions);
        }

        List<TierRate> ingestion = pricing.cloudWatchLogsIngestionTiers();
        OptionalDouble storageRate = pricing.cloudWatchLogsStoragePerGbMonth();
        if (ingestion.isEmpty() || storageRate.isEmpty()) {
            return PricingSpec.forResource(resource, "logs", "tiered_ingestion_plus_storage", 0, null,
                    "CloudWatch logs pricing not found", List.of("Logs pricing data not available"));
        }
        List<String> assumptions = new ArrayList<>();
        assumptions.add(String.format("Storage: $%.4f per GB-month", storageRate.getAsDouble()));
        assumptions.add("Ingestion tiered pricing:");
        assumptions.addAll(describeTiers(ingestion, "GB", "GB"));
        assumptions.add("Logs Insights queries billed separately");
        return PricingSpec.forResource(resource, "logs", "tiered_ingestion_plus_storage", ingestion.get(0).rate(),
                "GB-ingested", "CloudWatch Logs", assumptions);
    }

    private static List<String> describeTiers(List<TierRate> tiers, String quantityLabel, String unitLabel) {
        List<String> lines = new ArrayList<>();
        double previousBound = 0.0;
        for (TierRate tier : tiers) {
            if (tier.upTo() != null) {
                lines.add(String.format("  %.0f-%.0f %s: $%.4f/%s",
                        previousBound, tier.upTo(), quantityLabel, tier.rate(), unitLabel));
                previousBound = tier.upTo();
            } else {
                lines.add(String.format("  Above %.0f %s: $%.4f/%s", previousBound, quantityLabel, tier.rate(), unitLabel));
            }
        }
        return lines;
    }

    private static OptionalDouble parseCustomMetrics(ResourceDescriptor resource) {
        String raw = resource.tag("custom_metrics");
        if (raw == null || raw.isBlank()) {
            return OptionalDouble.empty();
        }
        double value;
        try {
            value = Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new InvalidResourceException(String.format(
                    "invalid value for 'custom_metrics': \"%s\" is not a valid number", raw), e);
        }
        if (Double.isNaN(value) || value < 0 || value > MAX_CUSTOM_METRICS) {
            throw new InvalidResourceException(String.format(
                    "invalid value for 'custom_metrics': %g must be between 0 and %.0f", value, MAX_CUSTOM_METRICS));
        }
        return OptionalDouble.of(value);
    }

    private static String skuOf(ResourceDescriptor resource) {
        String sku = resource.sku();
        return sku == null || sku.isBlank() ? "logs" : sku.toLowerCase(Locale.ROOT);
    }
}
