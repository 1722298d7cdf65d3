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
import java.util.Set;

/**
 * DynamoDB tables in on-demand or provisioned capacity mode.
 *
 * CAPACITY MODES (from the SKU, default on-demand):
 * - on-demand:   reads x readPrice + writes x writePrice + storage
 * - provisioned: RCU x 730 x rcuPrice + WCU x 730 x wcuPrice + storage
 *
 * A missing rate does not zero the whole estimate. The remaining
 * components are still charged and the missing ones are named in the
 * billing detail.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DynamoDbCostCalculator implements ServiceCostCalculator {

    static final String ON_DEMAND = "on-demand";
    static final String PROVISIONED = "provisioned";

    private final PricingSource pricing;

    @Override
    public Set<ServiceIdentifier> getServices() {
        return Set.of(ServiceIdentifier.DYNAMODB);
    }

    @Override
    public CostEstimate estimate(ResourceDescriptor resource, EstimationContext context) {
        String mode = capacityModeOf(resource);
        List<String> unavailable = new ArrayList<>();

        double storageGb = AttributeExtractor.nonNegativeDouble(resource.tags(), "storage_gb").orElse(0.0);
        OptionalDouble storagePrice = pricing.dynamoDbStoragePerGbMonth();
        if (storagePrice.isEmpty()) {
            warnUnavailable("Storage");
            unavailable.add("Storage");
        }
        double storageCost = storageGb * storagePrice.orElse(0.0);

        double total;
        double unitPrice;
        String detail;
        if (PROVISIONED.equals(mode)) {
            long rcu = AttributeExtractor.nonNegativeLong(resource.tags(), "read_capacity_units").orElse(0L);
            long wcu = AttributeExtractor.nonNegativeLong(resource.tags(), "write_capacity_units").orElse(0L);
            OptionalDouble rcuPrice = pricing.dynamoDbProvisionedRcuHourly();
            OptionalDouble wcuPrice = pricing.dynamoDbProvisionedWcuHourly();
            if (rcuPrice.isEmpty()) {
                warnUnavailable("RCU");
                unavailable.add("RCU");
            }
            if (wcuPrice.isEmpty()) {
                warnUnavailable("WCU");
                unavailable.add("WCU");
            }

            total = rcu * CostConstants.HOURS_PER_MONTH * rcuPrice.orElse(0.0)
                    + wcu * CostConstants.HOURS_PER_MONTH * wcuPrice.orElse(0.0)
                    + storageCost;
            unitPrice = rcuPrice.orElse(0.0);
            detail = String.format("DynamoDB provisioned, %d RCUs, %d WCUs, %d hrs/month, %.0fGB storage",
                    rcu, wcu, CostConstants.HOURS_PER_MONTH, storageGb);
        } else {
            long reads = AttributeExtractor.nonNegativeLong(resource.tags(), "read_requests_per_month").orElse(0L);
            long writes = AttributeExtractor.nonNegativeLong(resource.tags(), "write_requests_per_month").orElse(0L);
            OptionalDouble readPrice = pricing.dynamoDbOnDemandReadPrice();
            OptionalDouble writePrice = pricing.dynamoDbOnDemandWritePrice();
            if (readPrice.isEmpty()) {
                warnUnavailable("Read");
                unavailable.add("Read");
            }
            if (writePrice.isEmpty()) {
                warnUnavailable("Write");
                unavailable.add("Write");
            }

            total = reads * readPrice.orElse(0.0) + writes * writePrice.orElse(0.0) + storageCost;
            unitPrice = storagePrice.orElse(0.0);
            detail = String.format("DynamoDB on-demand, %d reads, %d writes, %.0fGB storage",
                    reads, writes, storageGb);
        }

        if (!unavailable.isEmpty()) {
            detail += " (pricing unavailable: " + String.join(", ", unavailable) + ")";
        }
        if (total == 0) {
            detail += " (missing or zero usage inputs)";
        }
        return CostEstimate.of(total, unitPrice, detail);
    }

    @Override
    public PricingSpec pricingSpec(ResourceDescriptor resource) {
        String mode = capacityModeOf(resource);
        OptionalDouble storagePrice = pricing.dynamoDbStoragePerGbMonth();

        if (PROVISIONED.equals(mode)) {
            OptionalDouble rcuPrice = pricing.dynamoDbProvisionedRcuHourly();
            OptionalDouble wcuPrice = pricing.dynamoDbProvisionedWcuHourly();
            if (rcuPrice.isEmpty() || wcuPrice.isEmpty() || storagePrice.isEmpty()) {
                return PricingSpec.forResource(resource, mode, "provisioned_capacity", 0, "RCU-hour",
                        "DynamoDB provisioned pricing not found",
                        List.of("Provisioned capacity pricing data not available"));
            }
            return PricingSpec.forResource(resource, mode, "provisioned_capacity", rcuPrice.getAsDouble(), "RCU-hour",
                    "DynamoDB provisioned capacity mode",
                    List.of(String.format("Read Capacity Unit: $%.6f per hour", rcuPrice.getAsDouble()),
                            String.format("Write Capacity Unit: $%.6f per hour", wcuPrice.getAsDouble()),
                            String.format("Storage: $%.4f per GB-month", storagePrice.getAsDouble()),
                            "Auto-scaling adjustments not included",
                            "Reserved capacity discounts not applied"));
        }

        OptionalDouble readPrice = pricing.dynamoDbOnDemandReadPrice();
        OptionalDouble writePrice = pricing.dynamoDbOnDemandWritePrice();
        if (readPrice.isEmpty() || writePrice.isEmpty() || storagePrice.isEmpty()) {
            return PricingSpec.forResource(resource, mode, "on_demand", 0, "GB-month",
                    "DynamoDB on-demand pricing not found", List.of("On-demand pricing data not available"));
        }
        return PricingSpec.forResource(resource, mode, "on_demand", storagePrice.getAsDouble(), "GB-month",
                "DynamoDB on-demand capacity mode",
                List.of(String.format("Read request units: $%.6f per million", readPrice.getAsDouble() * 1_000_000),
                        String.format("Write request units: $%.6f per million", writePrice.getAsDouble() * 1_000_000),
                        String.format("Storage: $%.4f per GB-month", storagePrice.getAsDouble()),
                        "Global tables replication costs not included",
                        "DynamoDB Streams not included"));
    }

    static String capacityModeOf(ResourceDescriptor resource) {
        String sku = resource.sku();
        return sku == null || sku.isBlank() ? ON_DEMAND : sku.toLowerCase(Locale.ROOT);
    }

    private void warnUnavailable(String component) {
        log.warn("DynamoDB {} pricing unavailable", component);
    }
}
