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
import java.util.Map;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.Set;

/**
 * RDS single-AZ instances: instance hours x 730 plus provisioned storage.
 *
 * DEFAULTS:
 * - engine: MySQL (also used for unrecognized engines)
 * - storage_type: gp2 (also used for unrecognized types)
 * - storage_size: 20 GB
 *
 * Every applied default is listed in the billing detail.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RdsCostCalculator implements ServiceCostCalculator {

    static final String DEFAULT_ENGINE = "mysql";
    static final String DEFAULT_STORAGE_TYPE = "gp2";
    static final int DEFAULT_STORAGE_GB = 20;

    /**
     * Engine tag values to the engine names used in the pricing data.
     */
    static final Map<String, String> ENGINE_NAMES = Map.ofEntries(
            Map.entry("mysql", "MySQL"),
            Map.entry("postgres", "PostgreSQL"),
            Map.entry("postgresql", "PostgreSQL"),
            Map.entry("mariadb", "MariaDB"),
            Map.entry("oracle", "Oracle"),
            Map.entry("oracle-se2", "Oracle"),
            Map.entry("sqlserver", "SQL Server"),
            Map.entry("sqlserver-ex", "SQL Server"),
            Map.entry("sql-server", "SQL Server")
    );

    private static final Set<String> STORAGE_TYPES = Set.of("gp2", "gp3", "io1", "io2", "standard");

    private final PricingSource pricing;

    @Override
    public Set<ServiceIdentifier> getServices() {
        return Set.of(ServiceIdentifier.RDS);
    }

    @Override
    public CostEstimate estimate(ResourceDescriptor resource, EstimationContext context) {
        String instanceClass = ServiceCostCalculator.resolveSku(resource);

        String engineTag = resource.tag("engine");
        boolean engineDefaulted = engineTag == null || engineTag.isEmpty();
        String engine = engineDefaulted ? DEFAULT_ENGINE : engineTag.toLowerCase(Locale.ROOT);
        String engineName = ENGINE_NAMES.get(engine);
        if (engineName == null) {
            engineName = ENGINE_NAMES.get(DEFAULT_ENGINE);
            engineDefaulted = true;
        }

        String storageTag = resource.tag("storage_type");
        String storageType = storageTag == null ? "" : storageTag.toLowerCase(Locale.ROOT);
        boolean storageDefaulted = !STORAGE_TYPES.contains(storageType);
        if (storageDefaulted) {
            storageType = DEFAULT_STORAGE_TYPE;
        }

        OptionalInt size = AttributeExtractor.positiveInt(resource.tags(), "storage_size");
        int storageGb = size.orElse(DEFAULT_STORAGE_GB);

        OptionalDouble hourly = pricing.rdsInstanceHourly(instanceClass, engineName);
        if (hourly.isEmpty()) {
            log.debug("RDS pricing not found: instanceClass={}, engine={}", instanceClass, engineName);
            return CostEstimate.zero(CostConstants.pricingNotFound("RDS instance type", instanceClass));
        }

        OptionalDouble storageRate = pricing.rdsStoragePerGbMonth(storageType);
        if (storageRate.isEmpty()) {
            log.warn("RDS storage pricing unavailable for {}, storage cost excluded", storageType);
        }

        double instanceMonthly = hourly.getAsDouble() * CostConstants.HOURS_PER_MONTH;
        double storageMonthly = storageRate.orElse(0.0) * storageGb;

        List<String> notes = new ArrayList<>();
        if (engineDefaulted) {
            notes.add("engine defaulted to MySQL");
        }
        if (storageDefaulted) {
            notes.add("storage type defaulted");
        }
        if (size.isEmpty()) {
            notes.add("size defaulted to " + DEFAULT_STORAGE_GB + "GB");
        }
        if (storageRate.isEmpty()) {
            notes.add("storage pricing unavailable");
        }

        String detail = String.format("RDS %s %s, %d hrs/month + %dGB %s storage",
                instanceClass, engineName, CostConstants.HOURS_PER_MONTH, storageGb, storageType);
        if (!notes.isEmpty()) {
            detail += " (" + String.join(", ", notes) + ")";
        }
        return CostEstimate.of(instanceMonthly + storageMonthly, hourly.getAsDouble(), detail);
    }

    @Override
    public PricingSpec pricingSpec(ResourceDescriptor resource) {
        String instanceClass = ServiceCostCalculator.resolveSku(resource);
        String engineTag = resource.tag("engine");
        String engine = engineTag == null || engineTag.isEmpty() ? DEFAULT_ENGINE : engineTag.toLowerCase(Locale.ROOT);
        String engineName = ENGINE_NAMES.getOrDefault(engine, ENGINE_NAMES.get(DEFAULT_ENGINE));

        OptionalDouble hourly = pricing.rdsInstanceHourly(instanceClass, engineName);
        if (hourly.isEmpty()) {
            return PricingSpec.forResource(resource, instanceClass, "per_hour", 0, "hour",
                    CostConstants.pricingNotFound("RDS instance", instanceClass),
                    List.of(String.format("Instance type %s with engine %s not found", instanceClass, engineName)));
        }
        return PricingSpec.forResource(resource, instanceClass, "per_hour", hourly.getAsDouble(), "hour",
                String.format("RDS %s instance with %s engine", instanceClass, engineName),
                List.of("Database engine: " + engineName,
                        "Single-AZ deployment",
                        "Storage costs billed separately",
                        "Backup storage not included",
                        "Read replicas billed separately"));
    }
}
