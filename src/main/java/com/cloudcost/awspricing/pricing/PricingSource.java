package com.cloudcost.awspricing.pricing;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Read-only pricing lookups for a single AWS region.
 *
 * CONTRACT:
 * - Every lookup returns an empty optional when the rate is unknown
 * - No lookup throws; absence is the only failure mode
 * - Implementations are immutable after construction and safe to share
 *
 * Unit conventions: hourly rates are USD per hour, storage rates USD per
 * GB-month, request rates USD per single request.
 */
public interface PricingSource {

    String region();

    // Compute / storage

    OptionalDouble ec2OnDemandHourly(String instanceType, String operatingSystem, String tenancy);

    OptionalDouble ebsPerGbMonth(String volumeType);

    OptionalDouble s3PerGbMonth(String storageClass);

    // Databases

    /**
     * @param engine display engine name, e.g. "PostgreSQL"; matched ignoring case and spaces
     */
    OptionalDouble rdsInstanceHourly(String instanceClass, String engine);

    OptionalDouble rdsStoragePerGbMonth(String storageType);

    OptionalDouble elastiCacheNodeHourly(String nodeType, String engine);

    OptionalDouble dynamoDbStoragePerGbMonth();

    OptionalDouble dynamoDbProvisionedRcuHourly();

    OptionalDouble dynamoDbProvisionedWcuHourly();

    OptionalDouble dynamoDbOnDemandReadPrice();

    OptionalDouble dynamoDbOnDemandWritePrice();

    // Containers / serverless

    OptionalDouble eksClusterHourly(boolean extendedSupport);

    OptionalDouble lambdaRequestPrice();

    /**
     * @param architecture "x86_64" or "arm64"
     */
    OptionalDouble lambdaGbSecondPrice(String architecture);

    // Networking

    OptionalDouble albHourly();

    OptionalDouble albLcuHourly();

    OptionalDouble nlbHourly();

    OptionalDouble nlbNlcuHourly();

    Optional<NatGatewayRate> natGatewayRate();

    // Monitoring

    List<TierRate> cloudWatchLogsIngestionTiers();

    OptionalDouble cloudWatchLogsStoragePerGbMonth();

    List<TierRate> cloudWatchMetricsTiers();
}
