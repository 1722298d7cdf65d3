package com.cloudcost.awspricing.pricing;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.Function;

/**
 * {@link PricingSource} backed by an in-memory {@link PricingDocument}.
 *
 * Index maps are built once in the constructor and never modified, so a
 * single instance is shared by all requests.
 */
@Slf4j
public class EmbeddedPricingSource implements PricingSource {

    private final String region;
    private final Map<String, Double> ec2Index;
    private final Map<String, Double> ebsIndex;
    private final Map<String, Double> s3Index;
    private final Map<String, Double> rdsInstanceIndex;
    private final Map<String, Double> rdsStorageIndex;
    private final Map<String, Double> elastiCacheIndex;
    private final Map<String, Double> lambdaGbSecondIndex;
    private final PricingDocument.EksRates eks;
    private final PricingDocument.LambdaRates lambda;
    private final PricingDocument.DynamoDbRates dynamoDb;
    private final PricingDocument.LoadBalancerRates loadBalancer;
    private final PricingDocument.NatGatewayRates natGateway;
    private final PricingDocument.CloudWatchRates cloudWatch;

    public EmbeddedPricingSource(PricingDocument document) {
        this.region = document.region();
        this.ec2Index = index(document.ec2(),
                rate -> ec2Key(rate.instanceType(), rate.operatingSystem(), rate.tenancy()),
                PricingDocument.Ec2Rate::hourly);
        this.ebsIndex = copyOf(document.ebs(), key -> key.toLowerCase(Locale.ROOT));
        this.s3Index = copyOf(document.s3(), key -> key.toUpperCase(Locale.ROOT));
        this.rdsInstanceIndex = document.rds() == null ? Map.of() : index(document.rds().instances(),
                rate -> engineKey(rate.instanceClass(), rate.engine()),
                PricingDocument.RdsInstanceRate::hourly);
        this.rdsStorageIndex = document.rds() == null ? Map.of()
                : copyOf(document.rds().storage(), key -> key.toLowerCase(Locale.ROOT));
        this.elastiCacheIndex = index(document.elastiCache(),
                rate -> engineKey(rate.nodeType(), rate.engine()),
                PricingDocument.ElastiCacheRate::hourly);
        this.eks = document.eks();
        this.lambda = document.lambda();
        this.lambdaGbSecondIndex = lambda == null ? Map.of()
                : copyOf(lambda.gbSecond(), key -> key.toLowerCase(Locale.ROOT));
        this.dynamoDb = document.dynamodb();
        this.loadBalancer = document.loadBalancer();
        this.natGateway = document.natGateway();
        this.cloudWatch = document.cloudWatch();

        log.info("Indexed pricing for {}: {} EC2 rates, {} RDS rates, {} ElastiCache rates",
                region, ec2Index.size(), rdsInstanceIndex.size(), elastiCacheIndex.size());
    }

    @Override
    public String region() {
        return region;
    }

    @Override
    public OptionalDouble ec2OnDemandHourly(String instanceType, String operatingSystem, String tenancy) {
        return lookup(ec2Index, ec2Key(instanceType, operatingSystem, tenancy));
    }

    @Override
    public OptionalDouble ebsPerGbMonth(String volumeType) {
        return lookup(ebsIndex, lower(volumeType));
    }

    @Override
    public OptionalDouble s3PerGbMonth(String storageClass) {
        return lookup(s3Index, storageClass == null ? null : storageClass.toUpperCase(Locale.ROOT));
    }

    @Override
    public OptionalDouble rdsInstanceHourly(String instanceClass, String engine) {
        return lookup(rdsInstanceIndex, engineKey(instanceClass, engine));
    }

    @Override
    public OptionalDouble rdsStoragePerGbMonth(String storageType) {
        return lookup(rdsStorageIndex, lower(storageType));
    }

    @Override
    public OptionalDouble elastiCacheNodeHourly(String nodeType, String engine) {
        return lookup(elastiCacheIndex, engineKey(nodeType, engine));
    }

    @Override
    public OptionalDouble dynamoDbStoragePerGbMonth() {
        return dynamoDb == null ? OptionalDouble.empty() : of(dynamoDb.storagePerGbMonth());
    }

    @Override
    public OptionalDouble dynamoDbProvisionedRcuHourly() {
        return dynamoDb == null ? OptionalDouble.empty() : of(dynamoDb.provisionedRcuHourly());
    }

    @Override
    public OptionalDouble dynamoDbProvisionedWcuHourly() {
        return dynamoDb == null ? OptionalDouble.empty() : of(dynamoDb.provisionedWcuHourly());
    }

    @Override
    public OptionalDouble dynamoDbOnDemandReadPrice() {
        return dynamoDb == null ? OptionalDouble.empty() : of(dynamoDb.onDemandReadPerRequest());
    }

    @Override
    public OptionalDouble dynamoDbOnDemandWritePrice() {
        return dynamoDb == null ? OptionalDouble.empty() : of(dynamoDb.onDemandWritePerRequest());
    }

    @Override
    public OptionalDouble eksClusterHourly(boolean extendedSupport) {
        if (eks == null) {
            return OptionalDouble.empty();
        }
        return of(extendedSupport ? eks.extendedHourly() : eks.standardHourly());
    }

    @Override
    public OptionalDouble lambdaRequestPrice() {
        return lambda == null ? OptionalDouble.empty() : of(lambda.requestPrice());
    }

    @Override
    public OptionalDouble lambdaGbSecondPrice(String architecture) {
        return lookup(lambdaGbSecondIndex, lower(architecture));
    }

    @Override
    public OptionalDouble albHourly() {
        return loadBalancer == null ? OptionalDouble.empty() : of(loadBalancer.albHourly());
    }

    @Override
    public OptionalDouble albLcuHourly() {
        return loadBalancer == null ? OptionalDouble.empty() : of(loadBalancer.albLcuHourly());
    }

    @Override
    public OptionalDouble nlbHourly() {
        return loadBalancer == null ? OptionalDouble.empty() : of(loadBalancer.nlbHourly());
    }

    @Override
    public OptionalDouble nlbNlcuHourly() {
        return loadBalancer == null ? OptionalDouble.empty() : of(loadBalancer.nlbNlcuHourly());
    }

    @Override
    public Optional<NatGatewayRate> natGatewayRate() {
        if (natGateway == null || natGateway.hourly() == null || natGateway.dataPerGb() == null) {
            return Optional.empty();
        }
        return Optional.of(new NatGatewayRate(natGateway.hourly(), natGateway.dataPerGb()));
    }

    @Override
    public List<TierRate> cloudWatchLogsIngestionTiers() {
        return cloudWatch == null || cloudWatch.logsIngestionTiers() == null
                ? List.of() : List.copyOf(cloudWatch.logsIngestionTiers());
    }

    @Override
    public OptionalDouble cloudWatchLogsStoragePerGbMonth() {
        return cloudWatch == null ? OptionalDouble.empty() : of(cloudWatch.logsStoragePerGbMonth());
    }

    @Override
    public List<TierRate> cloudWatchMetricsTiers() {
        return cloudWatch == null || cloudWatch.metricsTiers() == null
                ? List.of() : List.copyOf(cloudWatch.metricsTiers());
    }

    // ==================== INDEX HELPERS ====================

    static String ec2Key(String instanceType, String operatingSystem, String tenancy) {
        return lower(instanceType) + "/" + lower(operatingSystem) + "/" + lower(tenancy);
    }

    /**
     * Engine names are compared ignoring case and spaces, so "SQL Server"
     * and "sqlserver" or "PostgreSQL" and "postgresql" hit the same rate.
     */
    static String engineKey(String sku, String engine) {
        String normalizedEngine = engine == null ? "" : engine.replace(" ", "").toLowerCase(Locale.ROOT);
        return lower(sku) + "/" + normalizedEngine;
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }

    private static <T> Map<String, Double> index(List<T> rates, Function<T, String> key, Function<T, Double> value) {
        if (rates == null) {
            return Map.of();
        }
        Map<String, Double> result = new HashMap<>();
        for (T rate : rates) {
            Double previous = result.put(key.apply(rate), value.apply(rate));
            if (previous != null) {
                log.warn("Duplicate pricing entry for {}, keeping the last one", key.apply(rate));
            }
        }
        return Collections.unmodifiableMap(result);
    }

    private static Map<String, Double> copyOf(Map<String, Double> rates, Function<String, String> keyNormalizer) {
        if (rates == null) {
            return Map.of();
        }
        Map<String, Double> result = new HashMap<>();
        rates.forEach((key, value) -> {
            if (value != null) {
                result.put(keyNormalizer.apply(key), value);
            }
        });
        return Collections.unmodifiableMap(result);
    }

    private static OptionalDouble lookup(Map<String, Double> index, String key) {
        if (key == null) {
            return OptionalDouble.empty();
        }
        return of(index.get(key));
    }

    private static OptionalDouble of(Double value) {
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }
}
