package com.cloudcost.awspricing.pricing;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;

/**
 * On-disk shape of a region's embedded pricing data.
 *
 * Every section is optional. A missing section or rate simply makes the
 * matching lookups come back empty.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PricingDocument(
        String region,
        String currency,
        List<Ec2Rate> ec2,
        Map<String, Double> ebs,
        RdsRates rds,
        Map<String, Double> s3,
        EksRates eks,
        LambdaRates lambda,
        DynamoDbRates dynamodb,
        LoadBalancerRates loadBalancer,
        NatGatewayRates natGateway,
        CloudWatchRates cloudWatch,
        List<ElastiCacheRate> elastiCache
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Ec2Rate(String instanceType, String operatingSystem, String tenancy, double hourly) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RdsRates(List<RdsInstanceRate> instances, Map<String, Double> storage) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RdsInstanceRate(String instanceClass, String engine, double hourly) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record EksRates(Double standardHourly, Double extendedHourly) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LambdaRates(Double requestPrice, Map<String, Double> gbSecond) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DynamoDbRates(
            Double storagePerGbMonth,
            Double provisionedRcuHourly,
            Double provisionedWcuHourly,
            Double onDemandReadPerRequest,
            Double onDemandWritePerRequest
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LoadBalancerRates(Double albHourly, Double albLcuHourly, Double nlbHourly, Double nlbNlcuHourly) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record NatGatewayRates(Double hourly, Double dataPerGb) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CloudWatchRates(
            List<TierRate> logsIngestionTiers,
            Double logsStoragePerGbMonth,
            List<TierRate> metricsTiers
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ElastiCacheRate(String nodeType, String engine, double hourly) {}
}
