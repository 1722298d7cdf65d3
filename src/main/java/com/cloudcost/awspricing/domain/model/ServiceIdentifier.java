package com.cloudcost.awspricing.domain.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of AWS services the engine can classify.
 *
 * Every raw resource type string resolves to exactly one identifier.
 * Strings that match no known service resolve to UNKNOWN.
 *
 * Zero-cost identifiers (VPC, security group, subnet, IAM) are billed
 * nothing directly and always estimate to $0.
 */
public enum ServiceIdentifier {
    EC2("ec2", "Amazon EC2", ServiceCategory.COMPUTE, "Hours", GrowthType.NONE, false),
    EBS("ebs", "Amazon EBS", ServiceCategory.STORAGE, "GB-Mo", GrowthType.NONE, false),
    RDS("rds", "Amazon RDS", ServiceCategory.DATABASE, "Hours", GrowthType.NONE, false),
    EKS("eks", "Amazon EKS", ServiceCategory.COMPUTE, "Hours", GrowthType.NONE, false),
    S3("s3", "Amazon S3", ServiceCategory.STORAGE, "GB-Mo", GrowthType.LINEAR, false),
    LAMBDA("lambda", "AWS Lambda", ServiceCategory.COMPUTE, "GB-Seconds", GrowthType.NONE, false),
    DYNAMODB("dynamodb", "Amazon DynamoDB", ServiceCategory.DATABASE, "Requests", GrowthType.LINEAR, false),
    ELB("elb", "Elastic Load Balancing", ServiceCategory.NETWORK, "Hours", GrowthType.NONE, false),
    NATGW("natgw", "Amazon VPC NAT Gateway", ServiceCategory.NETWORK, "Hours", GrowthType.NONE, false),
    CLOUDWATCH("cloudwatch", "Amazon CloudWatch", ServiceCategory.MANAGEMENT, "GB", GrowthType.NONE, false),
    ELASTICACHE("elasticache", "Amazon ElastiCache", ServiceCategory.DATABASE, "Hours", GrowthType.NONE, false),
    VPC("vpc", "Amazon VPC", ServiceCategory.NETWORK, "Units", GrowthType.NONE, true),
    SECURITY_GROUP("securitygroup", "Amazon VPC", ServiceCategory.NETWORK, "Units", GrowthType.NONE, true),
    SUBNET("subnet", "Amazon VPC", ServiceCategory.NETWORK, "Units", GrowthType.NONE, true),
    IAM("iam", "AWS IAM", ServiceCategory.OTHER, "Units", GrowthType.NONE, true),
    UNKNOWN("unknown", "AWS", ServiceCategory.OTHER, "Units", GrowthType.NONE, false);

    private final String code;
    private final String serviceName;
    private final ServiceCategory category;
    private final String pricingUnit;
    private final GrowthType growthType;
    private final boolean zeroCost;

    ServiceIdentifier(String code, String serviceName, ServiceCategory category,
                      String pricingUnit, GrowthType growthType, boolean zeroCost) {
        this.code = code;
        this.serviceName = serviceName;
        this.category = category;
        this.pricingUnit = pricingUnit;
        this.growthType = growthType;
        this.zeroCost = zeroCost;
    }

    /**
     * Canonical short form, e.g. "ec2" or "natgw".
     */
    public String getCode() {
        return code;
    }

    /**
     * AWS display name used in FOCUS records.
     */
    public String getServiceName() {
        return serviceName;
    }

    public ServiceCategory getCategory() {
        return category;
    }

    /**
     * Default pricing unit when a calculation has no specific unit.
     */
    public String getPricingUnit() {
        return pricingUnit;
    }

    public GrowthType getGrowthType() {
        return growthType;
    }

    public boolean isZeroCost() {
        return zeroCost;
    }

    public static Optional<ServiceIdentifier> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(service -> service != UNKNOWN && service.code.equals(code))
                .findFirst();
    }
}
