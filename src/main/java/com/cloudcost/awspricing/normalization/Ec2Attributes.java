package com.cloudcost.awspricing.normalization;

/**
 * Pricing-relevant EC2 attributes. Both fields always hold a value.
 */
public record Ec2Attributes(
        String operatingSystem,
        String tenancy
) {
    public static final String LINUX = "Linux";
    public static final String SHARED = "Shared";

    public static Ec2Attributes defaults() {
        return new Ec2Attributes(LINUX, SHARED);
    }
}
