package com.cloudcost.awspricing.normalization;

import com.cloudcost.awspricing.exception.InvalidResourceException;

import java.util.Set;

/**
 * Parsed AWS ARN: {@code arn:partition:service:region:account:resource}.
 *
 * The resource part is split into type and id on the first "/" or,
 * failing that, the first ":". Region may be empty for global services.
 */
public record AwsArn(
        String partition,
        String service,
        String region,
        String accountId,
        String resourceType,
        String resourceId
) {
    private static final Set<String> PUBLIC_PARTITIONS = Set.of("aws", "aws-cn", "aws-us-gov");
    private static final Set<String> ISOLATED_PARTITIONS = Set.of("aws-iso", "aws-iso-b");

    public static AwsArn parse(String arn) {
        if (arn == null || arn.isEmpty()) {
            throw new InvalidResourceException("ARN is empty");
        }
        String[] parts = arn.split(":", 6);
        if (parts.length < 6) {
            throw new InvalidResourceException(String.format(
                    "invalid ARN format: expected at least 6 colon-separated parts, got %d", parts.length));
        }
        if (!parts[0].equals("arn")) {
            throw new InvalidResourceException(String.format("invalid ARN: must start with 'arn:', got \"%s\"", parts[0]));
        }

        String partition = parts[1];
        if (partition.isEmpty()) {
            throw new InvalidResourceException("invalid ARN: partition is empty");
        }
        if (!PUBLIC_PARTITIONS.contains(partition)) {
            if (ISOLATED_PARTITIONS.contains(partition)) {
                throw new InvalidResourceException(String.format(
                        "unsupported ARN partition \"%s\": isolated partitions (aws-iso, aws-iso-b) "
                                + "do not have public pricing data available", partition));
            }
            throw new InvalidResourceException(String.format("invalid ARN partition: \"%s\"", partition));
        }
        if (parts[2].isEmpty()) {
            throw new InvalidResourceException("invalid ARN: service is empty");
        }
        String resourcePart = parts[5];
        if (resourcePart.isEmpty()) {
            throw new InvalidResourceException("invalid ARN: resource part is empty");
        }

        int slash = resourcePart.indexOf('/');
        int colon = resourcePart.indexOf(':');
        int split = slash != -1 ? slash : colon;
        String type = split == -1 ? resourcePart : resourcePart.substring(0, split);
        String id = split == -1 ? "" : resourcePart.substring(split + 1);

        return new AwsArn(partition, parts[2], parts[3], parts[4], type, id);
    }

    /**
     * Canonical resource type code for this ARN's service.
     * EC2 volumes are EBS; load balancers and log groups get their own codes.
     */
    public String toResourceType() {
        if (service.equals("ec2") && resourceType.equals("volume")) {
            return "ebs";
        }
        if (service.equals("ec2") && resourceType.equals("natgateway")) {
            return "natgw";
        }
        return switch (service) {
            case "elasticloadbalancing" -> "elb";
            case "logs" -> "cloudwatch";
            default -> service;
        };
    }

    public boolean isGlobalService() {
        return service.equals("s3") || service.equals("iam");
    }
}
