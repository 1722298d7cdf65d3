package com.cloudcost.awspricing.normalization;

import com.cloudcost.awspricing.domain.model.ServiceIdentifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps raw resource type strings to a {@link ServiceIdentifier}.
 *
 * Accepted forms:
 * - canonical short codes: "ec2", "natgw", "elb"
 * - Pulumi type tokens: "aws:ec2/instance:Instance", "aws:lb/loadBalancer:LoadBalancer"
 *
 * Both steps are total functions. Empty input yields empty output, and a
 * string that matches nothing is returned unchanged and resolves to UNKNOWN.
 * Normalizing an already normalized value returns it as is.
 */
@Component
public class ResourceTypeNormalizer {

    private static final String AWS_PREFIX = "aws:";

    // Module names after "aws:" that map straight to a canonical code
    private static final Map<String, String> MODULE_ALIASES = Map.ofEntries(
            Map.entry("ec2", "ec2"),
            Map.entry("ebs", "ebs"),
            Map.entry("rds", "rds"),
            Map.entry("s3", "s3"),
            Map.entry("lambda", "lambda"),
            Map.entry("dynamodb", "dynamodb"),
            Map.entry("eks", "eks"),
            Map.entry("natgw", "natgw"),
            Map.entry("natgateway", "natgw"),
            Map.entry("cloudwatch", "cloudwatch"),
            Map.entry("elasticache", "elasticache"),
            Map.entry("lb", "elb"),
            Map.entry("alb", "elb"),
            Map.entry("nlb", "elb")
    );

    // Zero-cost networking resources under the ec2 module; must be a whole path segment
    private static final Map<String, String> ZERO_COST_PATTERNS = Map.of(
            "ec2/vpc", "vpc",
            "ec2/securitygroup", "securitygroup",
            "ec2/subnet", "subnet"
    );

    private static final Set<String> CANONICAL_CODES = Set.of(
            "ec2", "ebs", "rds", "s3", "lambda", "dynamodb", "eks", "elb", "natgw", "cloudwatch", "elasticache"
    );

    // Legacy substring fallbacks, checked in order
    private static final List<Map.Entry<List<String>, String>> LEGACY_PATTERNS = List.of(
            Map.entry(List.of("ec2/instance"), "ec2"),
            Map.entry(List.of("ebs/volume", "ec2/volume"), "ebs"),
            Map.entry(List.of("rds/instance"), "rds"),
            Map.entry(List.of("eks/cluster"), "eks"),
            Map.entry(List.of("s3/bucket"), "s3"),
            Map.entry(List.of("lambda/function"), "lambda"),
            Map.entry(List.of("dynamodb/table"), "dynamodb"),
            Map.entry(List.of("lb/loadbalancer", "alb/loadbalancer", "nlb/loadbalancer"), "elb"),
            Map.entry(List.of("ec2/natgateway"), "natgw"),
            Map.entry(List.of("cloudwatch/loggroup", "cloudwatch/logstream", "cloudwatch/metricalarm"), "cloudwatch"),
            Map.entry(List.of("elasticache/"), "elasticache"),
            Map.entry(List.of("iam/"), "iam")
    );

    /**
     * Resolves both the normalized type and the service in one pass.
     */
    public ResolvedResourceType resolve(String resourceType) {
        String original = resourceType == null ? "" : resourceType;
        String normalized = normalize(original);
        return new ResolvedResourceType(original, normalized, toServiceIdentifier(detectService(normalized)));
    }

    /**
     * Reduces a Pulumi type token to its canonical short code.
     *
     * An "aws:" token whose module is not recognized is returned unchanged
     * (original casing) so {@link #detectService} can still try the legacy
     * patterns on it. Any other input is lowercased.
     */
    public String normalize(String resourceType) {
        if (resourceType == null || resourceType.isEmpty()) {
            return "";
        }
        String lower = resourceType.toLowerCase(Locale.ROOT);
        if (!lower.startsWith(AWS_PREFIX)) {
            return lower;
        }

        if (lower.contains("ec2/volume")) {
            return "ebs";
        }
        if (lower.contains("ec2/natgateway")) {
            return "natgw";
        }
        if (lower.startsWith("aws:iam/")) {
            return "iam";
        }

        String suffix = lower.substring(AWS_PREFIX.length());
        for (Map.Entry<String, String> pattern : ZERO_COST_PATTERNS.entrySet()) {
            if (suffix.startsWith(pattern.getKey())) {
                String remaining = suffix.substring(pattern.getKey().length());
                if (remaining.isEmpty() || remaining.charAt(0) == ':') {
                    return pattern.getValue();
                }
            }
        }

        String module = suffix.split("/", -1)[0].split(":", -1)[0];
        String alias = MODULE_ALIASES.get(module);
        return alias != null ? alias : resourceType;
    }

    /**
     * Maps a (normalized) type string to its canonical service code,
     * or returns the input unchanged when nothing matches.
     */
    public String detectService(String resourceType) {
        if (resourceType == null || resourceType.isEmpty()) {
            return "";
        }
        if (CANONICAL_CODES.contains(resourceType)) {
            return resourceType;
        }
        if (resourceType.equals("alb") || resourceType.equals("nlb")) {
            return "elb";
        }
        if (ServiceIdentifier.fromCode(resourceType).map(ServiceIdentifier::isZeroCost).orElse(false)) {
            return resourceType;
        }

        String lower = resourceType.toLowerCase(Locale.ROOT);
        for (Map.Entry<List<String>, String> legacy : LEGACY_PATTERNS) {
            if (legacy.getKey().stream().anyMatch(lower::contains)) {
                return legacy.getValue();
            }
        }
        return resourceType;
    }

    public ServiceIdentifier toServiceIdentifier(String serviceCode) {
        return ServiceIdentifier.fromCode(serviceCode).orElse(ServiceIdentifier.UNKNOWN);
    }
}
