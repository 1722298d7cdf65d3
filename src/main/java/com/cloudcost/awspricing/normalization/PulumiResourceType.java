package com.cloudcost.awspricing.normalization;

import com.cloudcost.awspricing.exception.InvalidResourceException;

/**
 * Parsed form of a Pulumi type token {@code provider:module/resource:Type}.
 */
public record PulumiResourceType(
        String provider,
        String module,
        String resource,
        String type
) {
    public static PulumiResourceType parse(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidResourceException("invalid format: expected 'provider:module/resource:Type'");
        }
        String[] providerSplit = token.split(":", 2);
        if (providerSplit.length != 2 || providerSplit[0].isEmpty()) {
            throw new InvalidResourceException("invalid format: expected 'provider:module/resource:Type'");
        }
        String[] moduleSplit = providerSplit[1].split("/", 2);
        if (moduleSplit.length != 2 || moduleSplit[0].isEmpty()) {
            throw new InvalidResourceException("invalid format: expected module/resource:Type");
        }
        String[] resourceSplit = moduleSplit[1].split(":", 2);
        if (resourceSplit.length != 2 || resourceSplit[0].isEmpty() || resourceSplit[1].isEmpty()) {
            throw new InvalidResourceException("invalid format: expected resource:Type");
        }
        return new PulumiResourceType(providerSplit[0], moduleSplit[0], resourceSplit[0], resourceSplit[1]);
    }

    public boolean is(String expectedModule, String expectedType) {
        return module.equalsIgnoreCase(expectedModule) && type.equals(expectedType);
    }
}
