package com.cloudcost.awspricing.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable description of a single cloud resource.
 *
 * resourceType may be canonical ("ec2") or vendor-hierarchical
 * ("aws:ec2/instance:Instance"). Normalization never mutates an instance;
 * the with* methods return new values.
 */
public record ResourceDescriptor(
        String provider,
        String resourceType,
        String sku,
        String region,
        Map<String, String> tags,
        String id,
        String name,
        Double utilizationPercentage
) {

    public ResourceDescriptor {
        tags = tags == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(tags));
    }

    public static ResourceDescriptor of(String provider, String resourceType, String sku,
                                        String region, Map<String, String> tags) {
        return new ResourceDescriptor(provider, resourceType, sku, region, tags, null, null, null);
    }

    public String tag(String key) {
        return tags.get(key);
    }

    public boolean hasTag(String key) {
        return tags.containsKey(key);
    }

    public ResourceDescriptor withResourceType(String newResourceType) {
        return new ResourceDescriptor(provider, newResourceType, sku, region, tags, id, name, utilizationPercentage);
    }

    public ResourceDescriptor withRegion(String newRegion) {
        return new ResourceDescriptor(provider, resourceType, sku, newRegion, tags, id, name, utilizationPercentage);
    }
}
