package com.cloudcost.awspricing.estimation;

import com.cloudcost.awspricing.config.EngineSettings;
import com.cloudcost.awspricing.domain.model.ResourceDescriptor;
import com.cloudcost.awspricing.domain.model.ServiceIdentifier;
import com.cloudcost.awspricing.exception.InvalidResourceException;
import com.cloudcost.awspricing.exception.RegionMismatchException;
import com.cloudcost.awspricing.normalization.ResolvedResourceType;
import com.cloudcost.awspricing.normalization.ResourceTypeNormalizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Validates resource descriptors before any cost computation.
 *
 * CHECKS (in order):
 * 1. Descriptor present
 * 2. Provider is "aws"
 * 3. resource_type present
 * 4. Effective region equals the engine region
 *
 * Global services (S3, IAM) with no region adopt the engine region. The
 * caller's descriptor is never modified; the effective region lives on the
 * returned copy.
 */
@Component
@RequiredArgsConstructor
public class RequestValidator {

    public static final String AWS = "aws";
    private static final Set<ServiceIdentifier> GLOBAL_SERVICES = Set.of(ServiceIdentifier.S3, ServiceIdentifier.IAM);

    private final EngineSettings settings;
    private final ResourceTypeNormalizer normalizer;

    public ValidatedResource validate(ResourceDescriptor resource) {
        if (resource == null) {
            throw new InvalidResourceException("resource is required");
        }
        if (resource.provider() == null || resource.provider().isBlank()) {
            throw new InvalidResourceException("provider is required");
        }
        if (!AWS.equals(resource.provider())) {
            throw new InvalidResourceException("only \"aws\" provider is supported");
        }
        if (resource.resourceType() == null || resource.resourceType().isBlank()) {
            throw new InvalidResourceException("resource_type is required");
        }

        ResolvedResourceType type = normalizer.resolve(resource.resourceType());
        String region = effectiveRegion(resource.region(), type.service());
        if (!settings.region().equals(region)) {
            throw new RegionMismatchException(settings.region(), region);
        }

        return new ValidatedResource(resource.withRegion(region), type);
    }

    /**
     * Region used for pricing: the resource's own, or the engine region for
     * a global service that has none.
     */
    public String effectiveRegion(String region, ServiceIdentifier service) {
        if ((region == null || region.isEmpty()) && GLOBAL_SERVICES.contains(service)) {
            return settings.region();
        }
        return region == null ? "" : region;
    }
}
