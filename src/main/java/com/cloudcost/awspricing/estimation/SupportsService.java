package com.cloudcost.awspricing.estimation;

import com.cloudcost.awspricing.config.EngineSettings;
import com.cloudcost.awspricing.domain.model.MetricKind;
import com.cloudcost.awspricing.domain.model.ResourceDescriptor;
import com.cloudcost.awspricing.domain.model.ServiceIdentifier;
import com.cloudcost.awspricing.domain.model.SupportsResult;
import com.cloudcost.awspricing.normalization.ResolvedResourceType;
import com.cloudcost.awspricing.normalization.ResourceTypeNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Answers whether this engine instance can price a resource.
 *
 * Never throws: every negative answer carries a human-readable reason.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SupportsService {

    private static final Set<ServiceIdentifier> SUPPORTED = EnumSet.of(
            ServiceIdentifier.EC2, ServiceIdentifier.RDS, ServiceIdentifier.LAMBDA, ServiceIdentifier.S3,
            ServiceIdentifier.EBS, ServiceIdentifier.EKS, ServiceIdentifier.DYNAMODB, ServiceIdentifier.ELASTICACHE,
            ServiceIdentifier.ELB, ServiceIdentifier.NATGW, ServiceIdentifier.CLOUDWATCH
    );

    private static final Set<ServiceIdentifier> CARBON_METRIC_SERVICES =
            EnumSet.of(ServiceIdentifier.EC2, ServiceIdentifier.ELASTICACHE);

    private final EngineSettings settings;
    private final RequestValidator validator;
    private final ResourceTypeNormalizer normalizer;

    public SupportsResult supports(ResourceDescriptor resource) {
        if (resource == null) {
            return SupportsResult.unsupported("Invalid request: missing resource descriptor");
        }
        if (!RequestValidator.AWS.equals(resource.provider())) {
            return SupportsResult.unsupported(String.format(
                    "Provider \"%s\" not supported (only \"aws\" is supported)", resource.provider()));
        }

        ResolvedResourceType type = normalizer.resolve(resource.resourceType());
        String region = validator.effectiveRegion(resource.region(), type.service());
        if (!settings.region().equals(region)) {
            return SupportsResult.unsupported(String.format(
                    "Region not supported by this binary (plugin region: %s, resource region: %s)",
                    settings.region(), region));
        }

        if (!SUPPORTED.contains(type.service())) {
            log.debug("Supports: resource type {} not supported", resource.resourceType());
            return SupportsResult.unsupported(String.format(
                    "Resource type \"%s\" not supported", resource.resourceType()));
        }

        List<MetricKind> metrics = CARBON_METRIC_SERVICES.contains(type.service())
                ? List.of(MetricKind.CARBON_FOOTPRINT)
                : List.of();
        return new SupportsResult(true, "", metrics);
    }
}
