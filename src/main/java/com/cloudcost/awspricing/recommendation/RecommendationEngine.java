package com.cloudcost.awspricing.recommendation;

import com.cloudcost.awspricing.config.EngineSettings;
import com.cloudcost.awspricing.domain.model.CostEstimate;
import com.cloudcost.awspricing.domain.model.Recommendation;
import com.cloudcost.awspricing.domain.model.RecommendationImpact;
import com.cloudcost.awspricing.domain.model.RecommendationSummary;
import com.cloudcost.awspricing.domain.model.ResourceDescriptor;
import com.cloudcost.awspricing.domain.model.ServiceIdentifier;
import com.cloudcost.awspricing.exception.InvalidResourceException;
import com.cloudcost.awspricing.normalization.ResourceTypeNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Batch recommendation generator.
 *
 * DECISION FLOW:
 * 1. Reject batches above the configured maximum
 * 2. Build the scope: target resources, or a single resource from the filter SKU
 * 3. Skip non-AWS resources and resources that fail the filter
 * 4. Ask the upgrade advisor for EC2, EBS and RDS candidates
 * 5. Copy correlation id and name onto every recommendation
 * 6. Summarize by category and action type
 *
 * In strict mode a non-AWS provider or a service without recommendation
 * support fails the whole batch instead of being skipped.
 *
 * Input descriptors are never modified; normalized copies are used.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecommendationEngine {

    private final UpgradeAdvisor advisor;
    private final ResourceTypeNormalizer normalizer;
    private final EngineSettings settings;

    public RecommendationResponse getRecommendations(RecommendationRequest request) {
        long start = System.currentTimeMillis();
        if (request == null) {
            throw new InvalidResourceException("missing request");
        }

        List<ResourceDescriptor> targets = request.targetResources() == null ? List.of() : request.targetResources();
        if (targets.size() > settings.maxBatchSize()) {
            throw new InvalidResourceException(String.format("batch size %d exceeds maximum of %d",
                    targets.size(), settings.maxBatchSize()));
        }

        RecommendationFilter filter = normalizeFilter(request.filter());
        List<ResourceDescriptor> scope = buildScope(targets, filter);

        List<Recommendation> recommendations = new ArrayList<>();
        int matched = 0;
        int skipped = 0;
        for (ResourceDescriptor resource : scope) {
            if (resource.provider() != null && !resource.provider().isEmpty() && !"aws".equals(resource.provider())) {
                skipped++;
                log.debug("Skipping resource {} in recommendations batch: non-AWS provider {}",
                        resource.resourceType(), resource.provider());
                if (settings.strictValidation()) {
                    throw new InvalidResourceException(String.format(
                            "strict validation: unsupported provider \"%s\" (only \"aws\" supported)",
                            resource.provider()));
                }
                continue;
            }

            if (!matches(resource, filter)) {
                skipped++;
                log.debug("Skipping resource {} ({}) in recommendations batch: filter mismatch",
                        resource.resourceType(), resource.sku());
                continue;
            }
            matched++;

            for (Recommendation recommendation : recommendationsFor(resource)) {
                recommendations.add(correlate(recommendation, resource));
            }
        }

        RecommendationSummary summary = summarize(recommendations);
        log.info("GetRecommendations completed: totalResources={}, matchedResources={}, recommendations={}, "
                        + "skippedResources={}, totalSavings={}, durationMs={}",
                scope.size(), matched, recommendations.size(), skipped,
                summary.totalEstimatedSavings(), System.currentTimeMillis() - start);

        return new RecommendationResponse(recommendations, summary);
    }

    private List<Recommendation> recommendationsFor(ResourceDescriptor resource) {
        String region = resource.region() == null || resource.region().isEmpty()
                ? settings.region()
                : resource.region();
        ServiceIdentifier service = normalizer.resolve(resource.resourceType()).service();

        return switch (service) {
            case EC2 -> advisor.forEc2(resource.sku(), region);
            case EBS -> advisor.forEbs(resource.sku(), region, resource.tags());
            case RDS -> advisor.forRds(resource.sku(), resource.tags(), region);
            default -> {
                log.debug("No recommendations for resource type {} (service {})",
                        resource.resourceType(), service.getCode());
                if (settings.strictValidation()) {
                    throw new InvalidResourceException(String.format(
                            "strict validation: service \"%s\" does not support recommendations (resource_type: %s)",
                            service.getCode(), resource.resourceType()));
                }
                yield List.of();
            }
        };
    }

    /**
     * Native id wins over the resource_id tag; the name always comes from the name tag.
     */
    private Recommendation correlate(Recommendation recommendation, ResourceDescriptor resource) {
        String id = null;
        if (resource.id() != null && !resource.id().trim().isEmpty()) {
            id = resource.id().trim();
        } else if (resource.tag("resource_id") != null && !resource.tag("resource_id").isEmpty()) {
            id = resource.tag("resource_id");
        }
        String name = resource.tag("name");
        if (name != null && name.isEmpty()) {
            name = null;
        }
        return recommendation.withResource(recommendation.resource().withCorrelation(id, name));
    }

    private RecommendationFilter normalizeFilter(RecommendationFilter filter) {
        if (filter == null || filter.resourceType() == null || filter.resourceType().isEmpty()) {
            return filter;
        }
        return new RecommendationFilter(filter.region(), normalizer.normalize(filter.resourceType()),
                filter.sku(), filter.tags());
    }

    /**
     * Target resources with normalized types, or, when there are none, a
     * single AWS resource described by the filter's SKU.
     */
    private List<ResourceDescriptor> buildScope(List<ResourceDescriptor> targets, RecommendationFilter filter) {
        if (!targets.isEmpty()) {
            return targets.stream()
                    .map(resource -> resource.withResourceType(normalizer.normalize(resource.resourceType())))
                    .toList();
        }
        if (filter != null && filter.sku() != null && !filter.sku().isEmpty()) {
            return List.of(ResourceDescriptor.of("aws", filter.resourceType(), filter.sku(),
                    filter.region(), filter.tags()));
        }
        return List.of();
    }

    static boolean matches(ResourceDescriptor resource, RecommendationFilter filter) {
        if (filter == null) {
            return true;
        }
        if (isSet(filter.region()) && !filter.region().equals(resource.region())) {
            return false;
        }
        if (isSet(filter.resourceType()) && !filter.resourceType().equals(resource.resourceType())) {
            return false;
        }
        if (isSet(filter.sku()) && !filter.sku().equals(resource.sku())) {
            return false;
        }
        if (filter.tags() != null) {
            for (Map.Entry<String, String> tag : filter.tags().entrySet()) {
                if (!resource.hasTag(tag.getKey()) || !Objects.equals(tag.getValue(), resource.tag(tag.getKey()))) {
                    return false;
                }
            }
        }
        return true;
    }

    static RecommendationSummary summarize(List<Recommendation> recommendations) {
        double totalSavings = 0;
        Map<String, Integer> byCategory = new LinkedHashMap<>();
        Map<String, Integer> byActionType = new LinkedHashMap<>();
        for (Recommendation recommendation : recommendations) {
            if (recommendation.impact() != null) {
                totalSavings += recommendation.impact().estimatedSavings();
            } else {
                log.warn("Recommendation {} has no impact, excluded from savings total", recommendation.id());
            }
            byCategory.merge(recommendation.category().name(), 1, Integer::sum);
            byActionType.merge(recommendation.actionType().name(), 1, Integer::sum);
        }
        return new RecommendationSummary(recommendations.size(), totalSavings, CostEstimate.USD,
                RecommendationImpact.MONTHLY, byCategory, byActionType);
    }

    private static boolean isSet(String value) {
        return value != null && !value.isEmpty();
    }

    // Request and response types

    public record RecommendationRequest(
            List<ResourceDescriptor> targetResources,
            RecommendationFilter filter
    ) {}

    /**
     * AND filter over a batch. Empty fields match everything; every filter
     * tag must be present on the resource with the same value.
     */
    public record RecommendationFilter(
            String region,
            String resourceType,
            String sku,
            Map<String, String> tags
    ) {}

    public record RecommendationResponse(
            List<Recommendation> recommendations,
            RecommendationSummary summary
    ) {}
}
