package com.cloudcost.awspricing.actual;

import com.cloudcost.awspricing.config.EngineSettings;
import com.cloudcost.awspricing.domain.model.ResourceDescriptor;
import com.cloudcost.awspricing.exception.InvalidResourceException;
import com.cloudcost.awspricing.normalization.AttributeExtractor;
import com.cloudcost.awspricing.normalization.AwsArn;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns an actual-cost request into a resource descriptor.
 *
 * PRECEDENCE:
 * 1. ARN (sku must be supplied in tags)
 * 2. resourceId holding a JSON-encoded descriptor
 * 3. Descriptor fields carried in tags
 *
 * A resourceId that is not JSON is treated as a plain id and the tags are
 * used instead.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ActualResourceResolver {

    private static final Set<String> ARN_CONSUMED_TAGS;
    private static final Set<String> DESCRIPTOR_TAGS = Set.of("provider", "resource_type", "sku", "region");

    static {
        Set<String> keys = new HashSet<>(AttributeExtractor.SKU_KEYS);
        keys.add("sku");
        ARN_CONSUMED_TAGS = Set.copyOf(keys);
    }

    private final ObjectMapper objectMapper;
    private final EngineSettings settings;

    public ResourceDescriptor resolve(ActualCostRequest request) {
        if (request.arn() != null && !request.arn().isEmpty()) {
            try {
                return fromArn(request.arn(), request.tags());
            } catch (InvalidResourceException e) {
                throw new InvalidResourceException(
                        String.format("failed to parse ARN \"%s\": %s", request.arn(), e.getMessage()), e);
            }
        }

        Optional<ResourceDescriptor> fromJson = fromResourceId(request.resourceId());
        if (fromJson.isPresent()) {
            return fromJson.get();
        }
        return fromTags(request.tags());
    }

    private ResourceDescriptor fromArn(String arn, Map<String, String> tags) {
        AwsArn parsed = AwsArn.parse(arn);

        String sku = tags.get("sku");
        if (sku == null || sku.isEmpty()) {
            sku = AttributeExtractor.extractSku(tags).orElse(null);
        }
        if (sku == null) {
            throw new InvalidResourceException(String.format(
                    "ARN provided (%s) but tags missing 'sku' (instance type, volume type, etc.)", arn));
        }

        Map<String, String> remaining = new LinkedHashMap<>(tags);
        remaining.keySet().removeAll(ARN_CONSUMED_TAGS);

        String region = parsed.region();
        if (region.isEmpty() && parsed.isGlobalService()) {
            log.debug("ARN {} is for global service {}, assigning engine region {}",
                    arn, parsed.service(), settings.region());
            region = settings.region();
        }
        return ResourceDescriptor.of("aws", parsed.toResourceType(), sku, region, remaining);
    }

    private Optional<ResourceDescriptor> fromResourceId(String resourceId) {
        if (resourceId == null || resourceId.isEmpty()) {
            return Optional.empty();
        }
        try {
            ResourceIdDocument document = objectMapper.readValue(resourceId, ResourceIdDocument.class);
            return Optional.of(ResourceDescriptor.of(document.provider(), document.resourceType(),
                    document.sku(), document.region(), document.tags()));
        } catch (JsonProcessingException e) {
            log.debug("resourceId is not a JSON descriptor, falling back to tags: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private ResourceDescriptor fromTags(Map<String, String> tags) {
        if (tags.isEmpty()) {
            throw new InvalidResourceException("missing resource information: provide ResourceId as JSON or use Tags");
        }

        String sku = tags.get("sku");
        if (sku == null || sku.isEmpty()) {
            sku = AttributeExtractor.extractSku(tags).orElse("");
        }
        String provider = tags.getOrDefault("provider", "");
        String resourceType = tags.getOrDefault("resource_type", "");
        String region = AttributeExtractor.extractRegion(tags).orElse("");

        if (provider.isEmpty() || resourceType.isEmpty() || sku.isEmpty() || region.isEmpty()) {
            throw new InvalidResourceException(
                    "resource information incomplete: need provider, resource_type, sku, region in ResourceId or Tags");
        }

        Map<String, String> remaining = new LinkedHashMap<>(tags);
        remaining.keySet().removeAll(DESCRIPTOR_TAGS);
        return ResourceDescriptor.of(provider, resourceType, sku, region, remaining);
    }

    /**
     * Tags embedded in a JSON resourceId, or empty when resourceId is not JSON.
     */
    public Map<String, String> embeddedTags(String resourceId) {
        return fromResourceId(resourceId)
                .map(ResourceDescriptor::tags)
                .orElse(Map.of());
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ResourceIdDocument(
            String provider,
            @JsonProperty("resource_type") @JsonAlias("resourceType") String resourceType,
            String sku,
            String region,
            Map<String, String> tags
    ) {}
}
