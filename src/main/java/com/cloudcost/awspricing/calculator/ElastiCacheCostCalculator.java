package com.cloudcost.awspricing.calculator;

import com.cloudcost.awspricing.carbon.CarbonEstimator;
import com.cloudcost.awspricing.domain.model.CostEstimate;
import com.cloudcost.awspricing.domain.model.ImpactMetric;
import com.cloudcost.awspricing.domain.model.PricingSpec;
import com.cloudcost.awspricing.domain.model.ResourceDescriptor;
import com.cloudcost.awspricing.domain.model.ServiceIdentifier;
import com.cloudcost.awspricing.exception.InvalidResourceException;
import com.cloudcost.awspricing.pricing.PricingSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * ElastiCache clusters: node hourly rate x node count x 730.
 *
 * The node type is required. Node count comes from "num_nodes" or
 * "num_cache_nodes" (1 to 1000, default 1) and the engine from "engine"
 * (default redis).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ElastiCacheCostCalculator implements ServiceCostCalculator {

    static final String DEFAULT_ENGINE = "redis";
    static final int MAX_NODES = 1000;
    private static final String CACHE_PREFIX = "cache.";

    private final PricingSource pricing;
    private final CarbonEstimator carbonEstimator;

    @Override
    public Set<ServiceIdentifier> getServices() {
        return Set.of(ServiceIdentifier.ELASTICACHE);
    }

    @Override
    public CostEstimate estimate(ResourceDescriptor resource, EstimationContext context) {
        String nodeType = ServiceCostCalculator.resolveSku(resource);
        if (nodeType.isEmpty()) {
            throw new InvalidResourceException(
                    "ElastiCache node type not specified: use 'sku' field or 'instanceType' tag");
        }
        String engine = engineOf(resource);
        int nodes = nodeCountOf(resource);

        OptionalDouble hourly = pricing.elastiCacheNodeHourly(nodeType, engine);
        if (hourly.isEmpty()) {
            log.debug("ElastiCache pricing not found: nodeType={}, engine={}", nodeType, engine);
            return CostEstimate.zero(CostConstants.pricingNotFound("ElastiCache " + engine + " node", nodeType));
        }

        double rate = hourly.getAsDouble();
        String nodeLabel = nodes == 1 ? "1 node" : nodes + " nodes";
        CostEstimate estimate = CostEstimate.of(rate * nodes * CostConstants.HOURS_PER_MONTH, rate,
                String.format("ElastiCache %s (%s), %s, %d hrs/month",
                        nodeType, engine, nodeLabel, CostConstants.HOURS_PER_MONTH));

        // Power profiles are keyed by the EC2 family the node runs on
        String instanceType = nodeType.startsWith(CACHE_PREFIX) ? nodeType.substring(CACHE_PREFIX.length()) : nodeType;
        OptionalDouble carbon = carbonEstimator.estimateGrams(instanceType, resource.region(),
                context.utilizationFor(resource), CostConstants.HOURS_PER_MONTH);
        if (carbon.isPresent()) {
            estimate = estimate.withImpact(ImpactMetric.carbonGrams(carbon.getAsDouble() * nodes));
        }
        return estimate;
    }

    @Override
    public PricingSpec pricingSpec(ResourceDescriptor resource) {
        String nodeType = ServiceCostCalculator.resolveSku(resource);
        String engine = engineOf(resource);
        OptionalDouble hourly = pricing.elastiCacheNodeHourly(nodeType, engine);
        if (hourly.isEmpty()) {
            return PricingSpec.forResource(resource, nodeType, "per_hour_per_node", 0, "node-hour",
                    CostConstants.pricingNotFound("ElastiCache " + engine + " node", nodeType),
                    List.of("Node type not found in embedded pricing data"));
        }
        return PricingSpec.forResource(resource, nodeType, "per_hour_per_node", hourly.getAsDouble(), "node-hour",
                String.format("ElastiCache %s node running %s", nodeType, engine),
                List.of("Engine: " + engine,
                        "On-demand nodes",
                        "Backup storage not included",
                        "Data transfer costs not included"));
    }

    private static String engineOf(ResourceDescriptor resource) {
        String engine = resource.tag("engine");
        return engine == null || engine.isBlank() ? DEFAULT_ENGINE : engine.toLowerCase(Locale.ROOT);
    }

    static int nodeCountOf(ResourceDescriptor resource) {
        String raw = resource.tag("num_nodes");
        if (raw == null || raw.isBlank()) {
            raw = resource.tag("num_cache_nodes");
        }
        if (raw == null || raw.isBlank()) {
            return 1;
        }
        int nodes;
        try {
            nodes = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new InvalidResourceException(String.format(
                    "invalid value for node count: \"%s\" is not a valid integer", raw), e);
        }
        if (nodes < 1 || nodes > MAX_NODES) {
            throw new InvalidResourceException(String.format(
                    "invalid value for node count: %d must be between 1 and %d", nodes, MAX_NODES));
        }
        return nodes;
    }
}
