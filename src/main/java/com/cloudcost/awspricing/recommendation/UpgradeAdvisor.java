package com.cloudcost.awspricing.recommendation;

import com.cloudcost.awspricing.calculator.CostConstants;
import com.cloudcost.awspricing.domain.model.ModificationType;
import com.cloudcost.awspricing.domain.model.ModifyAction;
import com.cloudcost.awspricing.domain.model.Recommendation;
import com.cloudcost.awspricing.domain.model.RecommendationActionType;
import com.cloudcost.awspricing.domain.model.RecommendationCategory;
import com.cloudcost.awspricing.domain.model.RecommendationImpact;
import com.cloudcost.awspricing.domain.model.RecommendationPriority;
import com.cloudcost.awspricing.domain.model.ResourceRecommendationInfo;
import com.cloudcost.awspricing.normalization.Ec2Attributes;
import com.cloudcost.awspricing.pricing.PricingSource;
import com.cloudcost.awspricing.recommendation.InstanceFamilyCatalog.InstanceType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.UUID;

/**
 * Produces upgrade candidates for a single resource.
 *
 * CANDIDATES:
 * - EC2: newer generation (same architecture), Graviton migration
 * - RDS: newer generation, Graviton migration for supporting engines
 * - EBS: gp2 to gp3
 *
 * A candidate is emitted only when both the current and the candidate SKU
 * are priced and the candidate is not more expensive. EC2 lookups use
 * Linux/Shared pricing.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class UpgradeAdvisor {

    static final String SOURCE = "aws-public";
    static final int DEFAULT_EBS_VOLUME_GB = 100;
    static final String DEFAULT_RDS_ENGINE = "mysql";

    private static final String PROVIDER = "aws";
    private static final String X86_64 = "x86_64";
    private static final String ARM64 = "arm64";

    private final PricingSource pricing;

    // ==================== EC2 ====================

    public List<Recommendation> forEc2(String instanceType, String region) {
        List<Recommendation> recommendations = new ArrayList<>();
        ec2GenerationUpgrade(instanceType, region).ifPresent(recommendations::add);
        ec2GravitonMigration(instanceType, region).ifPresent(recommendations::add);
        return recommendations;
    }

    Optional<Recommendation> ec2GenerationUpgrade(String instanceType, String region) {
        Optional<InstanceType> parsed = InstanceFamilyCatalog.parseEc2(instanceType);
        if (parsed.isEmpty()) {
            return Optional.empty();
        }
        Optional<String> newFamily = InstanceFamilyCatalog.generationUpgrade(parsed.get().family());
        if (newFamily.isEmpty()) {
            return Optional.empty();
        }
        String newType = parsed.get().withFamily(newFamily.get());

        return hourlyImpact(ec2Hourly(instanceType), ec2Hourly(newType)).map(impact -> {
            List<String> reasoning = new ArrayList<>(List.of(
                    String.format("Newer %s instances offer better performance", newFamily.get()),
                    "Drop-in replacement with no architecture changes required"));
            InstanceFamilyCatalog.gravitonEquivalent(newFamily.get()).ifPresent(graviton ->
                    reasoning.add(String.format(
                            "Alternative: consider %s for ARM compatibility (~20%% additional savings)",
                            parsed.get().withFamily(graviton))));

            return base(ModificationType.GENERATION_UPGRADE, RecommendationPriority.MEDIUM)
                    .resource(resource("ec2", region, instanceType))
                    .modify(new ModifyAction(ModificationType.GENERATION_UPGRADE,
                            Map.of("instance_type", instanceType),
                            Map.of("instance_type", newType)))
                    .impact(impact)
                    .description(String.format(
                            "Upgrade from %s to %s for better performance at same or lower cost",
                            instanceType, newType))
                    .reasoning(reasoning)
                    .metadata(Map.of())
                    .build();
        });
    }

    Optional<Recommendation> ec2GravitonMigration(String instanceType, String region) {
        Optional<InstanceType> parsed = InstanceFamilyCatalog.parseEc2(instanceType);
        if (parsed.isEmpty()) {
            return Optional.empty();
        }
        Optional<String> gravitonFamily = InstanceFamilyCatalog.gravitonEquivalent(parsed.get().family());
        if (gravitonFamily.isEmpty()) {
            return Optional.empty();
        }
        String gravitonType = parsed.get().withFamily(gravitonFamily.get());

        return hourlyImpact(ec2Hourly(instanceType), ec2Hourly(gravitonType)).map(impact ->
                base(ModificationType.GRAVITON_MIGRATION, RecommendationPriority.LOW)
                        .resource(resource("ec2", region, instanceType))
                        .modify(new ModifyAction(ModificationType.GRAVITON_MIGRATION,
                                Map.of("instance_type", instanceType, "architecture", X86_64),
                                Map.of("instance_type", gravitonType, "architecture", ARM64)))
                        .impact(impact)
                        .description(String.format("Migrate from %s to %s (Graviton) for ~%.0f%% cost savings",
                                instanceType, gravitonType, impact.savingsPercentage()))
                        .reasoning(List.of(
                                "Graviton instances are typically ~20% cheaper with comparable performance",
                                "Requires validation that application supports ARM architecture"))
                        .metadata(Map.of(
                                "architecture_change", "x86_64 -> arm64",
                                "requires_validation", "Application must support ARM architecture"))
                        .build());
    }

    // ==================== EBS ====================

    public List<Recommendation> forEbs(String volumeType, String region, Map<String, String> tags) {
        if (!"gp2".equals(volumeType)) {
            return List.of();
        }
        int sizeGb = volumeSize(tags);

        OptionalDouble gp2 = pricing.ebsPerGbMonth("gp2");
        OptionalDouble gp3 = pricing.ebsPerGbMonth("gp3");
        if (gp2.isEmpty() || gp3.isEmpty() || gp3.getAsDouble() > gp2.getAsDouble()) {
            return List.of();
        }
        RecommendationImpact impact = RecommendationImpact.monthly(
                gp2.getAsDouble() * sizeGb, gp3.getAsDouble() * sizeGb);
        String size = String.valueOf(sizeGb);

        return List.of(base(ModificationType.VOLUME_TYPE_UPGRADE, RecommendationPriority.MEDIUM)
                .resource(resource("ebs", region, volumeType))
                .modify(new ModifyAction(ModificationType.VOLUME_TYPE_UPGRADE,
                        Map.of("volume_type", "gp2", "size_gb", size),
                        Map.of("volume_type", "gp3", "size_gb", size)))
                .impact(impact)
                .description(String.format("Upgrade %dGB gp2 volume to gp3 for ~%.0f%% cost savings",
                        sizeGb, impact.savingsPercentage()))
                .reasoning(List.of(
                        "gp3 volumes are ~20% cheaper than gp2",
                        "gp3 provides better baseline performance (3000 IOPS, 125 MB/s)",
                        "API-compatible change with no data migration required"))
                .metadata(Map.of(
                        "baseline_iops", "gp2: 100 IOPS/GB, gp3: 3000 IOPS (included)",
                        "baseline_throughput", "gp2: 128-250 MB/s, gp3: 125 MB/s (included)"))
                .build());
    }

    /**
     * Volume size from "size", or from "volume_size" when "size" is absent.
     * Unparseable or non-positive sizes fall back to 100 GB.
     */
    static int volumeSize(Map<String, String> tags) {
        String raw = tags.containsKey("size") ? tags.get("size") : tags.get("volume_size");
        if (raw == null) {
            return DEFAULT_EBS_VOLUME_GB;
        }
        try {
            int parsed = Integer.parseInt(raw.trim());
            return parsed > 0 ? parsed : DEFAULT_EBS_VOLUME_GB;
        } catch (NumberFormatException e) {
            log.warn("Invalid EBS size '{}', using default {} GB", raw, DEFAULT_EBS_VOLUME_GB);
            return DEFAULT_EBS_VOLUME_GB;
        }
    }

    // ==================== RDS ====================

    public List<Recommendation> forRds(String instanceClass, Map<String, String> tags, String region) {
        String engine = engineOf(tags);
        List<Recommendation> recommendations = new ArrayList<>();
        rdsGenerationUpgrade(instanceClass, engine, region).ifPresent(recommendations::add);
        if (InstanceFamilyCatalog.supportsGraviton(engine)) {
            rdsGravitonMigration(instanceClass, engine, region).ifPresent(recommendations::add);
        }
        return recommendations;
    }

    static String engineOf(Map<String, String> tags) {
        String engine = tags.get("engine");
        if (engine == null || engine.isEmpty()) {
            engine = tags.get("Engine");
        }
        if (engine == null || engine.isEmpty()) {
            return DEFAULT_RDS_ENGINE;
        }
        return InstanceFamilyCatalog.normalizeRdsEngine(engine);
    }

    Optional<Recommendation> rdsGenerationUpgrade(String instanceClass, String engine, String region) {
        Optional<InstanceType> parsed = InstanceFamilyCatalog.parseRds(instanceClass);
        if (parsed.isEmpty()) {
            return Optional.empty();
        }
        Optional<String> newFamily = InstanceFamilyCatalog.rdsGenerationUpgrade(parsed.get().family());
        if (newFamily.isEmpty()) {
            return Optional.empty();
        }
        String newClass = parsed.get().withFamily(newFamily.get());

        return hourlyImpact(rdsHourly(instanceClass, engine), rdsHourly(newClass, engine)).map(impact -> {
            List<String> reasoning = new ArrayList<>(List.of(
                    String.format("Newer %s instances offer better performance for %s", newFamily.get(), engine),
                    "Drop-in replacement with no architecture changes required"));
            InstanceFamilyCatalog.rdsGravitonEquivalent(newFamily.get())
                    .filter(graviton -> InstanceFamilyCatalog.supportsGraviton(engine))
                    .ifPresent(graviton -> reasoning.add(String.format(
                            "Alternative: consider %s for ARM compatibility (~20%% additional savings)",
                            parsed.get().withFamily(graviton))));

            return base(ModificationType.GENERATION_UPGRADE, RecommendationPriority.MEDIUM)
                    .resource(resource("rds", region, instanceClass))
                    .modify(new ModifyAction(ModificationType.GENERATION_UPGRADE,
                            Map.of("instance_type", instanceClass, "engine", engine),
                            Map.of("instance_type", newClass, "engine", engine)))
                    .impact(impact)
                    .description(String.format(
                            "Upgrade RDS %s from %s to %s for better performance at same or lower cost",
                            engine, instanceClass, newClass))
                    .reasoning(reasoning)
                    .metadata(Map.of())
                    .build();
        });
    }

    Optional<Recommendation> rdsGravitonMigration(String instanceClass, String engine, String region) {
        Optional<InstanceType> parsed = InstanceFamilyCatalog.parseRds(instanceClass);
        if (parsed.isEmpty()) {
            return Optional.empty();
        }
        Optional<String> gravitonFamily = InstanceFamilyCatalog.rdsGravitonEquivalent(parsed.get().family());
        if (gravitonFamily.isEmpty()) {
            return Optional.empty();
        }
        String gravitonClass = parsed.get().withFamily(gravitonFamily.get());

        return hourlyImpact(rdsHourly(instanceClass, engine), rdsHourly(gravitonClass, engine)).map(impact ->
                base(ModificationType.GRAVITON_MIGRATION, RecommendationPriority.LOW)
                        .resource(resource("rds", region, instanceClass))
                        .modify(new ModifyAction(ModificationType.GRAVITON_MIGRATION,
                                Map.of("instance_type", instanceClass, "engine", engine, "architecture", X86_64),
                                Map.of("instance_type", gravitonClass, "engine", engine, "architecture", ARM64)))
                        .impact(impact)
                        .description(String.format("Migrate RDS %s from %s to %s (Graviton) for ~%.0f%% cost savings",
                                engine, instanceClass, gravitonClass, impact.savingsPercentage()))
                        .reasoning(List.of(
                                "Graviton RDS instances are typically ~20% cheaper with comparable performance",
                                String.format("Validated: %s engine supports Graviton architecture", engine)))
                        .metadata(Map.of(
                                "architecture_change", "x86_64 -> arm64",
                                "engine", engine))
                        .build());
    }

    // ==================== HELPERS ====================

    private OptionalDouble ec2Hourly(String instanceType) {
        return pricing.ec2OnDemandHourly(instanceType, Ec2Attributes.LINUX, Ec2Attributes.SHARED);
    }

    private OptionalDouble rdsHourly(String instanceClass, String engine) {
        return pricing.rdsInstanceHourly(instanceClass, engine);
    }

    /**
     * Monthly impact of switching hourly rates, or empty when either rate
     * is unknown or the candidate costs more.
     */
    private static Optional<RecommendationImpact> hourlyImpact(OptionalDouble current, OptionalDouble candidate) {
        if (current.isEmpty() || candidate.isEmpty() || candidate.getAsDouble() > current.getAsDouble()) {
            return Optional.empty();
        }
        return Optional.of(RecommendationImpact.monthly(
                current.getAsDouble() * CostConstants.HOURS_PER_MONTH,
                candidate.getAsDouble() * CostConstants.HOURS_PER_MONTH));
    }

    private static Recommendation.RecommendationBuilder base(ModificationType type, RecommendationPriority priority) {
        return Recommendation.builder()
                .id(UUID.randomUUID().toString())
                .category(RecommendationCategory.COST)
                .actionType(RecommendationActionType.MODIFY)
                .priority(priority)
                .confidenceScore(type.getConfidence())
                .source(SOURCE);
    }

    private static ResourceRecommendationInfo resource(String resourceType, String region, String sku) {
        return new ResourceRecommendationInfo(PROVIDER, resourceType, region, sku, null, null);
    }
}
