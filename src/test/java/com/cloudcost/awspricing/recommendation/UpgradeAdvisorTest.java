package com.cloudcost.awspricing.recommendation;

import com.cloudcost.awspricing.domain.model.ModificationType;
import com.cloudcost.awspricing.domain.model.Recommendation;
import com.cloudcost.awspricing.domain.model.RecommendationPriority;
import com.cloudcost.awspricing.pricing.PricingFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class UpgradeAdvisorTest {

    private static final String REGION = "us-east-1";

    private final UpgradeAdvisor advisor = new UpgradeAdvisor(PricingFixtures.usEast1());

    @Nested
    @DisplayName("EC2")
    class Ec2 {

        @Test
        @DisplayName("Should emit a price-neutral generation upgrade with a Graviton hint")
        void shouldEmitGenerationUpgrade() {
            // When
            Recommendation recommendation = advisor.ec2GenerationUpgrade("m5.large", REGION).orElseThrow();

            // Then
            assertThat(recommendation.modify().recommendedConfig()).containsEntry("instance_type", "m6i.large");
            assertThat(recommendation.impact().estimatedSavings()).isCloseTo(0.0, within(1e-9));
            assertThat(recommendation.priority()).isEqualTo(RecommendationPriority.MEDIUM);
            assertThat(recommendation.confidenceScore()).isEqualTo(0.9);
            assertThat(recommendation.description())
                    .isEqualTo("Upgrade from m5.large to m6i.large for better performance at same or lower cost");
            assertThat(recommendation.reasoning()).anyMatch(line -> line.contains("consider m6g.large"));
            assertThat(recommendation.source()).isEqualTo("aws-public");
        }

        @Test
        @DisplayName("Should emit a Graviton migration with architecture change")
        void shouldEmitGravitonMigration() {
            // When
            Recommendation recommendation = advisor.ec2GravitonMigration("m5.large", REGION).orElseThrow();

            // Then
            assertThat(recommendation.modify().currentConfig()).containsEntry("architecture", "x86_64");
            assertThat(recommendation.modify().recommendedConfig())
                    .containsEntry("instance_type", "m6g.large")
                    .containsEntry("architecture", "arm64");
            assertThat(recommendation.impact().currentCost()).isCloseTo(0.096 * 730, within(1e-9));
            assertThat(recommendation.impact().projectedCost()).isCloseTo(0.077 * 730, within(1e-9));
            assertThat(recommendation.priority()).isEqualTo(RecommendationPriority.LOW);
            assertThat(recommendation.confidenceScore()).isEqualTo(0.7);
            assertThat(recommendation.description()).contains("(Graviton) for ~20% cost savings");
        }

        @Test
        @DisplayName("Should drop candidates that cost more")
        void shouldDropMoreExpensiveCandidates() {
            List<Recommendation> recommendations = advisor.forEc2("m6i.large", REGION);

            assertThat(recommendations).hasSize(1);
            assertThat(recommendations.get(0).modify().modificationType()).isEqualTo(ModificationType.GRAVITON_MIGRATION);
        }

        @Test
        @DisplayName("Should return nothing for unknown or unpriced types")
        void shouldReturnNothingForUnknown() {
            assertThat(advisor.forEc2("x1e.large", REGION)).isEmpty();
            assertThat(advisor.forEc2("garbage", REGION)).isEmpty();
            assertThat(advisor.forEc2("c4.large", REGION)).isEmpty();
        }
    }

    @Nested
    @DisplayName("EBS")
    class Ebs {

        @Test
        @DisplayName("Should recommend gp3 for gp2 at the default size")
        void shouldRecommendGp3() {
            // When
            List<Recommendation> recommendations = advisor.forEbs("gp2", REGION, Map.of());

            // Then
            assertThat(recommendations).hasSize(1);
            Recommendation recommendation = recommendations.get(0);
            assertThat(recommendation.impact().estimatedSavings()).isCloseTo(2.0, within(1e-9));
            assertThat(recommendation.modify().recommendedConfig())
                    .containsEntry("volume_type", "gp3")
                    .containsEntry("size_gb", "100");
            assertThat(recommendation.description()).isEqualTo("Upgrade 100GB gp2 volume to gp3 for ~20% cost savings");
        }

        @Test
        @DisplayName("Should ignore volumes that are not gp2")
        void shouldIgnoreOtherTypes() {
            assertThat(advisor.forEbs("gp3", REGION, Map.of())).isEmpty();
            assertThat(advisor.forEbs("io1", REGION, Map.of())).isEmpty();
        }

        @Test
        @DisplayName("Should read size then volume_size and default invalid values")
        void shouldResolveVolumeSize() {
            assertThat(UpgradeAdvisor.volumeSize(Map.of("volume_size", "250"))).isEqualTo(250);
            assertThat(UpgradeAdvisor.volumeSize(Map.of("size", "50", "volume_size", "250"))).isEqualTo(50);
            assertThat(UpgradeAdvisor.volumeSize(Map.of("size", "abc", "volume_size", "250"))).isEqualTo(100);
            assertThat(UpgradeAdvisor.volumeSize(Map.of("size", "-1"))).isEqualTo(100);
        }
    }

    @Nested
    @DisplayName("RDS")
    class Rds {

        @Test
        @DisplayName("Should emit generation upgrade and Graviton migration for MySQL")
        void shouldEmitBothForMysql() {
            List<Recommendation> recommendations = advisor.forRds("db.m5.large", Map.of(), REGION);

            assertThat(recommendations)
                    .extracting(r -> r.modify().recommendedConfig().get("instance_type"))
                    .containsExactly("db.m6i.large", "db.m6g.large");
            assertThat(recommendations.get(1).modify().recommendedConfig()).containsEntry("engine", "mysql");
        }

        @Test
        @DisplayName("Should never suggest Graviton for Oracle")
        void shouldSkipGravitonForOracle() {
            List<Recommendation> recommendations = advisor.forRds("db.m5.large", Map.of("engine", "oracle-ee"), REGION);

            assertThat(recommendations)
                    .extracting(r -> r.modify().modificationType())
                    .containsExactly(ModificationType.GENERATION_UPGRADE);
            assertThat(recommendations.get(0).reasoning()).noneMatch(line -> line.contains("ARM"));
        }

        @Test
        @DisplayName("Should normalize engine aliases from either tag case")
        void shouldNormalizeEngine() {
            assertThat(UpgradeAdvisor.engineOf(Map.of("Engine", "postgres14"))).isEqualTo("postgresql");
            assertThat(UpgradeAdvisor.engineOf(Map.of())).isEqualTo("mysql");
            assertThat(advisor.forRds("db.m6i.large", Map.of(), REGION))
                    .extracting(r -> r.modify().modificationType())
                    .containsExactly(ModificationType.GRAVITON_MIGRATION);
        }
    }
}
