package com.cloudcost.awspricing.estimation;

import com.cloudcost.awspricing.calculator.CalculatorFixtures;
import com.cloudcost.awspricing.carbon.CcfCarbonEstimator;
import com.cloudcost.awspricing.config.EngineSettings;
import com.cloudcost.awspricing.config.PricingProperties;
import com.cloudcost.awspricing.domain.model.GrowthType;
import com.cloudcost.awspricing.domain.model.ResourceDescriptor;
import com.cloudcost.awspricing.exception.InvalidResourceException;
import com.cloudcost.awspricing.normalization.ResourceTypeNormalizer;
import com.cloudcost.awspricing.pricing.PricingFixtures;
import com.cloudcost.awspricing.pricing.PricingSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ProjectedCostServiceTest {

    private ProjectedCostService service;

    @BeforeEach
    void setUp() {
        EngineSettings settings = EngineSettings.defaults("us-east-1");
        PricingSource pricing = PricingFixtures.usEast1();
        service = new ProjectedCostService(
                new RequestValidator(settings, new ResourceTypeNormalizer()),
                CalculatorFixtures.registry(pricing, new CcfCarbonEstimator(new PricingProperties())),
                pricing,
                settings);
    }

    @Nested
    @DisplayName("Projected cost")
    class ProjectedCost {

        @Test
        @DisplayName("Should price a Pulumi EC2 token and attach carbon")
        void shouldPriceEc2Token() {
            // Given
            var resource = ResourceDescriptor.of("aws", "aws:ec2/instance:Instance", "t3.micro", "us-east-1", Map.of());

            // When
            var estimate = service.getProjectedCost(resource, 0.5);

            // Then
            assertThat(estimate.costPerMonth()).isCloseTo(7.592, within(1e-9));
            assertThat(estimate.currency()).isEqualTo("USD");
            assertThat(estimate.impactMetrics()).hasSize(1);
        }

        @Test
        @DisplayName("Should stamp the service growth hint")
        void shouldStampGrowthType() {
            var resource = ResourceDescriptor.of("aws", "dynamodb", "on-demand", "us-east-1",
                    Map.of("storage_gb", "10"));

            var estimate = service.getProjectedCost(resource, null);

            assertThat(estimate.growthType()).isEqualTo(GrowthType.LINEAR);
        }

        @Test
        @DisplayName("Should return zero with explanation for unsupported types")
        void shouldExplainUnsupportedType() {
            var resource = ResourceDescriptor.of("aws", "aws:sqs/queue:Queue", "", "us-east-1", Map.of());

            var estimate = service.getProjectedCost(resource, null);

            assertThat(estimate.costPerMonth()).isZero();
            assertThat(estimate.billingDetail())
                    .isEqualTo("Resource type \"aws:sqs/queue:Queue\" not supported for cost estimation");
        }

        @Test
        @DisplayName("Should price zero-cost networking resources at zero")
        void shouldPriceZeroCostResources() {
            var resource = ResourceDescriptor.of("aws", "aws:ec2/vpc:Vpc", "", "us-east-1", Map.of());

            var estimate = service.getProjectedCost(resource, null);

            assertThat(estimate.costPerMonth()).isZero();
            assertThat(estimate.billingDetail()).startsWith("VPC has no direct hourly or monthly charge");
        }
    }

    @Nested
    @DisplayName("Estimate from attributes")
    class EstimateFromAttributes {

        @Test
        @DisplayName("Should price EC2 instance attributes")
        void shouldPriceInstance() {
            double cost = service.estimateFromAttributes("aws:ec2/instance:Instance",
                    Map.of("instanceType", "m5.large", "platform", "windows"));

            assertThat(cost).isCloseTo(0.188 * 730, within(1e-9));
        }

        @Test
        @DisplayName("Should price EBS volume attributes with defaults")
        void shouldPriceVolume() {
            assertThat(service.estimateFromAttributes("aws:ebs/volume:Volume", Map.of("type", "gp3", "size", 100)))
                    .isCloseTo(8.0, within(1e-9));
            assertThat(service.estimateFromAttributes("aws:ebs/volume:Volume", Map.of()))
                    .isCloseTo(0.8, within(1e-9));
            assertThat(service.estimateFromAttributes("aws:ebs/volume:Volume", Map.of("size", 0)))
                    .isCloseTo(0.8, within(1e-9));
        }

        @Test
        @DisplayName("Should return zero for other providers, regions and types")
        void shouldReturnZero() {
            Map<String, Object> elsewhere = new HashMap<>();
            elsewhere.put("instanceType", "t3.micro");
            elsewhere.put("availabilityZone", "eu-west-1a");

            assertThat(service.estimateFromAttributes("gcp:compute/instance:Instance", Map.of())).isZero();
            assertThat(service.estimateFromAttributes("aws:ec2/instance:Instance", elsewhere)).isZero();
            assertThat(service.estimateFromAttributes("aws:s3/bucket:Bucket", Map.of())).isZero();
            assertThat(service.estimateFromAttributes("aws:ec2/instance:Instance", Map.of())).isZero();
        }

        @Test
        @DisplayName("Should reject missing or malformed type tokens")
        void shouldRejectBadTokens() {
            assertThatThrownBy(() -> service.estimateFromAttributes("", Map.of()))
                    .isInstanceOf(InvalidResourceException.class)
                    .hasMessage("resource_type is required");
            assertThatThrownBy(() -> service.estimateFromAttributes("ec2", Map.of()))
                    .isInstanceOf(InvalidResourceException.class)
                    .hasMessageStartingWith("invalid resource_type format: invalid format");
        }
    }
}
