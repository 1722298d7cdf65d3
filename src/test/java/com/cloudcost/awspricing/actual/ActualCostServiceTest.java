package com.cloudcost.awspricing.actual;

import com.cloudcost.awspricing.calculator.CalculatorFixtures;
import com.cloudcost.awspricing.carbon.CcfCarbonEstimator;
import com.cloudcost.awspricing.config.EngineSettings;
import com.cloudcost.awspricing.config.PricingProperties;
import com.cloudcost.awspricing.domain.model.ActualCostResult;
import com.cloudcost.awspricing.estimation.ProjectedCostService;
import com.cloudcost.awspricing.estimation.RequestValidator;
import com.cloudcost.awspricing.exception.InvalidResourceException;
import com.cloudcost.awspricing.exception.RegionMismatchException;
import com.cloudcost.awspricing.normalization.ResourceTypeNormalizer;
import com.cloudcost.awspricing.pricing.PricingFixtures;
import com.cloudcost.awspricing.pricing.PricingSource;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ActualCostServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-10T00:00:00Z");
    private static final Instant START = Instant.parse("2025-03-01T00:00:00Z");
    private static final String INSTANCE_ARN = "arn:aws:ec2:us-east-1:123456789012:instance/i-0abc";

    private ActualCostService service;

    @BeforeEach
    void setUp() {
        EngineSettings settings = EngineSettings.defaults("us-east-1");
        PricingSource pricing = PricingFixtures.usEast1();
        RequestValidator validator = new RequestValidator(settings, new ResourceTypeNormalizer());
        ProjectedCostService projected = new ProjectedCostService(validator,
                CalculatorFixtures.registry(pricing, new CcfCarbonEstimator(new PricingProperties())),
                pricing, settings);
        service = new ActualCostService(
                new TimestampResolver(Clock.fixed(NOW, ZoneOffset.UTC)),
                new ActualResourceResolver(new ObjectMapper(), settings),
                validator,
                projected,
                settings);
    }

    @Nested
    @DisplayName("Prorated cost")
    class ProratedCost {

        @Test
        @DisplayName("Should prorate EC2 monthly cost over 24 hours")
        void shouldProrateInstance() {
            // When
            List<ActualCostResult> results = service.getActualCost(new ActualCostRequest(
                    INSTANCE_ARN, null, Map.of("sku", "t3.micro"), START, START.plus(Duration.ofHours(24)), null));

            // Then
            assertThat(results).hasSize(1);
            ActualCostResult result = results.get(0);
            assertThat(result.cost()).isCloseTo(0.2496, within(1e-9));
            assertThat(result.usageAmount()).isCloseTo(24.0, within(1e-9));
            assertThat(result.usageUnit()).isEqualTo("hours");
            assertThat(result.timestamp()).isEqualTo(START);
            assertThat(result.source())
                    .startsWith("aws-public-fallback[confidence:HIGH] | Fallback estimate: ")
                    .endsWith("24.00 hours / 730 = $0.2496");
        }

        @Test
        @DisplayName("Should fill the FOCUS record with hourly list price")
        void shouldFillFocusRecord() {
            ActualCostResult result = service.getActualCost(new ActualCostRequest(
                    INSTANCE_ARN, null, Map.of("sku", "t3.micro"), START, START.plus(Duration.ofHours(24)), null))
                    .get(0);

            assertThat(result.focusRecord().billedCost()).isEqualTo(result.cost());
            assertThat(result.focusRecord().listCost()).isEqualTo(result.cost());
            assertThat(result.focusRecord().listUnitPrice()).isCloseTo(0.0104, within(1e-12));
            assertThat(result.focusRecord().pricingUnit()).isEqualTo("Hours");
            assertThat(result.focusRecord().serviceName()).isEqualTo("Amazon EC2");
            assertThat(result.focusRecord().billingCurrency()).isEqualTo("USD");
            assertThat(result.focusRecord().chargePeriodEnd()).isEqualTo(START.plus(Duration.ofHours(24)));
        }

        @Test
        @DisplayName("Should prorate EBS volume over one week")
        void shouldProrateVolume() {
            ActualCostResult result = service.getActualCost(new ActualCostRequest(
                    "arn:aws:ec2:us-east-1:123456789012:volume/vol-1", null,
                    Map.of("sku", "gp3", "size", "100"), START, START.plus(Duration.ofDays(7)), null)).get(0);

            assertThat(result.cost()).isCloseTo(8.0 * 168 / 730, within(1e-9));
        }

        @Test
        @DisplayName("Should derive the window from pulumi:created and the clock")
        void shouldUseCreatedTag() {
            // Given
            Map<String, String> tags = Map.of(
                    "provider", "aws", "resource_type", "ec2", "sku", "t3.micro", "region", "us-east-1",
                    "pulumi:created", "2025-03-09T00:00:00Z", "pulumi:external", "true");

            // When
            ActualCostResult result = service.getActualCost(new ActualCostRequest(null, null, tags, null, null, null))
                    .get(0);

            // Then
            assertThat(result.usageAmount()).isCloseTo(24.0, within(1e-9));
            assertThat(result.source()).startsWith("aws-public-fallback[confidence:MEDIUM] imported resource | ");
        }
    }

    @Nested
    @DisplayName("Edge cases")
    class EdgeCases {

        @Test
        @DisplayName("Should return zero for a zero-length window")
        void shouldReturnZeroForEmptyWindow() {
            ActualCostResult result = service.getActualCost(new ActualCostRequest(
                    INSTANCE_ARN, null, Map.of("sku", "t3.micro"), START, START, null)).get(0);

            assertThat(result.cost()).isZero();
            assertThat(result.usageAmount()).isZero();
            assertThat(result.usageUnit()).isNull();
            assertThat(result.focusRecord().pricingUnit()).isEqualTo("Hours");
        }

        @Test
        @DisplayName("Should reject a window that ends before it starts")
        void shouldRejectInvertedWindow() {
            assertThatThrownBy(() -> service.getActualCost(new ActualCostRequest(
                    INSTANCE_ARN, null, Map.of("sku", "t3.micro"), START, START.minusSeconds(1), null)))
                    .isInstanceOf(InvalidResourceException.class)
                    .hasMessageStartingWith("invalid time range");
        }

        @Test
        @DisplayName("Should fail fast without a start time")
        void shouldRequireStart() {
            assertThatThrownBy(() -> service.getActualCost(new ActualCostRequest(
                    INSTANCE_ARN, null, Map.of("sku", "t3.micro"), null, null, null)))
                    .hasMessageContaining("start time required");
            assertThatThrownBy(() -> service.getActualCost(null))
                    .hasMessage("request is required");
        }

        @Test
        @DisplayName("Should reject resources from another region")
        void shouldRejectOtherRegion() {
            assertThatThrownBy(() -> service.getActualCost(new ActualCostRequest(
                    "arn:aws:ec2:eu-west-1:1:instance/i-1", null, Map.of("sku", "t3.micro"),
                    START, NOW, null)))
                    .isInstanceOf(RegionMismatchException.class);
        }

        @Test
        @DisplayName("Should reject a regionless ARN for a regional service")
        void shouldRejectRegionlessRegionalArn() {
            assertThatThrownBy(() -> service.getActualCost(new ActualCostRequest(
                    "arn:aws:ec2::123456789012:instance/i-1", null, Map.of("sku", "t3.micro"),
                    START, NOW, null)))
                    .isInstanceOf(RegionMismatchException.class)
                    .satisfies(e -> assertThat(((RegionMismatchException) e).getResourceRegion()).isEmpty());
        }

        @Test
        @DisplayName("Should price a regionless ARN for a global service in the engine region")
        void shouldAcceptRegionlessGlobalArn() {
            ActualCostResult result = service.getActualCost(new ActualCostRequest(
                    "arn:aws:s3:::my-bucket", null, Map.of("sku", "STANDARD", "size", "100"),
                    START, START.plus(Duration.ofHours(730)), null)).get(0);

            assertThat(result.focusRecord().regionId()).isEqualTo("us-east-1");
            assertThat(result.cost()).isCloseTo(2.3, within(1e-9));
        }

        @Test
        @DisplayName("Should return zero for a zero-length window on an unsupported type")
        void shouldReturnZeroForEmptyWindowOnUnsupportedType() {
            // Given
            Map<String, String> tags = Map.of(
                    "provider", "aws",
                    "resource_type", "aws:sqs/queue:Queue",
                    "sku", "standard",
                    "region", "us-east-1");

            // When
            ActualCostResult result = service.getActualCost(
                    new ActualCostRequest(null, null, tags, START, START, null)).get(0);

            // Then
            assertThat(result.cost()).isZero();
            assertThat(result.usageAmount()).isZero();
            assertThat(result.focusRecord().billedCost()).isZero();
        }

        @Test
        @DisplayName("Should drop tags with null values")
        void shouldDropNullTagValues() {
            // Given
            Map<String, String> tags = new HashMap<>();
            tags.put("sku", "t3.micro");
            tags.put("team", null);

            // When
            ActualCostRequest request = new ActualCostRequest(INSTANCE_ARN, null, tags, START, NOW, null);

            // Then
            assertThat(request.tags()).containsOnlyKeys("sku");
            assertThat(service.getActualCost(request)).hasSize(1);
        }

        @Test
        @DisplayName("Should compute fractional runtime hours")
        void shouldComputeRuntimeHours() {
            assertThat(ActualCostService.runtimeHours(START, START.plus(Duration.ofMinutes(90)))).isEqualTo(1.5);
        }
    }
}
