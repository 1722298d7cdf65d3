package com.cloudcost.awspricing.calculator;

import com.cloudcost.awspricing.domain.model.ResourceDescriptor;
import com.cloudcost.awspricing.exception.InvalidResourceException;
import com.cloudcost.awspricing.pricing.PricingFixtures;
import com.cloudcost.awspricing.pricing.PricingSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * NAT gateway and load balancer calculators.
 */
class NetworkCostCalculatorsTest {

    private NatGatewayCostCalculator natGateway;
    private LoadBalancerCostCalculator loadBalancer;

    @BeforeEach
    void setUp() {
        PricingSource pricing = PricingFixtures.usEast1();
        natGateway = new NatGatewayCostCalculator(pricing);
        loadBalancer = new LoadBalancerCostCalculator(pricing);
    }

    @Nested
    @DisplayName("NAT gateway")
    class NatGateway {

        @Test
        @DisplayName("Should charge hours plus processed data")
        void shouldChargeHoursPlusData() {
            // When
            var estimate = natGateway.estimate(nat(Map.of("data_processed_gb", "100")), EstimationContext.defaults());

            // Then
            assertThat(estimate.costPerMonth()).isCloseTo(0.045 * 730 + 100 * 0.045, within(1e-9));
            assertThat(estimate.billingDetail()).contains("100.00 GB data processed");
        }

        @Test
        @DisplayName("Should note missing data tag")
        void shouldNoteMissingDataTag() {
            var estimate = natGateway.estimate(nat(Map.of()), EstimationContext.defaults());

            assertThat(estimate.costPerMonth()).isCloseTo(32.85, within(1e-9));
            assertThat(estimate.billingDetail()).contains("data processing cost not included");
        }

        @Test
        @DisplayName("Should reject non-numeric data tag")
        void shouldRejectNonNumericData() {
            assertThatThrownBy(() -> natGateway.estimate(nat(Map.of("data_processed_gb", "abc")),
                    EstimationContext.defaults()))
                    .isInstanceOf(InvalidResourceException.class)
                    .hasMessageContaining("data_processed_gb");
        }

        @Test
        @DisplayName("Should reject negative and empty data tags")
        void shouldRejectNegativeAndEmpty() {
            assertThatThrownBy(() -> natGateway.estimate(nat(Map.of("data_processed_gb", "-1")),
                    EstimationContext.defaults()))
                    .hasMessageContaining("cannot be negative");
            assertThatThrownBy(() -> natGateway.estimate(nat(Map.of("data_processed_gb", " ")),
                    EstimationContext.defaults()))
                    .hasMessage("tag 'data_processed_gb' is present but empty");
        }
    }

    @Nested
    @DisplayName("Load balancers")
    class LoadBalancers {

        @Test
        @DisplayName("Should price ALB with LCU usage")
        void shouldPriceAlb() {
            // When
            var estimate = loadBalancer.estimate(lb("alb", Map.of("lcu_per_hour", "2")), EstimationContext.defaults());

            // Then
            assertThat(estimate.costPerMonth()).isCloseTo(730 * 0.0225 + 730 * 2 * 0.008, within(1e-9));
            assertThat(estimate.billingDetail()).startsWith("ALB");
        }

        @Test
        @DisplayName("Should detect NLB from sku and fall back to capacity_units")
        void shouldPriceNlb() {
            var estimate = loadBalancer.estimate(lb("network", Map.of("capacity_units", "1")), EstimationContext.defaults());

            assertThat(estimate.costPerMonth()).isCloseTo(730 * 0.0225 + 730 * 0.006, within(1e-9));
            assertThat(estimate.billingDetail()).startsWith("NLB");
        }

        @Test
        @DisplayName("Should fall back to capacity_units when the LCU tag is unparseable")
        void shouldFallBackFromInvalidLcuTag() {
            // When
            var estimate = loadBalancer.estimate(
                    lb("alb", Map.of("lcu_per_hour", "abc", "capacity_units", "5")), EstimationContext.defaults());

            // Then
            assertThat(estimate.costPerMonth()).isCloseTo(730 * 0.0225 + 730 * 5 * 0.008, within(1e-9));
        }
    }

    // Helper methods

    private ResourceDescriptor nat(Map<String, String> tags) {
        return ResourceDescriptor.of("aws", "natgw", "", "us-east-1", tags);
    }

    private ResourceDescriptor lb(String sku, Map<String, String> tags) {
        return ResourceDescriptor.of("aws", "elb", sku, "us-east-1", tags);
    }
}
