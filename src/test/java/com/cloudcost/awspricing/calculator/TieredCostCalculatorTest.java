package com.cloudcost.awspricing.calculator;

import com.cloudcost.awspricing.pricing.TierRate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TieredCostCalculatorTest {

    private static final List<TierRate> METRIC_TIERS = List.of(
            new TierRate(10_000.0, 0.30),
            new TierRate(250_000.0, 0.10),
            new TierRate(1_000_000.0, 0.05),
            new TierRate(null, 0.02)
    );

    @Test
    @DisplayName("Should charge each tier only for its own slice")
    void shouldChargeEachTierForItsSlice() {
        // When
        double cost = TieredCostCalculator.calculate(50_000, METRIC_TIERS);

        // Then
        assertThat(cost).isCloseTo(7_000.0, within(1e-6));
    }

    @Test
    @DisplayName("Should stay within the first tier for small quantities")
    void shouldStayWithinFirstTier() {
        assertThat(TieredCostCalculator.calculate(100, METRIC_TIERS)).isCloseTo(30.0, within(1e-9));
    }

    @Test
    @DisplayName("Should reach the unbounded last tier")
    void shouldReachUnboundedTier() {
        // 10k*0.30 + 240k*0.10 + 750k*0.05 + 1M*0.02
        double expected = 3_000 + 24_000 + 37_500 + 20_000;

        assertThat(TieredCostCalculator.calculate(2_000_000, METRIC_TIERS)).isCloseTo(expected, within(1e-6));
    }

    @Test
    @DisplayName("Should return zero for zero, negative or untiered quantities")
    void shouldReturnZeroForDegenerateInput() {
        assertThat(TieredCostCalculator.calculate(0, METRIC_TIERS)).isZero();
        assertThat(TieredCostCalculator.calculate(-5, METRIC_TIERS)).isZero();
        assertThat(TieredCostCalculator.calculate(100, List.of())).isZero();
        assertThat(TieredCostCalculator.calculate(100, null)).isZero();
    }
}
