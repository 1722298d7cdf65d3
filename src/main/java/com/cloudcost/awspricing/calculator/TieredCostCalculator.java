package com.cloudcost.awspricing.calculator;

import com.cloudcost.awspricing.pricing.TierRate;

import java.util.List;

/**
 * Integrates a quantity over a volume-tiered rate schedule.
 *
 * Tiers are ordered by ascending upper bound. Each tier charges its rate
 * only for the part of the quantity between the previous bound and its
 * own. Example: 50,000 units over [{10,000 @ 0.30}, {250,000 @ 0.10}]
 * costs 10,000 x 0.30 + 40,000 x 0.10 = 7,000.
 */
public final class TieredCostCalculator {

    private TieredCostCalculator() {
        // Utility class
    }

    public static double calculate(double quantity, List<TierRate> tiers) {
        if (tiers == null || tiers.isEmpty() || quantity <= 0) {
            return 0.0;
        }

        double total = 0.0;
        double previousUpper = 0.0;
        for (TierRate tier : tiers) {
            if (quantity <= previousUpper) {
                break;
            }
            double upper = Math.min(tier.upperBound(), quantity);
            double slice = upper - previousUpper;
            if (slice > 0) {
                total += slice * tier.rate();
            }
            previousUpper = tier.upperBound();
        }
        return total;
    }
}
