package com.cloudcost.awspricing.domain.model;

/**
 * Monetary impact of applying a recommendation, projected per month.
 */
public record RecommendationImpact(
        double estimatedSavings,
        String currency,
        String projectionPeriod,
        double currentCost,
        double projectedCost,
        double savingsPercentage
) {
    public static final String MONTHLY = "monthly";

    /**
     * Builds the impact of moving from one monthly cost to another.
     */
    public static RecommendationImpact monthly(double currentMonthly, double projectedMonthly) {
        double savings = currentMonthly - projectedMonthly;
        double savingsPercent = currentMonthly > 0 ? (savings / currentMonthly) * 100 : 0.0;
        return new RecommendationImpact(savings, CostEstimate.USD, MONTHLY,
                currentMonthly, projectedMonthly, savingsPercent);
    }
}
