package com.cloudcost.awspricing.domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of a projected cost calculation.
 *
 * A pricing miss is still a valid estimate: cost 0 with a billing detail
 * naming what was not found. Currency is always USD.
 */
public record CostEstimate(
        double costPerMonth,
        double unitPrice,
        String currency,
        String billingDetail,
        List<ImpactMetric> impactMetrics,
        GrowthType growthType
) {
    public static final String USD = "USD";

    public CostEstimate {
        impactMetrics = impactMetrics == null ? List.of() : List.copyOf(impactMetrics);
    }

    public static CostEstimate of(double costPerMonth, double unitPrice, String billingDetail) {
        return new CostEstimate(costPerMonth, unitPrice, USD, billingDetail, List.of(), null);
    }

    /**
     * Zero-cost estimate carrying an explanation.
     */
    public static CostEstimate zero(String billingDetail) {
        return of(0, 0, billingDetail);
    }

    public CostEstimate withImpact(ImpactMetric metric) {
        List<ImpactMetric> metrics = new ArrayList<>(impactMetrics);
        metrics.add(metric);
        return new CostEstimate(costPerMonth, unitPrice, currency, billingDetail, metrics, growthType);
    }

    public CostEstimate withGrowthType(GrowthType type) {
        return new CostEstimate(costPerMonth, unitPrice, currency, billingDetail, impactMetrics, type);
    }
}
