package com.cloudcost.awspricing.domain.model;

public record ImpactMetric(
        MetricKind kind,
        double value,
        String unit
) {
    public static ImpactMetric carbonGrams(double grams) {
        return new ImpactMetric(MetricKind.CARBON_FOOTPRINT, grams, "gCO2e");
    }
}
