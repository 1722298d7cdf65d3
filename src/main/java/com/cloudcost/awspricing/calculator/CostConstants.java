package com.cloudcost.awspricing.calculator;

/**
 * Shared constants and billing-detail templates for cost calculators.
 */
public final class CostConstants {

    /**
     * Hours in a billing month: 24 x 365 / 12, rounded.
     */
    public static final int HOURS_PER_MONTH = 730;

    private CostConstants() {
        // Utility class
    }

    /**
     * Explanation for a SKU that has no entry in the pricing data.
     */
    public static String pricingNotFound(String kind, String sku) {
        return String.format("%s \"%s\" not found in pricing data", kind, sku);
    }

    /**
     * Explanation for a service whose rates are missing for the region.
     */
    public static String pricingUnavailable(String service, String region) {
        return String.format("%s pricing data not available for region %s", service, region);
    }
}
