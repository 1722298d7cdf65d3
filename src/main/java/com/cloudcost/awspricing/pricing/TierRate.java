package com.cloudcost.awspricing.pricing;

/**
 * One slice of a volume-tiered rate schedule.
 *
 * upTo is the cumulative upper bound of the slice; null marks the open-ended
 * last tier.
 */
public record TierRate(
        Double upTo,
        double rate
) {
    public double upperBound() {
        return upTo == null ? Double.POSITIVE_INFINITY : upTo;
    }
}
