package com.cloudcost.awspricing.calculator;

import com.cloudcost.awspricing.domain.model.ResourceDescriptor;

/**
 * Request-level inputs shared by every calculator call of one request.
 *
 * @param utilizationPercentage request-wide utilization in [0, 1], or null
 */
public record EstimationContext(
        Double utilizationPercentage
) {
    public static final double DEFAULT_UTILIZATION = 0.5;

    public static EstimationContext defaults() {
        return new EstimationContext(null);
    }

    /**
     * Effective utilization: the resource override, then the request
     * value, then 0.5. Always clamped to [0, 1].
     */
    public double utilizationFor(ResourceDescriptor resource) {
        double utilization = DEFAULT_UTILIZATION;
        if (resource.utilizationPercentage() != null) {
            utilization = resource.utilizationPercentage();
        } else if (utilizationPercentage != null) {
            utilization = utilizationPercentage;
        }
        return Math.max(0.0, Math.min(1.0, utilization));
    }
}
