package com.cloudcost.awspricing.carbon;

import java.util.OptionalDouble;

/**
 * Estimates operational carbon emissions of a compute instance.
 */
public interface CarbonEstimator {

    /**
     * @param instanceType EC2-style instance type, e.g. "m5.large"
     * @param region       AWS region used to pick the grid emission factor
     * @param utilization  average CPU utilization in [0, 1]
     * @param hours        running hours
     * @return grams of CO2e, or empty when the instance type is unknown
     *         or estimation is disabled
     */
    OptionalDouble estimateGrams(String instanceType, String region, double utilization, double hours);
}
