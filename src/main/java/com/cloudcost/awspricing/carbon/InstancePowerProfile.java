package com.cloudcost.awspricing.carbon;

/**
 * Power draw per vCPU at idle and at full load, in watts.
 */
public record InstancePowerProfile(
        int vcpuCount,
        double minWattsPerVcpu,
        double maxWattsPerVcpu
) {}
