package com.cloudcost.awspricing.carbon;

import com.cloudcost.awspricing.config.PricingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Carbon estimation using the Cloud Carbon Footprint method.
 *
 * FORMULA:
 *   avgWatts  = min + utilization * (max - min)          (per vCPU)
 *   kWh       = avgWatts * vCPUs * hours / 1000
 *   gCO2e     = kWh * PUE * gridFactor(region) * 1,000,000
 *
 * Grid factors are metric tons CO2e per kWh. Unknown regions use the
 * global average.
 *
 * Power coefficients are kept per processor family. vCPU count is derived
 * from the size token: up to "large" is 2 vCPUs, "xlarge" 4, "Nxlarge" 4N.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CcfCarbonEstimator implements CarbonEstimator {

    static final double AWS_PUE = 1.135;
    static final double DEFAULT_GRID_FACTOR = 0.00039278;

    private static final Map<String, Double> GRID_FACTORS = Map.ofEntries(
            Map.entry("us-east-1", 0.000379),
            Map.entry("us-east-2", 0.000411),
            Map.entry("us-west-1", 0.000322),
            Map.entry("us-west-2", 0.000322),
            Map.entry("ca-central-1", 0.00012),
            Map.entry("eu-west-1", 0.0002786),
            Map.entry("eu-north-1", 0.0000088),
            Map.entry("ap-southeast-1", 0.000408),
            Map.entry("ap-southeast-2", 0.00079),
            Map.entry("ap-northeast-1", 0.000506),
            Map.entry("ap-south-1", 0.000708),
            Map.entry("sa-east-1", 0.0000617)
    );

    // Intel Xeon (Skylake/Cascade Lake/Ice Lake), AMD EPYC, AWS Graviton
    private static final double[] INTEL = {0.74, 3.5};
    private static final double[] AMD = {0.47, 2.02};
    private static final double[] GRAVITON = {0.47, 1.69};

    private static final Map<String, double[]> FAMILY_COEFFICIENTS = Map.ofEntries(
            Map.entry("t2", INTEL), Map.entry("t3", INTEL), Map.entry("t3a", AMD), Map.entry("t4g", GRAVITON),
            Map.entry("m4", INTEL), Map.entry("m5", INTEL), Map.entry("m5a", AMD), Map.entry("m5n", INTEL),
            Map.entry("m6i", INTEL), Map.entry("m6a", AMD), Map.entry("m6g", GRAVITON),
            Map.entry("m7i", INTEL), Map.entry("m7a", AMD), Map.entry("m7g", GRAVITON),
            Map.entry("c4", INTEL), Map.entry("c5", INTEL), Map.entry("c5a", AMD), Map.entry("c5n", INTEL),
            Map.entry("c6i", INTEL), Map.entry("c6a", AMD), Map.entry("c6g", GRAVITON), Map.entry("c6gn", GRAVITON),
            Map.entry("c7i", INTEL), Map.entry("c7a", AMD), Map.entry("c7g", GRAVITON),
            Map.entry("r4", INTEL), Map.entry("r5", INTEL), Map.entry("r5a", AMD), Map.entry("r5n", INTEL),
            Map.entry("r6i", INTEL), Map.entry("r6a", AMD), Map.entry("r6g", GRAVITON),
            Map.entry("r7i", INTEL), Map.entry("r7a", AMD), Map.entry("r7g", GRAVITON)
    );

    private static final Map<String, Integer> SIZE_VCPUS = Map.of(
            "nano", 2, "micro", 2, "small", 2, "medium", 2, "large", 2, "xlarge", 4, "metal", 96
    );

    private final PricingProperties properties;

    @Override
    public OptionalDouble estimateGrams(String instanceType, String region, double utilization, double hours) {
        if (!properties.getCarbon().isEnabled()) {
            return OptionalDouble.empty();
        }
        Optional<InstancePowerProfile> profile = profileFor(instanceType);
        if (profile.isEmpty()) {
            log.debug("No power profile for instance type {}", instanceType);
            return OptionalDouble.empty();
        }

        double clamped = Math.max(0.0, Math.min(1.0, utilization));
        return OptionalDouble.of(calculateGrams(profile.get(), clamped, gridFactor(region), hours));
    }

    static double calculateGrams(InstancePowerProfile profile, double utilization, double gridFactor, double hours) {
        double avgWatts = profile.minWattsPerVcpu()
                + utilization * (profile.maxWattsPerVcpu() - profile.minWattsPerVcpu());
        double energyKwh = avgWatts * profile.vcpuCount() * hours / 1000.0;
        return energyKwh * AWS_PUE * gridFactor * 1_000_000;
    }

    static double gridFactor(String region) {
        if (region == null) {
            return DEFAULT_GRID_FACTOR;
        }
        return GRID_FACTORS.getOrDefault(region, DEFAULT_GRID_FACTOR);
    }

    static Optional<InstancePowerProfile> profileFor(String instanceType) {
        if (instanceType == null) {
            return Optional.empty();
        }
        String[] parts = instanceType.toLowerCase(Locale.ROOT).split("\\.");
        if (parts.length != 2) {
            return Optional.empty();
        }
        double[] coefficients = FAMILY_COEFFICIENTS.get(parts[0]);
        Integer vcpus = vcpusForSize(parts[1]);
        if (coefficients == null || vcpus == null) {
            return Optional.empty();
        }
        return Optional.of(new InstancePowerProfile(vcpus, coefficients[0], coefficients[1]));
    }

    private static Integer vcpusForSize(String size) {
        Integer fixed = SIZE_VCPUS.get(size);
        if (fixed != null) {
            return fixed;
        }
        if (size.endsWith("xlarge")) {
            try {
                return Integer.parseInt(size.substring(0, size.length() - "xlarge".length())) * 4;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
