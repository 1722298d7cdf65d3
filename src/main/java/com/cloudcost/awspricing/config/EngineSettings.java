package com.cloudcost.awspricing.config;

/**
 * Engine configuration, resolved once at startup and read-only afterwards.
 */
public record EngineSettings(
        String region,
        String version,
        int maxBatchSize,
        boolean strictValidation,
        boolean testMode
) {
    public static final int DEFAULT_MAX_BATCH_SIZE = 100;
    public static final int MAX_BATCH_SIZE_LIMIT = 500;

    public static EngineSettings defaults(String region) {
        return new EngineSettings(region, "0.1.0", DEFAULT_MAX_BATCH_SIZE, false, false);
    }
}
