package com.cloudcost.awspricing.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.env.PropertyResolver;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves {@link EngineSettings} from application properties and the
 * environment-variable alias chains.
 *
 * ALIAS CHAINS (first non-blank wins):
 * - FINFOCUS_MAX_BATCH_SIZE, PULUMICOST_MAX_BATCH_SIZE, MAX_BATCH_SIZE
 * - FINFOCUS_STRICT_VALIDATION, PULUMICOST_STRICT_VALIDATION, STRICT_VALIDATION
 * - FINFOCUS_TEST_MODE
 *
 * Only the first name in a chain is current. Using any other logs a
 * deprecation warning naming the replacement.
 */
@Configuration
@Slf4j
public class EngineSettingsResolver {

    static final List<String> BATCH_SIZE_CHAIN =
            List.of("FINFOCUS_MAX_BATCH_SIZE", "PULUMICOST_MAX_BATCH_SIZE", "MAX_BATCH_SIZE");
    static final List<String> STRICT_VALIDATION_CHAIN =
            List.of("FINFOCUS_STRICT_VALIDATION", "PULUMICOST_STRICT_VALIDATION", "STRICT_VALIDATION");
    static final List<String> TEST_MODE_CHAIN = List.of("FINFOCUS_TEST_MODE");

    private static final Set<String> TRUTHY = Set.of("true", "1", "yes", "on");

    @Bean
    public EngineSettings engineSettings(PricingProperties properties, Environment environment) {
        EngineSettings settings = resolve(properties, environment);
        log.info("Engine settings: region={}, version={}, maxBatchSize={}, strictValidation={}, testMode={}",
                settings.region(), settings.version(), settings.maxBatchSize(),
                settings.strictValidation(), settings.testMode());
        return settings;
    }

    public static EngineSettings resolve(PricingProperties properties, PropertyResolver environment) {
        int maxBatchSize = lookup(environment, BATCH_SIZE_CHAIN)
                .map(EngineSettingsResolver::parseBatchSize)
                .orElse(EngineSettings.DEFAULT_MAX_BATCH_SIZE);
        boolean strict = lookup(environment, STRICT_VALIDATION_CHAIN)
                .map(EngineSettingsResolver::isTruthy)
                .orElse(false);
        boolean testMode = lookup(environment, TEST_MODE_CHAIN)
                .map(EngineSettingsResolver::isTruthy)
                .orElse(false);

        return new EngineSettings(properties.getRegion(), properties.getVersion(),
                maxBatchSize, strict, testMode);
    }

    static Optional<String> lookup(PropertyResolver environment, List<String> chain) {
        for (int i = 0; i < chain.size(); i++) {
            String name = chain.get(i);
            String value = environment.getProperty(name);
            if (value != null && !value.isBlank()) {
                if (i > 0) {
                    log.warn("Environment variable {} is deprecated, use {} instead", name, chain.get(0));
                }
                return Optional.of(value.trim());
            }
        }
        return Optional.empty();
    }

    static int parseBatchSize(String raw) {
        int size;
        try {
            size = Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            log.warn("Invalid max batch size '{}', using default {}", raw, EngineSettings.DEFAULT_MAX_BATCH_SIZE);
            return EngineSettings.DEFAULT_MAX_BATCH_SIZE;
        }
        if (size <= 0) {
            log.warn("Max batch size must be positive, got {}; using default {}",
                    size, EngineSettings.DEFAULT_MAX_BATCH_SIZE);
            return EngineSettings.DEFAULT_MAX_BATCH_SIZE;
        }
        if (size > EngineSettings.MAX_BATCH_SIZE_LIMIT) {
            log.warn("Max batch size {} exceeds limit, capping to {}", size, EngineSettings.MAX_BATCH_SIZE_LIMIT);
            return EngineSettings.MAX_BATCH_SIZE_LIMIT;
        }
        return size;
    }

    static boolean isTruthy(String raw) {
        return TRUTHY.contains(raw.trim().toLowerCase(Locale.ROOT));
    }
}
