package com.cloudcost.awspricing.pricing;

import com.cloudcost.awspricing.config.PricingProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads the embedded pricing document for the configured region at startup.
 *
 * A missing or unreadable document is a configuration error and stops the
 * application from starting.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PricingDataLoader {

    private final PricingProperties properties;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    public PricingDocument load() {
        String location = properties.resolvedDataLocation();
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IllegalStateException("Pricing data not found for region "
                    + properties.getRegion() + " at " + location);
        }

        log.info("Loading pricing data from {}", location);
        try (InputStream in = resource.getInputStream()) {
            PricingDocument document = objectMapper.readValue(in, PricingDocument.class);
            if (document.region() != null && !document.region().equals(properties.getRegion())) {
                throw new IllegalStateException("Pricing data at " + location + " is for region "
                        + document.region() + ", expected " + properties.getRegion());
            }
            return document;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to parse pricing data at " + location, e);
        }
    }
}
