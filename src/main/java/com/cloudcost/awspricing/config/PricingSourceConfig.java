package com.cloudcost.awspricing.config;

import com.cloudcost.awspricing.pricing.EmbeddedPricingSource;
import com.cloudcost.awspricing.pricing.PricingDataLoader;
import com.cloudcost.awspricing.pricing.PricingSource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the region's embedded pricing data as the shared {@link PricingSource}.
 */
@Configuration
public class PricingSourceConfig {

    @Bean
    public PricingSource pricingSource(PricingDataLoader loader) {
        return new EmbeddedPricingSource(loader.load());
    }
}
