package com.cloudcost.awspricing.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.stereotype.Component;

/**
 * Binds the {@code pricing.*} block of application.yml.
 */
@Data
@Component
@ConfigurationProperties(prefix = "pricing")
public class PricingProperties {

    /**
     * The single AWS region this instance serves. Pricing data is loaded for it only.
     */
    private String region = "us-east-1";

    private String version = "0.1.0";

    /**
     * Location of the embedded pricing document. {region} is substituted.
     */
    private String dataLocation = "classpath:pricing/{region}.json";

    @NestedConfigurationProperty
    private Carbon carbon = new Carbon();

    public String resolvedDataLocation() {
        return dataLocation.replace("{region}", region);
    }

    @Data
    public static class Carbon {
        private boolean enabled = true;
    }
}
