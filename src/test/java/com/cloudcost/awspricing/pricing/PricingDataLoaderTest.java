package com.cloudcost.awspricing.pricing;

import com.cloudcost.awspricing.config.PricingProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PricingDataLoaderTest {

    private PricingProperties properties;
    private PricingDataLoader loader;

    @BeforeEach
    void setUp() {
        properties = new PricingProperties();
        loader = new PricingDataLoader(properties, new DefaultResourceLoader(), new ObjectMapper());
    }

    @Test
    @DisplayName("Should load the bundled document for the configured region")
    void shouldLoadBundledDocument() {
        // When
        PricingDocument document = loader.load();

        // Then
        assertThat(document.region()).isEqualTo("us-east-1");
        assertThat(new EmbeddedPricingSource(document).region()).isEqualTo("us-east-1");
    }

    @Test
    @DisplayName("Should fail startup when region has no pricing data")
    void shouldFailForMissingRegion() {
        properties.setRegion("ap-nowhere-9");

        assertThatThrownBy(() -> loader.load())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Pricing data not found for region ap-nowhere-9");
    }
}
