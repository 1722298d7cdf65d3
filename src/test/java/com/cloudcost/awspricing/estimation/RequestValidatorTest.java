package com.cloudcost.awspricing.estimation;

import com.cloudcost.awspricing.config.EngineSettings;
import com.cloudcost.awspricing.domain.model.ResourceDescriptor;
import com.cloudcost.awspricing.domain.model.ServiceIdentifier;
import com.cloudcost.awspricing.exception.ErrorCode;
import com.cloudcost.awspricing.exception.InvalidResourceException;
import com.cloudcost.awspricing.exception.RegionMismatchException;
import com.cloudcost.awspricing.normalization.ResourceTypeNormalizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestValidatorTest {

    private final RequestValidator validator =
            new RequestValidator(EngineSettings.defaults("us-east-1"), new ResourceTypeNormalizer());

    @Nested
    @DisplayName("Required fields")
    class RequiredFields {

        @Test
        @DisplayName("Should reject missing descriptor, provider and type in that order")
        void shouldRejectMissingFields() {
            assertThatThrownBy(() -> validator.validate(null))
                    .isInstanceOf(InvalidResourceException.class)
                    .hasMessage("resource is required");
            assertThatThrownBy(() -> validator.validate(resource("", "", "us-east-1")))
                    .hasMessage("provider is required");
            assertThatThrownBy(() -> validator.validate(resource("gcp", "ec2", "us-east-1")))
                    .hasMessage("only \"aws\" provider is supported");
            assertThatThrownBy(() -> validator.validate(resource("aws", " ", "us-east-1")))
                    .hasMessage("resource_type is required");
        }
    }

    @Nested
    @DisplayName("Region")
    class Region {

        @Test
        @DisplayName("Should raise region mismatch with routing details")
        void shouldRaiseRegionMismatch() {
            assertThatThrownBy(() -> validator.validate(resource("aws", "ec2", "eu-west-1")))
                    .isInstanceOfSatisfying(RegionMismatchException.class, ex -> {
                        assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.UNSUPPORTED_REGION);
                        assertThat(ex.getDetails())
                                .containsEntry("plugin_region", "us-east-1")
                                .containsEntry("resource_region", "eu-west-1")
                                .containsEntry("required_region", "eu-west-1");
                    });
        }

        @Test
        @DisplayName("Should adopt the engine region for regionless global services")
        void shouldAdoptEngineRegionForGlobalServices() {
            // Given
            ResourceDescriptor bucket = resource("aws", "aws:s3/bucket:Bucket", "");

            // When
            ValidatedResource validated = validator.validate(bucket);

            // Then
            assertThat(validated.resource().region()).isEqualTo("us-east-1");
            assertThat(validated.service()).isEqualTo(ServiceIdentifier.S3);
            assertThat(bucket.region()).isEmpty();
        }

        @Test
        @DisplayName("Should not adopt engine region for regional services")
        void shouldRejectRegionlessRegionalService() {
            assertThatThrownBy(() -> validator.validate(resource("aws", "ec2", "")))
                    .isInstanceOf(RegionMismatchException.class);
        }
    }

    // Helper methods

    private ResourceDescriptor resource(String provider, String type, String region) {
        return ResourceDescriptor.of(provider, type, "t3.micro", region, Map.of());
    }
}
