package com.cloudcost.awspricing.normalization;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AttributeExtractorTest {

    @Nested
    @DisplayName("EC2 attributes")
    class Ec2 {

        @Test
        @DisplayName("Should default to Linux on shared tenancy")
        void shouldDefault() {
            assertThat(AttributeExtractor.ec2FromTags(null)).isEqualTo(Ec2Attributes.defaults());
            assertThat(AttributeExtractor.ec2FromTags(Map.of("platform", "plan9", "tenancy", "default")))
                    .isEqualTo(Ec2Attributes.defaults());
        }

        @Test
        @DisplayName("Should normalize platform and tenancy case-insensitively")
        void shouldNormalize() {
            Ec2Attributes attributes = AttributeExtractor.ec2FromTags(Map.of("platform", "WINDOWS", "tenancy", " dedicated "));

            assertThat(attributes.operatingSystem()).isEqualTo("Windows");
            assertThat(attributes.tenancy()).isEqualTo("Dedicated");
        }

        @Test
        @DisplayName("Should read attribute documents")
        void shouldReadAttributeDocument() {
            Ec2Attributes attributes = AttributeExtractor.ec2FromAttributes(Map.of("platform", "rhel", "tenancy", 3));

            assertThat(attributes.operatingSystem()).isEqualTo("RHEL");
            assertThat(attributes.tenancy()).isEqualTo(Ec2Attributes.SHARED);
        }
    }

    @Nested
    @DisplayName("SKU and region")
    class SkuAndRegion {

        @Test
        @DisplayName("Should take the highest-priority SKU key")
        void shouldUsePriorityOrder() {
            Map<String, String> tags = Map.of("volumeType", "gp3", "instanceType", "t3.micro", "type", "");

            assertThat(AttributeExtractor.extractSku(tags)).contains("t3.micro");
            assertThat(AttributeExtractor.extractSku(Map.of("type", " "))).isEmpty();
        }

        @Test
        @DisplayName("Should derive region from availability zone")
        void shouldDeriveRegionFromZone() {
            assertThat(AttributeExtractor.extractRegion(Map.of("availabilityZone", "us-west-2b"))).contains("us-west-2");
            assertThat(AttributeExtractor.extractRegion(Map.of("region", "eu-west-1", "availabilityZone", "us-west-2b")))
                    .contains("eu-west-1");
            assertThat(AttributeExtractor.regionFromAttributes(Map.of())).isEmpty();
        }
    }

    @Nested
    @DisplayName("Lenient numbers")
    class LenientNumbers {

        @Test
        @DisplayName("Should treat invalid and non-positive values as absent")
        void shouldTreatInvalidAsAbsent() {
            Map<String, String> tags = Map.of("a", "abc", "b", "0", "c", "-3", "d", " 42 ");

            assertThat(AttributeExtractor.positiveInt(tags, "a")).isEmpty();
            assertThat(AttributeExtractor.positiveInt(tags, "b")).isEmpty();
            assertThat(AttributeExtractor.positiveInt(tags, "d")).hasValue(42);
            assertThat(AttributeExtractor.nonNegativeDouble(tags, "b")).hasValue(0.0);
            assertThat(AttributeExtractor.nonNegativeDouble(tags, "c")).isEmpty();
            assertThat(AttributeExtractor.nonNegativeLong(tags, "d")).hasValue(42L);
            assertThat(AttributeExtractor.positiveDouble(tags, "missing")).isEmpty();
        }

        @Test
        @DisplayName("Should accept JSON numbers and numeric strings in attribute documents")
        void shouldReadNumberAttributes() {
            Map<String, Object> attributes = new HashMap<>();
            attributes.put("size", 100);
            attributes.put("iops", "3000");
            attributes.put("bad", "lots");
            attributes.put("zero", 0);

            assertThat(AttributeExtractor.numberAttr(attributes, "size")).hasValue(100.0);
            assertThat(AttributeExtractor.numberAttr(attributes, "iops")).hasValue(3000.0);
            assertThat(AttributeExtractor.numberAttr(attributes, "bad")).isEmpty();
            assertThat(AttributeExtractor.numberAttr(attributes, "zero")).hasValue(0.0);
        }
    }
}
