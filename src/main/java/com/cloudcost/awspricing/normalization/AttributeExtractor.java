package com.cloudcost.awspricing.normalization;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;

/**
 * Pulls typed, defaulted attributes out of a tag map or a structured
 * attribute document.
 *
 * EXTRACTION RULES:
 * - Absent or blank values yield an empty optional; callers apply the default
 * - Numeric strings and JSON numbers are both accepted
 * - An explicit zero is a present value where zero is allowed
 * - Invalid numbers are logged at warn and treated as absent
 *
 * Nothing here throws. Strict validation of user-supplied usage tags lives
 * with the calculators that need it.
 */
@Slf4j
public final class AttributeExtractor {

    /**
     * Tag keys that may carry a SKU, highest priority first.
     */
    public static final List<String> SKU_KEYS = List.of(
            "instanceType", "instance_class", "instanceClass", "type", "volumeType", "volume_type"
    );

    private static final Map<String, String> PLATFORMS = Map.of(
            "windows", "Windows",
            "rhel", "RHEL",
            "suse", "SUSE"
    );

    private static final Map<String, String> TENANCIES = Map.of(
            "dedicated", "Dedicated",
            "host", "Host"
    );

    private AttributeExtractor() {
        // Utility class
    }

    // ==================== EC2 ====================

    public static Ec2Attributes ec2FromTags(Map<String, String> tags) {
        if (tags == null) {
            return Ec2Attributes.defaults();
        }
        return new Ec2Attributes(
                normalizePlatform(tags.get("platform")),
                normalizeTenancy(tags.get("tenancy")));
    }

    public static Ec2Attributes ec2FromAttributes(Map<String, Object> attributes) {
        return new Ec2Attributes(
                normalizePlatform(stringAttr(attributes, "platform").orElse(null)),
                normalizeTenancy(stringAttr(attributes, "tenancy").orElse(null)));
    }

    static String normalizePlatform(String platform) {
        if (platform == null || platform.isBlank()) {
            return Ec2Attributes.LINUX;
        }
        return PLATFORMS.getOrDefault(platform.trim().toLowerCase(Locale.ROOT), Ec2Attributes.LINUX);
    }

    static String normalizeTenancy(String tenancy) {
        if (tenancy == null || tenancy.isBlank()) {
            return Ec2Attributes.SHARED;
        }
        return TENANCIES.getOrDefault(tenancy.trim().toLowerCase(Locale.ROOT), Ec2Attributes.SHARED);
    }

    // ==================== SKU / REGION ====================

    public static Optional<String> extractSku(Map<String, String> tags) {
        if (tags == null) {
            return Optional.empty();
        }
        return SKU_KEYS.stream()
                .map(tags::get)
                .filter(value -> value != null && !value.isBlank())
                .findFirst();
    }

    /**
     * Region from the "region" tag, or derived from "availabilityZone"
     * by dropping the zone letter.
     */
    public static Optional<String> extractRegion(Map<String, String> tags) {
        if (tags == null) {
            return Optional.empty();
        }
        return regionOf(tags.get("region"), tags.get("availabilityZone"));
    }

    public static Optional<String> regionFromAttributes(Map<String, Object> attributes) {
        return regionOf(stringAttr(attributes, "region").orElse(null),
                stringAttr(attributes, "availabilityZone").orElse(null));
    }

    private static Optional<String> regionOf(String region, String availabilityZone) {
        if (region != null && !region.isBlank()) {
            return Optional.of(region);
        }
        if (availabilityZone != null && availabilityZone.length() > 1) {
            return Optional.of(availabilityZone.substring(0, availabilityZone.length() - 1));
        }
        return Optional.empty();
    }

    // ==================== LENIENT TAG NUMBERS ====================

    public static OptionalInt positiveInt(Map<String, String> tags, String key) {
        String raw = rawTag(tags, key);
        if (raw == null) {
            return OptionalInt.empty();
        }
        try {
            int value = Integer.parseInt(raw);
            if (value > 0) {
                return OptionalInt.of(value);
            }
            log.warn("Ignoring non-positive value for tag '{}': {}", key, value);
        } catch (NumberFormatException e) {
            log.warn("Ignoring invalid integer for tag '{}': \"{}\"", key, raw);
        }
        return OptionalInt.empty();
    }

    public static OptionalDouble positiveDouble(Map<String, String> tags, String key) {
        String raw = rawTag(tags, key);
        if (raw == null) {
            return OptionalDouble.empty();
        }
        OptionalDouble parsed = parseFinite(raw);
        if (parsed.isPresent() && parsed.getAsDouble() > 0) {
            return parsed;
        }
        log.warn("Ignoring invalid or non-positive value for tag '{}': \"{}\"", key, raw);
        return OptionalDouble.empty();
    }

    public static OptionalDouble nonNegativeDouble(Map<String, String> tags, String key) {
        String raw = rawTag(tags, key);
        if (raw == null) {
            return OptionalDouble.empty();
        }
        OptionalDouble parsed = parseFinite(raw);
        if (parsed.isPresent() && parsed.getAsDouble() >= 0) {
            return parsed;
        }
        log.warn("Ignoring invalid or negative value for tag '{}': \"{}\"", key, raw);
        return OptionalDouble.empty();
    }

    public static OptionalLong nonNegativeLong(Map<String, String> tags, String key) {
        String raw = rawTag(tags, key);
        if (raw == null) {
            return OptionalLong.empty();
        }
        try {
            long value = Long.parseLong(raw);
            if (value >= 0) {
                return OptionalLong.of(value);
            }
            log.warn("Ignoring negative value for tag '{}': {}", key, value);
        } catch (NumberFormatException e) {
            log.warn("Ignoring invalid integer for tag '{}': \"{}\"", key, raw);
        }
        return OptionalLong.empty();
    }

    private static String rawTag(Map<String, String> tags, String key) {
        if (tags == null) {
            return null;
        }
        String raw = tags.get(key);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return raw.trim();
    }

    private static OptionalDouble parseFinite(String raw) {
        try {
            double value = Double.parseDouble(raw);
            return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    // ==================== ATTRIBUTE DOCUMENT ====================

    public static Optional<String> stringAttr(Map<String, Object> attributes, String key) {
        if (attributes == null) {
            return Optional.empty();
        }
        Object value = attributes.get(key);
        if (value instanceof String s && !s.isEmpty()) {
            return Optional.of(s);
        }
        return Optional.empty();
    }

    /**
     * Numeric attribute, accepting JSON numbers and numeric strings.
     * Zero is returned as a present value.
     */
    public static OptionalDouble numberAttr(Map<String, Object> attributes, String key) {
        if (attributes == null) {
            return OptionalDouble.empty();
        }
        Object value = attributes.get(key);
        if (value instanceof Number number) {
            return OptionalDouble.of(number.doubleValue());
        }
        if (value instanceof String s) {
            return parseFinite(s.trim());
        }
        return OptionalDouble.empty();
    }
}
