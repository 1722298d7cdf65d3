package com.cloudcost.awspricing.calculator;

import com.cloudcost.awspricing.exception.InvalidResourceException;

import java.util.Map;
import java.util.OptionalDouble;

/**
 * Strict parsing of user-supplied usage tags.
 *
 * Unlike the lenient extraction used for sizing attributes, a present but
 * malformed usage value rejects the request. An absent tag is not an error.
 */
final class UsageTagParser {

    private UsageTagParser() {
        // Utility class
    }

    /**
     * @return the parsed value, or empty when the tag is absent
     * @throws InvalidResourceException when the tag is present but empty, non-numeric or negative
     */
    static OptionalDouble nonNegative(Map<String, String> tags, String key) {
        if (!tags.containsKey(key)) {
            return OptionalDouble.empty();
        }
        String raw = tags.get(key) == null ? "" : tags.get(key).trim();
        if (raw.isEmpty()) {
            throw new InvalidResourceException(String.format("tag '%s' is present but empty", key));
        }
        double value = parse(key, raw);
        if (value < 0) {
            throw new InvalidResourceException(String.format(
                    "invalid value for '%s': %.2f cannot be negative", key, value));
        }
        return OptionalDouble.of(value);
    }

    /**
     * Like {@link #nonNegative} but an empty value counts as absent.
     */
    static OptionalDouble optionalNonNegative(Map<String, String> tags, String key) {
        String raw = tags.get(key);
        if (raw == null || raw.isBlank()) {
            return OptionalDouble.empty();
        }
        return nonNegative(tags, key);
    }

    private static double parse(String key, String raw) {
        try {
            double value = Double.parseDouble(raw);
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw new NumberFormatException(raw);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new InvalidResourceException(String.format(
                    "invalid value for '%s': \"%s\" is not a valid number", key, raw), e);
        }
    }
}
