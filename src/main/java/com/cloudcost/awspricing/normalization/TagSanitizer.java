package com.cloudcost.awspricing.normalization;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Produces a log-safe view of a tag map.
 */
public final class TagSanitizer {

    static final int MAX_LOGGED_TAGS = 5;
    private static final List<String> SENSITIVE_MARKERS = List.of("secret", "password", "token");

    private TagSanitizer() {
        // Utility class
    }

    /**
     * Drops keys that look like credentials and keeps at most five tags,
     * in key order so log lines are stable.
     */
    public static Map<String, String> forLogging(Map<String, String> tags) {
        Map<String, String> safe = new LinkedHashMap<>();
        if (tags == null) {
            return safe;
        }
        for (Map.Entry<String, String> entry : new TreeMap<>(tags).entrySet()) {
            if (safe.size() >= MAX_LOGGED_TAGS) {
                break;
            }
            String key = entry.getKey().toLowerCase(Locale.ROOT);
            if (SENSITIVE_MARKERS.stream().noneMatch(key::contains)) {
                safe.put(entry.getKey(), entry.getValue());
            }
        }
        return safe;
    }
}
