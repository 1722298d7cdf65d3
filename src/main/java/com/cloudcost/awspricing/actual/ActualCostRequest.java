package com.cloudcost.awspricing.actual;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Actual-cost query. The resource may be identified by ARN, by a JSON
 * descriptor in resourceId, or by descriptor fields carried in tags.
 *
 * @param start window start, or null to take it from the pulumi:created tag
 * @param end   window end, or null for now
 */
public record ActualCostRequest(
        String arn,
        String resourceId,
        Map<String, String> tags,
        Instant start,
        Instant end,
        Double utilizationPercentage
) {
    public ActualCostRequest {
        tags = tags == null ? Map.of() : withoutNulls(tags);
    }

    /**
     * JSON bodies may carry null tag values; those tags are dropped.
     */
    private static Map<String, String> withoutNulls(Map<String, String> tags) {
        Map<String, String> copy = new LinkedHashMap<>();
        tags.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, value);
            }
        });
        return Collections.unmodifiableMap(copy);
    }
}
