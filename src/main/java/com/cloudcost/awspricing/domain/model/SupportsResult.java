package com.cloudcost.awspricing.domain.model;

import java.util.List;

public record SupportsResult(
        boolean supported,
        String reason,
        List<MetricKind> supportedMetrics
) {
    public SupportsResult {
        supportedMetrics = supportedMetrics == null ? List.of() : List.copyOf(supportedMetrics);
    }

    public static SupportsResult unsupported(String reason) {
        return new SupportsResult(false, reason, List.of());
    }
}
