package com.cloudcost.awspricing.domain.model;

import java.time.Instant;

/**
 * Resolved actual-cost window. Built once per request and discarded after
 * the confidence level is derived.
 */
public record TimestampResolution(
        Instant start,
        Instant end,
        ResolutionSource source,
        boolean imported
) {}
