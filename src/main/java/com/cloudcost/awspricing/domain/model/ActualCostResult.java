package com.cloudcost.awspricing.domain.model;

import java.time.Instant;

public record ActualCostResult(
        Instant timestamp,
        double cost,
        double usageAmount,
        String usageUnit,
        String source,
        FocusCostRecord focusRecord
) {}
