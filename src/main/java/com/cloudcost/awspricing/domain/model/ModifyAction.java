package com.cloudcost.awspricing.domain.model;

import java.util.Map;

public record ModifyAction(
        ModificationType modificationType,
        Map<String, String> currentConfig,
        Map<String, String> recommendedConfig
) {}
