package com.cloudcost.awspricing.domain.model;

/**
 * Non-monetary impact metrics attached to cost estimates.
 */
public enum MetricKind {
    CARBON_FOOTPRINT
}
