package com.cloudcost.awspricing.domain.model;

/**
 * How trustworthy a resolved actual-cost window is.
 */
public enum ConfidenceLevel {
    HIGH,
    MEDIUM,
    LOW
}
