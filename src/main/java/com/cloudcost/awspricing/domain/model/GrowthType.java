package com.cloudcost.awspricing.domain.model;

/**
 * Expected cost growth pattern of a service over time.
 */
public enum GrowthType {
    /** Cost stays flat while the resource exists (instance hours). */
    NONE,
    /** Cost grows with accumulated data (storage, table size). */
    LINEAR
}
