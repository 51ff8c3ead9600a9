package com.crossvenue.arb.execution;

/**
 * What a venue reports when a fill wait completes.
 */
public enum FillStatus {
    FILLED,
    PARTIALLY_FILLED,
    REJECTED,
    CANCELLED,
    TIMED_OUT
}
