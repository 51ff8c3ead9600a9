package com.crossvenue.arb.execution;

public enum LegStatus {
    PENDING,
    SUBMITTED,
    PARTIALLY_FILLED,
    FILLED,
    CANCELLED,
    FAILED
}
