package com.crossvenue.arb.core;

public enum ExecutionStatus {
    SUCCESS,
    /** Refused before any order was sent. */
    REJECTED,
    /** Leg1 did not fill; nothing left open. */
    ABORTED,
    /** Leg1 filled, Leg2 did not. */
    FAILED_UNHEDGED
}
