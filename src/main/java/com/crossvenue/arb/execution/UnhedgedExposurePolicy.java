package com.crossvenue.arb.execution;

/**
 * What the executor does when the second leg fails after the first one filled.
 */
public enum UnhedgedExposurePolicy {
    /** Report and alert; the first leg stays open for an operator to handle. */
    ALERT_ONLY,
    /** Submit one offsetting order for the first leg, then report and alert regardless of its result. */
    UNWIND_AND_ALERT
}
