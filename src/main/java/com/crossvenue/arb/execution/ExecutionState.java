package com.crossvenue.arb.execution;

public enum ExecutionState {
    CREATED,
    LEG1_SUBMITTED,
    LEG1_FILLED,
    LEG2_SUBMITTED,
    COMPLETE,
    LEG1_TIMED_OUT,
    LEG1_FAILED,
    LEG1_PARTIALLY_FILLED,
    LEG2_FAILED_UNHEDGED;

    public boolean isTerminal() {
        return this == COMPLETE || isCleanAbort() || isUnhedged();
    }

    /** Terminal without any directional exposure left behind. */
    public boolean isCleanAbort() {
        return this == LEG1_TIMED_OUT || this == LEG1_FAILED;
    }

    /** Terminal with part or all of Leg1 held and nothing offsetting it. */
    public boolean isUnhedged() {
        return this == LEG1_PARTIALLY_FILLED || this == LEG2_FAILED_UNHEDGED;
    }
}
