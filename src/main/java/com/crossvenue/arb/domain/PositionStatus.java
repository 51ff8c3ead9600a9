package com.crossvenue.arb.domain;

public enum PositionStatus {
    PENDING,
    OPEN,
    CLOSED,
    FAILED;

    public boolean isTerminal() {
        return this == CLOSED || this == FAILED;
    }
}
