package com.crossvenue.arb.infra;

public enum AlertSeverity {
    INFO,
    WARNING,
    CRITICAL
}
