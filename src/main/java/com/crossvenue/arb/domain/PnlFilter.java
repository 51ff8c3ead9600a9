package com.crossvenue.arb.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Optional constraints on a PnL summary; any null field matches everything.
 */
@Value
@Builder
public class PnlFilter {
    StrategyKind strategyKind;
    Instant from;
    Instant to;

    public static PnlFilter all() {
        return PnlFilter.builder().build();
    }

    public boolean matches(PnlRecord record) {
        if (strategyKind != null && strategyKind != record.getStrategyKind()) {
            return false;
        }
        if (from != null && record.getTimestamp().isBefore(from)) {
            return false;
        }
        return to == null || !record.getTimestamp().isAfter(to);
    }
}
