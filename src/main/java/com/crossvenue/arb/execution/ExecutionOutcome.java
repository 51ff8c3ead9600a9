package com.crossvenue.arb.execution;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class ExecutionOutcome {
    String executionId;
    String opportunityId;
    ExecutionState state;
    Leg leg1;
    Leg leg2;
    Leg unwindLeg; // only under UNWIND_AND_ALERT after an unhedged failure
    BigDecimal realizedPnlUsd; // null unless COMPLETE
    Instant startedAt;
    Instant finishedAt;
    String message;

    public boolean isUnhedged() {
        return state.isUnhedged();
    }

    public boolean isUnwound() {
        return unwindLeg != null && unwindLeg.isFilled();
    }
}
