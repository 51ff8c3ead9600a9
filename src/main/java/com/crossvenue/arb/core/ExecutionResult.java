package com.crossvenue.arb.core;

import com.crossvenue.arb.domain.CapitalAllocation;
import com.crossvenue.arb.domain.Position;
import com.crossvenue.arb.domain.ProfitabilityAnalysis;
import com.crossvenue.arb.domain.RejectionReason;
import com.crossvenue.arb.execution.ExecutionState;
import com.crossvenue.arb.execution.Leg;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Outcome of {@link ArbitrageEngine#authorizeAndExecute}. Carries the failing check or the
 * executor's terminal state, so a decision can be reconstructed without replaying venue calls.
 */
@Value
@Builder
public class ExecutionResult {
    String opportunityId;
    ExecutionStatus status;
    RejectionReason rejectionReason; // REJECTED only
    ExecutionState executionState; // null when rejected
    ProfitabilityAnalysis analysis;
    CapitalAllocation allocation;
    Position position;
    BigDecimal pnlUsd;
    @Singular
    List<Leg> legs; // submission order
    Leg unwindLeg;
    String message;

    public static ExecutionResult rejected(String opportunityId, RejectionReason reason, String message,
            ProfitabilityAnalysis analysis) {
        return ExecutionResult.builder()
                .opportunityId(opportunityId)
                .status(ExecutionStatus.REJECTED)
                .rejectionReason(reason)
                .analysis(analysis)
                .message(message)
                .build();
    }

    public boolean isSuccess() {
        return status == ExecutionStatus.SUCCESS;
    }
}
