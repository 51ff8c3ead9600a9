package com.crossvenue.arb.execution;

import lombok.Getter;

import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One run of the two-leg state machine. Runs at most once, submits {@code leg2} at most once and
 * processes each fill report at most once.
 */
@Getter
public class TwoLegExecution {

    private final String executionId;
    private final String opportunityId;
    private final Leg leg1;
    private final Leg leg2;

    @Getter(lombok.AccessLevel.NONE)
    private final AtomicReference<ExecutionState> state = new AtomicReference<>(ExecutionState.CREATED);
    @Getter(lombok.AccessLevel.NONE)
    private final AtomicBoolean leg2Submitted = new AtomicBoolean();
    @Getter(lombok.AccessLevel.NONE)
    private final Set<String> processedFills = ConcurrentHashMap.newKeySet();

    /**
     * @param leg1 the leg submitted first, normally the one less likely to fill
     * @throws IllegalStateException if either leg already belongs to another execution
     */
    public TwoLegExecution(String opportunityId, Leg leg1, Leg leg2) {
        Objects.requireNonNull(leg1, "leg1");
        Objects.requireNonNull(leg2, "leg2");
        if (leg1 == leg2) {
            throw new IllegalArgumentException("Both legs of an execution must be distinct");
        }
        if (!leg1.claim()) {
            throw new IllegalStateException("Leg " + leg1.getLegId() + " already belongs to another execution");
        }
        if (!leg2.claim()) {
            throw new IllegalStateException("Leg " + leg2.getLegId() + " already belongs to another execution");
        }
        this.executionId = UUID.randomUUID().toString();
        this.opportunityId = opportunityId;
        this.leg1 = leg1;
        this.leg2 = leg2;
    }

    public ExecutionState getState() {
        return state.get();
    }

    void transition(ExecutionState from, ExecutionState to) {
        if (!state.compareAndSet(from, to)) {
            throw new IllegalStateException("Execution " + executionId + " cannot move " + from + " -> " + to
                    + " (current: " + state.get() + ")");
        }
    }

    void claimLeg2Submission() {
        if (!leg2Submitted.compareAndSet(false, true)) {
            throw new IllegalStateException("Leg2 of execution " + executionId + " was already submitted");
        }
    }

    /** @return false if a report for this order id was already processed */
    boolean acceptFill(String externalOrderId) {
        return processedFills.add(externalOrderId);
    }
}
