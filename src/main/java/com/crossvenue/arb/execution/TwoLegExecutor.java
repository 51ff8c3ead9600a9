package com.crossvenue.arb.execution;

import com.crossvenue.arb.config.ArbitrageProperties;
import com.crossvenue.arb.domain.Side;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drives a {@link TwoLegExecution} through submit, bounded fill wait, and either the second leg or a
 * clean abort:
 *
 * <pre>
 * CREATED -> LEG1_SUBMITTED -> LEG1_FILLED -> LEG2_SUBMITTED -> COMPLETE
 *                   |                               |
 *                   +-> LEG1_TIMED_OUT / LEG1_FAILED +-> LEG2_FAILED_UNHEDGED
 *                   +-> LEG1_PARTIALLY_FILLED
 * </pre>
 *
 * The second leg is submitted only when the first one reports exactly {@link FillStatus#FILLED}.
 * A partially filled first leg has its remainder cancelled and is handled like a failed second leg:
 * the filled part is unhedged exposure and the unhedged policy applies to it.
 * Nothing is retried; a timed-out leg gets a single cancel attempt.
 */
@Slf4j
@Service
public class TwoLegExecutor {

    private final VenueAdapterRegistry adapters;
    private final Duration legFillTimeout;
    private final UnhedgedExposurePolicy unhedgedPolicy;
    private final Clock clock;

    @Autowired
    public TwoLegExecutor(VenueAdapterRegistry adapters, ArbitrageProperties properties, Clock clock) {
        this(adapters, properties.getExecution().getLegFillTimeout(), properties.getExecution().getUnhedgedPolicy(),
                clock);
    }

    public TwoLegExecutor(VenueAdapterRegistry adapters, Duration legFillTimeout, UnhedgedExposurePolicy unhedgedPolicy,
            Clock clock) {
        if (unhedgedPolicy == null) {
            throw new IllegalArgumentException("arb.execution.unhedged-policy must be configured");
        }
        this.adapters = adapters;
        this.legFillTimeout = legFillTimeout;
        this.unhedgedPolicy = unhedgedPolicy;
        this.clock = clock;
    }

    public UnhedgedExposurePolicy getUnhedgedPolicy() {
        return unhedgedPolicy;
    }

    /**
     * Runs the execution to a terminal state. Venue failures end up in the returned outcome; they are
     * never thrown.
     *
     * @throws IllegalStateException if this execution has already been run
     */
    public ExecutionOutcome execute(TwoLegExecution execution) {
        execution.transition(ExecutionState.CREATED, ExecutionState.LEG1_SUBMITTED);
        Instant startedAt = clock.instant();
        Leg leg1 = execution.getLeg1();
        Leg leg2 = execution.getLeg2();
        log.info("--- START EXECUTION {} for {} ---", execution.getExecutionId(), execution.getOpportunityId());

        VenueAdapter venue1;
        VenueAdapter venue2;
        try {
            venue1 = adapters.resolve(leg1.getVenueId());
            venue2 = adapters.resolve(leg2.getVenueId());
        } catch (IllegalArgumentException e) {
            leg1.markStatus(LegStatus.FAILED);
            execution.transition(ExecutionState.LEG1_SUBMITTED, ExecutionState.LEG1_FAILED);
            return outcome(execution, startedAt, null, null, e.getMessage());
        }

        // Leg 1
        log.info("[EXECUTION] State: {} | {} {} {} on {} ${} @ {}", ExecutionState.LEG1_SUBMITTED, leg1.getSide(),
                leg1.getMarketId(), leg1.getOutcome(), leg1.getVenueId(), leg1.getSizeUsd(), leg1.getPrice());
        if (!submit(venue1, leg1)) {
            execution.transition(ExecutionState.LEG1_SUBMITTED, ExecutionState.LEG1_FAILED);
            return outcome(execution, startedAt, null, null, "Leg1 rejected by " + leg1.getVenueId());
        }

        FillResult leg1Result = awaitFill(execution, venue1, leg1);
        if (leg1Result == FillResult.PARTIAL) {
            cancel(venue1, leg1);
            execution.transition(ExecutionState.LEG1_SUBMITTED, ExecutionState.LEG1_PARTIALLY_FILLED);
            log.error("[UNHEDGED] Execution {} | Leg1 only partially filled, Leg2 not submitted. Open: {} {} {} ${}"
                            + " of ${} @ {} on {}", execution.getExecutionId(), leg1.getSide(), leg1.getMarketId(),
                    leg1.getOutcome(), leg1.getFilledSizeUsd(), leg1.getSizeUsd(), leg1.getFillPrice(),
                    leg1.getVenueId());
            return unhedged(execution, startedAt, venue1, "Leg1 filled $" + leg1.getFilledSizeUsd() + " of $"
                    + leg1.getSizeUsd() + ", Leg2 not submitted");
        }
        if (leg1Result != FillResult.FILLED) {
            ExecutionState terminal = leg1Result == FillResult.TIMED_OUT
                    ? ExecutionState.LEG1_TIMED_OUT
                    : ExecutionState.LEG1_FAILED;
            if (leg1Result != FillResult.FAILED) {
                cancel(venue1, leg1);
            }
            execution.transition(ExecutionState.LEG1_SUBMITTED, terminal);
            log.info("[EXECUTION] State: {} | Leg1 not filled ({}), Leg2 not submitted", terminal, leg1Result);
            return outcome(execution, startedAt, null, null, "Leg1 " + leg1Result.describe() + ", aborted cleanly");
        }
        execution.transition(ExecutionState.LEG1_SUBMITTED, ExecutionState.LEG1_FILLED);
        log.info("[EXECUTION] State: {} | Leg1 filled @ {}", ExecutionState.LEG1_FILLED, leg1.getFillPrice());

        // Leg 2, immediately and at most once
        execution.claimLeg2Submission();
        execution.transition(ExecutionState.LEG1_FILLED, ExecutionState.LEG2_SUBMITTED);
        log.info("[EXECUTION] State: {} | {} {} {} on {} ${} @ {}", ExecutionState.LEG2_SUBMITTED, leg2.getSide(),
                leg2.getMarketId(), leg2.getOutcome(), leg2.getVenueId(), leg2.getSizeUsd(), leg2.getPrice());
        FillResult leg2Result = submit(venue2, leg2) ? awaitFill(execution, venue2, leg2) : FillResult.FAILED;

        if (leg2Result != FillResult.FILLED) {
            if (leg2Result == FillResult.TIMED_OUT || leg2Result == FillResult.PARTIAL) {
                cancel(venue2, leg2);
            }
            execution.transition(ExecutionState.LEG2_SUBMITTED, ExecutionState.LEG2_FAILED_UNHEDGED);
            log.error("[UNHEDGED] Execution {} | Leg2 {} after Leg1 filled. Open: {} {} {} ${} @ {} on {}",
                    execution.getExecutionId(), leg2Result.describe(), leg1.getSide(), leg1.getMarketId(),
                    leg1.getOutcome(), leg1.getSizeUsd(), leg1.getFillPrice(), leg1.getVenueId());
            return unhedged(execution, startedAt, venue1, "Leg2 " + leg2Result.describe() + " after Leg1 filled");
        }

        execution.transition(ExecutionState.LEG2_SUBMITTED, ExecutionState.COMPLETE);
        BigDecimal pnl = realizedPnl(leg1, leg2);
        log.info("--- EXECUTION COMPLETE {} | Leg1 @ {} Leg2 @ {} | PnL: ${} ---", execution.getExecutionId(),
                leg1.getFillPrice(), leg2.getFillPrice(), pnl);
        return outcome(execution, startedAt, null, pnl, "Both legs filled");
    }

    /**
     * Realized PnL for a filled pair. A buy/sell pair earns sell price minus buy price per unit; a
     * pair on the same side earns the distance of the combined price from 1.00.
     */
    public static BigDecimal realizedPnl(Leg leg1, Leg leg2) {
        BigDecimal size = leg1.getSizeUsd();
        BigDecimal p1 = leg1.getFillPrice();
        BigDecimal p2 = leg2.getFillPrice();
        if (leg1.getSide() != leg2.getSide()) {
            BigDecimal sell = leg1.getSide() == Side.SELL ? p1 : p2;
            BigDecimal buy = leg1.getSide() == Side.SELL ? p2 : p1;
            return sell.subtract(buy).multiply(size);
        }
        BigDecimal sum = p1.add(p2);
        return leg1.getSide() == Side.BUY
                ? BigDecimal.ONE.subtract(sum).multiply(size)
                : sum.subtract(BigDecimal.ONE).multiply(size);
    }

    private boolean submit(VenueAdapter venue, Leg leg) {
        try {
            String externalOrderId = venue.submit(leg.toOrderRequest());
            if (externalOrderId == null || externalOrderId.isBlank()) {
                log.error("[EXECUTION] {} returned no order id for leg {}", venue.venueId(), leg.getLegId());
                leg.markStatus(LegStatus.FAILED);
                return false;
            }
            leg.markSubmitted(externalOrderId);
            return true;
        } catch (RuntimeException e) {
            log.error("[EXECUTION] Submit failed on {} for leg {}: {}", venue.venueId(), leg.getLegId(),
                    e.getMessage());
            leg.markStatus(LegStatus.FAILED);
            return false;
        }
    }

    private FillResult awaitFill(TwoLegExecution execution, VenueAdapter venue, Leg leg) {
        String orderId = leg.getExternalOrderId();
        CompletableFuture<FillReport> pending = null;
        FillReport report;
        try {
            pending = venue.awaitFill(orderId, legFillTimeout);
            report = pending.get(legFillTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            return FillResult.TIMED_OUT;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[EXECUTION] Interrupted while awaiting fill for {}", orderId);
            return FillResult.TIMED_OUT;
        } catch (ExecutionException | RuntimeException e) {
            Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
            log.error("[EXECUTION] Fill wait failed on {} for {}: {}", venue.venueId(), orderId, cause.getMessage());
            leg.markStatus(LegStatus.FAILED);
            return FillResult.FAILED;
        }

        if (report == null || !orderId.equals(report.getExternalOrderId())) {
            log.warn("[EXECUTION] Ignoring fill report for another order (expected {}, got {})", orderId,
                    report == null ? null : report.getExternalOrderId());
            leg.markStatus(LegStatus.FAILED);
            return FillResult.FAILED;
        }
        if (!execution.acceptFill(orderId)) {
            log.warn("[EXECUTION] Duplicate fill report for {} ignored", orderId);
            return FillResult.FAILED;
        }

        switch (report.getStatus()) {
            case FILLED:
                leg.markFilled(report.getFillPrice() != null ? report.getFillPrice() : leg.getPrice());
                return FillResult.FILLED;
            case PARTIALLY_FILLED:
                // unknown filled size counts as the whole order
                leg.markPartiallyFilled(report.getFillPrice() != null ? report.getFillPrice() : leg.getPrice(),
                        report.getFilledSizeUsd() != null && report.getFilledSizeUsd().signum() > 0
                                ? report.getFilledSizeUsd().min(leg.getSizeUsd())
                                : leg.getSizeUsd());
                return FillResult.PARTIAL;
            case TIMED_OUT:
                return FillResult.TIMED_OUT;
            case CANCELLED:
                leg.markStatus(LegStatus.CANCELLED);
                return FillResult.FAILED;
            default:
                log.warn("[EXECUTION] {} rejected {}: {}", venue.venueId(), orderId, report.getReason());
                leg.markStatus(LegStatus.FAILED);
                return FillResult.FAILED;
        }
    }

    private void cancel(VenueAdapter venue, Leg leg) {
        boolean cancelled = false;
        try {
            cancelled = venue.cancel(leg.getExternalOrderId());
        } catch (RuntimeException e) {
            log.warn("[EXECUTION] Cancel of {} on {} threw: {}", leg.getExternalOrderId(), venue.venueId(),
                    e.getMessage());
        }
        if (cancelled) {
            if (leg.getStatus() != LegStatus.PARTIALLY_FILLED) {
                leg.markStatus(LegStatus.CANCELLED);
            }
        } else {
            log.warn("[EXECUTION] Cancel of {} on {} not confirmed, proceeding", leg.getExternalOrderId(),
                    venue.venueId());
            if (leg.getStatus() == LegStatus.SUBMITTED) {
                leg.markStatus(LegStatus.FAILED);
            }
        }
    }

    private ExecutionOutcome unhedged(TwoLegExecution execution, Instant startedAt, VenueAdapter venue1,
            String message) {
        Leg unwind = unhedgedPolicy == UnhedgedExposurePolicy.UNWIND_AND_ALERT
                ? unwind(execution, venue1, execution.getLeg1())
                : null;
        String suffix = unwind == null ? ""
                : unwind.isFilled() ? ", Leg1 unwound @ " + unwind.getFillPrice()
                : ", unwind of Leg1 did not fill";
        return outcome(execution, startedAt, unwind, null, message + suffix);
    }

    private Leg unwind(TwoLegExecution execution, VenueAdapter venue, Leg leg1) {
        Leg unwind = leg1.offsetting();
        log.warn("[UNWIND] Execution {} | Submitting offsetting {} {} ${} @ {}", execution.getExecutionId(),
                unwind.getSide(), unwind.getMarketId(), unwind.getSizeUsd(), unwind.getPrice());
        if (!submit(venue, unwind)) {
            return unwind;
        }
        FillResult result = awaitFill(execution, venue, unwind);
        if (result != FillResult.FILLED) {
            if (result != FillResult.FAILED) {
                cancel(venue, unwind);
            }
            log.error("[UNWIND] Execution {} | Unwind {}; Leg1 exposure remains open", execution.getExecutionId(),
                    result.describe());
        } else {
            log.warn("[UNWIND] Execution {} | Leg1 unwound @ {}", execution.getExecutionId(), unwind.getFillPrice());
        }
        return unwind;
    }

    private ExecutionOutcome outcome(TwoLegExecution execution, Instant startedAt, Leg unwind, BigDecimal pnl,
            String message) {
        return ExecutionOutcome.builder()
                .executionId(execution.getExecutionId())
                .opportunityId(execution.getOpportunityId())
                .state(execution.getState())
                .leg1(execution.getLeg1())
                .leg2(execution.getLeg2())
                .unwindLeg(unwind)
                .realizedPnlUsd(pnl)
                .startedAt(startedAt)
                .finishedAt(clock.instant())
                .message(message)
                .build();
    }

    private enum FillResult {
        FILLED, PARTIAL, TIMED_OUT, FAILED;

        String describe() {
            switch (this) {
                case PARTIAL:
                    return "only partially filled";
                case TIMED_OUT:
                    return "timed out";
                case FAILED:
                    return "failed";
                default:
                    return "filled";
            }
        }
    }
}
