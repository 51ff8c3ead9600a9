package com.crossvenue.arb.core;

import com.crossvenue.arb.config.ArbitrageProperties;
import com.crossvenue.arb.cost.CostModel;
import com.crossvenue.arb.cost.VenueRegistry;
import com.crossvenue.arb.domain.CapitalAllocation;
import com.crossvenue.arb.domain.CombinatorialOpportunity;
import com.crossvenue.arb.domain.ExposureMetrics;
import com.crossvenue.arb.domain.MarketQuote;
import com.crossvenue.arb.domain.Opportunity;
import com.crossvenue.arb.domain.PnlFilter;
import com.crossvenue.arb.domain.PnlSummary;
import com.crossvenue.arb.domain.Position;
import com.crossvenue.arb.domain.ProfitabilityAnalysis;
import com.crossvenue.arb.domain.RebalancingOpportunity;
import com.crossvenue.arb.domain.RejectionReason;
import com.crossvenue.arb.domain.RelationshipSignal;
import com.crossvenue.arb.domain.Side;
import com.crossvenue.arb.execution.ExecutionOutcome;
import com.crossvenue.arb.execution.Leg;
import com.crossvenue.arb.execution.TwoLegExecution;
import com.crossvenue.arb.execution.TwoLegExecutor;
import com.crossvenue.arb.infra.Alert;
import com.crossvenue.arb.infra.AlertDispatcher;
import com.crossvenue.arb.infra.AlertSeverity;
import com.crossvenue.arb.infra.LedgerStateExporter;
import com.crossvenue.arb.risk.AuthorizationRequest;
import com.crossvenue.arb.risk.AuthorizationResult;
import com.crossvenue.arb.risk.CapitalLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Entry point that ties the analyzer, the capital ledger and the two-leg executor together.
 *
 * <p>{@link #authorizeAndExecute} re-detects the opportunity on fresh quotes, sizes it, re-runs the
 * profitability check, asks the ledger for capital, opens the position and only then hands the legs
 * to the executor. The executor's terminal state decides how the position is settled.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ArbitrageEngine {

    private final ProfitabilityAnalyzer analyzer;
    private final CostModel costModel;
    private final CapitalLedger ledger;
    private final TwoLegExecutor executor;
    private final MarketDataSource marketData;
    private final RelationshipClassifier classifier;
    private final RebalancingDetector rebalancingDetector;
    private final CombinatorialDetector combinatorialDetector;
    private final VenueRegistry venues;
    private final AlertDispatcher alerts;
    private final LedgerStateExporter stateExporter;
    private final ArbitrageProperties properties;
    private final Clock clock;

    /** Profitability at the default position size. Side-effect free apart from logging. */
    public ProfitabilityAnalysis evaluate(Opportunity opportunity) {
        return analyzer.analyze(opportunity, costInputs(properties.getProfitability().getDefaultPositionSizeUsd()));
    }

    public CostInputs costInputs(BigDecimal positionSizeUsd) {
        return CostInputs.builder()
                .positionSizeUsd(positionSizeUsd)
                .gasPriceGwei(costModel.currentGasPriceGwei())
                .nativeTokenUsd(costModel.currentNativeTokenUsd())
                .gasUnitsPerLeg(properties.getProfitability().getGasUnitsPerLeg())
                .maxQuoteAge(properties.getProfitability().getMaxQuoteAge())
                .asOf(clock.instant())
                .build();
    }

    public ExecutionResult authorizeAndExecute(Opportunity opportunity) {
        String opportunityId = opportunity.getId();

        Optional<Opportunity> refreshed = refresh(opportunity);
        if (refreshed.isEmpty()) {
            return reject(opportunityId, RejectionReason.OPPORTUNITY_VANISHED,
                    "Opportunity no longer present on current quotes", null);
        }
        Opportunity current = refreshed.get();
        List<LegPlan> plans = LegPlanner.legsOf(current);

        BigDecimal liquidity = LegPlanner.availableLiquidityUsd(plans);
        BigDecimal size = properties.getProfitability().getDefaultPositionSizeUsd()
                .min(ledger.recommendPositionSize(liquidity));
        if (size.signum() <= 0) {
            return reject(opportunityId, RejectionReason.NO_CAPACITY, "No capital or liquidity available", null);
        }

        ProfitabilityAnalysis analysis = analyzer.analyze(current, costInputs(size));
        if (!analysis.isProfitable()) {
            return reject(opportunityId, RejectionReason.NOT_PROFITABLE, analysis.getRecommendation(), analysis);
        }

        AuthorizationResult authorization = ledger.authorize(AuthorizationRequest.builder()
                .opportunityId(opportunityId)
                .strategyKind(current.getStrategyKind())
                .requestedUsd(size)
                .marketIds(current.marketIds())
                .availableLiquidityUsd(liquidity)
                .build());
        if (!authorization.isApproved()) {
            return reject(opportunityId, authorization.getRejectionReason(), authorization.getMessage(), analysis);
        }
        CapitalAllocation allocation = authorization.getAllocation();

        List<LegPlan> ordered = LegPlanner.riskiestFirst(plans, venues);
        Leg leg1 = toLeg(ordered.get(0), allocation.getApprovedUsd());
        Leg leg2 = toLeg(ordered.get(1), allocation.getApprovedUsd());

        Position position;
        try {
            position = ledger.recordOpen(allocation, leg1.getPrice(), leg1.getSide());
        } catch (IllegalStateException e) {
            ledger.release(allocation);
            return reject(opportunityId, RejectionReason.ALLOCATION_EXPIRED, e.getMessage(), analysis);
        }

        ExecutionOutcome outcome = executor.execute(new TwoLegExecution(opportunityId, leg1, leg2));
        ExecutionResult result = settle(outcome, position, analysis, allocation);
        if (stateExporter.isEnabled()) {
            stateExporter.export(ledger.snapshot());
        }
        return result;
    }

    public ExposureMetrics exposure() {
        return ledger.exposure();
    }

    public PnlSummary pnlSummary(PnlFilter filter) {
        return ledger.pnlSummary(filter);
    }

    private ExecutionResult settle(ExecutionOutcome outcome, Position position, ProfitabilityAnalysis analysis,
            CapitalAllocation allocation) {
        Leg leg1 = outcome.getLeg1();
        Leg leg2 = outcome.getLeg2();
        BigDecimal fees = analysis.getTransactionCosts().getPlatformFeesUsd()
                .add(analysis.getTransactionCosts().getGasCostsUsd());
        ExecutionResult.ExecutionResultBuilder result = ExecutionResult.builder()
                .opportunityId(outcome.getOpportunityId())
                .executionState(outcome.getState())
                .analysis(analysis)
                .allocation(allocation)
                .leg(leg1)
                .leg(leg2)
                .unwindLeg(outcome.getUnwindLeg())
                .message(outcome.getMessage());

        switch (outcome.getState()) {
            case COMPLETE -> {
                Position closed = ledger.recordClose(position.getPositionId(),
                        impliedExitPrice(position, outcome.getRealizedPnlUsd()), fees);
                alerts.dispatch(alert(AlertSeverity.INFO, "Arbitrage executed", outcome,
                        "Realized $" + outcome.getRealizedPnlUsd() + " before fees, $" + closed.getPnlUsd()
                                + " net on $" + closed.getSizeUsd()));
                return result.status(ExecutionStatus.SUCCESS)
                        .position(closed)
                        .pnlUsd(closed.getPnlUsd())
                        .build();
            }
            case LEG1_TIMED_OUT, LEG1_FAILED -> {
                Position failed = ledger.recordFailure(position.getPositionId(), BigDecimal.ZERO);
                alerts.dispatch(alert(AlertSeverity.INFO, "Execution aborted", outcome, outcome.getMessage()));
                return result.status(ExecutionStatus.ABORTED)
                        .position(failed)
                        .pnlUsd(BigDecimal.ZERO)
                        .build();
            }
            case LEG1_PARTIALLY_FILLED -> {
                Position resized = ledger.recordPartialFill(position.getPositionId(), leg1.getFilledSizeUsd(),
                        leg1.getFillPrice());
                return unhedged(outcome, resized, fees, result);
            }
            case LEG2_FAILED_UNHEDGED -> {
                return unhedged(outcome, position, fees, result);
            }
            default -> throw new IllegalStateException("Executor returned non-terminal state " + outcome.getState());
        }
    }

    private ExecutionResult unhedged(ExecutionOutcome outcome, Position position, BigDecimal fees,
            ExecutionResult.ExecutionResultBuilder result) {
        Leg leg1 = outcome.getLeg1();
        Position current = outcome.isUnwound()
                ? ledger.recordClose(position.getPositionId(), outcome.getUnwindLeg().getFillPrice(), fees)
                : ledger.position(position.getPositionId());
        alerts.dispatch(alert(AlertSeverity.CRITICAL, "UNHEDGED EXPOSURE", outcome,
                outcome.getMessage() + ". Leg1: " + leg1.getSide() + " " + leg1.getMarketId() + " "
                        + leg1.getOutcome() + " $" + leg1.getFilledSizeUsd() + " @ " + leg1.getFillPrice()
                        + " on " + leg1.getVenueId() + ". Position " + current.getStatus()));
        return result.status(ExecutionStatus.FAILED_UNHEDGED)
                .position(current)
                .pnlUsd(outcome.isUnwound() ? current.getPnlUsd() : null)
                .build();
    }

    private Optional<Opportunity> refresh(Opportunity opportunity) {
        return opportunity.accept(new Opportunity.Visitor<Optional<Opportunity>>() {
            @Override
            public Optional<Opportunity> visitRebalancing(RebalancingOpportunity rebalancing) {
                return marketData.quote(rebalancing.getMarketId())
                        .flatMap(quote -> rebalancingDetector.detect(quote, rebalancing.getId()))
                        .map(Opportunity.class::cast);
            }

            @Override
            public Optional<Opportunity> visitCombinatorial(CombinatorialOpportunity combinatorial) {
                String marketA = combinatorial.getQuoteA().getMarketId();
                String marketB = combinatorial.getQuoteB().getMarketId();
                Optional<MarketQuote> quoteA = marketData.quote(marketA);
                Optional<MarketQuote> quoteB = marketData.quote(marketB);
                if (quoteA.isEmpty() || quoteB.isEmpty()) {
                    return Optional.empty();
                }
                RelationshipSignal signal = classifier.classify(marketA, marketB).orElse(combinatorial.getSignal());
                return combinatorialDetector.detect(quoteA.get(), quoteB.get(), signal, combinatorial.getId())
                        .map(Opportunity.class::cast);
            }
        });
    }

    private ExecutionResult reject(String opportunityId, RejectionReason reason, String message,
            ProfitabilityAnalysis analysis) {
        log.info("Opportunity {} rejected: {} - {}", opportunityId, reason, message);
        return ExecutionResult.rejected(opportunityId, reason, message, analysis);
    }

    private Alert alert(AlertSeverity severity, String title, ExecutionOutcome outcome, String message) {
        return Alert.builder()
                .severity(severity)
                .title(title)
                .message(message)
                .opportunityId(outcome.getOpportunityId())
                .executionId(outcome.getExecutionId())
                .timestamp(clock.instant())
                .build();
    }

    /**
     * Exit price at which the ledger's side-aware return on the position equals the realized PnL of
     * the hedged pair.
     */
    static BigDecimal impliedExitPrice(Position position, BigDecimal realizedPnlUsd) {
        BigDecimal returnPerUnit = realizedPnlUsd.divide(position.getSizeUsd(), MathContext.DECIMAL64);
        BigDecimal move = position.getEntryPrice().multiply(returnPerUnit);
        return position.getSide() == Side.SELL
                ? position.getEntryPrice().subtract(move)
                : position.getEntryPrice().add(move);
    }

    private static Leg toLeg(LegPlan plan, BigDecimal sizeUsd) {
        return Leg.builder()
                .marketId(plan.getMarketId())
                .venueId(plan.getVenueId())
                .outcome(plan.getOutcome())
                .side(plan.getSide())
                .price(plan.getPrice())
                .sizeUsd(sizeUsd)
                .build();
    }
}
