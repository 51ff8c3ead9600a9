package com.crossvenue.arb.risk;

import com.crossvenue.arb.config.ArbitrageProperties;
import com.crossvenue.arb.domain.CapitalAllocation;
import com.crossvenue.arb.domain.ExposureMetrics;
import com.crossvenue.arb.domain.PnlFilter;
import com.crossvenue.arb.domain.PnlRecord;
import com.crossvenue.arb.domain.PnlSummary;
import com.crossvenue.arb.domain.Position;
import com.crossvenue.arb.domain.PositionStatus;
import com.crossvenue.arb.domain.RejectionReason;
import com.crossvenue.arb.domain.Side;
import com.crossvenue.arb.domain.StrategyKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single source of truth for capital usage.
 *
 * <p>Every mutation ({@link #authorize}, {@link #recordOpen}, {@link #recordPartialFill},
 * {@link #recordClose}, {@link #recordFailure}, {@link #release}) runs under one lock, because the exposure limits are
 * read-then-write checks. Reads ({@link #exposure()}, {@link #pnlSummary}, {@link #positions()})
 * work on concurrent snapshots and never take the lock.
 *
 * <p>An approved allocation is held as a reservation until it is opened, released or expires.
 * Reservations count against the same limits as open positions, so concurrent authorizations
 * cannot jointly exceed them.
 */
@Slf4j
@Service
public class CapitalLedger {

    private static final MathContext MC = MathContext.DECIMAL64;
    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private final BigDecimal totalCapitalUsd;
    private final BigDecimal maxPositionSizePct;
    private final BigDecimal maxSingleMarketExposurePct;
    private final BigDecimal maxTotalExposurePct;
    private final BigDecimal liquidityUsagePct;
    private final Duration allocationTtl;
    private final Clock clock;

    private final ReentrantLock writeLock = new ReentrantLock();
    private final Map<String, Position> positions = new ConcurrentHashMap<>();
    private final Map<String, CapitalAllocation> reservations = new ConcurrentHashMap<>();
    private final List<PnlRecord> pnlHistory = new CopyOnWriteArrayList<>();

    public CapitalLedger(ArbitrageProperties properties, Clock clock) {
        ArbitrageProperties.Capital capital = properties.getCapital();
        this.totalCapitalUsd = capital.getTotalCapitalUsd();
        this.maxPositionSizePct = capital.getMaxPositionSizePct();
        this.maxSingleMarketExposurePct = capital.getMaxSingleMarketExposurePct();
        this.maxTotalExposurePct = capital.getMaxTotalExposurePct();
        this.liquidityUsagePct = capital.getLiquidityUsagePct();
        this.allocationTtl = capital.getAllocationTtl();
        this.clock = clock;
        log.info("[LEDGER] Initialized with capital ${} (max position {}%, max market {}%, max total {}%)",
                totalCapitalUsd, maxPositionSizePct, maxSingleMarketExposurePct, maxTotalExposurePct);
    }

    public BigDecimal getTotalCapitalUsd() {
        return totalCapitalUsd;
    }

    public AuthorizationResult authorize(String opportunityId, StrategyKind strategyKind, BigDecimal requestedUsd) {
        return authorize(AuthorizationRequest.builder()
                .opportunityId(opportunityId)
                .strategyKind(strategyKind)
                .requestedUsd(requestedUsd)
                .build());
    }

    /**
     * Checks, in order: position-size cap, remaining total-exposure capacity, liquidity cap (when
     * depth is known), and per-market exposure cap. The first failing check is the rejection.
     */
    public AuthorizationResult authorize(AuthorizationRequest request) {
        BigDecimal requested = request.getRequestedUsd();
        if (requested == null || requested.signum() <= 0) {
            return reject(request, RejectionReason.INVALID_REQUEST, "Requested amount must be positive");
        }

        writeLock.lock();
        try {
            Instant now = clock.instant();
            pruneExpiredReservations(now);

            BigDecimal maxPosition = pctOfCapital(maxPositionSizePct);
            if (requested.compareTo(maxPosition) > 0) {
                return reject(request, RejectionReason.POSITION_SIZE_LIMIT,
                        "Requested $" + requested + " exceeds max position $" + maxPosition);
            }

            BigDecimal remaining = remainingCapacity();
            if (requested.compareTo(remaining) > 0) {
                return reject(request, RejectionReason.TOTAL_EXPOSURE_LIMIT,
                        "Requested $" + requested + " exceeds remaining capacity $" + remaining);
            }

            BigDecimal liquidity = request.getAvailableLiquidityUsd();
            if (liquidity != null) {
                BigDecimal liquidityCap = percent(liquidity, liquidityUsagePct);
                if (requested.compareTo(liquidityCap) > 0) {
                    return reject(request, RejectionReason.LIQUIDITY_LIMIT,
                            "Requested $" + requested + " exceeds " + liquidityUsagePct + "% of visible depth $"
                                    + liquidity);
                }
            }

            BigDecimal maxMarket = pctOfCapital(maxSingleMarketExposurePct);
            for (String marketId : request.getMarketIds()) {
                BigDecimal committed = committedExposure(marketId);
                if (committed.add(requested).compareTo(maxMarket) > 0) {
                    return reject(request, RejectionReason.SINGLE_MARKET_EXPOSURE_LIMIT,
                            "Market " + marketId + " would reach $" + committed.add(requested) + " (max $"
                                    + maxMarket + ")");
                }
            }

            CapitalAllocation allocation = CapitalAllocation.builder()
                    .allocationId(UUID.randomUUID().toString())
                    .opportunityId(request.getOpportunityId())
                    .strategyKind(request.getStrategyKind())
                    .marketIds(List.copyOf(request.getMarketIds()))
                    .requestedUsd(requested)
                    .approvedUsd(requested)
                    .allocationPct(requested.divide(totalCapitalUsd, MC).multiply(HUNDRED))
                    .timestamp(now)
                    .expiresAt(now.plus(allocationTtl))
                    .build();
            reservations.put(allocation.getAllocationId(), allocation);

            log.info("[LEDGER] Capital allocated: ${} ({}% of capital) for {}", requested,
                    allocation.getAllocationPct().setScale(2, RoundingMode.HALF_UP), request.getOpportunityId());
            return AuthorizationResult.approved(allocation);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Largest position the limits currently allow: the position-size cap, the liquidity share of
     * visible depth (when known) and the remaining capacity. Zero when no capacity remains.
     */
    public BigDecimal recommendPositionSize(BigDecimal availableLiquidityUsd) {
        BigDecimal size = pctOfCapital(maxPositionSizePct);
        if (availableLiquidityUsd != null) {
            size = size.min(percent(availableLiquidityUsd, liquidityUsagePct));
        }
        BigDecimal remaining = remainingCapacity();
        if (remaining.signum() <= 0) {
            log.warn("[LEDGER] No remaining exposure capacity");
            return BigDecimal.ZERO;
        }
        return size.min(remaining).max(BigDecimal.ZERO);
    }

    public boolean isActive(CapitalAllocation allocation) {
        return reservations.containsKey(allocation.getAllocationId()) && !allocation.isExpired(clock.instant());
    }

    /**
     * Returns an unused allocation's capital to available capacity. Releasing an allocation that was
     * already opened, released or pruned is a no-op.
     */
    public void release(CapitalAllocation allocation) {
        writeLock.lock();
        try {
            if (reservations.remove(allocation.getAllocationId()) != null) {
                log.info("[LEDGER] Released ${} reserved for {}", allocation.getApprovedUsd(),
                        allocation.getOpportunityId());
            }
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Converts a live allocation into an open position; from here its capital counts as open
     * exposure.
     *
     * @throws IllegalStateException if the allocation is unknown, already used or expired
     */
    public Position recordOpen(CapitalAllocation allocation, BigDecimal entryPrice, Side side) {
        writeLock.lock();
        try {
            Instant now = clock.instant();
            CapitalAllocation reserved = reservations.get(allocation.getAllocationId());
            if (reserved == null) {
                throw new IllegalStateException("Allocation " + allocation.getAllocationId()
                        + " is unknown, released or already opened");
            }
            if (reserved.isExpired(now)) {
                reservations.remove(reserved.getAllocationId());
                throw new IllegalStateException("Allocation " + reserved.getAllocationId() + " expired at "
                        + reserved.getExpiresAt());
            }
            reservations.remove(reserved.getAllocationId());

            Position position = Position.builder()
                    .positionId(UUID.randomUUID().toString())
                    .allocationId(reserved.getAllocationId())
                    .opportunityId(reserved.getOpportunityId())
                    .marketIds(reserved.getMarketIds())
                    .strategyKind(reserved.getStrategyKind())
                    .side(side)
                    .sizeUsd(reserved.getApprovedUsd())
                    .entryPrice(entryPrice)
                    .status(PositionStatus.OPEN)
                    .openedAt(now)
                    .build();
            positions.put(position.getPositionId(), position);

            log.info("[LEDGER] Position opened: {} | {} | {} ${} @ {}", position.getPositionId(),
                    position.getStrategyKind(), side, position.getSizeUsd(), entryPrice);
            return position;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Shrinks an open position to what actually filled and frees the capital of the unfilled
     * remainder. The position stays open.
     *
     * @throws IllegalArgumentException if the filled size is not positive or exceeds the position
     */
    public Position recordPartialFill(String positionId, BigDecimal filledSizeUsd, BigDecimal fillPrice) {
        writeLock.lock();
        try {
            Position position = requireOpen(positionId);
            if (filledSizeUsd.signum() <= 0 || filledSizeUsd.compareTo(position.getSizeUsd()) > 0) {
                throw new IllegalArgumentException("Filled size $" + filledSizeUsd + " outside (0, $"
                        + position.getSizeUsd() + "] for position " + positionId);
            }
            Position resized = position.toBuilder()
                    .sizeUsd(filledSizeUsd)
                    .entryPrice(fillPrice != null ? fillPrice : position.getEntryPrice())
                    .build();
            positions.put(positionId, resized);
            log.warn("[LEDGER] Position partially filled: {} | ${} of ${} held, ${} released", positionId,
                    filledSizeUsd, position.getSizeUsd(), position.getSizeUsd().subtract(filledSizeUsd));
            return resized;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Closes an open position with side-aware PnL (long: (exit - entry) / entry, short:
     * (entry - exit) / entry), net of fees, and frees its capital.
     */
    public Position recordClose(String positionId, BigDecimal exitPrice, BigDecimal feesPaidUsd) {
        writeLock.lock();
        try {
            Position position = requireOpen(positionId);
            Instant now = clock.instant();

            BigDecimal move = position.getSide() == Side.BUY
                    ? exitPrice.subtract(position.getEntryPrice())
                    : position.getEntryPrice().subtract(exitPrice);
            BigDecimal pnlPct = position.getEntryPrice().signum() == 0
                    ? BigDecimal.ZERO
                    : move.divide(position.getEntryPrice(), MC).multiply(HUNDRED);
            BigDecimal fees = feesPaidUsd != null ? feesPaidUsd : BigDecimal.ZERO;
            BigDecimal pnlUsd = pnlPct.divide(HUNDRED, MC).multiply(position.getSizeUsd()).subtract(fees);

            Position closed = position.toBuilder()
                    .exitPrice(exitPrice)
                    .status(PositionStatus.CLOSED)
                    .closedAt(now)
                    .pnlUsd(pnlUsd)
                    .pnlPct(pnlPct)
                    .feesPaidUsd(fees)
                    .build();
            positions.put(positionId, closed);
            pnlHistory.add(PnlRecord.builder()
                    .positionId(positionId)
                    .strategyKind(closed.getStrategyKind())
                    .pnlUsd(pnlUsd)
                    .pnlPct(pnlPct)
                    .timestamp(now)
                    .build());

            log.info("[LEDGER] Position closed: {} | PnL: ${} ({}%)", positionId,
                    pnlUsd.setScale(2, RoundingMode.HALF_UP), pnlPct.setScale(2, RoundingMode.HALF_UP));
            return closed;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Terminal failure of an open position that never took on directional risk. Frees its capital
     * without a PnL record.
     */
    public Position recordFailure(String positionId, BigDecimal feesPaidUsd) {
        writeLock.lock();
        try {
            Position position = requireOpen(positionId);
            BigDecimal fees = feesPaidUsd != null ? feesPaidUsd : BigDecimal.ZERO;
            Position failed = position.toBuilder()
                    .status(PositionStatus.FAILED)
                    .closedAt(clock.instant())
                    .pnlUsd(fees.negate())
                    .feesPaidUsd(fees)
                    .build();
            positions.put(positionId, failed);
            log.info("[LEDGER] Position failed: {} | ${} released", positionId, position.getSizeUsd());
            return failed;
        } finally {
            writeLock.unlock();
        }
    }

    public ExposureMetrics exposure() {
        List<Position> open = positions.values().stream()
                .filter(p -> p.getStatus() == PositionStatus.OPEN)
                .toList();

        BigDecimal total = BigDecimal.ZERO;
        Map<String, BigDecimal> byMarket = new TreeMap<>();
        Map<StrategyKind, BigDecimal> byStrategy = new EnumMap<>(StrategyKind.class);
        for (Position p : open) {
            total = total.add(p.getSizeUsd());
            for (String marketId : p.getMarketIds()) {
                byMarket.merge(marketId, p.getSizeUsd(), BigDecimal::add);
            }
            byStrategy.merge(p.getStrategyKind(), p.getSizeUsd(), BigDecimal::add);
        }

        Map.Entry<String, BigDecimal> largest = byMarket.entrySet().stream()
                .max(Map.Entry.comparingByValue())
                .orElse(null);
        BigDecimal largestUsd = largest != null ? largest.getValue() : BigDecimal.ZERO;

        return ExposureMetrics.builder()
                .totalExposureUsd(total)
                .exposureByMarket(byMarket)
                .exposureByStrategy(byStrategy)
                .largestMarketId(largest != null ? largest.getKey() : null)
                .maxSingleMarketExposureUsd(largestUsd)
                .maxSingleMarketExposurePct(largestUsd.divide(totalCapitalUsd, MC).multiply(HUNDRED))
                .diversificationScore(diversification(byMarket.values()))
                .build();
    }

    public PnlSummary pnlSummary(PnlFilter filter) {
        List<PnlRecord> matching = pnlHistory.stream().filter(filter::matches).toList();
        BigDecimal total = matching.stream().map(PnlRecord::getPnlUsd).reduce(BigDecimal.ZERO, BigDecimal::add);
        int trades = matching.size();
        int wins = (int) matching.stream().filter(r -> r.getPnlUsd().signum() > 0).count();

        return PnlSummary.builder()
                .strategyKind(filter.getStrategyKind())
                .totalPnlUsd(total)
                .totalTrades(trades)
                .winningTrades(wins)
                .losingTrades(trades - wins)
                .winRatePct(trades == 0 ? BigDecimal.ZERO
                        : BigDecimal.valueOf(wins).multiply(HUNDRED).divide(BigDecimal.valueOf(trades), MC))
                .avgPnlUsd(trades == 0 ? BigDecimal.ZERO : total.divide(BigDecimal.valueOf(trades), MC))
                .build();
    }

    public Position position(String positionId) {
        return positions.get(positionId);
    }

    /**
     * Tracked positions, followed by one PENDING entry per outstanding allocation, oldest first.
     */
    public List<Position> positions() {
        List<Position> result = new ArrayList<>(positions.values());
        result.sort(Comparator.comparing(Position::getOpenedAt));
        Instant now = clock.instant();
        reservations.values().stream()
                .filter(a -> !a.isExpired(now))
                .sorted(Comparator.comparing(CapitalAllocation::getTimestamp))
                .map(CapitalLedger::pendingView)
                .forEach(result::add);
        return result;
    }

    public LedgerSnapshot snapshot() {
        List<Position> tracked = new ArrayList<>(positions.values());
        tracked.sort(Comparator.comparing(Position::getOpenedAt));
        return LedgerSnapshot.builder()
                .totalCapitalUsd(totalCapitalUsd)
                .positions(tracked)
                .reservations(List.copyOf(reservations.values()))
                .pnlHistory(List.copyOf(pnlHistory))
                .takenAt(clock.instant())
                .build();
    }

    private Position requireOpen(String positionId) {
        Position position = positions.get(positionId);
        if (position == null) {
            throw new IllegalArgumentException("Position not found: " + positionId);
        }
        if (position.getStatus() != PositionStatus.OPEN) {
            throw new IllegalStateException("Position " + positionId + " is not open (status: "
                    + position.getStatus() + ")");
        }
        return position;
    }

    private AuthorizationResult reject(AuthorizationRequest request, RejectionReason reason, String message) {
        log.warn("[LEDGER] Rejected {}: {} - {}", request.getOpportunityId(), reason, message);
        return AuthorizationResult.rejected(reason, message);
    }

    private void pruneExpiredReservations(Instant now) {
        reservations.values().removeIf(a -> {
            boolean expired = a.isExpired(now);
            if (expired) {
                log.info("[LEDGER] Allocation {} for {} expired unused", a.getAllocationId(), a.getOpportunityId());
            }
            return expired;
        });
    }

    private BigDecimal remainingCapacity() {
        Instant now = clock.instant();
        BigDecimal open = positions.values().stream()
                .filter(p -> p.getStatus() == PositionStatus.OPEN)
                .map(Position::getSizeUsd)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal reserved = reservations.values().stream()
                .filter(a -> !a.isExpired(now))
                .map(CapitalAllocation::getApprovedUsd)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return pctOfCapital(maxTotalExposurePct).subtract(open).subtract(reserved);
    }

    private BigDecimal committedExposure(String marketId) {
        Instant now = clock.instant();
        BigDecimal open = positions.values().stream()
                .filter(p -> p.getStatus() == PositionStatus.OPEN && p.getMarketIds().contains(marketId))
                .map(Position::getSizeUsd)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal reserved = reservations.values().stream()
                .filter(a -> !a.isExpired(now) && a.getMarketIds().contains(marketId))
                .map(CapitalAllocation::getApprovedUsd)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return open.add(reserved);
    }

    private BigDecimal pctOfCapital(BigDecimal pct) {
        return percent(totalCapitalUsd, pct);
    }

    private static BigDecimal percent(BigDecimal amount, BigDecimal pct) {
        return amount.multiply(pct).divide(HUNDRED, MC);
    }

    /** 1 - HHI over per-market shares; 1.0 with nothing open. */
    static double diversification(Collection<BigDecimal> marketExposures) {
        BigDecimal total = marketExposures.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        if (total.signum() == 0) {
            return 1.0;
        }
        double hhi = 0.0;
        for (BigDecimal exposure : marketExposures) {
            double share = exposure.divide(total, MC).doubleValue();
            hhi += share * share;
        }
        return 1.0 - hhi;
    }

    private static Position pendingView(CapitalAllocation allocation) {
        return Position.builder()
                .positionId(allocation.getAllocationId())
                .allocationId(allocation.getAllocationId())
                .opportunityId(allocation.getOpportunityId())
                .marketIds(allocation.getMarketIds())
                .strategyKind(allocation.getStrategyKind())
                .sizeUsd(allocation.getApprovedUsd())
                .status(PositionStatus.PENDING)
                .openedAt(allocation.getTimestamp())
                .build();
    }
}
