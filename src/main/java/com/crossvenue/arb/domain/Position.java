package com.crossvenue.arb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * A tracked position. Instances are immutable; the ledger replaces an open position with its
 * closed (or failed) copy exactly once, and with a smaller open copy when only part of it filled.
 */
@Value
@Builder(toBuilder = true)
public class Position {
    String positionId;
    String allocationId;
    String opportunityId;
    List<String> marketIds;
    StrategyKind strategyKind;
    Side side;
    BigDecimal sizeUsd;
    BigDecimal entryPrice;
    BigDecimal exitPrice; // null until closed
    PositionStatus status;
    Instant openedAt;
    Instant closedAt;
    @Builder.Default
    BigDecimal pnlUsd = BigDecimal.ZERO;
    @Builder.Default
    BigDecimal pnlPct = BigDecimal.ZERO;
    @Builder.Default
    BigDecimal feesPaidUsd = BigDecimal.ZERO;

    public String primaryMarketId() {
        return marketIds.get(0);
    }
}
