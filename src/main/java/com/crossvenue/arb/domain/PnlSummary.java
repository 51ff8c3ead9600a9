package com.crossvenue.arb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class PnlSummary {
    StrategyKind strategyKind; // null = all strategies
    BigDecimal totalPnlUsd;
    int totalTrades;
    int winningTrades;
    int losingTrades;
    BigDecimal winRatePct;
    BigDecimal avgPnlUsd;
}
