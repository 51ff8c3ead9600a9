package com.crossvenue.arb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class PnlRecord {
    String positionId;
    StrategyKind strategyKind;
    BigDecimal pnlUsd;
    BigDecimal pnlPct;
    Instant timestamp;
}
