package com.crossvenue.arb.risk;

import com.crossvenue.arb.domain.CapitalAllocation;
import com.crossvenue.arb.domain.PnlRecord;
import com.crossvenue.arb.domain.Position;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Value
@Builder
public class LedgerSnapshot {
    BigDecimal totalCapitalUsd;
    List<Position> positions;
    List<CapitalAllocation> reservations;
    List<PnlRecord> pnlHistory;
    Instant takenAt;
}
