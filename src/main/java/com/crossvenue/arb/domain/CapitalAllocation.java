package com.crossvenue.arb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Capital approved for one opportunity. Only the ledger creates these; a rejection produces none.
 */
@Value
@Builder
public class CapitalAllocation {
    String allocationId;
    String opportunityId;
    StrategyKind strategyKind;
    List<String> marketIds;
    BigDecimal requestedUsd;
    BigDecimal approvedUsd;
    BigDecimal allocationPct;
    Instant timestamp;
    Instant expiresAt;

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
