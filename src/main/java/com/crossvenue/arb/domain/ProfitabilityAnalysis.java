package com.crossvenue.arb.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Value
@Builder
public class ProfitabilityAnalysis {
    String opportunityId;
    BigDecimal positionSizeUsd;
    BigDecimal grossSpreadUsd;
    BigDecimal grossSpreadPct;
    TransactionCosts transactionCosts;
    BigDecimal netProfitUsd;
    BigDecimal netProfitPct;
    boolean profitable;
    BigDecimal breakEvenSpreadPct;
    BigDecimal minRequiredSpreadPct;
    String recommendation;
    @Singular
    List<String> riskFactors;
    Instant evaluatedAt;
}
