package com.crossvenue.arb.risk;

import com.crossvenue.arb.domain.StrategyKind;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
@Builder
public class AuthorizationRequest {
    String opportunityId;
    StrategyKind strategyKind;
    BigDecimal requestedUsd;
    /** Markets the position would be exposed to; empty skips the single-market check. */
    @Singular
    List<String> marketIds;
    /** Visible order-book depth in USD, or null when unknown. */
    BigDecimal availableLiquidityUsd;
}
