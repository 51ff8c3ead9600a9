package com.crossvenue.arb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class TransactionCosts {
    BigDecimal platformFeesUsd;
    BigDecimal gasCostsUsd;
    BigDecimal slippageCostsUsd;
    BigDecimal totalCostsUsd;
    BigDecimal totalCostsPct;
}
