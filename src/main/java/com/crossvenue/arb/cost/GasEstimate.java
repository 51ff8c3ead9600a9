package com.crossvenue.arb.cost;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class GasEstimate {
    long gasUnits;
    BigDecimal gasPriceGwei;
    BigDecimal costNative;
    BigDecimal nativeTokenUsd;
    BigDecimal costUsd;
}
