package com.crossvenue.arb.core;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * Everything the analyzer needs besides the opportunity itself. Gas and native-token prices are
 * resolved before analysis so the analysis stays deterministic.
 */
@Value
@Builder
public class CostInputs {
    BigDecimal positionSizeUsd;
    BigDecimal gasPriceGwei;
    BigDecimal nativeTokenUsd;
    long gasUnitsPerLeg;
    Duration maxQuoteAge;
    Instant asOf;
}
