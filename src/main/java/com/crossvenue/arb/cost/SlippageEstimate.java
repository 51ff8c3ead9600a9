package com.crossvenue.arb.cost;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class SlippageEstimate {
    BigDecimal bestPrice;
    BigDecimal executionPrice;
    BigDecimal slippageUsd;
    BigDecimal slippagePct;
    BigDecimal availableLiquidityUsd;
    /** True when depth was missing and the conservative default was applied. */
    boolean estimated;
    /** True when the book ran out before the order was filled. */
    boolean depthExhausted;
}
