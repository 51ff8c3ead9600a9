package com.crossvenue.arb.execution;

import com.crossvenue.arb.domain.Outcome;
import com.crossvenue.arb.domain.Side;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Immutable order handed to a venue adapter. {@code clientOrderId} is unique per leg and lets an
 * adapter recognise a resubmission.
 */
@Value
@Builder
public class OrderRequest {
    String clientOrderId;
    String marketId;
    Outcome outcome;
    Side side;
    BigDecimal price;
    BigDecimal sizeUsd;
}
