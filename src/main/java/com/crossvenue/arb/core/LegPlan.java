package com.crossvenue.arb.core;

import com.crossvenue.arb.domain.OrderBook;
import com.crossvenue.arb.domain.Outcome;
import com.crossvenue.arb.domain.Side;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One side of an opportunity as it would be traded: which outcome token, where, which way and at
 * what quoted price. {@code orderBook} may be null.
 */
@Value
@Builder
public class LegPlan {
    String marketId;
    String venueId;
    Outcome outcome;
    Side side;
    BigDecimal price;
    OrderBook orderBook;
    Instant quotedAt;

    public boolean hasDepth() {
        return orderBook != null && !orderBook.isEmpty(side);
    }
}
