package com.crossvenue.arb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * Normalized snapshot of one binary market on one venue, as delivered by market-data ingestion.
 * {@code noPrice}, the best bid/ask and both order books are optional.
 */
@Value
@Builder(toBuilder = true)
public class MarketQuote {
    String venueId;
    String marketId;
    BigDecimal yesPrice;
    BigDecimal noPrice;
    BigDecimal bestBid;
    BigDecimal bestAsk;
    OrderBook orderBook; // YES token
    OrderBook noOrderBook;
    Instant timestamp;

    public boolean hasOrderBook() {
        return orderBook != null;
    }

    public boolean isStale(Instant asOf, Duration maxAge) {
        return timestamp == null || Duration.between(timestamp, asOf).compareTo(maxAge) > 0;
    }
}
