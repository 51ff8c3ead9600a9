package com.crossvenue.arb.core;

import com.crossvenue.arb.domain.MarketQuote;
import com.crossvenue.arb.domain.OrderBook;

import java.util.Collection;
import java.util.Optional;

/**
 * Latest normalized quotes, as delivered by market-data ingestion.
 */
public interface MarketDataSource {

    Optional<MarketQuote> quote(String marketId);

    default Optional<OrderBook> orderBook(String marketId) {
        return quote(marketId).map(MarketQuote::getOrderBook);
    }

    /** Every market currently quoted. */
    Collection<MarketQuote> quotes();
}
