package com.crossvenue.arb.core;

import com.crossvenue.arb.domain.MarketQuote;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Latest quote per market id, pushed by market-data ingestion.
 */
@Component
public class MarketSnapshotCache implements MarketDataSource {

    private final ConcurrentHashMap<String, MarketQuote> cache = new ConcurrentHashMap<>();

    public void updateQuote(MarketQuote quote) {
        cache.put(quote.getMarketId(), quote);
    }

    @Override
    public Optional<MarketQuote> quote(String marketId) {
        return Optional.ofNullable(cache.get(marketId));
    }

    @Override
    public Collection<MarketQuote> quotes() {
        return List.copyOf(cache.values());
    }

    public void remove(String marketId) {
        cache.remove(marketId);
    }
}
