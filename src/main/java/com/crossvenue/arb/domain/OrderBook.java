package com.crossvenue.arb.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Value
@Builder
public class OrderBook {
    String marketId;

    @Singular
    List<PriceLevel> bids;
    @Singular
    List<PriceLevel> asks;

    /**
     * Levels a taker on the given side consumes, best price first: asks ascending for a BUY,
     * bids descending for a SELL.
     */
    public List<PriceLevel> levelsFor(Side side) {
        List<PriceLevel> sorted = new ArrayList<>(side == Side.BUY ? asks : bids);
        if (side == Side.BUY) {
            sorted.sort(Comparator.comparing(PriceLevel::getPrice));
        } else {
            sorted.sort(Comparator.comparing(PriceLevel::getPrice).reversed());
        }
        return sorted;
    }

    public BigDecimal bestAsk() {
        return asks.stream().map(PriceLevel::getPrice).min(Comparator.naturalOrder()).orElse(null);
    }

    public BigDecimal bestBid() {
        return bids.stream().map(PriceLevel::getPrice).max(Comparator.naturalOrder()).orElse(null);
    }

    /** Visible notional (price x size) on the side a taker would consume. */
    public BigDecimal depthUsd(Side side) {
        return (side == Side.BUY ? asks : bids).stream()
                .map(PriceLevel::notional)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public boolean isEmpty(Side side) {
        return (side == Side.BUY ? asks : bids).isEmpty();
    }
}
