package com.crossvenue.arb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Value
@Builder
public class CombinatorialOpportunity implements Opportunity {
    String id;
    MarketQuote quoteA;
    MarketQuote quoteB;
    BigDecimal priceA;
    BigDecimal priceB;
    RelationshipSignal signal;
    Side sideA;
    Side sideB;
    Instant detectedAt;

    public BigDecimal spread() {
        return priceA.subtract(priceB).abs();
    }

    @Override
    public StrategyKind getStrategyKind() {
        return StrategyKind.COMBINATORIAL;
    }

    @Override
    public List<String> marketIds() {
        return List.of(quoteA.getMarketId(), quoteB.getMarketId());
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitCombinatorial(this);
    }
}
