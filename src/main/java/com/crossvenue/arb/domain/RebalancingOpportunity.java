package com.crossvenue.arb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Value
@Builder
public class RebalancingOpportunity implements Opportunity {
    String id;
    MarketQuote quote;
    BigDecimal yesPrice;
    BigDecimal noPrice;
    BigDecimal deviation; // |yes + no - 1|
    RebalancingSide side;
    Instant detectedAt;

    public String getMarketId() {
        return quote.getMarketId();
    }

    public BigDecimal priceSum() {
        return yesPrice.add(noPrice);
    }

    @Override
    public StrategyKind getStrategyKind() {
        return StrategyKind.REBALANCING;
    }

    @Override
    public List<String> marketIds() {
        return List.of(quote.getMarketId());
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitRebalancing(this);
    }
}
