package com.crossvenue.arb.core;

import com.crossvenue.arb.config.ArbitrageProperties;
import com.crossvenue.arb.domain.MarketQuote;
import com.crossvenue.arb.domain.RebalancingOpportunity;
import com.crossvenue.arb.domain.RebalancingSide;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Flags a market whose YES and NO prices do not add up to 1.00 by at least
 * {@code arb.strategy.min-deviation-pct} percentage points.
 */
@Slf4j
@Service
public class RebalancingDetector {

    private final BigDecimal minDeviationPct;
    private final Clock clock;

    public RebalancingDetector(ArbitrageProperties properties, Clock clock) {
        this.minDeviationPct = properties.getStrategy().getMinDeviationPct();
        this.clock = clock;
    }

    public List<RebalancingOpportunity> detectAll(Collection<MarketQuote> quotes) {
        List<RebalancingOpportunity> opportunities = new ArrayList<>();
        for (MarketQuote quote : quotes) {
            detect(quote).ifPresent(opportunities::add);
        }
        log.debug("Rebalancing scan: {} markets, {} opportunities", quotes.size(), opportunities.size());
        return opportunities;
    }

    public Optional<RebalancingOpportunity> detect(MarketQuote quote) {
        return detect(quote, UUID.randomUUID().toString());
    }

    /** Same as {@link #detect(MarketQuote)} but keeps the given opportunity id. */
    public Optional<RebalancingOpportunity> detect(MarketQuote quote, String opportunityId) {
        if (quote == null || quote.getYesPrice() == null || quote.getNoPrice() == null) {
            return Optional.empty();
        }
        BigDecimal sum = quote.getYesPrice().add(quote.getNoPrice());
        BigDecimal deviation = sum.subtract(BigDecimal.ONE).abs();
        if (deviation.signum() == 0 || deviation.movePointRight(2).compareTo(minDeviationPct) < 0) {
            return Optional.empty();
        }

        RebalancingSide side = sum.compareTo(BigDecimal.ONE) < 0 ? RebalancingSide.BUY_BOTH : RebalancingSide.SELL_BOTH;
        RebalancingOpportunity opportunity = RebalancingOpportunity.builder()
                .id(opportunityId)
                .quote(quote)
                .yesPrice(quote.getYesPrice())
                .noPrice(quote.getNoPrice())
                .deviation(deviation)
                .side(side)
                .detectedAt(clock.instant())
                .build();
        log.info("REBALANCING FOUND: Market [{}] on {} | YES {} + NO {} = {} | {}", quote.getMarketId(),
                quote.getVenueId(), quote.getYesPrice(), quote.getNoPrice(), sum, side);
        return Optional.of(opportunity);
    }
}
