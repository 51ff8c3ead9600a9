package com.crossvenue.arb.core;

import com.crossvenue.arb.config.ArbitrageProperties;
import com.crossvenue.arb.domain.CombinatorialOpportunity;
import com.crossvenue.arb.domain.MarketQuote;
import com.crossvenue.arb.domain.RelationshipDirection;
import com.crossvenue.arb.domain.RelationshipKind;
import com.crossvenue.arb.domain.RelationshipSignal;
import com.crossvenue.arb.domain.Side;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Builds a combinatorial candidate for a classified market pair whose prices violate the
 * relationship between them.
 *
 * <p>For a directional entailment (A implies B) the implying market can never be worth more than
 * the implied one, so the candidate sells the implying market and buys the implied one, and only
 * when the implying market is priced higher. For every other arbitrageable relationship the richer
 * market is sold and the cheaper one bought.
 */
@Slf4j
@Service
public class CombinatorialDetector {

    private final double minConfidence;
    private final BigDecimal minSpreadPct;
    private final Clock clock;

    public CombinatorialDetector(ArbitrageProperties properties, Clock clock) {
        this.minConfidence = properties.getStrategy().getMinConfidence();
        this.minSpreadPct = properties.getStrategy().getMinSpreadPct();
        this.clock = clock;
    }

    /** Checks every pair of the given quotes that the classifier knows about. */
    public List<CombinatorialOpportunity> detectAll(List<MarketQuote> quotes, RelationshipClassifier classifier) {
        List<CombinatorialOpportunity> opportunities = new ArrayList<>();
        for (int i = 0; i < quotes.size(); i++) {
            for (int j = i + 1; j < quotes.size(); j++) {
                MarketQuote a = quotes.get(i);
                MarketQuote b = quotes.get(j);
                classifier.classify(a.getMarketId(), b.getMarketId())
                        .flatMap(signal -> detect(a, b, signal))
                        .ifPresent(opportunities::add);
            }
        }
        log.debug("Combinatorial scan: {} markets, {} opportunities", quotes.size(), opportunities.size());
        return opportunities;
    }

    public Optional<CombinatorialOpportunity> detect(MarketQuote quoteA, MarketQuote quoteB, RelationshipSignal signal) {
        return detect(quoteA, quoteB, signal, UUID.randomUUID().toString());
    }

    /**
     * @throws IllegalArgumentException if the signal is about a different pair of markets
     */
    public Optional<CombinatorialOpportunity> detect(MarketQuote quoteA, MarketQuote quoteB, RelationshipSignal signal,
            String opportunityId) {
        if (quoteA == null || quoteB == null || signal == null) {
            return Optional.empty();
        }
        if (signal.getMarketAId().equals(quoteB.getMarketId()) && signal.getMarketBId().equals(quoteA.getMarketId())) {
            MarketQuote swap = quoteA;
            quoteA = quoteB;
            quoteB = swap;
        } else if (!signal.getMarketAId().equals(quoteA.getMarketId())
                || !signal.getMarketBId().equals(quoteB.getMarketId())) {
            throw new IllegalArgumentException("Signal " + signal.getMarketAId() + "/" + signal.getMarketBId()
                    + " does not describe " + quoteA.getMarketId() + "/" + quoteB.getMarketId());
        }

        if (signal.getKind() == null || !signal.getKind().isArbitrageable()) {
            return Optional.empty();
        }
        if (signal.getConfidence() < minConfidence) {
            log.debug("Skipping {}/{}: confidence {} below {}", quoteA.getMarketId(), quoteB.getMarketId(),
                    signal.getConfidence(), minConfidence);
            return Optional.empty();
        }
        BigDecimal priceA = quoteA.getYesPrice();
        BigDecimal priceB = quoteB.getYesPrice();
        if (priceA == null || priceB == null) {
            return Optional.empty();
        }

        Side sideA;
        int cmp = priceA.compareTo(priceB);
        if (signal.getKind() == RelationshipKind.ENTAILMENT
                && signal.getDirection() == RelationshipDirection.A_IMPLIES_B) {
            if (cmp <= 0) {
                return Optional.empty();
            }
            sideA = Side.SELL;
        } else if (signal.getKind() == RelationshipKind.ENTAILMENT
                && signal.getDirection() == RelationshipDirection.B_IMPLIES_A) {
            if (cmp >= 0) {
                return Optional.empty();
            }
            sideA = Side.BUY;
        } else {
            if (cmp == 0) {
                return Optional.empty();
            }
            sideA = cmp > 0 ? Side.SELL : Side.BUY;
        }

        BigDecimal spread = priceA.subtract(priceB).abs();
        if (spread.movePointRight(2).compareTo(minSpreadPct) < 0) {
            return Optional.empty();
        }

        CombinatorialOpportunity opportunity = CombinatorialOpportunity.builder()
                .id(opportunityId)
                .quoteA(quoteA)
                .quoteB(quoteB)
                .priceA(priceA)
                .priceB(priceB)
                .signal(signal)
                .sideA(sideA)
                .sideB(sideA.opposite())
                .detectedAt(clock.instant())
                .build();
        log.info("COMBINATORIAL FOUND: {} [{}] {} @ {} / {} [{}] {} @ {} | {} {} (confidence {})",
                sideA, quoteA.getVenueId(), quoteA.getMarketId(), priceA, sideA.opposite(), quoteB.getVenueId(),
                quoteB.getMarketId(), priceB, signal.getKind(), signal.getDirection(), signal.getConfidence());
        return Optional.of(opportunity);
    }
}
