package com.crossvenue.arb.core;

import com.crossvenue.arb.config.ArbitrageProperties;
import com.crossvenue.arb.domain.CombinatorialOpportunity;
import com.crossvenue.arb.domain.MarketQuote;
import com.crossvenue.arb.domain.Opportunity;
import com.crossvenue.arb.domain.RebalancingOpportunity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Scan loop: detect on the watched markets, rank, and hand every profitable candidate to
 * {@link ArbitrageEngine#authorizeAndExecute} on the execution pool. A market already involved in
 * an in-flight execution is skipped until that execution finishes.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "arb.scan", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ArbitrageOrchestrator {

    private final ArbitrageEngine engine;
    private final MarketDataSource marketData;
    private final RelationshipClassifier classifier;
    private final RebalancingDetector rebalancingDetector;
    private final CombinatorialDetector combinatorialDetector;
    private final OpportunityPrioritizer prioritizer;
    private final Executor executionExecutor;
    private final List<String> watchedMarketIds;

    private final Set<String> marketsInFlight = new HashSet<>();

    public ArbitrageOrchestrator(ArbitrageEngine engine, MarketDataSource marketData,
            RelationshipClassifier classifier, RebalancingDetector rebalancingDetector,
            CombinatorialDetector combinatorialDetector, OpportunityPrioritizer prioritizer,
            @Qualifier("executionExecutor") Executor executionExecutor, ArbitrageProperties properties) {
        this.engine = engine;
        this.marketData = marketData;
        this.classifier = classifier;
        this.rebalancingDetector = rebalancingDetector;
        this.combinatorialDetector = combinatorialDetector;
        this.prioritizer = prioritizer;
        this.executionExecutor = executionExecutor;
        this.watchedMarketIds = List.copyOf(properties.getScan().getMarketIds());
    }

    @Scheduled(fixedDelayString = "${arb.scan.interval:PT5S}")
    public void runLoop() {
        List<MarketQuote> quotes = watchedQuotes();
        log.info("Arb scan heartbeat: {} markets, {} in flight", quotes.size(), inFlightCount());
        if (quotes.isEmpty()) {
            return;
        }

        List<RankedOpportunity> ranked;
        try {
            List<RebalancingOpportunity> rebalancing = rebalancingDetector.detectAll(quotes);
            List<CombinatorialOpportunity> combinatorial = combinatorialDetector.detectAll(quotes, classifier);
            ranked = prioritizer.prioritize(rebalancing, combinatorial, engine::evaluate);
        } catch (RuntimeException e) {
            log.error("Error during opportunity scan", e);
            return;
        }

        for (RankedOpportunity candidate : ranked) {
            if (!candidate.getAnalysis().isProfitable()) {
                log.debug("Skipping {}: {}", candidate.getOpportunity().getId(),
                        candidate.getAnalysis().getRecommendation());
                continue;
            }
            dispatch(candidate.getOpportunity());
        }
    }

    int inFlightCount() {
        synchronized (marketsInFlight) {
            return marketsInFlight.size();
        }
    }

    private void dispatch(Opportunity opportunity) {
        List<String> markets = opportunity.marketIds();
        if (!claim(markets)) {
            log.debug("Skipping {}: a market is already in flight", opportunity.getId());
            return;
        }
        try {
            executionExecutor.execute(() -> {
                try {
                    ExecutionResult result = engine.authorizeAndExecute(opportunity);
                    log.info("Opportunity {} finished: {}{}", opportunity.getId(), result.getStatus(),
                            result.getRejectionReason() != null ? " (" + result.getRejectionReason() + ")" : "");
                } catch (RuntimeException e) {
                    log.error("Failed to execute opportunity {}", opportunity.getId(), e);
                } finally {
                    release(markets);
                }
            });
        } catch (RejectedExecutionException e) {
            release(markets);
            log.warn("Execution pool full, dropping {} until the next scan", opportunity.getId());
        }
    }

    private List<MarketQuote> watchedQuotes() {
        if (watchedMarketIds.isEmpty()) {
            return new ArrayList<>(marketData.quotes());
        }
        List<MarketQuote> quotes = new ArrayList<>();
        for (String marketId : watchedMarketIds) {
            marketData.quote(marketId).ifPresent(quotes::add);
        }
        return quotes;
    }

    private boolean claim(List<String> markets) {
        synchronized (marketsInFlight) {
            for (String market : markets) {
                if (marketsInFlight.contains(market)) {
                    return false;
                }
            }
            marketsInFlight.addAll(markets);
            return true;
        }
    }

    private void release(List<String> markets) {
        synchronized (marketsInFlight) {
            markets.forEach(marketsInFlight::remove);
        }
    }
}
