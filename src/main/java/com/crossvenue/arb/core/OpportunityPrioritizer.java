package com.crossvenue.arb.core;

import com.crossvenue.arb.config.ArbitrageProperties;
import com.crossvenue.arb.domain.Opportunity;
import com.crossvenue.arb.domain.ProfitabilityAnalysis;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

/**
 * Merges rebalancing and combinatorial candidates into one list, best net profit first, capped at
 * {@code arb.strategy.max-opportunities-per-cycle}.
 */
@Slf4j
@Service
public class OpportunityPrioritizer {

    private static final Comparator<RankedOpportunity> BY_NET_PROFIT_DESC = Comparator
            .comparing((RankedOpportunity r) -> r.getAnalysis().getNetProfitPct())
            .reversed()
            .thenComparing(r -> r.getOpportunity().getDetectedAt());

    private final int maxOpportunitiesPerCycle;

    public OpportunityPrioritizer(ArbitrageProperties properties) {
        this.maxOpportunitiesPerCycle = properties.getStrategy().getMaxOpportunitiesPerCycle();
    }

    public List<RankedOpportunity> prioritize(List<? extends Opportunity> rebalancing,
            List<? extends Opportunity> combinatorial, Function<Opportunity, ProfitabilityAnalysis> evaluator) {
        List<RankedOpportunity> ranked = new ArrayList<>(rebalancing.size() + combinatorial.size());
        for (Opportunity opportunity : rebalancing) {
            ranked.add(new RankedOpportunity(opportunity, evaluator.apply(opportunity)));
        }
        for (Opportunity opportunity : combinatorial) {
            ranked.add(new RankedOpportunity(opportunity, evaluator.apply(opportunity)));
        }
        ranked.sort(BY_NET_PROFIT_DESC);
        if (ranked.size() > maxOpportunitiesPerCycle) {
            log.debug("Keeping top {} of {} opportunities", maxOpportunitiesPerCycle, ranked.size());
            return new ArrayList<>(ranked.subList(0, maxOpportunitiesPerCycle));
        }
        return ranked;
    }
}
