package com.crossvenue.arb.domain;

import java.time.Instant;
import java.util.List;

/**
 * A detected price discrepancy, either within one market or across a logically linked pair.
 * Consumers handle both variants through {@link Visitor}, so adding a variant breaks compilation
 * wherever it is not handled.
 */
public sealed interface Opportunity permits RebalancingOpportunity, CombinatorialOpportunity {

    String getId();

    StrategyKind getStrategyKind();

    Instant getDetectedAt();

    List<String> marketIds();

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitRebalancing(RebalancingOpportunity opportunity);

        R visitCombinatorial(CombinatorialOpportunity opportunity);
    }
}
