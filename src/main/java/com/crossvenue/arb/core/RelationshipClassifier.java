package com.crossvenue.arb.core;

import com.crossvenue.arb.domain.RelationshipSignal;

import java.util.Optional;

public interface RelationshipClassifier {

    /**
     * @return the relationship between the two markets, oriented so that {@code marketAId} is the
     *         first argument; empty if the pair has not been classified
     */
    Optional<RelationshipSignal> classify(String marketAId, String marketBId);
}
