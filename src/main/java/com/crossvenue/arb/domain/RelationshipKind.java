package com.crossvenue.arb.domain;

public enum RelationshipKind {
    MUTUALLY_EXCLUSIVE,
    COMPLEMENTARY,
    ENTAILMENT,
    INDEPENDENT,
    CONTRADICTION;

    /** Kinds that imply a price constraint between the two markets. */
    public boolean isArbitrageable() {
        return this == MUTUALLY_EXCLUSIVE || this == COMPLEMENTARY || this == ENTAILMENT;
    }
}
