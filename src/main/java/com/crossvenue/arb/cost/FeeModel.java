package com.crossvenue.arb.cost;

public enum FeeModel {
    /** Percentage of the position, charged only when the position is assumed to win. */
    WINNER_FLAT,
    /** Higher percentage near the 50-cent midpoint, lower at the extremes. */
    PRICE_BRACKETED,
    /** Percentage of the position regardless of outcome. */
    FLAT
}
