package com.crossvenue.arb.domain;

public enum StrategyKind {
    REBALANCING,
    COMBINATORIAL
}
