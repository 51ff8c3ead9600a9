package com.crossvenue.arb.domain;

public enum RebalancingSide {
    BUY_BOTH, // YES + NO < 1
    SELL_BOTH // YES + NO > 1
}
