package com.crossvenue.arb.domain;

public enum RejectionReason {
    INVALID_REQUEST,
    POSITION_SIZE_LIMIT,
    TOTAL_EXPOSURE_LIMIT,
    LIQUIDITY_LIMIT,
    SINGLE_MARKET_EXPOSURE_LIMIT,
    NOT_PROFITABLE,
    OPPORTUNITY_VANISHED,
    NO_CAPACITY,
    ALLOCATION_EXPIRED
}
