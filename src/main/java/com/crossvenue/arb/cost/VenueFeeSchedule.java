package com.crossvenue.arb.cost;

import java.math.BigDecimal;

/**
 * Fee charged by one venue for a position. Implementations are linear in position size with
 * non-negative rates, so the fee never decreases as the position grows.
 */
public interface VenueFeeSchedule {

    BigDecimal MIDPOINT = new BigDecimal("0.5");

    /**
     * @param positionSizeUsd position size in USD
     * @param contractPrice   contract price in [0, 1], or null when unknown
     * @param winnerAssumed   whether the position is assumed to resolve in the money
     */
    BigDecimal fee(BigDecimal positionSizeUsd, BigDecimal contractPrice, boolean winnerAssumed);

    static VenueFeeSchedule flat(BigDecimal feePct) {
        return (size, price, winner) -> percentOf(size, feePct);
    }

    static VenueFeeSchedule winnerFlat(BigDecimal feePct) {
        return (size, price, winner) -> winner ? percentOf(size, feePct) : BigDecimal.ZERO;
    }

    /**
     * Unknown prices are charged as if at the midpoint, which is the more expensive bracket.
     */
    static VenueFeeSchedule priceBracketed(BigDecimal lowerBound, BigDecimal upperBound,
            BigDecimal midFeePct, BigDecimal extremeFeePct) {
        return (size, price, winner) -> {
            BigDecimal p = price != null ? price : MIDPOINT;
            boolean extreme = p.compareTo(lowerBound) < 0 || p.compareTo(upperBound) > 0;
            return percentOf(size, extreme ? extremeFeePct : midFeePct);
        };
    }

    static BigDecimal percentOf(BigDecimal amount, BigDecimal pct) {
        return amount.multiply(pct).movePointLeft(2);
    }
}
