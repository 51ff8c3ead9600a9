package com.crossvenue.arb.core;

import com.crossvenue.arb.cost.VenueRegistry;
import com.crossvenue.arb.domain.CombinatorialOpportunity;
import com.crossvenue.arb.domain.MarketQuote;
import com.crossvenue.arb.domain.Opportunity;
import com.crossvenue.arb.domain.Outcome;
import com.crossvenue.arb.domain.RebalancingOpportunity;
import com.crossvenue.arb.domain.RebalancingSide;
import com.crossvenue.arb.domain.Side;

import java.math.BigDecimal;
import java.util.List;

/**
 * Expands an opportunity into its two legs, in opportunity order (YES before NO, A before B).
 */
public final class LegPlanner implements Opportunity.Visitor<List<LegPlan>> {

    private static final LegPlanner INSTANCE = new LegPlanner();

    private LegPlanner() {
    }

    public static List<LegPlan> legsOf(Opportunity opportunity) {
        return opportunity.accept(INSTANCE);
    }

    /**
     * Orders two legs for submission, the one more likely to fail to fill first: a leg without
     * visible depth, then the leg with less visible depth, then the venue with the higher fill-risk
     * rank. Ties keep opportunity order.
     */
    public static List<LegPlan> riskiestFirst(List<LegPlan> legs, VenueRegistry venues) {
        LegPlan a = legs.get(0);
        LegPlan b = legs.get(1);
        return isRiskier(b, a, venues) ? List.of(b, a) : List.of(a, b);
    }

    /** Visible depth on the side the leg consumes, or null when unknown. */
    public static BigDecimal visibleDepthUsd(LegPlan leg) {
        return leg.hasDepth() ? leg.getOrderBook().depthUsd(leg.getSide()) : null;
    }

    /** Smallest visible depth across the legs, or null if any leg's depth is unknown. */
    public static BigDecimal availableLiquidityUsd(List<LegPlan> legs) {
        BigDecimal min = null;
        for (LegPlan leg : legs) {
            BigDecimal depth = visibleDepthUsd(leg);
            if (depth == null) {
                return null;
            }
            min = min == null ? depth : min.min(depth);
        }
        return min;
    }

    private static boolean isRiskier(LegPlan x, LegPlan y, VenueRegistry venues) {
        BigDecimal depthX = visibleDepthUsd(x);
        BigDecimal depthY = visibleDepthUsd(y);
        if (depthX == null || depthY == null) {
            if (depthX == null && depthY != null) {
                return true;
            }
            if (depthX != null) {
                return false;
            }
        } else if (depthX.compareTo(depthY) != 0) {
            return depthX.compareTo(depthY) < 0;
        }
        return venues.resolve(x.getVenueId()).getFillRiskRank() > venues.resolve(y.getVenueId()).getFillRiskRank();
    }

    @Override
    public List<LegPlan> visitRebalancing(RebalancingOpportunity opportunity) {
        MarketQuote quote = opportunity.getQuote();
        Side side = opportunity.getSide() == RebalancingSide.BUY_BOTH ? Side.BUY : Side.SELL;
        LegPlan yes = LegPlan.builder()
                .marketId(quote.getMarketId())
                .venueId(quote.getVenueId())
                .outcome(Outcome.YES)
                .side(side)
                .price(opportunity.getYesPrice())
                .orderBook(quote.getOrderBook())
                .quotedAt(quote.getTimestamp())
                .build();
        LegPlan no = LegPlan.builder()
                .marketId(quote.getMarketId())
                .venueId(quote.getVenueId())
                .outcome(Outcome.NO)
                .side(side)
                .price(opportunity.getNoPrice())
                .orderBook(quote.getNoOrderBook())
                .quotedAt(quote.getTimestamp())
                .build();
        return List.of(yes, no);
    }

    @Override
    public List<LegPlan> visitCombinatorial(CombinatorialOpportunity opportunity) {
        return List.of(
                leg(opportunity.getQuoteA(), opportunity.getSideA(), opportunity.getPriceA()),
                leg(opportunity.getQuoteB(), opportunity.getSideB(), opportunity.getPriceB()));
    }

    private static LegPlan leg(MarketQuote quote, Side side, BigDecimal price) {
        return LegPlan.builder()
                .marketId(quote.getMarketId())
                .venueId(quote.getVenueId())
                .outcome(Outcome.YES)
                .side(side)
                .price(price)
                .orderBook(quote.getOrderBook())
                .quotedAt(quote.getTimestamp())
                .build();
    }
}
