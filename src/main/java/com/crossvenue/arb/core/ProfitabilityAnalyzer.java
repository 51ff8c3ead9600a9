package com.crossvenue.arb.core;

import com.crossvenue.arb.config.ArbitrageProperties;
import com.crossvenue.arb.cost.CostModel;
import com.crossvenue.arb.cost.GasEstimate;
import com.crossvenue.arb.cost.SlippageEstimate;
import com.crossvenue.arb.domain.CombinatorialOpportunity;
import com.crossvenue.arb.domain.Opportunity;
import com.crossvenue.arb.domain.ProfitabilityAnalysis;
import com.crossvenue.arb.domain.RebalancingOpportunity;
import com.crossvenue.arb.domain.TransactionCosts;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns an opportunity plus resolved cost inputs into a net-profit verdict. The same inputs always
 * produce the same analysis; the only timestamp used is {@link CostInputs#getAsOf()}.
 */
@Slf4j
@Service
public class ProfitabilityAnalyzer {

    private static final MathContext MC = MathContext.DECIMAL64;
    private static final BigDecimal SLIPPAGE_RISK_SHARE = new BigDecimal("0.30");
    private static final BigDecimal GAS_RISK_SHARE = new BigDecimal("0.20");

    private final CostModel costModel;
    private final BigDecimal minProfitMarginPct;

    public ProfitabilityAnalyzer(CostModel costModel, ArbitrageProperties properties) {
        this.costModel = costModel;
        this.minProfitMarginPct = properties.getProfitability().getMinProfitMarginPct();
    }

    public ProfitabilityAnalysis analyze(Opportunity opportunity, CostInputs inputs) {
        BigDecimal size = inputs.getPositionSizeUsd();
        BigDecimal grossSpreadPerUnit = opportunity.accept(GrossSpread.INSTANCE);
        BigDecimal grossSpreadUsd = grossSpreadPerUnit.multiply(size);
        BigDecimal grossSpreadPct = grossSpreadPerUnit.movePointRight(2);

        List<String> riskFactors = new ArrayList<>();
        BigDecimal platformFees = BigDecimal.ZERO;
        BigDecimal gasCosts = BigDecimal.ZERO;
        BigDecimal slippageCosts = BigDecimal.ZERO;
        boolean missingDepth = false;
        boolean staleQuote = false;

        for (LegPlan leg : LegPlanner.legsOf(opportunity)) {
            platformFees = platformFees.add(costModel.platformFee(leg.getVenueId(), size, leg.getPrice(), true));

            GasEstimate gas = costModel.gasCost(inputs.getGasUnitsPerLeg(), inputs.getGasPriceGwei(),
                    inputs.getNativeTokenUsd());
            gasCosts = gasCosts.add(gas.getCostUsd());

            boolean stale = leg.getQuotedAt() == null
                    || leg.getQuotedAt().plus(inputs.getMaxQuoteAge()).isBefore(inputs.getAsOf());
            staleQuote |= stale;
            // a stale book says nothing about current depth
            SlippageEstimate slippage = costModel.slippage(
                    stale || !leg.hasDepth() ? null : leg.getOrderBook().levelsFor(leg.getSide()),
                    size, leg.getSide(), leg.getPrice());
            missingDepth |= slippage.isEstimated();
            if (slippage.isDepthExhausted()) {
                riskFactors.add("Insufficient depth on " + leg.getMarketId() + " " + leg.getOutcome()
                        + " - remainder charged default slippage");
            }
            slippageCosts = slippageCosts.add(slippage.getSlippageUsd());
        }

        BigDecimal totalCosts = platformFees.add(gasCosts).add(slippageCosts);
        BigDecimal totalCostsPct = pctOf(totalCosts, size);
        TransactionCosts costs = TransactionCosts.builder()
                .platformFeesUsd(platformFees)
                .gasCostsUsd(gasCosts)
                .slippageCostsUsd(slippageCosts)
                .totalCostsUsd(totalCosts)
                .totalCostsPct(totalCostsPct)
                .build();

        BigDecimal netProfitUsd = grossSpreadUsd.subtract(totalCosts);
        BigDecimal netProfitPct = pctOf(netProfitUsd, size);
        BigDecimal breakEvenPct = totalCostsPct;
        BigDecimal minRequiredPct = breakEvenPct.add(minProfitMarginPct);
        boolean profitable = netProfitPct.compareTo(minProfitMarginPct) >= 0;

        if (missingDepth) {
            riskFactors.add("Missing order book data - using conservative slippage estimate");
        }
        if (staleQuote) {
            riskFactors.add("Stale quote (older than " + inputs.getMaxQuoteAge() + ")");
        }
        if (slippageCosts.compareTo(grossSpreadUsd.multiply(SLIPPAGE_RISK_SHARE)) > 0) {
            riskFactors.add("High slippage risk (>30% of gross spread)");
        }
        if (gasCosts.compareTo(grossSpreadUsd.multiply(GAS_RISK_SHARE)) > 0) {
            riskFactors.add("High gas costs (>20% of gross spread)");
        }
        if (grossSpreadPct.compareTo(minRequiredPct) < 0) {
            riskFactors.add("Spread (" + fmt(grossSpreadPct) + "%) below minimum required (" + fmt(minRequiredPct)
                    + "%)");
        }

        ProfitabilityAnalysis analysis = ProfitabilityAnalysis.builder()
                .opportunityId(opportunity.getId())
                .positionSizeUsd(size)
                .grossSpreadUsd(grossSpreadUsd)
                .grossSpreadPct(grossSpreadPct)
                .transactionCosts(costs)
                .netProfitUsd(netProfitUsd)
                .netProfitPct(netProfitPct)
                .profitable(profitable)
                .breakEvenSpreadPct(breakEvenPct)
                .minRequiredSpreadPct(minRequiredPct)
                .recommendation(recommend(profitable, grossSpreadPct, breakEvenPct, netProfitPct, minRequiredPct))
                .riskFactors(riskFactors)
                .evaluatedAt(inputs.getAsOf())
                .build();

        log.debug("Analyzed {} | Gross: ${} | Costs: ${} | Net: {}% | Profitable: {}",
                opportunity.getId(), fmt(grossSpreadUsd), fmt(totalCosts), fmt(netProfitPct), profitable);
        return analysis;
    }

    private static String recommend(boolean profitable, BigDecimal grossPct, BigDecimal breakEvenPct,
            BigDecimal netPct, BigDecimal minRequiredPct) {
        if (profitable) {
            return "PROFITABLE - execute (net " + fmt(netPct) + "%)";
        }
        if (grossPct.compareTo(breakEvenPct) >= 0) {
            return "BREAK-EVEN - wait for the spread to widen (net " + fmt(netPct) + "%)";
        }
        return "NOT PROFITABLE - skip (net " + fmt(netPct) + "%, need " + fmt(minRequiredPct) + "%)";
    }

    private static BigDecimal pctOf(BigDecimal part, BigDecimal whole) {
        if (whole.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return part.divide(whole, MC).movePointRight(2);
    }

    private static String fmt(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    /** Raw spread per unit of position, before costs. */
    private enum GrossSpread implements Opportunity.Visitor<BigDecimal> {
        INSTANCE;

        @Override
        public BigDecimal visitRebalancing(RebalancingOpportunity opportunity) {
            return opportunity.priceSum().subtract(BigDecimal.ONE).abs();
        }

        @Override
        public BigDecimal visitCombinatorial(CombinatorialOpportunity opportunity) {
            return opportunity.spread();
        }
    }
}
