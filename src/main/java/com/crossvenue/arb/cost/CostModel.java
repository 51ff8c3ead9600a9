package com.crossvenue.arb.cost;

import com.crossvenue.arb.config.ArbitrageProperties;
import com.crossvenue.arb.domain.PriceLevel;
import com.crossvenue.arb.domain.Side;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Platform fees, gas and order-book slippage for a position. Holds no mutable state; the only I/O
 * is the optional gas-price and native-token lookups, which never propagate failures.
 */
@Slf4j
@Service
public class CostModel {

    private static final MathContext MC = MathContext.DECIMAL64;
    private static final BigDecimal GWEI_PER_NATIVE = new BigDecimal("1000000000");
    private static final BigDecimal DEFAULT_REFERENCE_PRICE = new BigDecimal("0.5");

    private final VenueRegistry venues;
    private final GasPriceSource gasPriceSource;
    private final NativeTokenPriceOracle priceOracle;
    private final BigDecimal defaultGasPriceGwei;
    private final BigDecimal defaultNativeTokenUsd;
    private final BigDecimal defaultSlippagePct;

    public CostModel(VenueRegistry venues, GasPriceSource gasPriceSource, NativeTokenPriceOracle priceOracle,
            ArbitrageProperties properties) {
        this.venues = venues;
        this.gasPriceSource = gasPriceSource;
        this.priceOracle = priceOracle;
        this.defaultGasPriceGwei = properties.getCost().getDefaultGasPriceGwei();
        this.defaultNativeTokenUsd = properties.getCost().getDefaultNativeTokenUsd();
        this.defaultSlippagePct = properties.getCost().getDefaultSlippagePct();
    }

    public BigDecimal platformFee(String venueId, BigDecimal positionSizeUsd, BigDecimal contractPrice,
            boolean winnerAssumed) {
        VenueProfile profile = venues.lookup(venueId).orElseGet(() -> {
            log.warn("Unknown venue '{}', charging fallback fee schedule", venueId);
            return venues.fallback();
        });
        return profile.getFeeSchedule().fee(positionSizeUsd, contractPrice, winnerAssumed);
    }

    public GasEstimate gasCost(long gasUnits, BigDecimal gasPriceGwei) {
        return gasCost(gasUnits, gasPriceGwei, null);
    }

    /**
     * Gas cost in USD. Missing inputs are looked up, and fall back to the configured defaults when
     * the lookup is unavailable. With both prices supplied the call is pure.
     */
    public GasEstimate gasCost(long gasUnits, BigDecimal gasPriceGwei, BigDecimal nativeTokenUsd) {
        BigDecimal price = gasPriceGwei != null ? gasPriceGwei : currentGasPriceGwei();
        BigDecimal tokenUsd = nativeTokenUsd != null ? nativeTokenUsd : currentNativeTokenUsd();

        BigDecimal costNative = BigDecimal.valueOf(gasUnits).multiply(price).divide(GWEI_PER_NATIVE, MC);
        return GasEstimate.builder()
                .gasUnits(gasUnits)
                .gasPriceGwei(price)
                .costNative(costNative)
                .nativeTokenUsd(tokenUsd)
                .costUsd(costNative.multiply(tokenUsd, MC))
                .build();
    }

    public BigDecimal currentGasPriceGwei() {
        try {
            return gasPriceSource.currentGasPriceGwei()
                    .filter(p -> p.signum() > 0)
                    .orElse(defaultGasPriceGwei);
        } catch (RuntimeException e) {
            log.warn("Gas price lookup failed, using default {} gwei: {}", defaultGasPriceGwei, e.getMessage());
            return defaultGasPriceGwei;
        }
    }

    public BigDecimal currentNativeTokenUsd() {
        try {
            return priceOracle.nativeTokenPriceUsd()
                    .filter(p -> p.signum() > 0)
                    .orElse(defaultNativeTokenUsd);
        } catch (RuntimeException e) {
            log.warn("Native token price oracle unavailable, using default ${}: {}", defaultNativeTokenUsd,
                    e.getMessage());
            return defaultNativeTokenUsd;
        }
    }

    public SlippageEstimate slippage(List<PriceLevel> levels, BigDecimal orderSizeUsd, Side side) {
        return slippage(levels, orderSizeUsd, side, null);
    }

    /**
     * Walks the book from the best price outward until {@code orderSizeUsd} of notional is consumed.
     * The execution price is the contract-weighted average of the consumed levels and slippage is
     * its distance from the best price times the contracts filled. Notional left unfilled when the
     * book runs out is charged the default slippage rate.
     *
     * @param quotedPrice reference price used only when no depth is available
     */
    public SlippageEstimate slippage(List<PriceLevel> levels, BigDecimal orderSizeUsd, Side side,
            BigDecimal quotedPrice) {
        List<PriceLevel> usable = levels == null ? List.of() : levels.stream()
                .filter(l -> l.getPrice() != null && l.getSize() != null)
                .filter(l -> l.getPrice().signum() > 0 && l.getSize().signum() > 0)
                .toList();
        if (usable.isEmpty()) {
            return defaultSlippage(orderSizeUsd, side, quotedPrice);
        }

        List<PriceLevel> sorted = new ArrayList<>(usable);
        Comparator<PriceLevel> byPrice = Comparator.comparing(PriceLevel::getPrice);
        sorted.sort(side == Side.BUY ? byPrice : byPrice.reversed());

        BigDecimal bestPrice = sorted.get(0).getPrice();
        BigDecimal availableLiquidity = sorted.stream().map(PriceLevel::notional).reduce(BigDecimal.ZERO,
                BigDecimal::add);

        BigDecimal remainingUsd = orderSizeUsd;
        BigDecimal filledUsd = BigDecimal.ZERO;
        BigDecimal filledContracts = BigDecimal.ZERO;
        for (PriceLevel level : sorted) {
            if (remainingUsd.signum() <= 0) {
                break;
            }
            BigDecimal takeUsd = remainingUsd.min(level.notional());
            filledContracts = filledContracts.add(takeUsd.divide(level.getPrice(), MC));
            filledUsd = filledUsd.add(takeUsd);
            remainingUsd = remainingUsd.subtract(takeUsd);
        }

        if (filledContracts.signum() == 0) {
            return defaultSlippage(orderSizeUsd, side, bestPrice);
        }

        BigDecimal executionPrice = filledUsd.divide(filledContracts, MC);
        BigDecimal slippageUsd = executionPrice.subtract(bestPrice).abs().multiply(filledContracts, MC);
        boolean depthExhausted = remainingUsd.signum() > 0;
        if (depthExhausted) {
            slippageUsd = slippageUsd.add(VenueFeeSchedule.percentOf(remainingUsd, defaultSlippagePct));
            log.debug("Book exhausted with ${} unfilled, charging default slippage on the remainder", remainingUsd);
        }

        return SlippageEstimate.builder()
                .bestPrice(bestPrice)
                .executionPrice(executionPrice)
                .slippageUsd(slippageUsd)
                .slippagePct(pctOf(slippageUsd, orderSizeUsd))
                .availableLiquidityUsd(availableLiquidity)
                .estimated(false)
                .depthExhausted(depthExhausted)
                .build();
    }

    /**
     * Missing depth is never treated as zero slippage: the configured default rate applies.
     */
    private SlippageEstimate defaultSlippage(BigDecimal orderSizeUsd, Side side, BigDecimal quotedPrice) {
        BigDecimal best = quotedPrice != null ? quotedPrice : DEFAULT_REFERENCE_PRICE;
        BigDecimal move = VenueFeeSchedule.percentOf(best, defaultSlippagePct);
        BigDecimal executionPrice = side == Side.BUY
                ? best.add(move).min(BigDecimal.ONE)
                : best.subtract(move).max(BigDecimal.ZERO);
        return SlippageEstimate.builder()
                .bestPrice(best)
                .executionPrice(executionPrice)
                .slippageUsd(VenueFeeSchedule.percentOf(orderSizeUsd, defaultSlippagePct))
                .slippagePct(defaultSlippagePct)
                .availableLiquidityUsd(BigDecimal.ZERO)
                .estimated(true)
                .depthExhausted(false)
                .build();
    }

    private static BigDecimal pctOf(BigDecimal part, BigDecimal whole) {
        if (whole.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return part.divide(whole, MC).movePointRight(2);
    }
}
