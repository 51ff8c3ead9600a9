package com.crossvenue.arb.cost;

import com.crossvenue.arb.TestFixtures;
import com.crossvenue.arb.config.ArbitrageProperties;
import com.crossvenue.arb.domain.PriceLevel;
import com.crossvenue.arb.domain.Side;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import static com.crossvenue.arb.TestFixtures.usd;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class CostModelTest {

    private ArbitrageProperties properties;
    private CostModel costModel;

    @BeforeEach
    void setUp() {
        properties = TestFixtures.properties();
        costModel = TestFixtures.costModel(properties);
    }

    @Test
    void platformFeeFollowsVenueSchedules() {
        assertEquals(0, costModel.platformFee("polymarket", usd("100"), usd("0.65"), true).compareTo(usd("2.00")));
        assertEquals(0, costModel.platformFee("polymarket", usd("100"), usd("0.65"), false).signum());

        assertEquals(0, costModel.platformFee("kalshi", usd("100"), usd("0.50"), true).compareTo(usd("1.50")));
        assertEquals(0, costModel.platformFee("kalshi", usd("100"), usd("0.10"), true).compareTo(usd("0.50")));
        assertEquals(0, costModel.platformFee("kalshi", usd("100"), usd("0.90"), true).compareTo(usd("0.50")));
        // unknown price is charged the midpoint bracket
        assertEquals(0, costModel.platformFee("kalshi", usd("100"), null, true).compareTo(usd("1.50")));

        assertEquals(0, costModel.platformFee("PNP", usd("100"), usd("0.30"), true).compareTo(usd("1.00")));
    }

    @Test
    void unknownVenueFallsBackToConservativeFlatFee() {
        BigDecimal fee = costModel.platformFee("some-new-exchange", usd("250"), usd("0.40"), true);
        assertEquals(0, fee.compareTo(usd("2.50")));
    }

    @Test
    void platformFeeNeverDecreasesWithPositionSize() {
        for (String venue : List.of("polymarket", "kalshi", "pnp", "unknown-venue")) {
            for (String price : List.of("0.05", "0.20", "0.50", "0.80", "0.95")) {
                BigDecimal previous = BigDecimal.ZERO;
                for (int size = 0; size <= 5000; size += 50) {
                    BigDecimal fee = costModel.platformFee(venue, BigDecimal.valueOf(size), usd(price), true);
                    assertTrue(fee.compareTo(previous) >= 0, venue + " fee decreased at size " + size);
                    previous = fee;
                }
            }
        }
    }

    @Test
    void gasCostConvertsUnitsToUsd() {
        GasEstimate gas = costModel.gasCost(150_000, usd("30"), usd("1"));
        assertEquals(0, gas.getCostNative().compareTo(usd("0.0045")));
        assertEquals(0, gas.getCostUsd().compareTo(usd("0.0045")));

        GasEstimate pricier = costModel.gasCost(150_000, usd("100"), usd("0.80"));
        assertEquals(0, pricier.getCostUsd().compareTo(usd("0.012")));
    }

    @Test
    void gasCostUsesDefaultsWhenLookupsFail() {
        GasPriceSource gasSource = mock(GasPriceSource.class);
        NativeTokenPriceOracle oracle = mock(NativeTokenPriceOracle.class);
        when(gasSource.currentGasPriceGwei()).thenThrow(new IllegalStateException("rpc down"));
        when(oracle.nativeTokenPriceUsd()).thenThrow(new IllegalStateException("oracle down"));
        CostModel model = new CostModel(new VenueRegistry(properties), gasSource, oracle, properties);

        GasEstimate gas = model.gasCost(150_000, null);

        assertEquals(0, gas.getGasPriceGwei().compareTo(usd("30")));
        assertEquals(0, gas.getNativeTokenUsd().compareTo(BigDecimal.ONE));
        assertEquals(0, gas.getCostUsd().compareTo(usd("0.0045")));
        verify(gasSource).currentGasPriceGwei();
        verify(oracle).nativeTokenPriceUsd();
    }

    @Test
    void gasCostUsesLivePricesWhenAvailable() {
        CostModel model = new CostModel(new VenueRegistry(properties), () -> Optional.of(usd("60")),
                () -> Optional.of(usd("0.50")), properties);

        GasEstimate gas = model.gasCost(100_000, null);

        assertEquals(0, gas.getCostUsd().compareTo(usd("0.003")));
    }

    @Test
    void slippageWalksTheBookFromBestPrice() {
        List<PriceLevel> asks = List.of(
                PriceLevel.of("0.52", "100"),
                PriceLevel.of("0.50", "100"),
                PriceLevel.of("0.55", "200"));

        SlippageEstimate estimate = costModel.slippage(asks, usd("80"), Side.BUY);

        assertFalse(estimate.isEstimated());
        assertFalse(estimate.isDepthExhausted());
        assertEquals(0, estimate.getBestPrice().compareTo(usd("0.50")));
        assertThat(estimate.getExecutionPrice()).isBetween(usd("0.50"), usd("0.52"));
        assertThat(estimate.getSlippageUsd()).isPositive();
        assertEquals(0, estimate.getAvailableLiquidityUsd().compareTo(usd("212")));
    }

    @Test
    void orderInsideBestLevelHasNoSlippage() {
        SlippageEstimate estimate = costModel.slippage(List.of(PriceLevel.of("0.40", "1000")), usd("100"), Side.BUY);

        assertEquals(0, estimate.getExecutionPrice().compareTo(usd("0.40")));
        assertEquals(0, estimate.getSlippageUsd().signum());
    }

    @Test
    void exhaustedBookChargesDefaultRateOnRemainder() {
        List<PriceLevel> bids = List.of(PriceLevel.of("0.60", "100"), PriceLevel.of("0.58", "100"));

        SlippageEstimate estimate = costModel.slippage(bids, usd("500"), Side.SELL);

        assertTrue(estimate.isDepthExhausted());
        // 0.5% of the 382 that found no depth
        assertThat(estimate.getSlippageUsd()).isGreaterThanOrEqualTo(usd("1.91"));
    }

    @Test
    void missingBookIsNeverZeroSlippage() {
        SlippageEstimate none = costModel.slippage(null, usd("100"), Side.BUY);
        SlippageEstimate empty = costModel.slippage(List.of(), usd("100"), Side.SELL, usd("0.70"));

        assertTrue(none.isEstimated());
        assertEquals(0, none.getSlippageUsd().compareTo(usd("0.50")));
        assertEquals(0, empty.getSlippageUsd().compareTo(usd("0.50")));
        assertThat(empty.getExecutionPrice()).isLessThan(usd("0.70"));
    }

    @Test
    void executionPriceStaysInsideBookBounds() {
        Random random = new Random(42);
        for (int i = 0; i < 500; i++) {
            List<PriceLevel> levels = new ArrayList<>();
            int count = 1 + random.nextInt(6);
            for (int l = 0; l < count; l++) {
                levels.add(PriceLevel.builder()
                        .price(BigDecimal.valueOf(1 + random.nextInt(99), 2))
                        .size(BigDecimal.valueOf(1 + random.nextInt(500)))
                        .build());
            }
            Side side = random.nextBoolean() ? Side.BUY : Side.SELL;
            BigDecimal size = BigDecimal.valueOf(1 + random.nextInt(1000));

            SlippageEstimate estimate = costModel.slippage(levels, size, side);

            BigDecimal min = levels.stream().map(PriceLevel::getPrice).min(Comparator.naturalOrder()).orElseThrow();
            BigDecimal max = levels.stream().map(PriceLevel::getPrice).max(Comparator.naturalOrder()).orElseThrow();
            BigDecimal best = side == Side.BUY ? min : max;
            assertEquals(0, estimate.getBestPrice().compareTo(best));
            assertThat(estimate.getExecutionPrice()).isBetween(min, max);
            if (side == Side.BUY) {
                assertThat(estimate.getExecutionPrice()).isGreaterThanOrEqualTo(best);
            } else {
                assertThat(estimate.getExecutionPrice()).isLessThanOrEqualTo(best);
            }
            assertThat(estimate.getSlippageUsd()).isGreaterThanOrEqualTo(BigDecimal.ZERO);
        }
    }
}
