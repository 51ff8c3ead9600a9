package com.crossvenue.arb.config;

import com.crossvenue.arb.cost.FeeModel;
import com.crossvenue.arb.execution.UnhedgedExposurePolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Validated
@ConfigurationProperties(prefix = "arb")
public class ArbitrageProperties {

    @Valid
    private Capital capital = new Capital();
    @Valid
    private Profitability profitability = new Profitability();
    @Valid
    private Cost cost = new Cost();
    @Valid
    private Strategy strategy = new Strategy();
    @Valid
    private Execution execution = new Execution();
    @Valid
    private Scan scan = new Scan();
    private Infra infra = new Infra();

    @Data
    public static class Capital {
        @Positive
        private BigDecimal totalCapitalUsd = new BigDecimal("10000");
        @Positive
        @DecimalMax("100")
        private BigDecimal maxPositionSizePct = new BigDecimal("10");
        @Positive
        @DecimalMax("100")
        private BigDecimal maxSingleMarketExposurePct = new BigDecimal("20");
        @Positive
        @DecimalMax("100")
        private BigDecimal maxTotalExposurePct = new BigDecimal("80");
        /** Never commit more than this share of visible order-book depth. */
        @Positive
        @DecimalMax("100")
        private BigDecimal liquidityUsagePct = new BigDecimal("50");
        @NotNull
        private Duration allocationTtl = Duration.ofSeconds(30);
    }

    @Data
    public static class Profitability {
        @DecimalMin("0")
        private BigDecimal minProfitMarginPct = new BigDecimal("2.5");
        @Positive
        private BigDecimal defaultPositionSizeUsd = new BigDecimal("100");
        @Min(0)
        private long gasUnitsPerLeg = 150_000;
        @NotNull
        private Duration maxQuoteAge = Duration.ofSeconds(30);
    }

    @Data
    public static class Cost {
        @Positive
        private BigDecimal defaultGasPriceGwei = new BigDecimal("30");
        @Positive
        private BigDecimal defaultNativeTokenUsd = BigDecimal.ONE;
        @DecimalMin("0")
        private BigDecimal defaultSlippagePct = new BigDecimal("0.5");
        @DecimalMin("0")
        private BigDecimal unknownVenueFeePct = BigDecimal.ONE;
        private Map<String, Venue> venues = defaultVenues();
    }

    @Data
    public static class Venue {
        private FeeModel feeModel = FeeModel.FLAT;
        /** Flat or winner fee, in percent. */
        private BigDecimal feePct = BigDecimal.ONE;
        /** PRICE_BRACKETED: fee inside [lowerBound, upperBound]. */
        private BigDecimal midFeePct = new BigDecimal("1.5");
        /** PRICE_BRACKETED: fee outside the bracket. */
        private BigDecimal extremeFeePct = new BigDecimal("0.5");
        private BigDecimal lowerBound = new BigDecimal("0.20");
        private BigDecimal upperBound = new BigDecimal("0.80");
        /** Higher rank = more likely to fail to fill; such legs are submitted first. */
        private int fillRiskRank = 0;
    }

    @Data
    public static class Strategy {
        @DecimalMin("0")
        private BigDecimal minDeviationPct = new BigDecimal("0.5");
        @DecimalMin("0")
        @DecimalMax("1")
        private double minConfidence = 0.85;
        @DecimalMin("0")
        private BigDecimal minSpreadPct = BigDecimal.ONE;
        @Min(1)
        private int maxOpportunitiesPerCycle = 10;
    }

    @Data
    public static class Execution {
        @NotNull
        private Duration legFillTimeout = Duration.ofSeconds(5);
        /** Deliberately without a default: operators must choose how unhedged legs are handled. */
        @NotNull
        private UnhedgedExposurePolicy unhedgedPolicy;
    }

    @Data
    public static class Scan {
        private boolean enabled = true;
        @NotNull
        private Duration interval = Duration.ofSeconds(5);
        private List<String> marketIds = new ArrayList<>();
        @Min(1)
        private int executionThreads = 4;
    }

    @Data
    public static class Infra {
        private String polygonRpcUrl;
        private String nativeTokenPriceUrl;
        private String telegramApiUrl = "https://api.telegram.org";
        private String telegramBotToken;
        private String telegramChatId;
        private String ledgerStateFile;
        /** How long a fetched gas or native-token price is reused. */
        private Duration priceCacheTtl = Duration.ofSeconds(30);
        private Duration paperFillLatency = Duration.ofMillis(100);
    }

    private static Map<String, Venue> defaultVenues() {
        Map<String, Venue> venues = new LinkedHashMap<>();

        Venue polymarket = new Venue();
        polymarket.setFeeModel(FeeModel.WINNER_FLAT);
        polymarket.setFeePct(new BigDecimal("2.0"));
        venues.put("polymarket", polymarket);

        Venue kalshi = new Venue();
        kalshi.setFeeModel(FeeModel.PRICE_BRACKETED);
        kalshi.setFillRiskRank(2);
        venues.put("kalshi", kalshi);

        Venue pnp = new Venue();
        pnp.setFeeModel(FeeModel.FLAT);
        pnp.setFeePct(BigDecimal.ONE);
        pnp.setFillRiskRank(1);
        venues.put("pnp", pnp);
        return venues;
    }
}
