package com.crossvenue.arb.infra;

import com.crossvenue.arb.config.ArbitrageProperties;
import com.crossvenue.arb.cost.GasPriceSource;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;
import org.web3j.utils.Convert;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Network gas price from {@code eth_gasPrice} on the configured Polygon RPC endpoint. Without an
 * endpoint, or when the call fails, no price is reported and the cost model uses its default.
 */
@Slf4j
@Component
public class Web3GasPriceSource implements GasPriceSource {

    private final Web3j web3j;
    private final Duration cacheTtl;
    private final Clock clock;

    private volatile BigDecimal cachedGwei;
    private volatile Instant cachedAt;

    @Autowired
    public Web3GasPriceSource(ArbitrageProperties properties, Clock clock) {
        this(buildClient(properties.getInfra().getPolygonRpcUrl()), properties.getInfra().getPriceCacheTtl(), clock);
    }

    Web3GasPriceSource(Web3j web3j, Duration cacheTtl, Clock clock) {
        this.web3j = web3j;
        this.cacheTtl = cacheTtl;
        this.clock = clock;
        if (web3j == null) {
            log.warn("No Polygon RPC URL configured. Gas costs use the default gas price.");
        }
    }

    @Override
    public Optional<BigDecimal> currentGasPriceGwei() {
        if (web3j == null) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        if (cachedGwei != null && cachedAt.plus(cacheTtl).isAfter(now)) {
            return Optional.of(cachedGwei);
        }
        try {
            BigInteger wei = web3j.ethGasPrice().send().getGasPrice();
            BigDecimal gwei = Convert.fromWei(new BigDecimal(wei), Convert.Unit.GWEI);
            cachedGwei = gwei;
            cachedAt = now;
            log.debug("Polygon gas price: {} gwei", gwei);
            return Optional.of(gwei);
        } catch (IOException e) {
            log.warn("eth_gasPrice failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    @PreDestroy
    public void shutdown() {
        if (web3j != null) {
            web3j.shutdown();
        }
    }

    private static Web3j buildClient(String rpcUrl) {
        if (rpcUrl == null || rpcUrl.isBlank()) {
            return null;
        }
        log.info("Gas price source: {}", rpcUrl);
        return Web3j.build(new HttpService(rpcUrl));
    }
}
