package com.crossvenue.arb.infra;

import com.crossvenue.arb.config.ArbitrageProperties;
import com.crossvenue.arb.cost.NativeTokenPriceOracle;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Native-token USD price from a JSON endpoint. The first numeric {@code usd} field in the response
 * is used, which matches the common {@code {"matic-network":{"usd":0.71}}} shape.
 */
@Slf4j
@Component
public class HttpNativeTokenPriceOracle implements NativeTokenPriceOracle {

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String priceUrl;
    private final Duration cacheTtl;
    private final Clock clock;

    private volatile BigDecimal cachedUsd;
    private volatile Instant cachedAt;

    public HttpNativeTokenPriceOracle(ArbitrageProperties properties, OkHttpClient httpClient,
            ObjectMapper objectMapper, Clock clock) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.priceUrl = properties.getInfra().getNativeTokenPriceUrl();
        this.cacheTtl = properties.getInfra().getPriceCacheTtl();
        this.clock = clock;
        if (priceUrl == null || priceUrl.isBlank()) {
            log.warn("No native token price URL configured. Gas costs use the default token price.");
        }
    }

    @Override
    public Optional<BigDecimal> nativeTokenPriceUsd() {
        if (priceUrl == null || priceUrl.isBlank()) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        if (cachedUsd != null && cachedAt.plus(cacheTtl).isAfter(now)) {
            return Optional.of(cachedUsd);
        }

        Request request = new Request.Builder()
                .url(priceUrl)
                .header("Accept", "application/json")
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful() || response.body() == null) {
                log.warn("Native token price request failed: {} {}", response.code(), response.message());
                return Optional.empty();
            }
            Optional<BigDecimal> price = parse(objectMapper.readTree(response.body().string()));
            price.ifPresent(p -> {
                cachedUsd = p;
                cachedAt = now;
            });
            return price;
        } catch (IOException e) {
            log.warn("Native token price request failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    static Optional<BigDecimal> parse(JsonNode root) {
        if (root == null) {
            return Optional.empty();
        }
        JsonNode usd = root.isNumber() ? root : root.findValue("usd");
        if (usd == null || !usd.isNumber()) {
            return Optional.empty();
        }
        BigDecimal price = usd.decimalValue();
        return price.signum() > 0 ? Optional.of(price) : Optional.empty();
    }
}
