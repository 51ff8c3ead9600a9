package com.crossvenue.arb.infra;

import com.crossvenue.arb.TestFixtures;
import com.crossvenue.arb.TestFixtures.MutableClock;
import com.crossvenue.arb.config.ArbitrageProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.Call;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class HttpNativeTokenPriceOracleTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void parsesNestedUsdField() throws Exception {
        Optional<BigDecimal> price = HttpNativeTokenPriceOracle.parse(
                objectMapper.readTree("{\"matic-network\":{\"usd\":0.71}}"));

        assertEquals(0, price.orElseThrow().compareTo(new BigDecimal("0.71")));
    }

    @Test
    void parsesBareNumber() throws Exception {
        assertEquals(0, HttpNativeTokenPriceOracle.parse(objectMapper.readTree("1.25")).orElseThrow()
                .compareTo(new BigDecimal("1.25")));
    }

    @Test
    void ignoresMissingOrNonPositivePrices() throws Exception {
        assertTrue(HttpNativeTokenPriceOracle.parse(objectMapper.readTree("{\"eur\":0.65}")).isEmpty());
        assertTrue(HttpNativeTokenPriceOracle.parse(objectMapper.readTree("{\"usd\":\"n/a\"}")).isEmpty());
        assertTrue(HttpNativeTokenPriceOracle.parse(objectMapper.readTree("{\"usd\":0}")).isEmpty());
        assertTrue(HttpNativeTokenPriceOracle.parse(null).isEmpty());
    }

    @Test
    void cachesPriceForConfiguredTtl() throws Exception {
        OkHttpClient httpClient = mock(OkHttpClient.class);
        Call call = mock(Call.class);
        when(httpClient.newCall(any())).thenReturn(call);
        when(call.execute()).thenAnswer(inv -> response("{\"matic-network\":{\"usd\":0.71}}"));
        MutableClock clock = new MutableClock(TestFixtures.NOW);
        HttpNativeTokenPriceOracle oracle = new HttpNativeTokenPriceOracle(properties(), httpClient, objectMapper,
                clock);

        assertEquals(0, oracle.nativeTokenPriceUsd().orElseThrow().compareTo(new BigDecimal("0.71")));
        assertEquals(0, oracle.nativeTokenPriceUsd().orElseThrow().compareTo(new BigDecimal("0.71")));
        verify(call, times(1)).execute();

        clock.advance(Duration.ofSeconds(31));
        oracle.nativeTokenPriceUsd();
        verify(call, times(2)).execute();
    }

    @Test
    void networkFailureReportsNoPrice() throws Exception {
        OkHttpClient httpClient = mock(OkHttpClient.class);
        Call call = mock(Call.class);
        when(httpClient.newCall(any())).thenReturn(call);
        when(call.execute()).thenThrow(new IOException("connection reset"));
        HttpNativeTokenPriceOracle oracle = new HttpNativeTokenPriceOracle(properties(), httpClient, objectMapper,
                new MutableClock(TestFixtures.NOW));

        assertTrue(oracle.nativeTokenPriceUsd().isEmpty());
    }

    @Test
    void unconfiguredOracleNeverCallsOut() {
        OkHttpClient httpClient = mock(OkHttpClient.class);
        HttpNativeTokenPriceOracle oracle = new HttpNativeTokenPriceOracle(TestFixtures.properties(), httpClient,
                objectMapper, new MutableClock(TestFixtures.NOW));

        assertTrue(oracle.nativeTokenPriceUsd().isEmpty());
        verifyNoInteractions(httpClient);
    }

    private static ArbitrageProperties properties() {
        ArbitrageProperties properties = TestFixtures.properties();
        properties.getInfra().setNativeTokenPriceUrl("https://prices.example.test/simple/price");
        return properties;
    }

    private static Response response(String json) {
        return new Response.Builder()
                .request(new Request.Builder().url("https://prices.example.test/simple/price").build())
                .protocol(Protocol.HTTP_1_1)
                .code(200)
                .message("OK")
                .body(ResponseBody.create(json, MediaType.parse("application/json")))
                .build();
    }
}
