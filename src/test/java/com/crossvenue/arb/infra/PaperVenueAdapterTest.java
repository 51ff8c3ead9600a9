package com.crossvenue.arb.infra;

import com.crossvenue.arb.TestFixtures;
import com.crossvenue.arb.config.ArbitrageProperties;
import com.crossvenue.arb.domain.Outcome;
import com.crossvenue.arb.domain.Side;
import com.crossvenue.arb.execution.FillReport;
import com.crossvenue.arb.execution.FillStatus;
import com.crossvenue.arb.execution.OrderRequest;
import com.crossvenue.arb.execution.VenueException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class PaperVenueAdapterTest {

    @Test
    void fillsAtLimitPriceAfterLatency() throws Exception {
        PaperVenueAdapter venue = venue(Duration.ofMillis(10));
        String orderId = venue.submit(order("0.42", "100"));

        FillReport report = venue.awaitFill(orderId, Duration.ofSeconds(2)).get(5, TimeUnit.SECONDS);

        assertTrue(orderId.startsWith("paper-"));
        assertEquals(FillStatus.FILLED, report.getStatus());
        assertEquals(orderId, report.getExternalOrderId());
        assertEquals(0, report.getFillPrice().compareTo(new BigDecimal("0.42")));
        assertFalse(venue.cancel(orderId));
        assertEquals(0, venue.restingOrderCount());
    }

    @Test
    void reportsTimeoutWhenLatencyExceedsWait() throws Exception {
        PaperVenueAdapter venue = venue(Duration.ofSeconds(2));
        String orderId = venue.submit(order("0.42", "100"));

        FillReport report = venue.awaitFill(orderId, Duration.ofMillis(50)).get(5, TimeUnit.SECONDS);

        assertEquals(FillStatus.TIMED_OUT, report.getStatus());
    }

    @Test
    void cancelledOrderNeverFills() throws Exception {
        PaperVenueAdapter venue = venue(Duration.ofMillis(200));
        String orderId = venue.submit(order("0.42", "100"));
        CompletableFuture<FillReport> fill = venue.awaitFill(orderId, Duration.ofSeconds(2));

        assertTrue(venue.cancel(orderId));
        assertEquals(0, venue.restingOrderCount());
        assertEquals(FillStatus.CANCELLED, fill.get(5, TimeUnit.SECONDS).getStatus());
        assertFalse(venue.cancel(orderId));
    }

    @Test
    void timedOutOrderIsForgottenOnceCancelled() throws Exception {
        PaperVenueAdapter venue = venue(Duration.ofSeconds(2));
        String first = venue.submit(order("0.42", "100"));
        venue.submit(order("0.58", "100"));
        assertEquals(2, venue.restingOrderCount());

        assertEquals(FillStatus.TIMED_OUT, venue.awaitFill(first, Duration.ofMillis(50))
                .get(5, TimeUnit.SECONDS).getStatus());
        assertTrue(venue.cancel(first));

        assertEquals(1, venue.restingOrderCount());
    }

    @Test
    void rejectsInvalidOrders() {
        PaperVenueAdapter venue = venue(Duration.ofMillis(10));

        assertThrows(VenueException.class, () -> venue.submit(order("1.20", "100")));
        assertThrows(VenueException.class, () -> venue.submit(order("0", "100")));
        assertThrows(VenueException.class, () -> venue.submit(order("0.50", "-1")));
    }

    @Test
    void unknownOrderFailsTheWait() {
        PaperVenueAdapter venue = venue(Duration.ofMillis(10));

        CompletableFuture<FillReport> fill = venue.awaitFill("paper-missing", Duration.ofMillis(100));

        ExecutionException e = assertThrows(ExecutionException.class, () -> fill.get(1, TimeUnit.SECONDS));
        assertInstanceOf(VenueException.class, e.getCause());
        assertFalse(venue.cancel("paper-missing"));
    }

    private static PaperVenueAdapter venue(Duration latency) {
        ArbitrageProperties properties = TestFixtures.properties();
        properties.getInfra().setPaperFillLatency(latency);
        return new PaperVenueAdapter(properties);
    }

    private static OrderRequest order(String price, String sizeUsd) {
        return OrderRequest.builder()
                .clientOrderId("leg-1")
                .marketId("mkt-A")
                .outcome(Outcome.YES)
                .side(Side.BUY)
                .price(new BigDecimal(price))
                .sizeUsd(new BigDecimal(sizeUsd))
                .build();
    }
}
