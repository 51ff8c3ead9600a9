package com.crossvenue.arb.infra;

import com.crossvenue.arb.config.ArbitrageProperties;
import com.crossvenue.arb.execution.FillReport;
import com.crossvenue.arb.execution.FillStatus;
import com.crossvenue.arb.execution.OrderRequest;
import com.crossvenue.arb.execution.VenueAdapter;
import com.crossvenue.arb.execution.VenueAdapterRegistry;
import com.crossvenue.arb.execution.VenueException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Simulated venue: every valid order fills at its limit price after {@code arb.infra.paper-fill-latency}.
 * Serves every venue that has no adapter of its own. Only resting orders are kept; an order is
 * forgotten once it fills or is cancelled.
 */
@Slf4j
@Component
public class PaperVenueAdapter implements VenueAdapter {

    private final Duration fillLatency;
    private final Map<String, OrderRequest> resting = new ConcurrentHashMap<>();

    public PaperVenueAdapter(ArbitrageProperties properties) {
        this.fillLatency = properties.getInfra().getPaperFillLatency();
    }

    @Override
    public String venueId() {
        return VenueAdapterRegistry.PAPER_VENUE_ID;
    }

    @Override
    public String submit(OrderRequest order) {
        if (order.getPrice() == null || order.getPrice().signum() <= 0 || order.getPrice().compareTo(BigDecimal.ONE) > 0) {
            throw new VenueException(venueId(), "Price out of range: " + order.getPrice());
        }
        if (order.getSizeUsd() == null || order.getSizeUsd().signum() <= 0) {
            throw new VenueException(venueId(), "Size must be positive: " + order.getSizeUsd());
        }
        String orderId = "paper-" + UUID.randomUUID();
        resting.put(orderId, order);
        log.info("[PAPER] {} {} {} ${} @ {} -> {}", order.getSide(), order.getMarketId(), order.getOutcome(),
                order.getSizeUsd(), order.getPrice(), orderId);
        return orderId;
    }

    @Override
    public CompletableFuture<FillReport> awaitFill(String externalOrderId, Duration timeout) {
        if (!resting.containsKey(externalOrderId)) {
            return CompletableFuture.failedFuture(new VenueException(venueId(), "Unknown order " + externalOrderId));
        }
        return CompletableFuture
                .supplyAsync(() -> fill(externalOrderId),
                        CompletableFuture.delayedExecutor(fillLatency.toMillis(), TimeUnit.MILLISECONDS))
                .completeOnTimeout(FillReport.unfilled(externalOrderId, FillStatus.TIMED_OUT, "No fill within " + timeout),
                        timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public boolean cancel(String externalOrderId) {
        if (resting.remove(externalOrderId) == null) {
            return false;
        }
        log.info("[PAPER] Cancelled {}", externalOrderId);
        return true;
    }

    int restingOrderCount() {
        return resting.size();
    }

    private FillReport fill(String orderId) {
        OrderRequest order = resting.remove(orderId);
        if (order == null) {
            return FillReport.unfilled(orderId, FillStatus.CANCELLED, "Cancelled before fill");
        }
        return FillReport.filled(orderId, order.getPrice(), order.getSizeUsd());
    }
}
