package com.crossvenue.arb.execution;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Venue whose responses are scripted per submitted order, and which records every call.
 */
public class ScriptedVenueAdapter implements VenueAdapter {

    public enum Behaviour {
        FILL,
        PARTIAL_FILL,
        REJECT_ON_SUBMIT,
        REJECT_FILL,
        NEVER_FILL,
        WRONG_ORDER_ID,
        /** Acknowledges the order with the id handed out for the previous one. */
        REUSE_ORDER_ID
    }

    private final String venueId;
    private final Deque<Behaviour> script = new ArrayDeque<>();
    private final Map<String, Behaviour> behaviourByOrder = new HashMap<>();
    private final Map<String, OrderRequest> ordersById = new HashMap<>();
    private String lastOrderId;

    public final List<OrderRequest> submitted = new ArrayList<>();
    public final List<String> cancelled = new ArrayList<>();
    public boolean cancelThrows;

    public ScriptedVenueAdapter(String venueId, Behaviour... behaviours) {
        this.venueId = venueId;
        script.addAll(List.of(behaviours));
    }

    @Override
    public String venueId() {
        return venueId;
    }

    @Override
    public synchronized String submit(OrderRequest order) {
        submitted.add(order);
        Behaviour behaviour = script.isEmpty() ? Behaviour.FILL : script.poll();
        if (behaviour == Behaviour.REJECT_ON_SUBMIT) {
            throw new VenueException(venueId, "insufficient balance");
        }
        if (behaviour == Behaviour.REUSE_ORDER_ID && lastOrderId != null) {
            return lastOrderId;
        }
        String orderId = venueId + "-" + submitted.size();
        behaviourByOrder.put(orderId, behaviour);
        ordersById.put(orderId, order);
        lastOrderId = orderId;
        return orderId;
    }

    @Override
    public synchronized CompletableFuture<FillReport> awaitFill(String externalOrderId, Duration timeout) {
        OrderRequest order = ordersById.get(externalOrderId);
        switch (behaviourByOrder.get(externalOrderId)) {
            case FILL:
                return CompletableFuture.completedFuture(
                        FillReport.filled(externalOrderId, order.getPrice(), order.getSizeUsd()));
            case PARTIAL_FILL:
                return CompletableFuture.completedFuture(FillReport.builder()
                        .externalOrderId(externalOrderId)
                        .status(FillStatus.PARTIALLY_FILLED)
                        .fillPrice(order.getPrice())
                        .filledSizeUsd(order.getSizeUsd().divide(BigDecimal.valueOf(2)))
                        .build());
            case REJECT_FILL:
                return CompletableFuture.completedFuture(
                        FillReport.unfilled(externalOrderId, FillStatus.REJECTED, "market closed"));
            case WRONG_ORDER_ID:
                return CompletableFuture.completedFuture(
                        FillReport.filled("someone-else", order.getPrice(), order.getSizeUsd()));
            default:
                return new CompletableFuture<>();
        }
    }

    @Override
    public synchronized boolean cancel(String externalOrderId) {
        cancelled.add(externalOrderId);
        if (cancelThrows) {
            throw new VenueException(venueId, "cancel endpoint unavailable");
        }
        return true;
    }

    public synchronized int submitCount() {
        return submitted.size();
    }
}
