package com.crossvenue.arb.execution;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Order entry for one trading venue. The executor does not care whether an implementation talks to
 * a real exchange or a simulator.
 */
public interface VenueAdapter {

    /** Lower-case venue id, matching {@code MarketQuote#getVenueId()}. */
    String venueId();

    /**
     * @return the venue's external order id
     * @throws VenueException if the venue rejects the order outright
     */
    String submit(OrderRequest order);

    /**
     * Completes with the fill outcome, or with {@link FillStatus#TIMED_OUT} once {@code timeout}
     * has elapsed. Callers still bound the wait themselves.
     */
    CompletableFuture<FillReport> awaitFill(String externalOrderId, Duration timeout);

    /**
     * Best-effort cancel of whatever is still resting.
     *
     * @return true if the venue confirmed the cancel
     */
    boolean cancel(String externalOrderId);
}
