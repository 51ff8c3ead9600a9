package com.crossvenue.arb.execution;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Venue id to adapter lookup. Venues without their own adapter are routed to the adapter registered
 * as {@value #PAPER_VENUE_ID}, when there is one.
 */
@Slf4j
@Component
public class VenueAdapterRegistry {

    public static final String PAPER_VENUE_ID = "paper";

    private final Map<String, VenueAdapter> adapters;

    public VenueAdapterRegistry(List<VenueAdapter> adapters) {
        Map<String, VenueAdapter> byVenue = new LinkedHashMap<>();
        for (VenueAdapter adapter : adapters) {
            VenueAdapter previous = byVenue.put(normalize(adapter.venueId()), adapter);
            if (previous != null) {
                throw new IllegalStateException("Two venue adapters registered for " + adapter.venueId());
            }
        }
        this.adapters = Collections.unmodifiableMap(byVenue);
        log.info("Venue adapters: {}", this.adapters.keySet());
    }

    /**
     * @throws IllegalArgumentException if neither the venue nor the paper venue has an adapter
     */
    public VenueAdapter resolve(String venueId) {
        VenueAdapter adapter = adapters.get(normalize(venueId));
        if (adapter != null) {
            return adapter;
        }
        VenueAdapter paper = adapters.get(PAPER_VENUE_ID);
        if (paper == null) {
            throw new IllegalArgumentException("No venue adapter for " + venueId);
        }
        log.debug("No adapter for venue {}, routing to paper venue", venueId);
        return paper;
    }

    private static String normalize(String venueId) {
        return venueId == null ? "" : venueId.trim().toLowerCase(Locale.ROOT);
    }
}
