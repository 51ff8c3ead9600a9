package com.crossvenue.arb.execution;

/**
 * A venue refused or could not process a request.
 */
public class VenueException extends RuntimeException {

    private final String venueId;

    public VenueException(String venueId, String message) {
        super(message);
        this.venueId = venueId;
    }

    public VenueException(String venueId, String message, Throwable cause) {
        super(message, cause);
        this.venueId = venueId;
    }

    public String getVenueId() {
        return venueId;
    }
}
