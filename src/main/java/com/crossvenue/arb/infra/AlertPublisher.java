package com.crossvenue.arb.infra;

/**
 * Delivery channel for operator alerts. Implementations may throw; {@link AlertDispatcher}
 * isolates failures.
 */
public interface AlertPublisher {

    void publish(Alert alert);
}
