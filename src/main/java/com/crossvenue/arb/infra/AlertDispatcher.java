package com.crossvenue.arb.infra;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Fans an alert out to every publisher. A failing publisher is logged and skipped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AlertDispatcher {

    private final List<AlertPublisher> publishers;

    public void dispatch(Alert alert) {
        for (AlertPublisher publisher : publishers) {
            try {
                publisher.publish(alert);
            } catch (RuntimeException e) {
                log.error("Alert publisher {} failed for '{}'", publisher.getClass().getSimpleName(),
                        alert.getTitle(), e);
            }
        }
    }
}
