package com.crossvenue.arb.infra;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class LoggingAlertPublisher implements AlertPublisher {

    @Override
    public void publish(Alert alert) {
        switch (alert.getSeverity()) {
            case CRITICAL -> log.error("🚨 [ALERT] {}", alert.format());
            case WARNING -> log.warn("⚠️ [ALERT] {}", alert.format());
            default -> log.info("[ALERT] {}", alert.format());
        }
    }
}
