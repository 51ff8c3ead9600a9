package com.crossvenue.arb.infra;

import com.crossvenue.arb.TestFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class AlertDispatcherTest {

    private final Alert alert = Alert.builder()
            .severity(AlertSeverity.CRITICAL)
            .title("UNHEDGED EXPOSURE")
            .message("Leg2 timed out after Leg1 filled")
            .opportunityId("opp-1")
            .executionId("exec-1")
            .timestamp(TestFixtures.NOW)
            .build();

    @Test
    void failingPublisherDoesNotStopOthers() {
        AlertPublisher broken = mock(AlertPublisher.class);
        AlertPublisher working = mock(AlertPublisher.class);
        doThrow(new IllegalStateException("telegram down")).when(broken).publish(any());

        new AlertDispatcher(List.of(broken, working)).dispatch(alert);

        verify(broken).publish(alert);
        verify(working).publish(alert);
    }

    @Test
    void formatsAlertForOperators() {
        String text = alert.format();

        assertTrue(text.startsWith("[CRITICAL] UNHEDGED EXPOSURE"));
        assertTrue(text.contains("Opportunity: opp-1"));
        assertTrue(text.contains("Execution: exec-1"));
        assertTrue(text.endsWith("Leg2 timed out after Leg1 filled"));
    }

    @Test
    void loggingPublisherAcceptsEverySeverity() {
        LoggingAlertPublisher publisher = new LoggingAlertPublisher();

        for (AlertSeverity severity : AlertSeverity.values()) {
            Alert withSeverity = Alert.builder()
                    .severity(severity)
                    .title("Execution aborted")
                    .timestamp(TestFixtures.NOW)
                    .build();
            assertDoesNotThrow(() -> publisher.publish(withSeverity));
        }
    }
}
