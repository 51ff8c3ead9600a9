package com.crossvenue.arb.infra;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class Alert {
    AlertSeverity severity;
    String title;
    String message;
    String opportunityId;
    String executionId;
    Instant timestamp;

    public String format() {
        StringBuilder sb = new StringBuilder()
                .append('[').append(severity).append("] ").append(title);
        if (opportunityId != null) {
            sb.append("\nOpportunity: ").append(opportunityId);
        }
        if (executionId != null) {
            sb.append("\nExecution: ").append(executionId);
        }
        if (message != null) {
            sb.append('\n').append(message);
        }
        return sb.toString();
    }
}
