package edu.northeastern.hanafeng.matrixreloaded.metrics;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
public class MetricsReport {

    private long durationMs;
    /** Keyed by {@link UserRequest#label()}, in declaration order. */
    private Map<String, RequestMetrics> requests;
    private long messagesSent;
    private long messagesReceived;
    private long messagesPending;
    private long orphanedReceipts;
    private boolean allMessagesReceived;
}
