package edu.northeastern.hanafeng.matrixreloaded.metrics;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Timing and error statistics of one {@link UserRequest} kind over a step.
 * Latencies are in milliseconds with sub-millisecond precision.
 */
@Data
@Builder
public class RequestMetrics {

    private long requests;
    private long errors;
    private double throughputPerSecond;
    private double minMs;
    private double meanMs;
    private double p50Ms;
    private double p90Ms;
    private double p99Ms;
    private double maxMs;

    /** Distinct error messages and how often each occurred. */
    private Map<String, Long> errorSamples;
}
