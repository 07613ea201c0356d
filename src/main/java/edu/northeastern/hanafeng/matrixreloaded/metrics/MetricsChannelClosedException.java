package edu.northeastern.hanafeng.matrixreloaded.metrics;

/**
 * An event could not be delivered because the metrics channel is closed.
 * Metrics of the run can no longer be trusted, so this aborts the run.
 */
public class MetricsChannelClosedException extends RuntimeException {

    public MetricsChannelClosedException(String message) {
        super(message);
    }

    public MetricsChannelClosedException(String message, Throwable cause) {
        super(message, cause);
    }
}
