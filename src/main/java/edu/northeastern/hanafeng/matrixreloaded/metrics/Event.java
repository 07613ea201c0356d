package edu.northeastern.hanafeng.matrixreloaded.metrics;

import java.time.Duration;

/**
 * Everything the simulation reports to the {@link MetricsAggregator}.
 */
public sealed interface Event permits Event.RequestDuration, Event.RequestError, Event.MessageSent,
        Event.MessageReceived, Event.AllMessagesSent, Event.Finish {

    record RequestDuration(UserRequest request, Duration duration) implements Event {
    }

    record RequestError(UserRequest request, Throwable cause) implements Event {
    }

    record MessageSent(String eventId) implements Event {
    }

    record MessageReceived(String eventId) implements Event {
    }

    /** The run phase of the step is over; no further messages will be sent. */
    record AllMessagesSent() implements Event {
    }

    /** Ends the aggregation of the current step. */
    record Finish() implements Event {
    }
}
