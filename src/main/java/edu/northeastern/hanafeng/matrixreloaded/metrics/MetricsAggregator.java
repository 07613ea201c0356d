package edu.northeastern.hanafeng.matrixreloaded.metrics;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Turns the events of one step into a {@link MetricsReport}.
 * <p>
 * The aggregation task started by {@link #start(Executor)} is the only reader of the
 * {@link EventChannel} and the only writer of the aggregate state. It runs until it
 * receives {@link Event.Finish}. {@link #allMessagesReceived()} may be called from any
 * thread while the task runs.
 */
@Slf4j
public class MetricsAggregator {

    static final int MAX_ERROR_SAMPLES = 10;
    private static final double NANOS_PER_MILLI = 1_000_000.0;

    private final EventChannel channel;

    private final Map<UserRequest, List<Long>> latenciesNanos = new EnumMap<>(UserRequest.class);
    private final Map<UserRequest, Long> errorCounts = new EnumMap<>(UserRequest.class);
    private final Map<UserRequest, Map<String, Long>> errorSamples = new EnumMap<>(UserRequest.class);

    private final Set<String> sent = ConcurrentHashMap.newKeySet();
    private final Set<String> received = ConcurrentHashMap.newKeySet();
    private final Set<String> outstanding = ConcurrentHashMap.newKeySet();
    private long receipts;
    private volatile boolean allMessagesSent;
    private long startNanos = System.nanoTime();

    public MetricsAggregator(EventChannel channel) {
        this.channel = channel;
    }

    public CompletableFuture<MetricsReport> start(Executor executor) {
        return CompletableFuture.supplyAsync(this::consume, executor);
    }

    /**
     * True when the run phase has ended and every sent message has been received by
     * at least one other member.
     */
    public boolean allMessagesReceived() {
        return allMessagesSent && outstanding.isEmpty();
    }

    MetricsReport consume() {
        startNanos = System.nanoTime();
        try {
            while (true) {
                Event event = channel.receive();
                if (event instanceof Event.Finish) {
                    MetricsReport report = buildReport();
                    log.info("Metrics aggregation finished: sent={}, received={}, pending={}",
                            report.getMessagesSent(), report.getMessagesReceived(), report.getMessagesPending());
                    return report;
                }
                apply(event);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            channel.close(e);
            throw new MetricsChannelClosedException("Metrics aggregation was interrupted", e);
        } catch (RuntimeException e) {
            channel.close(e);
            throw new MetricsChannelClosedException("Metrics aggregation failed", e);
        }
    }

    void apply(Event event) {
        if (event instanceof Event.RequestDuration duration) {
            latenciesNanos.computeIfAbsent(duration.request(), k -> new ArrayList<>())
                    .add(duration.duration().toNanos());
        } else if (event instanceof Event.RequestError error) {
            errorCounts.merge(error.request(), 1L, Long::sum);
            recordErrorSample(error);
        } else if (event instanceof Event.MessageSent messageSent) {
            sent.add(messageSent.eventId());
            if (!received.contains(messageSent.eventId())) {
                outstanding.add(messageSent.eventId());
            }
        } else if (event instanceof Event.MessageReceived messageReceived) {
            receipts++;
            received.add(messageReceived.eventId());
            if (!outstanding.remove(messageReceived.eventId()) && !sent.contains(messageReceived.eventId())) {
                log.debug("Received message {} before or without its send", messageReceived.eventId());
            }
        } else if (event instanceof Event.AllMessagesSent) {
            allMessagesSent = true;
        }
    }

    private void recordErrorSample(Event.RequestError error) {
        Map<String, Long> samples = errorSamples.computeIfAbsent(error.request(), k -> new LinkedHashMap<>());
        String detail = describe(error.cause());
        if (samples.containsKey(detail) || samples.size() < MAX_ERROR_SAMPLES) {
            samples.merge(detail, 1L, Long::sum);
        }
    }

    MetricsReport buildReport() {
        long elapsedMs = Math.max(1, (System.nanoTime() - startNanos) / 1_000_000);
        Map<String, RequestMetrics> requests = new LinkedHashMap<>();
        for (UserRequest request : UserRequest.values()) {
            List<Long> latencies = latenciesNanos.getOrDefault(request, List.of());
            long errors = errorCounts.getOrDefault(request, 0L);
            if (latencies.isEmpty() && errors == 0) {
                continue;
            }
            requests.put(request.label(), summarize(latencies, errors, elapsedMs,
                    errorSamples.getOrDefault(request, Map.of())));
        }

        long orphaned = received.stream().filter(id -> !sent.contains(id)).count();
        return MetricsReport.builder()
                .durationMs(elapsedMs)
                .requests(requests)
                .messagesSent(sent.size())
                .messagesReceived(receipts)
                .messagesPending(outstanding.size())
                .orphanedReceipts(orphaned)
                .allMessagesReceived(allMessagesReceived())
                .build();
    }

    private static RequestMetrics summarize(List<Long> latencies, long errors, long elapsedMs,
                                            Map<String, Long> samples) {
        List<Long> sorted = new ArrayList<>(latencies);
        sorted.sort(null);
        long total = sorted.stream().mapToLong(Long::longValue).sum();
        return RequestMetrics.builder()
                .requests(sorted.size())
                .errors(errors)
                .throughputPerSecond(sorted.size() * 1000.0 / elapsedMs)
                .minMs(sorted.isEmpty() ? 0 : toMillis(sorted.get(0)))
                .meanMs(sorted.isEmpty() ? 0 : total / NANOS_PER_MILLI / sorted.size())
                .p50Ms(toMillis(percentile(sorted, 50)))
                .p90Ms(toMillis(percentile(sorted, 90)))
                .p99Ms(toMillis(percentile(sorted, 99)))
                .maxMs(sorted.isEmpty() ? 0 : toMillis(sorted.get(sorted.size() - 1)))
                .errorSamples(new LinkedHashMap<>(samples))
                .build();
    }

    private static double toMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    // nearest-rank
    static long percentile(List<Long> sorted, int percentile) {
        if (sorted.isEmpty()) {
            return 0;
        }
        int rank = (int) Math.ceil(percentile / 100.0 * sorted.size());
        return sorted.get(Math.max(0, rank - 1));
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown";
        }
        String message = cause.getMessage();
        return message == null ? cause.getClass().getSimpleName() : message;
    }
}
