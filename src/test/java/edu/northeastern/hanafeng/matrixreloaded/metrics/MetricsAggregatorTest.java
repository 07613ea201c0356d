package edu.northeastern.hanafeng.matrixreloaded.metrics;

import edu.northeastern.hanafeng.matrixreloaded.client.ChatClientException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MetricsAggregatorTest {

    private EventChannel channel;
    private MetricsAggregator aggregator;

    @BeforeEach
    void setUp() {
        channel = new EventChannel(100);
        aggregator = new MetricsAggregator(channel);
    }

    @Test
    void testApply_CountsEveryRequest() {
        // Given
        int requests = 25;

        // When
        for (int i = 1; i <= requests; i++) {
            aggregator.apply(new Event.RequestDuration(UserRequest.SEND_MESSAGE, Duration.ofMillis(i)));
        }
        MetricsReport report = aggregator.buildReport();

        // Then
        RequestMetrics metrics = report.getRequests().get("send_message");
        assertEquals(requests, metrics.getRequests());
        assertEquals(0, metrics.getErrors());
        assertEquals(1.0, metrics.getMinMs(), 0.001);
        assertEquals(25.0, metrics.getMaxMs(), 0.001);
        assertEquals(13.0, metrics.getMeanMs(), 0.001);
        assertEquals(13.0, metrics.getP50Ms(), 0.001);
        assertEquals(23.0, metrics.getP90Ms(), 0.001);
        assertEquals(25.0, metrics.getP99Ms(), 0.001);
        assertFalse(report.getRequests().containsKey("login"));
    }

    @Test
    void testApply_SubMillisecondLatenciesKeepPrecision() {
        // When
        aggregator.apply(new Event.RequestDuration(UserRequest.SYNC, Duration.ofNanos(250_000)));
        aggregator.apply(new Event.RequestDuration(UserRequest.SYNC, Duration.ofNanos(750_000)));
        MetricsReport report = aggregator.buildReport();

        // Then
        RequestMetrics metrics = report.getRequests().get("sync");
        assertEquals(0.25, metrics.getMinMs(), 0.0001);
        assertEquals(0.25, metrics.getP50Ms(), 0.0001);
        assertEquals(0.5, metrics.getMeanMs(), 0.0001);
        assertEquals(0.75, metrics.getMaxMs(), 0.0001);
    }

    @Test
    void testApply_ErrorSamplesAreCapped() {
        // When
        for (int i = 0; i < 15; i++) {
            aggregator.apply(new Event.RequestError(UserRequest.LOGIN, new ChatClientException("error " + i)));
        }
        aggregator.apply(new Event.RequestError(UserRequest.LOGIN, new ChatClientException("error 0")));
        MetricsReport report = aggregator.buildReport();

        // Then
        RequestMetrics metrics = report.getRequests().get("login");
        assertEquals(16, metrics.getErrors());
        assertEquals(0, metrics.getRequests());
        assertEquals(MetricsAggregator.MAX_ERROR_SAMPLES, metrics.getErrorSamples().size());
        assertEquals(2L, metrics.getErrorSamples().get("error 0"));
    }

    @Test
    void testAllMessagesReceived_TracksOutstandingMessages() {
        // Given
        aggregator.apply(new Event.MessageSent("$a"));
        aggregator.apply(new Event.MessageSent("$b"));
        aggregator.apply(new Event.MessageReceived("$a"));
        aggregator.apply(new Event.MessageSent("$c"));

        // When/Then
        assertFalse(aggregator.allMessagesReceived());
        aggregator.apply(new Event.AllMessagesSent());
        assertFalse(aggregator.allMessagesReceived());

        aggregator.apply(new Event.MessageReceived("$b"));
        assertFalse(aggregator.allMessagesReceived());

        aggregator.apply(new Event.MessageReceived("$c"));
        assertTrue(aggregator.allMessagesReceived());
    }

    @Test
    void testAllMessagesReceived_RequiresEndOfRunPhase() {
        // When
        aggregator.apply(new Event.MessageSent("$a"));
        aggregator.apply(new Event.MessageReceived("$a"));

        // Then
        assertFalse(aggregator.allMessagesReceived());
    }

    @Test
    void testApply_ReceiptBeforeSend_IsNotOutstanding() {
        // When
        aggregator.apply(new Event.MessageReceived("$a"));
        aggregator.apply(new Event.MessageSent("$a"));
        aggregator.apply(new Event.AllMessagesSent());
        MetricsReport report = aggregator.buildReport();

        // Then
        assertTrue(aggregator.allMessagesReceived());
        assertEquals(0, report.getMessagesPending());
        assertEquals(0, report.getOrphanedReceipts());
    }

    @Test
    void testBuildReport_CountsOrphansAndDuplicateReceipts() {
        // Given
        aggregator.apply(new Event.MessageSent("$a"));
        aggregator.apply(new Event.MessageReceived("$a"));
        aggregator.apply(new Event.MessageReceived("$a"));
        aggregator.apply(new Event.MessageReceived("$from-previous-step"));
        aggregator.apply(new Event.MessageSent("$b"));

        // When
        MetricsReport report = aggregator.buildReport();

        // Then
        assertEquals(2, report.getMessagesSent());
        assertEquals(3, report.getMessagesReceived());
        assertEquals(1, report.getMessagesPending());
        assertEquals(1, report.getOrphanedReceipts());
        assertFalse(report.isAllMessagesReceived());
    }

    @Test
    void testPercentile_NearestRank() {
        assertEquals(0, MetricsAggregator.percentile(List.of(), 50));
        assertEquals(7, MetricsAggregator.percentile(List.of(7L), 99));
        assertEquals(2, MetricsAggregator.percentile(List.of(1L, 2L, 3L, 4L), 50));
        assertEquals(4, MetricsAggregator.percentile(List.of(1L, 2L, 3L, 4L), 90));
    }

    @Test
    void testStart_FinishProducesReport() throws Exception {
        // Given
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            CompletableFuture<MetricsReport> pending = aggregator.start(executor);

            // When
            channel.send(new Event.RequestDuration(UserRequest.REGISTER, Duration.ofMillis(3)));
            channel.send(new Event.MessageSent("$a"));
            channel.send(new Event.MessageReceived("$a"));
            channel.send(new Event.AllMessagesSent());
            channel.send(new Event.Finish());
            MetricsReport report = pending.get(5, TimeUnit.SECONDS);

            // Then
            assertEquals(1, report.getRequests().get("register").getRequests());
            assertEquals(1, report.getMessagesSent());
            assertTrue(report.isAllMessagesReceived());
            assertFalse(channel.isClosed());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testStart_ConcurrentProducers_EveryRequestCounted() throws Exception {
        // Given
        int producers = 4;
        int eventsPerProducer = 250;
        ExecutorService consumer = Executors.newSingleThreadExecutor();
        ExecutorService producerPool = Executors.newFixedThreadPool(producers);
        try {
            CompletableFuture<MetricsReport> pending = aggregator.start(consumer);

            // When durations and errors of two request kinds interleave across threads
            List<Future<?>> sends = new ArrayList<>();
            for (int p = 0; p < producers; p++) {
                int producer = p;
                sends.add(producerPool.submit(() -> {
                    for (int i = 0; i < eventsPerProducer; i++) {
                        UserRequest request = (i + producer) % 2 == 0 ? UserRequest.SEND_MESSAGE : UserRequest.JOIN_ROOM;
                        Event event = i % 3 == 0
                                ? new Event.RequestError(request, new ChatClientException("error " + i))
                                : new Event.RequestDuration(request, Duration.ofMillis(i));
                        channel.send(event);
                    }
                    return null;
                }));
            }
            for (Future<?> send : sends) {
                send.get(10, TimeUnit.SECONDS);
            }
            channel.send(new Event.Finish());
            MetricsReport report = pending.get(10, TimeUnit.SECONDS);

            // Then
            long requests = 0;
            long errors = 0;
            for (RequestMetrics metrics : report.getRequests().values()) {
                requests += metrics.getRequests();
                errors += metrics.getErrors();
            }
            assertEquals(producers * eventsPerProducer, requests + errors);
            assertEquals(producers * 84, errors);
        } finally {
            producerPool.shutdownNow();
            consumer.shutdownNow();
        }
    }

    @Test
    void testStart_FreshAggregatorPerStep() throws Exception {
        // Given
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            aggregator.start(executor);
            channel.send(new Event.MessageSent("$a"));
            channel.send(new Event.Finish());

            // When the next step starts on the same channel
            MetricsAggregator next = new MetricsAggregator(channel);
            CompletableFuture<MetricsReport> pending = next.start(executor);
            channel.send(new Event.MessageReceived("$a"));
            channel.send(new Event.Finish());
            MetricsReport report = pending.get(5, TimeUnit.SECONDS);

            // Then
            assertEquals(0, report.getMessagesSent());
            assertEquals(1, report.getMessagesReceived());
            assertEquals(1, report.getOrphanedReceipts());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testStart_ConsumerInterrupted_ClosesChannel() throws Exception {
        // Given
        ExecutorService executor = Executors.newSingleThreadExecutor();
        CompletableFuture<MetricsReport> pending = aggregator.start(executor);
        channel.send(new Event.MessageSent("$first"));
        while (channel.size() > 0) {
            TimeUnit.MILLISECONDS.sleep(10);
        }

        // When
        executor.shutdownNow();

        // Then
        ExecutionException e = assertThrows(ExecutionException.class, () -> pending.get(5, TimeUnit.SECONDS));
        assertInstanceOf(MetricsChannelClosedException.class, e.getCause());
        assertTrue(channel.isClosed());
        assertThrows(MetricsChannelClosedException.class, () -> channel.send(new Event.MessageSent("$a")));
    }
}
