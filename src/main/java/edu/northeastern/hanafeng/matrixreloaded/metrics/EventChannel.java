package edu.northeastern.hanafeng.matrixreloaded.metrics;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded multi-producer, single-consumer queue of {@link Event}s.
 * <p>
 * Events of one producer are received in the order they were sent. Producers block
 * while the queue is full. Once closed, every send fails with
 * {@link MetricsChannelClosedException}.
 */
@Slf4j
public class EventChannel {

    private static final long FULL_QUEUE_RECHECK_MS = 100;

    private final BlockingQueue<Event> queue;
    private volatile boolean closed;
    private volatile Throwable closeCause;

    public EventChannel(int capacity) {
        this.queue = new LinkedBlockingQueue<>(capacity);
    }

    public void send(Event event) throws InterruptedException {
        log.trace("Sending event {}", event);
        do {
            // a producer blocked on a full queue must notice when the consumer dies
            if (closed) {
                throw new MetricsChannelClosedException("Metrics channel is closed, dropping " + event, closeCause);
            }
        } while (!queue.offer(event, FULL_QUEUE_RECHECK_MS, TimeUnit.MILLISECONDS));
    }

    public Event receive() throws InterruptedException {
        return queue.take();
    }

    public void close() {
        closed = true;
    }

    /**
     * Closes the channel because its consumer died.
     */
    public void close(Throwable cause) {
        closeCause = cause;
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    public int size() {
        return queue.size();
    }
}
