package edu.northeastern.hanafeng.matrixreloaded.runner;

import edu.northeastern.hanafeng.matrixreloaded.metrics.Event;
import edu.northeastern.hanafeng.matrixreloaded.metrics.EventChannel;
import edu.northeastern.hanafeng.matrixreloaded.metrics.MetricsChannelClosedException;
import edu.northeastern.hanafeng.matrixreloaded.support.ProgressListener;
import edu.northeastern.hanafeng.matrixreloaded.user.PeerDirectory;
import edu.northeastern.hanafeng.matrixreloaded.user.User;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * Run phase of a step: every tick a random sample of users acts once, concurrently.
 * <p>
 * A tick lasts {@code tickDuration}. Actions still running when it ends are cancelled and
 * their partial work is discarded; a tick that finishes early sleeps for the rest of it.
 * The next tick only starts once every action of the previous one completed or was cancelled.
 */
@Slf4j
@Component
public class TickScheduler {

    static final String PHASE = "Running";

    private final ThreadPoolTaskExecutor userActionExecutor;
    private final ProgressListener progress;

    public TickScheduler(@Qualifier("userActionExecutor") ThreadPoolTaskExecutor userActionExecutor,
                         ProgressListener progress) {
        this.userActionExecutor = userActionExecutor;
        this.progress = progress;
    }

    /**
     * @return the number of ticks executed
     */
    public int run(List<User> users, PeerDirectory peers, Duration stepDuration, Duration tickDuration,
                   int maxUsersPerTick, EventChannel events) throws InterruptedException {
        ExecutorService executor = userActionExecutor.getThreadPoolExecutor();
        long stepNanos = stepDuration.toNanos();
        long tickNanos = tickDuration.toNanos();
        int usersToAct = Math.min(users.size(), maxUsersPerTick);

        progress.started(PHASE, (long) Math.ceil((double) stepNanos / tickNanos));
        long start = System.nanoTime();
        int ticks = 0;
        long cancelled = 0;
        while (System.nanoTime() - start < stepNanos) {
            long tickStart = System.nanoTime();

            List<Callable<Void>> actions = new ArrayList<>(usersToAct);
            for (User user : sample(users, usersToAct, ThreadLocalRandom.current())) {
                actions.add(() -> {
                    user.act(peers);
                    return null;
                });
            }
            List<Future<Void>> outcomes = executor.invokeAll(actions, tickNanos, TimeUnit.NANOSECONDS);
            cancelled += countCancelled(outcomes);
            ticks++;

            long elapsed = System.nanoTime() - tickStart;
            if (elapsed < tickNanos) {
                TimeUnit.NANOSECONDS.sleep(tickNanos - elapsed);
            }
            progress.advanced(PHASE, 1);
        }
        progress.finished(PHASE);

        log.info("Run phase finished: ticks={}, usersPerTick={}, cancelledActions={}", ticks, usersToAct, cancelled);
        events.send(new Event.AllMessagesSent());
        return ticks;
    }

    /**
     * Picks {@code count} distinct elements uniformly at random (partial Fisher-Yates).
     */
    static <T> List<T> sample(List<T> items, int count, Random random) {
        int n = items.size();
        int k = Math.min(count, n);
        int[] indexes = new int[n];
        for (int i = 0; i < n; i++) {
            indexes[i] = i;
        }
        List<T> sampled = new ArrayList<>(k);
        for (int i = 0; i < k; i++) {
            int j = i + random.nextInt(n - i);
            int swap = indexes[i];
            indexes[i] = indexes[j];
            indexes[j] = swap;
            sampled.add(items.get(indexes[i]));
        }
        return sampled;
    }

    private static int countCancelled(List<Future<Void>> outcomes) throws InterruptedException {
        int cancelled = 0;
        for (Future<Void> outcome : outcomes) {
            try {
                outcome.get();
            } catch (CancellationException e) {
                cancelled++;
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof MetricsChannelClosedException closed) {
                    throw closed;
                }
                log.error("User action failed unexpectedly", cause);
            }
        }
        return cancelled;
    }
}
