package edu.northeastern.hanafeng.matrixreloaded.runner;

import edu.northeastern.hanafeng.matrixreloaded.common.utils.EnvironmentUtils;
import edu.northeastern.hanafeng.matrixreloaded.config.SimulationConfig;
import edu.northeastern.hanafeng.matrixreloaded.friendship.Friendship;
import edu.northeastern.hanafeng.matrixreloaded.friendship.FriendshipGenerator;
import edu.northeastern.hanafeng.matrixreloaded.metrics.Event;
import edu.northeastern.hanafeng.matrixreloaded.metrics.EventChannel;
import edu.northeastern.hanafeng.matrixreloaded.metrics.MetricsAggregator;
import edu.northeastern.hanafeng.matrixreloaded.metrics.MetricsChannelClosedException;
import edu.northeastern.hanafeng.matrixreloaded.metrics.MetricsReport;
import edu.northeastern.hanafeng.matrixreloaded.report.StepReport;
import edu.northeastern.hanafeng.matrixreloaded.report.StepReportSink;
import edu.northeastern.hanafeng.matrixreloaded.report.UserCounterStore;
import edu.northeastern.hanafeng.matrixreloaded.user.UserPopulation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Drives a whole simulation: {@code totalSteps} steps, each of which grows the population,
 * extends the friendship graph, lets users act for {@code stepDuration} and reports the
 * metrics collected meanwhile.
 * Implements CommandLineRunner for automatic execution after Spring context initialization.
 */
@Slf4j
@Component
public class SimulationRunner implements CommandLineRunner {

    static final Duration TEARDOWN_POLL_INTERVAL = Duration.ofSeconds(1);

    private final SimulationConfig config;
    private final UserPopulation population;
    private final FriendshipGenerator friendshipGenerator;
    private final TickScheduler tickScheduler;
    private final Executor metricsAggregatorExecutor;
    private final List<StepReportSink> reportSinks;
    private final UserCounterStore userCounterStore;
    private final EnvironmentUtils environmentUtils;

    private final Set<Friendship> friendships = new TreeSet<>();

    public SimulationRunner(SimulationConfig config,
                            UserPopulation population,
                            FriendshipGenerator friendshipGenerator,
                            TickScheduler tickScheduler,
                            @Qualifier("metricsAggregatorExecutor") Executor metricsAggregatorExecutor,
                            List<StepReportSink> reportSinks,
                            UserCounterStore userCounterStore,
                            EnvironmentUtils environmentUtils) {
        this.config = config;
        this.population = population;
        this.friendshipGenerator = friendshipGenerator;
        this.tickScheduler = tickScheduler;
        this.metricsAggregatorExecutor = metricsAggregatorExecutor;
        this.reportSinks = reportSinks;
        this.userCounterStore = userCounterStore;
        this.environmentUtils = environmentUtils;
    }

    @Override
    public void run(String... args) throws Exception {
        long executionId = System.currentTimeMillis();
        log.info("=== Simulation {} Starting against {} ===", executionId, config.getHomeserverUrl());
        long startTime = System.currentTimeMillis();
        try {
            runSimulation(executionId);
        } catch (MetricsChannelClosedException e) {
            log.error("Metrics collection stopped working, aborting simulation {}", executionId, e);
            throw e;
        }
        log.info("=== Simulation {} Finished in {}s ===", executionId, (System.currentTimeMillis() - startTime) / 1000);
    }

    /**
     * Runs every step of one simulation.
     *
     * @return the report of each completed step, in step order
     */
    public List<StepReport> runSimulation(long executionId) throws InterruptedException {
        EventChannel events = new EventChannel(config.getEventChannelCapacity());
        List<StepReport> reports = new ArrayList<>(config.getTotalSteps());
        int initialUsers = population.size();
        try {
            for (int step = 1; step <= config.getTotalSteps(); step++) {
                reports.add(runStep(executionId, step, events));
            }
            return reports;
        } finally {
            population.stopAll();
            events.close();
            userCounterStore.record(executionId, config.getHomeserverUrl(), population.size() - initialUsers);
        }
    }

    private StepReport runStep(long executionId, int step, EventChannel events) throws InterruptedException {
        log.info("=== Step {}/{} ===", step, config.getTotalSteps());
        MetricsAggregator aggregator = new MetricsAggregator(events);
        CompletableFuture<MetricsReport> pendingReport = aggregator.start(metricsAggregatorExecutor);

        try {
            population.bootstrap(config.getUsersPerStep(), executionId, events);
            friendshipGenerator.extend(population.getUsers(), friendships);
        } catch (CompletionException e) {
            throw unwrap(e);
        }

        tickScheduler.run(population.getUsers(), population, config.getStepDuration(), config.getTickDuration(),
                config.getMaxUsersToActPerTick(), events);

        awaitDeliveries(aggregator);
        events.send(new Event.Finish());
        MetricsReport metrics = awaitReport(pendingReport);

        StepReport report = StepReport.builder()
                .executionId(executionId)
                .step(step)
                .homeserver(config.getHomeserverUrl())
                .generatedBy(environmentUtils.getHostname())
                .generatedAt(Instant.now())
                .stepUsers(population.size())
                .stepFriendships(friendships.size())
                .report(metrics)
                .build();
        publish(report);

        log.info("Step {} done: users={}, friendships={}, sent={}, received={}, pending={}",
                step, report.getStepUsers(), report.getStepFriendships(),
                metrics.getMessagesSent(), metrics.getMessagesReceived(), metrics.getMessagesPending());
        return report;
    }

    private void awaitDeliveries(MetricsAggregator aggregator) throws InterruptedException {
        long deadline = System.nanoTime() + config.getWaitingPeriod().toNanos();
        while (!aggregator.allMessagesReceived() && System.nanoTime() < deadline) {
            TimeUnit.MILLISECONDS.sleep(TEARDOWN_POLL_INTERVAL.toMillis());
        }
        if (!aggregator.allMessagesReceived()) {
            log.warn("Some messages were still undelivered after waiting {}s", config.getWaitingPeriod().toSeconds());
        }
    }

    private static MetricsReport awaitReport(CompletableFuture<MetricsReport> pendingReport)
            throws InterruptedException {
        try {
            return pendingReport.get();
        } catch (ExecutionException e) {
            throw unwrap(e);
        }
    }

    private void publish(StepReport report) {
        for (StepReportSink sink : reportSinks) {
            try {
                sink.publish(report);
            } catch (RuntimeException e) {
                log.error("Report sink {} failed for step {}", sink.getClass().getSimpleName(), report.getStep(), e);
            }
        }
    }

    private static RuntimeException unwrap(Exception e) {
        Throwable cause = e.getCause();
        if (cause instanceof MetricsChannelClosedException closed) {
            return closed;
        }
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        return new IllegalStateException("Simulation step failed", cause);
    }
}
