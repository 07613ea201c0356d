package edu.northeastern.hanafeng.matrixreloaded.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class SimulationAsyncConfig {

    private final SimulationConfig simulationConfig;

    /**
     * Configure the thread pool running user actions during ticks.
     * One thread per user allowed to act in a tick, so a full tick
     * runs all its actions at once.
     */
    @Bean(name = "userActionExecutor")
    public ThreadPoolTaskExecutor userActionExecutor() {
        int threads = simulationConfig.getMaxUsersToActPerTick();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setThreadNamePrefix("user-action-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        log.info("User action pool configured: threads={}", threads);
        return executor;
    }

    /**
     * Configure user creation thread pool.
     * Its size caps how many users register/login/sync concurrently.
     */
    @Bean(name = "userCreationExecutor")
    public ThreadPoolTaskExecutor userCreationExecutor() {
        int threads = simulationConfig.getUserCreationThroughput();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setThreadNamePrefix("user-init-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    /**
     * Configure room creation thread pool.
     * Its size caps how many friendships are connected concurrently.
     */
    @Bean(name = "roomCreationExecutor")
    public ThreadPoolTaskExecutor roomCreationExecutor() {
        int threads = simulationConfig.getRoomCreationThroughput();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setThreadNamePrefix("room-init-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    /**
     * Configure the metrics aggregator thread.
     * Only one thread: each step has exactly one consumer of the event channel.
     */
    @Bean(name = "metricsAggregatorExecutor")
    public ThreadPoolTaskExecutor metricsAggregatorExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setThreadNamePrefix("metrics-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
