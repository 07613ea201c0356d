package edu.northeastern.hanafeng.matrixreloaded.user;

import edu.northeastern.hanafeng.matrixreloaded.client.ChatClient;
import edu.northeastern.hanafeng.matrixreloaded.client.ChatClientException;
import edu.northeastern.hanafeng.matrixreloaded.client.ChatClientFactory;
import edu.northeastern.hanafeng.matrixreloaded.client.ClientOptions;
import edu.northeastern.hanafeng.matrixreloaded.config.SimulationConfig;
import edu.northeastern.hanafeng.matrixreloaded.metrics.EventChannel;
import edu.northeastern.hanafeng.matrixreloaded.support.HomeserverAddress;
import edu.northeastern.hanafeng.matrixreloaded.support.ProgressListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns the simulated users of a run. The population only grows: users are appended
 * while bootstrapping a step and are never removed.
 */
@Slf4j
@Component
public class UserPopulation implements PeerDirectory {

    static final String PHASE = "Init users";
    private static final int TRANSITIONS_PER_ATTEMPT = 3;

    private final SimulationConfig config;
    private final ChatClientFactory clientFactory;
    private final Executor userCreationExecutor;
    private final ProgressListener progress;
    private final HomeserverAddress homeserver;

    private final List<User> users = Collections.synchronizedList(new ArrayList<>());
    // counts attempted users, dropped ones included, so ids are never handed out twice
    private final AtomicInteger nextOrdinal = new AtomicInteger();

    public UserPopulation(SimulationConfig config,
                          ChatClientFactory clientFactory,
                          @Qualifier("userCreationExecutor") Executor userCreationExecutor,
                          ProgressListener progress) {
        this.config = config;
        this.clientFactory = clientFactory;
        this.userCreationExecutor = userCreationExecutor;
        this.progress = progress;
        this.homeserver = HomeserverAddress.parse(config.getHomeserverUrl());
    }

    /**
     * Creates {@code count} users and drives each of them to the syncing state.
     * Users that run out of attempts are left out.
     *
     * @return the number of users added to the population
     */
    public int bootstrap(int count, long executionId, EventChannel events) {
        progress.started(PHASE, count);

        List<CompletableFuture<Optional<User>>> creations = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            String localpart = "user_" + nextOrdinal.getAndIncrement() + "_" + executionId;
            creations.add(CompletableFuture.supplyAsync(() -> createUser(localpart, events), userCreationExecutor));
        }
        CompletableFuture.allOf(creations.toArray(new CompletableFuture[0])).join();

        int created = 0;
        for (CompletableFuture<Optional<User>> creation : creations) {
            Optional<User> user = creation.join();
            if (user.isPresent()) {
                users.add(user.get());
                created++;
            }
        }
        progress.finished(PHASE);

        if (created < count) {
            log.warn("Could not initialize {} of {} users", count - created, count);
        }
        log.info("Population now has {} users", users.size());
        return created;
    }

    Optional<User> createUser(String localpart, EventChannel events) {
        String userId = homeserver.userId(localpart);
        ClientOptions options = new ClientOptions(homeserver.url(), config.isRetryRequestConfig(), config.getRequestTimeout());
        User user = null;
        try {
            for (int attempt = 1; attempt <= config.getUserCreationRetryAttempts(); attempt++) {
                if (user == null) {
                    user = newUser(userId, localpart, options, events);
                }
                if (user != null && advanceToSyncing(user)) {
                    return Optional.of(user);
                }
                log.debug("Attempt {} to initialize user {} did not reach syncing", attempt, userId);
            }
            log.warn("Could not initialize user {} after {} attempts", userId, config.getUserCreationRetryAttempts());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while initializing user {}", userId);
            return Optional.empty();
        } finally {
            progress.advanced(PHASE, 1);
        }
    }

    private User newUser(String userId, String localpart, ClientOptions options, EventChannel events) {
        try {
            ChatClient client = clientFactory.create(userId, options);
            return new User(localpart, client, events, new SocialActionPicker());
        } catch (ChatClientException e) {
            log.debug("Failed to create a client for {}: {}", userId, e.getMessage());
            return null;
        }
    }

    private boolean advanceToSyncing(User user) throws InterruptedException {
        for (int i = 0; i < TRANSITIONS_PER_ATTEMPT && !user.isSyncing(); i++) {
            UserState before = user.getState();
            user.act(this);
            if (user.getState() == before) {
                break;
            }
        }
        return user.isSyncing();
    }

    public List<User> getUsers() {
        synchronized (users) {
            return List.copyOf(users);
        }
    }

    public int size() {
        return users.size();
    }

    @Override
    public Optional<String> randomPeerOf(String userId) {
        List<User> snapshot = getUsers();
        if (snapshot.size() < 2) {
            return Optional.empty();
        }
        ThreadLocalRandom random = ThreadLocalRandom.current();
        for (int attempt = 0; attempt < 5; attempt++) {
            User candidate = snapshot.get(random.nextInt(snapshot.size()));
            if (!candidate.getId().equals(userId)) {
                return Optional.of(candidate.getId());
            }
        }
        return Optional.empty();
    }

    /**
     * Stops the background sync of every user.
     */
    public void stopAll() {
        getUsers().forEach(User::stopSync);
        log.info("Stopped background sync of {} users", users.size());
    }
}
