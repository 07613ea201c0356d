package edu.northeastern.hanafeng.matrixreloaded.friendship;

import edu.northeastern.hanafeng.matrixreloaded.client.ChatClientException;
import edu.northeastern.hanafeng.matrixreloaded.config.SimulationConfig;
import edu.northeastern.hanafeng.matrixreloaded.support.ProgressListener;
import edu.northeastern.hanafeng.matrixreloaded.user.PeerDirectory;
import edu.northeastern.hanafeng.matrixreloaded.user.User;
import edu.northeastern.hanafeng.matrixreloaded.user.UserState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Grows the friendship graph of the population up to
 * {@code ceil(friendshipRatio * n(n-1)/2)} pairs. Every new friendship becomes a room
 * shared by both users.
 */
@Slf4j
@Component
public class FriendshipGenerator {

    static final String PHASE = "Init friendships";
    static final int MAX_PAIRS_PER_EXTENSION = Integer.MAX_VALUE - 8;
    private static final int RECONNECT_TRANSITIONS = 3;

    private final SimulationConfig config;
    private final Executor roomCreationExecutor;
    private final ProgressListener progress;

    public FriendshipGenerator(SimulationConfig config,
                               @Qualifier("roomCreationExecutor") Executor roomCreationExecutor,
                               ProgressListener progress) {
        this.config = config;
        this.roomCreationExecutor = roomCreationExecutor;
        this.progress = progress;
    }

    public static long targetFor(int users, double ratio) {
        if (users < 2) {
            return 0;
        }
        long maxFriendships = (long) users * (users - 1) / 2;
        long target = BigDecimal.valueOf(ratio)
                .multiply(BigDecimal.valueOf(maxFriendships))
                .setScale(0, RoundingMode.CEILING)
                .longValueExact();
        return Math.min(target, maxFriendships);
    }

    /**
     * Adds friendships between {@code users} until {@code friendships} reaches this step's target.
     * Users that are not syncing are first driven back to syncing; pairs are only drawn among
     * syncing users. Only the calling thread modifies {@code friendships}. Pairs whose room could
     * not be set up are left out.
     *
     * @return the number of friendships added
     */
    public int extend(List<User> users, Set<Friendship> friendships) {
        long target = targetFor(users.size(), config.getFriendshipRatio());
        long missing = Math.max(0, target - friendships.size());
        if (missing == 0) {
            log.info("Friendship graph already has {}/{} pairs", friendships.size(), target);
            return 0;
        }

        Map<String, User> byId = new LinkedHashMap<>();
        for (User user : reconnect(users)) {
            byId.put(user.getId(), user);
        }
        int batch = batchSize(missing);
        if (batch < missing) {
            log.warn("Friendship graph is {} pairs short, adding at most {} this step", missing, batch);
        }
        List<Friendship> candidates = selectNewPairs(new ArrayList<>(byId.keySet()), friendships, batch,
                ThreadLocalRandom.current());
        if (candidates.size() < batch) {
            log.warn("Only {} of {} missing pairs are free among {} syncing users",
                    candidates.size(), batch, byId.size());
        }

        progress.started(PHASE, candidates.size());
        List<CompletableFuture<Boolean>> connections = new ArrayList<>(candidates.size());
        for (Friendship candidate : candidates) {
            User first = byId.get(candidate.first());
            User second = byId.get(candidate.second());
            connections.add(CompletableFuture.supplyAsync(() -> connect(first, second), roomCreationExecutor));
        }
        CompletableFuture.allOf(connections.toArray(new CompletableFuture[0])).join();

        int added = 0;
        for (int i = 0; i < candidates.size(); i++) {
            if (connections.get(i).join()) {
                friendships.add(candidates.get(i));
                added++;
            }
        }
        progress.finished(PHASE);

        if (added < candidates.size()) {
            log.warn("Dropped {} friendships whose rooms could not be created", candidates.size() - added);
        }
        log.info("Friendship graph now has {}/{} pairs", friendships.size(), target);
        return added;
    }

    static int batchSize(long missing) {
        return (int) Math.min(missing, MAX_PAIRS_PER_EXTENSION);
    }

    /**
     * Drives every user that is not syncing back to syncing.
     *
     * @return the users that are syncing afterwards
     */
    List<User> reconnect(List<User> users) {
        List<User> idle = new ArrayList<>();
        for (User user : users) {
            if (!user.isSyncing()) {
                idle.add(user);
            }
        }
        if (!idle.isEmpty()) {
            List<CompletableFuture<Void>> attempts = new ArrayList<>(idle.size());
            for (User user : idle) {
                attempts.add(CompletableFuture.runAsync(() -> advanceToSyncing(user), roomCreationExecutor));
            }
            CompletableFuture.allOf(attempts.toArray(new CompletableFuture[0])).join();
        }

        List<User> syncing = new ArrayList<>(users.size());
        for (User user : users) {
            if (user.isSyncing()) {
                syncing.add(user);
            }
        }
        if (!idle.isEmpty()) {
            log.info("Reconnected {} of {} users that were not syncing",
                    idle.size() - (users.size() - syncing.size()), idle.size());
        }
        return syncing;
    }

    private void advanceToSyncing(User user) {
        try {
            for (int i = 0; i < RECONNECT_TRANSITIONS && !user.isSyncing(); i++) {
                UserState before = user.getState();
                user.act(PeerDirectory.NONE);
                if (user.getState() == before) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while reconnecting {}", user.getId());
        }
    }

    /**
     * Picks up to {@code missing} distinct pairs of {@code ids} absent from {@code existing}. Uses
     * rejection sampling while free pairs are plentiful and enumerates the free pairs when the
     * graph is close to complete.
     */
    static List<Friendship> selectNewPairs(List<String> ids, Set<Friendship> existing, int missing, Random random) {
        int n = ids.size();
        Set<String> idSet = new HashSet<>(ids);
        long taken = 0;
        for (Friendship friendship : existing) {
            if (idSet.contains(friendship.first()) && idSet.contains(friendship.second())) {
                taken++;
            }
        }
        long free = (long) n * (n - 1) / 2 - taken;
        if (missing <= 0 || free <= 0) {
            return List.of();
        }

        if (missing * 2L > free) {
            List<Friendship> freePairs = new ArrayList<>();
            for (int i = 0; i < n; i++) {
                for (int j = i + 1; j < n; j++) {
                    Friendship candidate = Friendship.of(ids.get(i), ids.get(j));
                    if (!existing.contains(candidate)) {
                        freePairs.add(candidate);
                    }
                }
            }
            Collections.shuffle(freePairs, random);
            return new ArrayList<>(freePairs.subList(0, Math.min(missing, freePairs.size())));
        }

        Set<Friendship> chosen = new LinkedHashSet<>();
        while (chosen.size() < missing) {
            String first = ids.get(random.nextInt(n));
            String second = ids.get(random.nextInt(n));
            if (first.equals(second)) {
                continue;
            }
            Friendship candidate = Friendship.of(first, second);
            if (!existing.contains(candidate)) {
                chosen.add(candidate);
            }
        }
        return new ArrayList<>(chosen);
    }

    private boolean connect(User first, User second) {
        String roomId = null;
        try {
            for (int attempt = 1; attempt <= config.getRoomCreationRetryAttempts(); attempt++) {
                try {
                    if (roomId == null) {
                        roomId = first.createRoom(List.of(second.getId()));
                    }
                    second.joinRoom(roomId);
                    return true;
                } catch (ChatClientException e) {
                    log.debug("Attempt {} to connect {} and {} failed: {}",
                            attempt, first.getId(), second.getId(), e.getMessage());
                }
            }
            log.warn("Could not connect {} and {} after {} attempts",
                    first.getId(), second.getId(), config.getRoomCreationRetryAttempts());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while connecting {} and {}", first.getId(), second.getId());
            return false;
        } finally {
            progress.advanced(PHASE, 1);
        }
    }
}
