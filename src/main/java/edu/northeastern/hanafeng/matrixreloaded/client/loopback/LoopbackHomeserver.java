package edu.northeastern.hanafeng.matrixreloaded.client.loopback;

import edu.northeastern.hanafeng.matrixreloaded.client.ChatClientException;
import edu.northeastern.hanafeng.matrixreloaded.client.RegistrationStatus;
import edu.northeastern.hanafeng.matrixreloaded.client.SyncEvent;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process homeserver used when no server under test is wired in.
 * <p>
 * Keeps accounts, room membership and per-user timelines in memory. Every request
 * pays the configured latency and fails with the configured probability, so the
 * simulation exercises the same success and failure paths it would against a real
 * server. Room and delivery bookkeeping is guarded by the instance monitor; latency
 * is paid outside of it.
 */
@Slf4j
public class LoopbackHomeserver {

    @Getter
    private final String serverName;
    private final Duration latency;
    private final double failureRate;

    private final Set<String> accounts = new LinkedHashSet<>();
    private final Map<String, Set<String>> roomMembers = new HashMap<>();
    private final Map<String, Set<String>> invites = new HashMap<>();
    private final Map<String, String> statuses = new HashMap<>();
    private final Map<String, LoopbackChatClient> syncing = new HashMap<>();
    private final Map<String, List<SyncEvent>> backlog = new HashMap<>();
    private final AtomicLong roomCounter = new AtomicLong();

    public LoopbackHomeserver(String serverName, Duration latency, double failureRate) {
        this.serverName = serverName;
        this.latency = latency;
        this.failureRate = failureRate;
    }

    /**
     * Pays the request latency and rolls for an injected failure.
     */
    void request(String operation, Duration timeout) throws ChatClientException, InterruptedException {
        if (latency.compareTo(timeout) > 0) {
            TimeUnit.NANOSECONDS.sleep(timeout.toNanos());
            throw new ChatClientException(operation + " timed out after " + timeout.toMillis() + "ms");
        }
        if (!latency.isZero()) {
            TimeUnit.NANOSECONDS.sleep(latency.toNanos());
        }
        if (failureRate > 0 && ThreadLocalRandom.current().nextDouble() < failureRate) {
            throw new ChatClientException(operation + " failed: M_UNKNOWN (injected)");
        }
    }

    synchronized RegistrationStatus register(String localpart) {
        return accounts.add(localpart) ? RegistrationStatus.REGISTERED : RegistrationStatus.ALREADY_EXISTS;
    }

    synchronized boolean isRegistered(String localpart) {
        return accounts.contains(localpart);
    }

    public synchronized int getAccountCount() {
        return accounts.size();
    }

    String createRoom(String creator, List<String> invitees) {
        String roomId = "!room" + roomCounter.incrementAndGet() + ":" + serverName;
        List<Delivery> deliveries = new ArrayList<>();
        synchronized (this) {
            Set<String> members = new LinkedHashSet<>();
            members.add(creator);
            roomMembers.put(roomId, members);
            deliveries.add(enqueue(creator, new SyncEvent.RoomCreated(roomId)));
            for (String invitee : invitees) {
                invites.computeIfAbsent(invitee, k -> new LinkedHashSet<>()).add(roomId);
                deliveries.add(enqueue(invitee, new SyncEvent.Invite(roomId)));
            }
        }
        deliveries.forEach(Delivery::run);
        return roomId;
    }

    synchronized void join(String userId, String roomId) throws ChatClientException {
        Set<String> members = roomMembers.get(roomId);
        if (members == null) {
            throw new ChatClientException("M_NOT_FOUND: unknown room " + roomId);
        }
        members.add(userId);
        Set<String> pending = invites.get(userId);
        if (pending != null) {
            pending.remove(roomId);
        }
    }

    String send(String sender, String roomId, String text) throws ChatClientException {
        String eventId = "$" + UUID.randomUUID();
        List<Delivery> deliveries = new ArrayList<>();
        synchronized (this) {
            Set<String> members = roomMembers.get(roomId);
            if (members == null || !members.contains(sender)) {
                throw new ChatClientException("M_FORBIDDEN: " + sender + " is not in room " + roomId);
            }
            SyncEvent.Message message = new SyncEvent.Message(roomId, eventId, sender, text);
            for (String member : members) {
                if (!member.equals(sender)) {
                    deliveries.add(enqueue(member, message));
                }
            }
        }
        deliveries.forEach(Delivery::run);
        return eventId;
    }

    synchronized void setStatus(String userId, String status) {
        statuses.put(userId, status);
    }

    public synchronized String getStatus(String userId) {
        return statuses.get(userId);
    }

    public synchronized List<String> joinedRooms(String userId) {
        List<String> joined = new ArrayList<>();
        roomMembers.forEach((roomId, members) -> {
            if (members.contains(userId)) {
                joined.add(roomId);
            }
        });
        return joined;
    }

    public synchronized List<String> invitedRooms(String userId) {
        return new ArrayList<>(invites.getOrDefault(userId, Set.of()));
    }

    public synchronized Set<String> members(String roomId) {
        return new LinkedHashSet<>(roomMembers.getOrDefault(roomId, Set.of()));
    }

    /**
     * Registers a running sync and replays what was missed while the user was offline.
     */
    void attach(LoopbackChatClient client) {
        List<SyncEvent> missed;
        synchronized (this) {
            syncing.put(client.userId(), client);
            missed = backlog.remove(client.userId());
        }
        if (missed != null) {
            missed.forEach(client::deliver);
        }
    }

    synchronized void detach(LoopbackChatClient client) {
        syncing.remove(client.userId(), client);
    }

    // caller holds the monitor
    private Delivery enqueue(String userId, SyncEvent event) {
        LoopbackChatClient target = syncing.get(userId);
        if (target != null && target.isSyncRunning()) {
            return new Delivery(target, event);
        }
        if (target != null) {
            syncing.remove(userId);
        }
        backlog.computeIfAbsent(userId, k -> new ArrayList<>()).add(event);
        return Delivery.NONE;
    }

    private record Delivery(LoopbackChatClient target, SyncEvent event) {

        static final Delivery NONE = new Delivery(null, null);

        void run() {
            if (target != null) {
                target.deliver(event);
            }
        }
    }
}
