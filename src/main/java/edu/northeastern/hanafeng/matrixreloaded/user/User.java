package edu.northeastern.hanafeng.matrixreloaded.user;

import edu.northeastern.hanafeng.matrixreloaded.client.ChatClient;
import edu.northeastern.hanafeng.matrixreloaded.client.ChatClientException;
import edu.northeastern.hanafeng.matrixreloaded.client.LoginStatus;
import edu.northeastern.hanafeng.matrixreloaded.client.RegistrationStatus;
import edu.northeastern.hanafeng.matrixreloaded.client.SyncEvent;
import edu.northeastern.hanafeng.matrixreloaded.client.SyncResult;
import edu.northeastern.hanafeng.matrixreloaded.metrics.Event;
import edu.northeastern.hanafeng.matrixreloaded.metrics.EventChannel;
import edu.northeastern.hanafeng.matrixreloaded.metrics.UserRequest;
import edu.northeastern.hanafeng.matrixreloaded.support.MessageTextPool;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A simulated user and its lifecycle state machine.
 * <p>
 * Each {@link #act(PeerDirectory)} performs at most one homeserver request chosen by
 * the current {@link UserState}, and moves to the next state once that request has
 * returned. If the call is interrupted the state stays as it was, so the same
 * step is simply attempted again later.
 * <p>
 * Thread-safe: a user acts on behalf of at most one thread at a time; a concurrent
 * {@code act} call returns without doing anything.
 */
@Slf4j
public class User {

    @Getter
    private final String id;
    @Getter
    private final String localpart;
    private final ChatClient client;
    private final EventChannel events;
    private final SocialActionPicker picker;
    private final AtomicBoolean acting = new AtomicBoolean(false);

    @Getter
    private volatile UserState state;

    public User(String localpart, ChatClient client, EventChannel events, SocialActionPicker picker) {
        this.id = client.userId();
        this.localpart = localpart;
        this.client = client;
        this.events = events;
        this.picker = picker;
        this.state = new UserState.Unregistered();
    }

    public void act(PeerDirectory peers) throws InterruptedException {
        if (!acting.compareAndSet(false, true)) {
            log.debug("User {} is still busy with a previous action, skipping", id);
            return;
        }
        try {
            state = next(state, peers);
        } finally {
            acting.set(false);
        }
    }

    public boolean isSyncing() {
        return state instanceof UserState.Syncing;
    }

    public List<String> knownRooms() {
        UserState current = state;
        if (current instanceof UserState.Syncing syncing) {
            return syncing.rooms().snapshot();
        }
        return List.of();
    }

    /**
     * Creates a room inviting {@code invitees} and remembers it. Used while wiring friendships.
     *
     * @throws ChatClientException also when the user is not syncing at the moment
     */
    public String createRoom(List<String> invitees) throws ChatClientException, InterruptedException {
        RoomSet rooms = syncing("createRoom").rooms();
        String roomId = timed(UserRequest.CREATE_ROOM, () -> client.createRoom(invitees));
        rooms.add(roomId);
        return roomId;
    }

    public void joinRoom(String roomId) throws ChatClientException, InterruptedException {
        joinRoom(syncing("joinRoom").rooms(), roomId);
    }

    /**
     * Asks the background sync to stop. The user logs out on its next action.
     */
    public void stopSync() {
        if (state instanceof UserState.Syncing syncing) {
            syncing.syncHandle().stop();
        }
    }

    private UserState next(UserState current, PeerDirectory peers) throws InterruptedException {
        if (current instanceof UserState.Unregistered) {
            return register(current);
        }
        if (current instanceof UserState.Unauthenticated) {
            return login(current);
        }
        if (current instanceof UserState.LoggedIn) {
            return startSync(current);
        }
        if (current instanceof UserState.Syncing syncing) {
            return socialize(syncing, peers);
        }
        if (current instanceof UserState.LoggedOut) {
            return restart();
        }
        throw new IllegalStateException("Unknown user state: " + current);
    }

    private UserState register(UserState current) throws InterruptedException {
        try {
            RegistrationStatus status = timed(UserRequest.REGISTER, () -> client.register(localpart));
            if (status == RegistrationStatus.ALREADY_EXISTS) {
                log.info("User {} is already registered, proceeding to login", id);
            }
            return new UserState.Unauthenticated();
        } catch (ChatClientException e) {
            return current;
        }
    }

    private UserState login(UserState current) throws InterruptedException {
        try {
            LoginStatus status = timed(UserRequest.LOGIN, () -> client.login(localpart));
            if (status == LoginStatus.NOT_REGISTERED) {
                log.info("User {} is not registered on the homeserver, registering again", id);
                return new UserState.Unregistered();
            }
            return new UserState.LoggedIn();
        } catch (ChatClientException e) {
            return current;
        }
    }

    private UserState startSync(UserState current) throws InterruptedException {
        try {
            SyncResult result = timed(UserRequest.SYNC, () -> client.sync(this::onMessage));
            Deque<SyncEvent> pending = new ConcurrentLinkedDeque<>();
            result.invitedRooms().forEach(roomId -> pending.addLast(new SyncEvent.Invite(roomId)));
            log.info("User {} is now syncing with {} rooms and {} invites",
                    id, result.joinedRooms().size(), result.invitedRooms().size());
            return new UserState.Syncing(new RoomSet(result.joinedRooms()), pending, result.syncHandle());
        } catch (ChatClientException e) {
            return current;
        }
    }

    private UserState socialize(UserState.Syncing syncing, PeerDirectory peers) throws InterruptedException {
        if (syncing.syncHandle().isStopRequested()) {
            log.info("Sync of user {} was stopped, logging out", id);
            return new UserState.LoggedOut();
        }

        Deque<SyncEvent> pending = syncing.pendingEvents();
        for (SyncEvent event : client.readSyncEvents()) {
            if (event instanceof SyncEvent.RoomCreated) {
                syncing.rooms().add(event.roomId());
            } else if (!(event instanceof SyncEvent.Invite && syncing.rooms().contains(event.roomId()))) {
                pending.addLast(event);
            }
        }

        SyncEvent latest = pending.peekLast();
        if (latest != null) {
            react(syncing, latest);
            // removed only once handled, an interrupted reaction is retried
            pending.removeLastOccurrence(latest);
            return syncing;
        }

        try {
            switch (picker.pick()) {
                case LOG_OUT:
                    timed(UserRequest.LOGOUT, () -> {
                        client.logout();
                        return null;
                    });
                    syncing.syncHandle().stop();
                    return new UserState.LoggedOut();
                case UPDATE_STATUS:
                    timed(UserRequest.UPDATE_STATUS, () -> {
                        client.updateStatus(MessageTextPool.randomStatus());
                        return null;
                    });
                    break;
                case ADD_FRIEND:
                    addFriend(syncing, peers);
                    break;
                case SEND_MESSAGE:
                    Optional<String> roomId = syncing.rooms().random();
                    if (roomId.isPresent()) {
                        sendMessage(roomId.get());
                    } else {
                        log.debug("User {} has no rooms to talk in yet", id);
                    }
                    break;
                default:
                    break;
            }
        } catch (ChatClientException e) {
            log.debug("Social action of user {} failed: {}", id, e.getMessage());
        }
        return syncing;
    }

    private void react(UserState.Syncing syncing, SyncEvent event) throws InterruptedException {
        try {
            if (event instanceof SyncEvent.Invite invite) {
                joinRoom(syncing.rooms(), invite.roomId());
            } else if (event instanceof SyncEvent.Message message) {
                sendMessage(message.roomId());
            }
        } catch (ChatClientException e) {
            log.debug("User {} dropped {} after: {}", id, event, e.getMessage());
        }
    }

    private void joinRoom(RoomSet rooms, String roomId) throws ChatClientException, InterruptedException {
        timed(UserRequest.JOIN_ROOM, () -> {
            client.joinRoom(roomId);
            return null;
        });
        rooms.add(roomId);
    }

    private void addFriend(UserState.Syncing syncing, PeerDirectory peers)
            throws ChatClientException, InterruptedException {
        Optional<String> peer = peers.randomPeerOf(id);
        if (peer.isEmpty()) {
            log.debug("User {} found nobody to befriend", id);
            return;
        }
        String roomId = timed(UserRequest.ADD_FRIEND, () -> client.addFriend(peer.get()));
        syncing.rooms().add(roomId);
    }

    private void sendMessage(String roomId) throws ChatClientException, InterruptedException {
        String eventId = timed(UserRequest.SEND_MESSAGE, () -> client.sendMessage(roomId, MessageTextPool.randomMessage()));
        events.send(new Event.MessageSent(eventId));
    }

    private UserState restart() {
        client.reset();
        log.debug("User {} reset its session", id);
        return new UserState.Unauthenticated();
    }

    private void onMessage(SyncEvent.Message message) {
        if (id.equals(message.sender())) {
            return;
        }
        try {
            events.send(new Event.MessageReceived(message.eventId()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while recording receipt of {} by {}", message.eventId(), id);
        }
    }

    private UserState.Syncing syncing(String operation) throws ChatClientException {
        UserState current = state;
        if (current instanceof UserState.Syncing syncing) {
            return syncing;
        }
        throw new ChatClientException(operation + " requires a syncing user, " + id + " is " + current);
    }

    /**
     * Runs one homeserver request and reports its duration, or its failure, to the metrics channel.
     */
    private <T> T timed(UserRequest request, ClientCall<T> call) throws ChatClientException, InterruptedException {
        long start = System.nanoTime();
        try {
            T result = call.call();
            events.send(new Event.RequestDuration(request, Duration.ofNanos(System.nanoTime() - start)));
            return result;
        } catch (ChatClientException e) {
            log.debug("{} of user {} failed: {}", request, id, e.getMessage());
            events.send(new Event.RequestError(request, e));
            throw e;
        }
    }

    @FunctionalInterface
    private interface ClientCall<T> {
        T call() throws ChatClientException, InterruptedException;
    }
}
