package edu.northeastern.hanafeng.matrixreloaded.client.loopback;

import edu.northeastern.hanafeng.matrixreloaded.client.ChatClient;
import edu.northeastern.hanafeng.matrixreloaded.client.ChatClientException;
import edu.northeastern.hanafeng.matrixreloaded.client.ClientOptions;
import edu.northeastern.hanafeng.matrixreloaded.client.LoginStatus;
import edu.northeastern.hanafeng.matrixreloaded.client.RegistrationStatus;
import edu.northeastern.hanafeng.matrixreloaded.client.SyncEvent;
import edu.northeastern.hanafeng.matrixreloaded.client.SyncHandle;
import edu.northeastern.hanafeng.matrixreloaded.client.SyncListener;
import edu.northeastern.hanafeng.matrixreloaded.client.SyncResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * {@link ChatClient} backed by a {@link LoopbackHomeserver}.
 */
@Slf4j
public class LoopbackChatClient implements ChatClient {

    private final LoopbackHomeserver homeserver;
    private final String userId;
    private final ClientOptions options;
    private final Queue<SyncEvent> inbox = new ConcurrentLinkedQueue<>();

    private volatile boolean loggedIn;
    private volatile SyncHandle syncHandle;
    private volatile SyncListener listener;

    public LoopbackChatClient(LoopbackHomeserver homeserver, String userId, ClientOptions options) {
        this.homeserver = homeserver;
        this.userId = userId;
        this.options = options;
    }

    @Override
    public String userId() {
        return userId;
    }

    @Override
    public RegistrationStatus register(String localpart) throws ChatClientException, InterruptedException {
        call("register");
        return homeserver.register(localpart);
    }

    @Override
    public LoginStatus login(String localpart) throws ChatClientException, InterruptedException {
        call("login");
        if (!homeserver.isRegistered(localpart)) {
            return LoginStatus.NOT_REGISTERED;
        }
        loggedIn = true;
        return LoginStatus.LOGGED_IN;
    }

    @Override
    public SyncResult sync(SyncListener listener) throws ChatClientException, InterruptedException {
        requireSession("sync");
        call("sync");
        SyncHandle handle = new SyncHandle();
        this.listener = listener;
        this.syncHandle = handle;
        SyncResult result = new SyncResult(homeserver.joinedRooms(userId), homeserver.invitedRooms(userId), handle);
        homeserver.attach(this);
        return result;
    }

    @Override
    public List<SyncEvent> readSyncEvents() {
        List<SyncEvent> drained = new ArrayList<>();
        SyncEvent event;
        while ((event = inbox.poll()) != null) {
            drained.add(event);
        }
        return drained;
    }

    @Override
    public String createRoom(List<String> invitees) throws ChatClientException, InterruptedException {
        requireSession("createRoom");
        call("createRoom");
        return homeserver.createRoom(userId, invitees);
    }

    @Override
    public void joinRoom(String roomId) throws ChatClientException, InterruptedException {
        requireSession("joinRoom");
        call("joinRoom");
        homeserver.join(userId, roomId);
    }

    @Override
    public String sendMessage(String roomId, String text) throws ChatClientException, InterruptedException {
        requireSession("sendMessage");
        call("sendMessage");
        return homeserver.send(userId, roomId, text);
    }

    @Override
    public String addFriend(String friendId) throws ChatClientException, InterruptedException {
        requireSession("addFriend");
        call("addFriend");
        return homeserver.createRoom(userId, List.of(friendId));
    }

    @Override
    public void updateStatus(String status) throws ChatClientException, InterruptedException {
        requireSession("updateStatus");
        call("updateStatus");
        homeserver.setStatus(userId, status);
    }

    @Override
    public void logout() throws ChatClientException, InterruptedException {
        requireSession("logout");
        call("logout");
        stopSync();
        loggedIn = false;
    }

    @Override
    public void reset() {
        stopSync();
        loggedIn = false;
        inbox.clear();
    }

    boolean isSyncRunning() {
        SyncHandle handle = syncHandle;
        return handle != null && !handle.isStopRequested();
    }

    void deliver(SyncEvent event) {
        if (!isSyncRunning()) {
            return;
        }
        inbox.add(event);
        SyncListener current = listener;
        if (current != null && event instanceof SyncEvent.Message message) {
            current.onMessage(message);
        }
    }

    private void stopSync() {
        SyncHandle handle = syncHandle;
        if (handle != null) {
            handle.stop();
        }
        homeserver.detach(this);
        syncHandle = null;
        listener = null;
    }

    private void requireSession(String operation) throws ChatClientException {
        if (!loggedIn) {
            throw new ChatClientException(operation + " failed: M_MISSING_TOKEN for " + userId);
        }
    }

    private void call(String operation) throws ChatClientException, InterruptedException {
        int attempts = options.retryEnabled() ? 2 : 1;
        for (int attempt = 1; ; attempt++) {
            try {
                homeserver.request(operation, options.requestTimeout());
                return;
            } catch (ChatClientException e) {
                if (attempt >= attempts) {
                    throw e;
                }
                log.debug("Retrying {} for {} after: {}", operation, userId, e.getMessage());
            }
        }
    }
}
