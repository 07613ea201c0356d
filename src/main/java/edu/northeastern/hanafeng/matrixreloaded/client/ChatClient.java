package edu.northeastern.hanafeng.matrixreloaded.client;

import java.util.List;

/**
 * Homeserver operations available to a single simulated user.
 * <p>
 * Every request method throws {@link ChatClientException} when the request fails and
 * {@link InterruptedException} when the calling task is cancelled. Implementations must
 * leave no half-applied local state behind in either case.
 */
public interface ChatClient {

    /** Full user id, e.g. {@code @user_1_1700000000000:matrix.example.org}. */
    String userId();

    RegistrationStatus register(String localpart) throws ChatClientException, InterruptedException;

    LoginStatus login(String localpart) throws ChatClientException, InterruptedException;

    /**
     * Starts the background sync. Messages from other members are reported to {@code listener}
     * as they arrive; all inbound events are also buffered for {@link #readSyncEvents()}.
     */
    SyncResult sync(SyncListener listener) throws ChatClientException, InterruptedException;

    /**
     * Drains the events buffered by the background sync since the previous call.
     * Does not contact the homeserver.
     */
    List<SyncEvent> readSyncEvents();

    /** Creates a room, invites {@code invitees} and returns the new room id. */
    String createRoom(List<String> invitees) throws ChatClientException, InterruptedException;

    void joinRoom(String roomId) throws ChatClientException, InterruptedException;

    /** Returns the event id assigned by the homeserver. */
    String sendMessage(String roomId, String text) throws ChatClientException, InterruptedException;

    /** Opens a direct room with {@code userId} and returns its id. */
    String addFriend(String userId) throws ChatClientException, InterruptedException;

    void updateStatus(String status) throws ChatClientException, InterruptedException;

    void logout() throws ChatClientException, InterruptedException;

    /** Drops the session and credentials so the user can log in again. */
    void reset();
}
