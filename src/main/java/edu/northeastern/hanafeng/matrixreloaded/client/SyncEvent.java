package edu.northeastern.hanafeng.matrixreloaded.client;

/**
 * Inbound event observed by a user's background sync.
 */
public sealed interface SyncEvent permits SyncEvent.Invite, SyncEvent.Message, SyncEvent.RoomCreated {

    String roomId();

    /** The user was invited to a room. */
    record Invite(String roomId) implements SyncEvent {
    }

    /** Another member posted a message in a joined room. */
    record Message(String roomId, String eventId, String sender, String text) implements SyncEvent {
    }

    /** A room created by this user, which it joined automatically. */
    record RoomCreated(String roomId) implements SyncEvent {
    }
}
