package edu.northeastern.hanafeng.matrixreloaded.user;

import edu.northeastern.hanafeng.matrixreloaded.client.SyncEvent;
import edu.northeastern.hanafeng.matrixreloaded.client.SyncHandle;

import java.util.Deque;

/**
 * Lifecycle state of a simulated user. Only {@link Syncing} carries data.
 */
public sealed interface UserState permits UserState.Unregistered, UserState.Unauthenticated,
        UserState.LoggedIn, UserState.Syncing, UserState.LoggedOut {

    record Unregistered() implements UserState {
    }

    record Unauthenticated() implements UserState {
    }

    record LoggedIn() implements UserState {
    }

    /**
     * @param rooms         rooms the user knows about
     * @param pendingEvents inbound events still to be reacted to, newest last
     * @param syncHandle    stop signal of the background sync
     */
    record Syncing(RoomSet rooms, Deque<SyncEvent> pendingEvents, SyncHandle syncHandle) implements UserState {
    }

    record LoggedOut() implements UserState {
    }
}
