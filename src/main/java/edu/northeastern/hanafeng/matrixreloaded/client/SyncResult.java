package edu.northeastern.hanafeng.matrixreloaded.client;

import java.util.List;

/**
 * Initial state returned when a background sync starts.
 */
public record SyncResult(List<String> joinedRooms, List<String> invitedRooms, SyncHandle syncHandle) {

    public SyncResult {
        joinedRooms = List.copyOf(joinedRooms);
        invitedRooms = List.copyOf(invitedRooms);
    }
}
