package edu.northeastern.hanafeng.matrixreloaded.metrics;

import java.util.Locale;

/**
 * Kinds of homeserver request a simulated user performs. Metrics are grouped by kind.
 */
public enum UserRequest {
    REGISTER,
    LOGIN,
    SYNC,
    CREATE_ROOM,
    JOIN_ROOM,
    SEND_MESSAGE,
    ADD_FRIEND,
    UPDATE_STATUS,
    LOGOUT;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
