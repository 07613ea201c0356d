package edu.northeastern.hanafeng.matrixreloaded.client;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Stop signal shared between a background sync and the user that owns it.
 * Either side may request the stop; the user polls it without blocking.
 */
public class SyncHandle {

    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    public void stop() {
        stopRequested.set(true);
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }
}
