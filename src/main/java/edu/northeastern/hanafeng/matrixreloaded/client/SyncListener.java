package edu.northeastern.hanafeng.matrixreloaded.client;

/**
 * Callback invoked by the background sync for every message posted by another member
 * of a joined room. Called from the sync's own thread.
 */
@FunctionalInterface
public interface SyncListener {

    void onMessage(SyncEvent.Message message);
}
