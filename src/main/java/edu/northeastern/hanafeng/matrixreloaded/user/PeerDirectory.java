package edu.northeastern.hanafeng.matrixreloaded.user;

import java.util.Optional;

/**
 * Lookup of other simulated users, used when a user adds a friend.
 */
@FunctionalInterface
public interface PeerDirectory {

    PeerDirectory NONE = userId -> Optional.empty();

    Optional<String> randomPeerOf(String userId);
}
