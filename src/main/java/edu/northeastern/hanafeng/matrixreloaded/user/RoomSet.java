package edu.northeastern.hanafeng.matrixreloaded.user;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Rooms known to a syncing user. Each room appears once. Thread-safe.
 */
public class RoomSet {

    private final Set<String> rooms = new LinkedHashSet<>();

    public RoomSet() {
    }

    public RoomSet(Collection<String> initial) {
        rooms.addAll(initial);
    }

    public synchronized boolean add(String roomId) {
        return rooms.add(roomId);
    }

    public synchronized boolean contains(String roomId) {
        return rooms.contains(roomId);
    }

    public synchronized int size() {
        return rooms.size();
    }

    public synchronized List<String> snapshot() {
        return new ArrayList<>(rooms);
    }

    public Optional<String> random() {
        List<String> copy = snapshot();
        if (copy.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(copy.get(ThreadLocalRandom.current().nextInt(copy.size())));
    }
}
