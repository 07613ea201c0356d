package edu.northeastern.hanafeng.matrixreloaded.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import edu.northeastern.hanafeng.matrixreloaded.config.SimulationConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class UserCounterStoreTest {

    @TempDir
    Path tempDir;

    private SimulationConfig config;
    private UserCounterStore store;

    @BeforeEach
    void setUp() {
        config = new SimulationConfig();
        config.setUsersStateFile(tempDir.resolve("state").resolve("users.json").toString());
        store = new UserCounterStore(config, new ObjectMapper());
    }

    @Test
    void testLoad_MissingFile_IsEmpty() {
        assertTrue(store.load().isEmpty());
    }

    @Test
    void testRecord_AppendsPerExecution() {
        // When
        store.record(1L, "https://hs-a", 20);
        store.record(2L, "https://hs-b", 5);

        // Then
        Map<String, UserCounterStore.UserCount> counts = store.load();
        assertEquals(List.of("1", "2"), List.copyOf(counts.keySet()));
        assertEquals(new UserCounterStore.UserCount("https://hs-a", 20), counts.get("1"));
        assertEquals(new UserCounterStore.UserCount("https://hs-b", 5), counts.get("2"));
    }

    @Test
    void testRecord_SameExecutionOverwrites() {
        // When
        store.record(1L, "https://hs", 20);
        store.record(1L, "https://hs", 30);

        // Then
        assertEquals(30, store.load().get("1").amount());
    }

    @Test
    void testLoad_CorruptFile_StartsOver() throws IOException {
        // Given
        Path file = Path.of(config.getUsersStateFile());
        Files.createDirectories(file.getParent());
        Files.writeString(file, "{not json");

        // When
        store.record(3L, "https://hs", 1);

        // Then
        assertEquals(Map.of("3", new UserCounterStore.UserCount("https://hs", 1)), store.load());
    }
}
