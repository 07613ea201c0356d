package edu.northeastern.hanafeng.matrixreloaded.report;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.northeastern.hanafeng.matrixreloaded.config.SimulationConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Keeps a JSON file with the number of users every execution created, keyed by execution id.
 * This is all the state the simulator keeps between runs.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UserCounterStore {

    private static final TypeReference<LinkedHashMap<String, UserCount>> COUNTS_TYPE = new TypeReference<>() {
    };

    private final SimulationConfig config;
    private final ObjectMapper objectMapper;

    public record UserCount(String homeserverUrl, int amount) {
    }

    public Map<String, UserCount> load() {
        File file = new File(config.getUsersStateFile());
        if (!file.exists()) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(file, COUNTS_TYPE);
        } catch (IOException e) {
            log.warn("Couldn't read user counters from {}, starting over", file, e);
            return new LinkedHashMap<>();
        }
    }

    public synchronized void record(long executionId, String homeserverUrl, int amount) {
        File file = new File(config.getUsersStateFile());
        Map<String, UserCount> counts = load();
        counts.put(String.valueOf(executionId), new UserCount(homeserverUrl, amount));
        try {
            File parent = file.getAbsoluteFile().getParentFile();
            if (parent != null && !parent.exists() && !parent.mkdirs()) {
                log.warn("Couldn't create directory {}", parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file, counts);
            log.info("Recorded {} users for execution {} in {}", amount, executionId, file);
        } catch (IOException e) {
            log.error("Failed to save user counters to {}", file, e);
        }
    }
}
