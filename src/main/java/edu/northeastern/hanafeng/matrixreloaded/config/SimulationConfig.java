package edu.northeastern.hanafeng.matrixreloaded.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Component
@ConfigurationProperties(prefix = "simulation")
@Validated
public class SimulationConfig {

    @NotBlank(message = "homeserverUrl is required")
    private String homeserverUrl = "loopback.local";

    @NotBlank(message = "outputDir is required")
    private String outputDir = "output";

    @Min(value = 1, message = "totalSteps must be at least 1")
    private int totalSteps = 2;

    @Min(value = 0, message = "usersPerStep must be >= 0")
    @Max(value = 1000000, message = "usersPerStep cannot exceed 1,000,000")
    private int usersPerStep = 10;

    @DecimalMin(value = "0.0", inclusive = false, message = "friendshipRatio must be greater than 0")
    @DecimalMax(value = "1.0", message = "friendshipRatio cannot exceed 1")
    private double friendshipRatio = 0.1;

    @NotNull
    private Duration stepDuration = Duration.ofSeconds(30);

    @NotNull
    private Duration tickDuration = Duration.ofSeconds(1);

    @Min(value = 1, message = "maxUsersToActPerTick must be at least 1")
    @Max(value = 100000, message = "maxUsersToActPerTick cannot exceed 100,000")
    private int maxUsersToActPerTick = 10;

    @NotNull
    private Duration waitingPeriod = Duration.ofSeconds(10);

    private boolean retryRequestConfig = false;

    @NotNull
    private Duration requestTimeout = Duration.ofSeconds(30);

    @Min(value = 1, message = "userCreationRetryAttempts must be at least 1")
    @Max(value = 100, message = "userCreationRetryAttempts cannot exceed 100")
    private int userCreationRetryAttempts = 3;

    @Min(value = 1, message = "userCreationThroughput must be at least 1")
    @Max(value = 5000, message = "userCreationThroughput cannot exceed 5000")
    private int userCreationThroughput = 10;

    @Min(value = 1, message = "roomCreationThroughput must be at least 1")
    @Max(value = 5000, message = "roomCreationThroughput cannot exceed 5000")
    private int roomCreationThroughput = 10;

    @Min(value = 1, message = "roomCreationRetryAttempts must be at least 1")
    @Max(value = 100, message = "roomCreationRetryAttempts cannot exceed 100")
    private int roomCreationRetryAttempts = 3;

    @Min(value = 10, message = "eventChannelCapacity must be at least 10")
    @Max(value = 1000000, message = "eventChannelCapacity cannot exceed 1,000,000")
    private int eventChannelCapacity = 1000;

    @NotBlank(message = "usersStateFile is required")
    private String usersStateFile = "users.json";

    @Valid
    private Loopback loopback = new Loopback();

    @AssertTrue(message = "tickDuration must be positive and not longer than stepDuration")
    public boolean isTickWithinStep() {
        if (tickDuration == null || stepDuration == null) {
            return true;
        }
        return !tickDuration.isNegative() && !tickDuration.isZero() && tickDuration.compareTo(stepDuration) <= 0;
    }

    /**
     * Settings of the in-process homeserver used when no real client binding is configured.
     */
    @Data
    public static class Loopback {

        @NotNull
        private Duration latency = Duration.ofMillis(5);

        @DecimalMin(value = "0.0", message = "failureRate must be >= 0")
        @DecimalMax(value = "1.0", message = "failureRate cannot exceed 1")
        private double failureRate = 0.0;
    }
}
