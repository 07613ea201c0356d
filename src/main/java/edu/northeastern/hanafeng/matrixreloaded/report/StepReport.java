package edu.northeastern.hanafeng.matrixreloaded.report;

import edu.northeastern.hanafeng.matrixreloaded.metrics.MetricsReport;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class StepReport {

    private long executionId;
    private int step;
    private String homeserver;
    private String generatedBy;
    private Instant generatedAt;
    private int stepUsers;
    private int stepFriendships;
    private MetricsReport report;
}
