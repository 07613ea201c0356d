package edu.northeastern.hanafeng.matrixreloaded.report;

import edu.northeastern.hanafeng.matrixreloaded.common.services.CloudWatchMetricsService;
import edu.northeastern.hanafeng.matrixreloaded.metrics.MetricsReport;
import edu.northeastern.hanafeng.matrixreloaded.metrics.RequestMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.cloudwatch.model.MetricDatum;
import software.amazon.awssdk.services.cloudwatch.model.StandardUnit;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Publishes a summary of each step report to CloudWatch.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "simulation.cloudwatch", name = "enabled", havingValue = "true")
public class CloudWatchStepReportPublisher implements StepReportSink {

    private final CloudWatchMetricsService cloudWatchMetricsService;

    @Override
    public void publish(StepReport report) {
        try {
            cloudWatchMetricsService.recordMetrics(toMetrics(report));
        } catch (Exception e) {
            log.error("Failed to publish report of step {} to CloudWatch", report.getStep(), e);
        }
    }

    List<MetricDatum> toMetrics(StepReport report) {
        Map<String, String> step = Map.of("Step", String.valueOf(report.getStep()));
        MetricsReport metrics = report.getReport();

        List<MetricDatum> data = new ArrayList<>();
        data.add(cloudWatchMetricsService.datum("StepUsers", report.getStepUsers(), StandardUnit.COUNT, step));
        data.add(cloudWatchMetricsService.datum("StepFriendships", report.getStepFriendships(), StandardUnit.COUNT, step));
        data.add(cloudWatchMetricsService.datum("MessagesSent", metrics.getMessagesSent(), StandardUnit.COUNT, step));
        data.add(cloudWatchMetricsService.datum("MessagesReceived", metrics.getMessagesReceived(), StandardUnit.COUNT, step));
        data.add(cloudWatchMetricsService.datum("MessagesPending", metrics.getMessagesPending(), StandardUnit.COUNT, step));

        metrics.getRequests().forEach((request, stats) -> {
            Map<String, String> dimensions = Map.of("Step", String.valueOf(report.getStep()), "Request", request);
            data.addAll(requestMetrics(stats, dimensions));
        });
        return data;
    }

    private List<MetricDatum> requestMetrics(RequestMetrics stats, Map<String, String> dimensions) {
        return List.of(
                cloudWatchMetricsService.datum("Requests", stats.getRequests(), StandardUnit.COUNT, dimensions),
                cloudWatchMetricsService.datum("RequestErrors", stats.getErrors(), StandardUnit.COUNT, dimensions),
                cloudWatchMetricsService.datum("Throughput", stats.getThroughputPerSecond(), StandardUnit.COUNT_SECOND, dimensions),
                cloudWatchMetricsService.datum("LatencyP50", stats.getP50Ms(), StandardUnit.MILLISECONDS, dimensions),
                cloudWatchMetricsService.datum("LatencyP99", stats.getP99Ms(), StandardUnit.MILLISECONDS, dimensions)
        );
    }
}
