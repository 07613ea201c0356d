package edu.northeastern.hanafeng.matrixreloaded.common.services;

import edu.northeastern.hanafeng.matrixreloaded.common.utils.EnvironmentUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.services.cloudwatch.CloudWatchClient;
import software.amazon.awssdk.services.cloudwatch.model.Dimension;
import software.amazon.awssdk.services.cloudwatch.model.MetricDatum;
import software.amazon.awssdk.services.cloudwatch.model.PutMetricDataRequest;
import software.amazon.awssdk.services.cloudwatch.model.StandardUnit;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "simulation.cloudwatch", name = "enabled", havingValue = "true")
public class CloudWatchMetricsService {

    static final int MAX_DATUMS_PER_REQUEST = 1000;

    private final CloudWatchClient cloudWatchClient;
    private final EnvironmentUtils environmentUtils;

    @Value("${simulation.cloudwatch.namespace:MatrixReloaded}")
    private String namespace;

    @Value("${simulation.cloudwatch.storage-resolution:60}")
    private int storageResolution;

    /**
     * Builds a datum tagged with this host's name and the given dimensions.
     */
    public MetricDatum datum(String metricName, double value, StandardUnit unit, Map<String, String> dimensions) {
        List<Dimension> allDimensions = new ArrayList<>();
        allDimensions.add(Dimension.builder().name("Hostname").value(environmentUtils.getHostname()).build());
        dimensions.forEach((name, dimensionValue) ->
                allDimensions.add(Dimension.builder().name(name).value(dimensionValue).build()));

        return MetricDatum.builder()
                .metricName(metricName)
                .unit(unit)
                .value(value)
                .timestamp(Instant.now())
                .dimensions(allDimensions)
                .storageResolution(storageResolution)
                .build();
    }

    public void recordMetrics(List<MetricDatum> data) {
        for (int from = 0; from < data.size(); from += MAX_DATUMS_PER_REQUEST) {
            List<MetricDatum> batch = data.subList(from, Math.min(data.size(), from + MAX_DATUMS_PER_REQUEST));
            try {
                PutMetricDataRequest request = PutMetricDataRequest.builder()
                        .namespace(namespace)
                        .metricData(batch)
                        .build();

                cloudWatchClient.putMetricData(request);
                log.info("Published {} CloudWatch metrics to namespace: {} with hostname: {}",
                        batch.size(), namespace, environmentUtils.getHostname());
            } catch (Exception e) {
                log.error("Failed to publish {} CloudWatch metrics to namespace: {}", batch.size(), namespace, e);
            }
        }
    }
}
