package edu.northeastern.hanafeng.matrixreloaded.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import edu.northeastern.hanafeng.matrixreloaded.config.SimulationConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Writes each step report to {@code {outputDir}/{executionId}/report_{step}_{millis}.yaml}.
 */
@Slf4j
@Component
public class YamlStepReportWriter implements StepReportSink {

    static final String FALLBACK_OUTPUT_DIR = "output";

    private final SimulationConfig config;
    private final ObjectMapper yamlMapper;

    public YamlStepReportWriter(SimulationConfig config, @Qualifier("yamlObjectMapper") ObjectMapper yamlMapper) {
        this.config = config;
        this.yamlMapper = yamlMapper;
    }

    @Override
    public void publish(StepReport report) {
        try {
            Path directory = ensureDirectory(report.getExecutionId());
            Path path = directory.resolve(String.format("report_%d_%d.yaml", report.getStep(), System.currentTimeMillis()));
            yamlMapper.writeValue(path.toFile(), report);
            log.info("Step report generated: {}", path);
        } catch (IOException e) {
            log.error("Failed to write report of step {}", report.getStep(), e);
        }
    }

    Path ensureDirectory(long executionId) throws IOException {
        Path preferred = Paths.get(config.getOutputDir(), String.valueOf(executionId));
        try {
            return Files.createDirectories(preferred);
        } catch (IOException e) {
            Path fallback = Paths.get(FALLBACK_OUTPUT_DIR, String.valueOf(executionId));
            log.warn("Couldn't create output folder {}, defaulting to {}", preferred, fallback);
            return Files.createDirectories(fallback);
        }
    }
}
