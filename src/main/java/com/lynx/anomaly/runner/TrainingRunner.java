package com.lynx.anomaly.runner;

import com.lynx.anomaly.config.TrainingConfig;
import com.lynx.anomaly.exception.TrainingException;
import com.lynx.anomaly.service.TrainingPipelineService;
import com.lynx.anomaly.service.TrainingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Runs one training job on startup.
 *
 * Run with:  java -jar lynx-anomaly-trainer.jar --trainer.input-csv=data.csv --trainer.contamination=0.05
 */
@Component
@ConditionalOnProperty(prefix = "trainer", name = "run-on-startup", havingValue = "true", matchIfMissing = true)
public class TrainingRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(TrainingRunner.class);

    private final TrainingPipelineService pipelineService;
    private final TrainingConfig config;
    private int exitCode = 0;

    public TrainingRunner(TrainingPipelineService pipelineService, TrainingConfig config) {
        this.pipelineService = pipelineService;
        this.config = config;
    }

    @Override
    public void run(String... args) {
        log.info("=== Isolation Forest training ===");
        log.info("Configuration: input={}, output={}, contamination={}, trees={}, scaler={}, validationSplit={}",
                config.getInputCsv(), config.getOutputDir(), config.getContamination(),
                config.getNumTrees(), config.getScaler(), config.getValidationSplit());

        try {
            TrainingResult result = pipelineService.run(config);
            logSummary(result);
            exitCode = 0;
        } catch (TrainingException e) {
            log.error("Training failed at stage '{}': {}", e.getStage().label(), e.getMessage(), e);
            exitCode = 1;
        }
    }

    private void logSummary(TrainingResult result) {
        log.info("=== Training completed successfully ===");
        log.info("Model exported to: {}", result.exportReport().directory());
        log.info("Features monitored: {} ({})", result.featureNames().size(), String.join(", ", result.featureNames()));
        log.info("Anomaly detection threshold: {}", String.format("%.4f", result.forest().getOffset()));
        log.info("Expected anomaly rate: {}", String.format("%.1f%%", result.forest().getContamination() * 100));

        Map<String, Boolean> health = result.metrics().getModelHealth().asMap();
        List<String> issues = health.entrySet().stream()
                .filter(e -> !e.getValue())
                .map(Map.Entry::getKey)
                .toList();
        if (issues.isEmpty()) {
            log.info("All model health checks passed");
        } else {
            log.warn("Health concerns: {}", issues);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
