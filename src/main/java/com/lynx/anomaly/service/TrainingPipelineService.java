package com.lynx.anomaly.service;

import com.lynx.anomaly.calibration.DatasetSplit;
import com.lynx.anomaly.calibration.DatasetSplitter;
import com.lynx.anomaly.calibration.ModelEvaluator;
import com.lynx.anomaly.calibration.ThresholdCalibrator;
import com.lynx.anomaly.config.ConfigSanitizer;
import com.lynx.anomaly.config.TrainingConfig;
import com.lynx.anomaly.config.TrainingMetrics;
import com.lynx.anomaly.data.TelemetryLoader;
import com.lynx.anomaly.engine.isolationforest.ForestParameters;
import com.lynx.anomaly.engine.isolationforest.IsolationForest;
import com.lynx.anomaly.engine.isolationforest.IsolationForestTrainer;
import com.lynx.anomaly.exception.ExportException;
import com.lynx.anomaly.exception.PipelineStage;
import com.lynx.anomaly.exception.TrainingException;
import com.lynx.anomaly.export.DebugCsvWriter;
import com.lynx.anomaly.export.ExportReport;
import com.lynx.anomaly.export.ModelBundle;
import com.lynx.anomaly.export.ModelBundleExporter;
import com.lynx.anomaly.inference.AnomalyDetector;
import com.lynx.anomaly.inference.ModelBundleLoader;
import com.lynx.anomaly.model.EvaluationMetrics;
import com.lynx.anomaly.model.FeatureMatrix;
import com.lynx.anomaly.model.ScalerParams;
import com.lynx.anomaly.scaling.FeatureScaler;
import com.lynx.anomaly.scaling.FeatureScalers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;
import java.util.function.Supplier;

/**
 * Runs the training job: load and validate, scale, train, calibrate and evaluate,
 * export. Each stage consumes the previous stage's output without modifying it.
 * Any failure surfaces as a {@link TrainingException} naming the stage.
 */
@Service
public class TrainingPipelineService {

    private static final Logger log = LoggerFactory.getLogger(TrainingPipelineService.class);

    // Rows re-scored through the reloaded bundle after export
    private static final int EXPORT_CHECK_ROWS = 100;
    private static final double EXPORT_CHECK_TOLERANCE = 1e-12;

    private final TelemetryLoader loader;
    private final DebugCsvWriter debugCsvWriter;
    private final ModelBundleExporter exporter;
    private final ModelBundleLoader bundleLoader;
    private final ConfigSanitizer configSanitizer;
    private final TrainingMetrics trainingMetrics;
    private final DatasetSplitter splitter = new DatasetSplitter();
    private final ThresholdCalibrator calibrator = new ThresholdCalibrator();
    private final ModelEvaluator evaluator = new ModelEvaluator();

    public TrainingPipelineService(TelemetryLoader loader,
                                   DebugCsvWriter debugCsvWriter,
                                   ModelBundleExporter exporter,
                                   ModelBundleLoader bundleLoader,
                                   ConfigSanitizer configSanitizer,
                                   TrainingMetrics trainingMetrics) {
        this.loader = loader;
        this.debugCsvWriter = debugCsvWriter;
        this.exporter = exporter;
        this.bundleLoader = bundleLoader;
        this.configSanitizer = configSanitizer;
        this.trainingMetrics = trainingMetrics;
    }

    public TrainingResult run(TrainingConfig config) {
        configSanitizer.sanitize(config);
        logMemoryUsage("initialization");

        Path outputDir = Path.of(config.getOutputDir());
        FeatureMatrix matrix = stage(PipelineStage.LOAD, () -> loader.load(Path.of(config.getInputCsv()), config));
        if (config.isWriteDebugCsv()) {
            debugCsvWriter.write(matrix, outputDir);
        }
        logMemoryUsage("after_preprocessing");
        return train(matrix, config);
    }

    /**
     * Runs every stage after loading, starting from an already validated matrix.
     */
    public TrainingResult train(FeatureMatrix matrix, TrainingConfig config) {
        configSanitizer.sanitize(config);
        double contamination = ConfigSanitizer.resolveContamination(config.getContamination());
        FeatureScaler scaler = FeatureScalers.forName(config.getScaler());

        ScalerParams scalerParams = stage(PipelineStage.SCALE, () -> scaler.fit(matrix));
        FeatureMatrix scaled = stage(PipelineStage.SCALE, () -> scaler.transform(matrix, scalerParams));
        log.info("{} scaling - center: {}, scale: {}", scalerParams.kind().label(),
                preview(scalerParams.center()), preview(scalerParams.scale()));

        DatasetSplit split = splitter.split(scaled, config.getValidationSplit(), config.getRandomState());
        if (split.hasValidation()) {
            log.info("Training on {} samples, validating on {}",
                    split.training().rowCount(), split.validation().rowCount());
        } else {
            log.info("Training on full dataset: {} samples", split.training().rowCount());
        }

        IsolationForest fitted = stage(PipelineStage.TRAIN, () -> {
            int subsample = ConfigSanitizer.resolveSubsampleSize(config.getMaxSamples(), split.training().rowCount());
            ForestParameters parameters = new ForestParameters(config.getNumTrees(), subsample,
                    config.getMaxDepth(), config.isBootstrap(), config.getRandomState(), config.getParallelism());
            return new IsolationForestTrainer(parameters).fit(split.training().toArray());
        });
        logMemoryUsage("after_training");

        double[] calibrationScores = stage(PipelineStage.EVALUATE,
                () -> fitted.decisionScores(split.calibrationRows().toArray()));
        double offset = calibrator.calibrate(calibrationScores, contamination);
        IsolationForest forest = fitted.calibrated(contamination, offset);

        EvaluationMetrics validationMetrics = null;
        if (split.hasValidation()) {
            validationMetrics = evaluator.evaluate(calibrationScores, offset, contamination);
            log.info("Validation results:");
            log.info("  Anomaly ratio: {} (expected: {})",
                    String.format("%.3f", validationMetrics.getAnomalyRatio()), String.format("%.3f", contamination));
            log.info("  Score range: {}", validationMetrics.getScoreRange());
            log.info("  Model health: {}", validationMetrics.getModelHealth().asMap());
            evaluator.warnOnHealth(validationMetrics);
        }

        EvaluationMetrics metrics = stage(PipelineStage.EVALUATE,
                () -> evaluator.evaluate(forest.decisionScores(scaled.toArray()), offset, contamination));
        logResults(metrics);
        trainingMetrics.recordRun(metrics.getAnomalyRatio(), offset);
        trainingMetrics.recordHealth(metrics.getModelHealth().asMap());

        EvaluationMetrics validation = validationMetrics;
        ExportReport report = stage(PipelineStage.EXPORT, () -> {
            Path outputDir = Path.of(config.getOutputDir());
            ModelBundle bundle = exporter.assemble(forest, scalerParams, metrics, validation, config, Instant.now());
            ExportReport written = exporter.write(bundle, outputDir);
            verifyExport(outputDir, matrix, forest, scaled);
            return written;
        });
        logMemoryUsage("completion");

        return new TrainingResult(matrix.featureNames(), scalerParams, forest, validationMetrics, metrics, report);
    }

    /**
     * Reloads the written bundle and checks it reproduces the in-memory scores on
     * the first rows of the raw matrix.
     */
    private void verifyExport(Path outputDir, FeatureMatrix raw, IsolationForest forest, FeatureMatrix scaled) {
        AnomalyDetector detector = bundleLoader.load(outputDir, raw.featureNames());
        int rows = Math.min(EXPORT_CHECK_ROWS, raw.rowCount());
        for (int i = 0; i < rows; i++) {
            double expected = forest.decisionScore(scaled.row(i));
            double actual = detector.decisionScore(raw.row(i));
            if (Math.abs(expected - actual) > EXPORT_CHECK_TOLERANCE) {
                throw new ExportException(String.format(
                        "Reloaded bundle scores row %d as %s, expected %s", i, actual, expected));
            }
        }
        log.debug("Reloaded bundle reproduces scores on {} rows", rows);
    }

    private <T> T stage(PipelineStage stage, Supplier<T> work) {
        try {
            return trainingMetrics.timeStage(stage, work);
        } catch (TrainingException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TrainingException(stage, e.getMessage(), e);
        }
    }

    private void logResults(EvaluationMetrics metrics) {
        log.info("Training results:");
        log.info("  Dataset: {} samples", metrics.getSampleCount());
        log.info("  Detected anomalies: {} ({})", metrics.getAnomaliesDetected(),
                String.format("%.2f%%", metrics.getAnomalyRatio() * 100));
        log.info("  Expected contamination: {}", String.format("%.2f%%", metrics.getExpectedContamination() * 100));
        log.info("  Contamination error: {}", String.format("%.3f", metrics.getContaminationError()));
        log.info("  Score range: {}", metrics.getScoreRange());
        log.info("  Anomaly threshold: {}", String.format("%.4f", metrics.getScoreThreshold()));
        log.info("  Model health: {}", metrics.getModelHealth().asMap());
    }

    private static String preview(double[] values) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < Math.min(3, values.length); i++) {
            if (i > 0) sb.append(", ");
            sb.append(String.format("%.4f", values[i]));
        }
        return sb.append(values.length > 3 ? ", ...]" : "]").toString();
    }

    private static void logMemoryUsage(String stage) {
        Runtime runtime = Runtime.getRuntime();
        long usedMb = (runtime.totalMemory() - runtime.freeMemory()) / (1024 * 1024);
        log.info("Memory usage at {}: {} MB", stage, usedMb);
    }
}
