package com.lynx.anomaly.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.lynx.anomaly.config.TrainingConfig;
import com.lynx.anomaly.engine.isolationforest.IsolationForest;
import com.lynx.anomaly.engine.isolationforest.IsolationTree;
import com.lynx.anomaly.exception.ExportException;
import com.lynx.anomaly.model.EvaluationMetrics;
import com.lynx.anomaly.model.ScalerParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes a {@link ModelBundle} as a set of JSON documents.
 *
 * Metadata, scaler, forest and integration guide are required: any failure
 * writing them raises {@link ExportException}. The tree-ensemble graph is optional
 * and a failure there is only logged.
 */
@Component
public class ModelBundleExporter {

    private static final Logger log = LoggerFactory.getLogger(ModelBundleExporter.class);

    public static final String MODEL_TYPE = "IsolationForest";
    public static final String MODEL_VERSION = "1.1.0";

    public static final String METADATA_FILE = "metadata.json";
    public static final String SCALER_FILE = "scaler.json";
    public static final String FOREST_FILE = "forest.json";
    public static final String GRAPH_FILE = "forest_graph.json";
    public static final String GUIDE_FILE = "integration_guide.json";

    private final ObjectMapper objectMapper;
    private final TreeEnsembleGraphEncoder graphEncoder;

    public ModelBundleExporter() {
        this(new TreeEnsembleGraphEncoder());
    }

    ModelBundleExporter(TreeEnsembleGraphEncoder graphEncoder) {
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        this.graphEncoder = graphEncoder;
    }

    public ModelBundle assemble(IsolationForest forest, ScalerParams scaler,
                                EvaluationMetrics metrics, EvaluationMetrics validationMetrics,
                                TrainingConfig config, Instant trainedAt) {
        if (!forest.isCalibrated()) {
            throw new ExportException("Cannot export a forest without a decision offset");
        }
        List<String> features = scaler.featureNames();
        String hash = FeatureOrderHash.of(features);

        BundleMetadata metadata = BundleMetadata.builder()
                .modelType(MODEL_TYPE)
                .modelVersion(MODEL_VERSION)
                .featureNames(features)
                .featureCount(features.size())
                .featureOrderHash(hash)
                .scalerKind(scaler.kind())
                .contamination(forest.getContamination())
                .estimatorCount(forest.getTrees().size())
                .maxSamples(forest.getSampleSize())
                .maxDepth(forest.getTrees().stream().mapToInt(IsolationTree::height).max().orElse(0))
                .bootstrap(config.isBootstrap())
                .decisionOffset(forest.getOffset())
                .scoreConvention(IsolationForest.SCORE_CONVENTION)
                .trainingTimestamp(trainedAt.toString())
                .evaluationMetrics(metrics)
                .validationMetrics(validationMetrics)
                .config(configSnapshot(config))
                .build();

        TreeEnsembleGraph graph = null;
        if (config.isInterchangeExport()) {
            try {
                graph = graphEncoder.encode(forest, features.size(), config.getOnnxOpset(), config.getAiOnnxMlOpset());
            } catch (RuntimeException e) {
                log.warn("Failed to encode tree-ensemble graph: {}. Continuing with other export formats", e.getMessage());
            }
        }

        IntegrationGuide guide = IntegrationGuide.builder()
                .interchangeModel(graph != null ? GRAPH_FILE : null)
                .forestModel(FOREST_FILE)
                .scalerConfig(SCALER_FILE)
                .featureOrder(features)
                .featureOrderHash(hash)
                .expectedContamination(forest.getContamination())
                .anomalyThreshold(forest.getOffset())
                .preprocessingSteps(List.of(
                        "1. Verify feature_order_hash against the hash of your feature order",
                        "2. Apply " + scaler.kind().formula() + " using center and scale from " + SCALER_FILE,
                        "3. Score scaled features with " + (graph != null ? GRAPH_FILE + " or " : "") + FOREST_FILE,
                        "4. Compare decision score to threshold for anomaly detection"))
                .thresholdCheck("anomaly = decision_score < anomaly_threshold")
                .confidence("confidence = abs(decision_score - anomaly_threshold)")
                .build();

        return new ModelBundle(metadata, ScalerDocument.from(scaler, hash), ForestDocument.from(forest, hash),
                guide, graph);
    }

    public ExportReport write(ModelBundle bundle, Path outputDir) {
        List<String> files = new ArrayList<>();
        try {
            Files.createDirectories(outputDir);
            writeJson(outputDir.resolve(METADATA_FILE), bundle.metadata(), files);
            writeJson(outputDir.resolve(SCALER_FILE), bundle.scaler(), files);
            writeJson(outputDir.resolve(FOREST_FILE), bundle.forest(), files);
            writeJson(outputDir.resolve(GUIDE_FILE), bundle.guide(), files);
        } catch (IOException e) {
            throw new ExportException("Failed to write required model artifacts to " + outputDir, e);
        }

        boolean interchange = false;
        if (bundle.interchange() != null) {
            try {
                writeJson(outputDir.resolve(GRAPH_FILE), bundle.interchange(), files);
                interchange = true;
                log.info("Tree-ensemble graph exported successfully");
            } catch (IOException | RuntimeException e) {
                log.error("Failed to export tree-ensemble graph: {}", e.getMessage());
                log.info("Continuing with other export formats...");
            }
        }

        log.info("Model successfully exported to {}", outputDir);
        log.info("Files created: {}", String.join(", ", files));
        return new ExportReport(outputDir, List.copyOf(files), interchange);
    }

    private void writeJson(Path file, Object document, List<String> written) throws IOException {
        objectMapper.writeValue(file.toFile(), document);
        written.add(file.getFileName().toString());
    }

    static Map<String, Object> configSnapshot(TrainingConfig config) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("input_csv", config.getInputCsv());
        snapshot.put("output_dir", config.getOutputDir());
        snapshot.put("contamination", config.getContamination());
        snapshot.put("n_estimators", config.getNumTrees());
        snapshot.put("random_state", config.getRandomState());
        snapshot.put("features", config.getFeatures());
        snapshot.put("memory_usage_ratio", config.isMemoryUsageRatio());
        snapshot.put("drop_columns", config.getDropColumns());
        snapshot.put("min_samples", config.getMinSamples());
        snapshot.put("validation_split", config.getValidationSplit());
        snapshot.put("scaler", config.getScaler());
        snapshot.put("max_samples", config.getMaxSamples());
        snapshot.put("bootstrap", config.isBootstrap());
        snapshot.put("feature_selection", config.isFeatureSelection());
        snapshot.put("onnx_opset", config.getOnnxOpset());
        snapshot.put("ai_onnx_ml_opset", config.getAiOnnxMlOpset());
        return snapshot;
    }
}
