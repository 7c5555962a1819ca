package com.lynx.anomaly.inference;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lynx.anomaly.calibration.ModelEvaluator;
import com.lynx.anomaly.exception.FeatureOrderMismatchException;
import com.lynx.anomaly.export.ModelBundleExporter;
import com.lynx.anomaly.model.EvaluationMetrics;
import com.lynx.anomaly.scaling.FeatureScaler;
import com.lynx.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelBundleLoaderTest {

    @TempDir
    Path tempDir;

    private final ModelBundleLoader loader = new ModelBundleLoader();
    private TestDataFactory.TrainedModel model;

    @BeforeEach
    void setUp() {
        model = TestDataFactory.trainedModel(400, 25, 0.1);
        EvaluationMetrics metrics = new ModelEvaluator().evaluate(
                model.forest().decisionScores(new double[][]{{0, 0, 0, 0, 0}}), model.forest().getOffset(), 0.1);
        ModelBundleExporter exporter = new ModelBundleExporter();
        exporter.write(exporter.assemble(model.forest(), model.scaler(), metrics, null,
                TestDataFactory.testConfig(tempDir), Instant.now()), tempDir);
    }

    @Test
    void load_reproducesInMemoryScores() {
        AnomalyDetector detector = loader.load(tempDir, TestDataFactory.FEATURES);

        assertThat(detector.featureNames()).containsExactlyElementsOf(TestDataFactory.FEATURES);
        assertThat(detector.threshold()).isEqualTo(model.forest().getOffset());
        for (int r = 0; r < 50; r++) {
            double[] raw = model.raw().row(r);
            double expected = model.forest().decisionScore(FeatureScaler.transformRow(raw, model.scaler()));
            assertThat(detector.decisionScore(raw)).isEqualTo(expected);
        }
    }

    @Test
    void load_swappedFeatureOrder_rejected() {
        List<String> swapped = List.of("memory_usage", "cpu_usage", "net_in", "net_out", "load_one");

        assertThatThrownBy(() -> loader.load(tempDir, swapped))
                .isInstanceOf(FeatureOrderMismatchException.class)
                .hasMessageContaining("metadata.json");
    }

    @Test
    void load_tamperedScalerFeatureNames_rejected() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        Path scalerFile = tempDir.resolve(ModelBundleExporter.SCALER_FILE);
        ObjectNode scaler = (ObjectNode) mapper.readTree(scalerFile.toFile());
        ArrayNode names = (ArrayNode) scaler.get("feature_names");
        names.set(0, names.get(1));
        names.set(1, mapper.getNodeFactory().textNode("cpu_usage"));
        mapper.writeValue(scalerFile.toFile(), scaler);

        assertThatThrownBy(() -> loader.load(tempDir, TestDataFactory.FEATURES))
                .isInstanceOf(FeatureOrderMismatchException.class)
                .hasMessageContaining("feature_names");
    }

    @Test
    void load_missingBundle_throwsUncheckedIo() {
        assertThatThrownBy(() -> loader.load(tempDir.resolve("absent"), TestDataFactory.FEATURES))
                .isInstanceOf(UncheckedIOException.class);
    }
}
