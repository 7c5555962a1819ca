package com.lynx.anomaly.service;

import com.lynx.anomaly.config.ConfigSanitizer;
import com.lynx.anomaly.config.TrainingConfig;
import com.lynx.anomaly.config.TrainingMetrics;
import com.lynx.anomaly.data.TelemetryCsvReader;
import com.lynx.anomaly.data.TelemetryLoader;
import com.lynx.anomaly.exception.PipelineStage;
import com.lynx.anomaly.exception.TrainingException;
import com.lynx.anomaly.export.DebugCsvWriter;
import com.lynx.anomaly.export.ModelBundleExporter;
import com.lynx.anomaly.inference.AnomalyDetector;
import com.lynx.anomaly.inference.ModelBundleLoader;
import com.lynx.anomaly.model.ScalerKind;
import com.lynx.anomaly.testutil.TestDataFactory;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TrainingPipelineServiceTest {

    @TempDir
    Path tempDir;

    private MeterRegistry registry;
    private TrainingMetrics trainingMetrics;
    private TrainingConfig config;
    private Path outputDir;

    @BeforeEach
    void setUp() throws Exception {
        registry = new SimpleMeterRegistry();
        trainingMetrics = new TrainingMetrics(registry);
        outputDir = tempDir.resolve("model_assets");
        Path csv = tempDir.resolve("system_metrics.csv");
        TestDataFactory.writeCsv(TestDataFactory.telemetryTable(800, 21L, 20), csv);

        config = TestDataFactory.testConfig(outputDir);
        config.setInputCsv(csv.toString());
    }

    private TrainingPipelineService service(ModelBundleExporter exporter) {
        return new TrainingPipelineService(new TelemetryLoader(new TelemetryCsvReader()), new DebugCsvWriter(),
                exporter, new ModelBundleLoader(), new ConfigSanitizer(), trainingMetrics);
    }

    @Test
    void run_endToEnd_exportsLoadableBundle() {
        TrainingResult result = service(new ModelBundleExporter()).run(config);

        assertThat(result.featureNames()).containsExactlyElementsOf(TestDataFactory.FEATURES);
        assertThat(result.forest().isCalibrated()).isTrue();
        assertThat(result.forest().getTrees()).hasSize(50);
        assertThat(result.exportReport().files())
                .contains("metadata.json", "scaler.json", "forest.json", "integration_guide.json");
        assertThat(Files.exists(outputDir.resolve("forest.json"))).isTrue();

        AnomalyDetector detector = new ModelBundleLoader().load(outputDir, TestDataFactory.FEATURES);
        assertThat(detector.threshold()).isEqualTo(result.forest().getOffset());
        assertThat(detector.detect(new double[]{97, 90, 400, 250, 6}).anomalous()).isTrue();
    }

    @Test
    void run_withValidationSplit_reportsValidationMetrics() {
        TrainingResult result = service(new ModelBundleExporter()).run(config);

        assertThat(result.validationMetrics()).isNotNull();
        assertThat(result.validationMetrics().getSampleCount()).isEqualTo(160);
        assertThat(result.validationMetrics().getAnomalyRatio()).isCloseTo(0.10, within(0.05));
        assertThat(result.metrics().getSampleCount()).isEqualTo(800);
    }

    @Test
    void run_withoutValidationSplit_realizesContamination() {
        config.setValidationSplit(0.0);
        config.setContamination(0.08);

        TrainingResult result = service(new ModelBundleExporter()).run(config);

        assertThat(result.validationMetrics()).isNull();
        assertThat(result.metrics().getAnomalyRatio()).isCloseTo(0.08, within(0.05));
        assertThat(result.metrics().getModelHealth().isReasonableContamination()).isTrue();
        assertThat(result.metrics().getModelHealth().isGoodVariance()).isTrue();
    }

    @Test
    void run_sameSeed_sameOffset() {
        double first = service(new ModelBundleExporter()).run(config).forest().getOffset();
        double second = service(new ModelBundleExporter()).run(config).forest().getOffset();

        assertThat(second).isEqualTo(first);
    }

    @Test
    void run_unrealisticContamination_trainsWithDefault() {
        config.setContamination(0.9);

        TrainingResult result = service(new ModelBundleExporter()).run(config);

        assertThat(result.forest().getContamination()).isEqualTo(TrainingConfig.DEFAULT_CONTAMINATION);
    }

    @Test
    void train_unknownScaler_trainsWithRobust() {
        config.setScaler("minmax");

        TrainingResult result = service(new ModelBundleExporter()).train(TestDataFactory.normalMatrix(300, 1L), config);

        assertThat(result.scalerParams().kind()).isEqualTo(ScalerKind.ROBUST);
        assertThat(config.getScaler()).isEqualTo("robust");
    }

    @Test
    void run_recordsStageTimingsAndGauges() {
        TrainingResult result = service(new ModelBundleExporter()).run(config);

        for (PipelineStage stage : PipelineStage.values()) {
            assertThat(registry.get("trainer.stage.duration").tag("stage", stage.label()).timer().count())
                    .isPositive();
        }
        assertThat(registry.get("trainer.decision.offset").gauge().value()).isEqualTo(result.forest().getOffset());
        assertThat(registry.get("trainer.anomaly.ratio").gauge().value())
                .isEqualTo(result.metrics().getAnomalyRatio());
    }

    @Test
    void run_debugCsvEnabled_writesPreprocessedData() {
        config.setWriteDebugCsv(true);

        service(new ModelBundleExporter()).run(config);

        assertThat(Files.exists(outputDir.resolve(DebugCsvWriter.FILE_NAME))).isTrue();
    }

    @Test
    void run_missingInput_failsAtLoadStage() {
        config.setInputCsv(tempDir.resolve("absent.csv").toString());

        assertThatThrownBy(() -> service(new ModelBundleExporter()).run(config))
                .isInstanceOf(TrainingException.class)
                .satisfies(e -> assertThat(((TrainingException) e).getStage()).isEqualTo(PipelineStage.LOAD));
        assertThat(Files.exists(outputDir.resolve("metadata.json"))).isFalse();
    }

    @Test
    void run_unexpectedExportFailure_wrappedWithStage() {
        ModelBundleExporter exporter = mock(ModelBundleExporter.class);
        when(exporter.assemble(any(), any(), any(), any(), any(), any()))
                .thenThrow(new IllegalStateException("disk on fire"));

        assertThatThrownBy(() -> service(exporter).run(config))
                .isInstanceOf(TrainingException.class)
                .hasMessage("[export] disk on fire")
                .hasCauseInstanceOf(IllegalStateException.class);
    }
}
