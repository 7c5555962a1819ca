package com.lynx.anomaly.data;

import com.lynx.anomaly.config.TrainingConfig;
import com.lynx.anomaly.exception.EmptyInputException;
import com.lynx.anomaly.exception.InsufficientSamplesException;
import com.lynx.anomaly.exception.MissingColumnException;
import com.lynx.anomaly.exception.PipelineStage;
import com.lynx.anomaly.exception.TooFewFeaturesException;
import com.lynx.anomaly.model.FeatureMatrix;
import com.lynx.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TelemetryLoaderTest {

    @TempDir
    Path tempDir;

    private TelemetryLoader loader;
    private TrainingConfig config;

    @BeforeEach
    void setUp() {
        loader = new TelemetryLoader(new TelemetryCsvReader());
        config = TestDataFactory.testConfig(tempDir);
    }

    @Test
    void prepare_validTable_producesFeaturesInConfiguredOrder() {
        RawTable raw = TestDataFactory.telemetryTable(200, 1L, 0);

        FeatureMatrix matrix = loader.prepare(raw, config);

        assertThat(matrix.featureNames()).containsExactlyElementsOf(TestDataFactory.FEATURES);
        assertThat(matrix.rowCount()).isEqualTo(200);
        assertThat(matrix.featureNames()).doesNotContain("time", "memory_used_kb", "memory_total_kb");
    }

    @Test
    void prepare_derivesMemoryPercentage() {
        RawTable raw = TestDataFactory.telemetryTable(100, 2L, 0);
        double[] used = raw.column("memory_used_kb");

        FeatureMatrix matrix = loader.prepare(raw, config);

        int memory = matrix.featureNames().indexOf("memory_usage");
        assertThat(matrix.get(0, memory)).isCloseTo(100.0 * used[0] / TestDataFactory.MEMORY_TOTAL_KB, within(1e-9));
    }

    @Test
    void prepare_emptyTable_throwsEmptyInput() {
        RawTable raw = new RawTable(Map.of(), 0);

        assertThatThrownBy(() -> loader.prepare(raw, config))
                .isInstanceOf(EmptyInputException.class)
                .satisfies(e -> assertThat(((EmptyInputException) e).getStage()).isEqualTo(PipelineStage.LOAD));
    }

    @Test
    void prepare_tooFewRows_throwsInsufficientSamples() {
        RawTable raw = TestDataFactory.telemetryTable(10, 3L, 0);

        assertThatThrownBy(() -> loader.prepare(raw, config))
                .isInstanceOf(InsufficientSamplesException.class)
                .hasMessageContaining("10");
    }

    @Test
    void prepare_missingMemoryCounter_throwsMissingColumn() {
        RawTable raw = TestDataFactory.telemetryTable(100, 4L, 0).withoutColumns(List.of("memory_total_kb"));

        assertThatThrownBy(() -> loader.prepare(raw, config))
                .isInstanceOf(MissingColumnException.class)
                .satisfies(e -> assertThat(((MissingColumnException) e).getColumns())
                        .containsExactly("memory_total_kb"));
    }

    @Test
    void prepare_memoryRatioDisabled_skipsMemoryFeature() {
        config.setMemoryUsageRatio(false);
        RawTable raw = TestDataFactory.telemetryTable(100, 5L, 0).withoutColumns(List.of("memory_total_kb"));

        FeatureMatrix matrix = loader.prepare(raw, config);

        assertThat(matrix.featureNames()).containsExactly("cpu_usage", "net_in", "net_out", "load_one");
    }

    @Test
    void prepare_zeroVarianceFeature_isExcluded() {
        RawTable raw = TestDataFactory.telemetryTable(100, 6L, 0)
                .withColumn("net_out", new double[100]);

        FeatureMatrix matrix = loader.prepare(raw, config);

        assertThat(matrix.featureNames()).doesNotContain("net_out").contains("net_in");
    }

    @Test
    void prepare_zeroVarianceFeatureWithSelectionDisabled_isKept() {
        config.setFeatureSelection(false);
        RawTable raw = TestDataFactory.telemetryTable(100, 6L, 0)
                .withColumn("net_out", new double[100]);

        FeatureMatrix matrix = loader.prepare(raw, config);

        assertThat(matrix.featureNames()).contains("net_out");
    }

    @Test
    void prepare_constantDerivedMemory_isExcluded() {
        double[] used = new double[100];
        Arrays.fill(used, 1_600_000);
        RawTable raw = TestDataFactory.telemetryTable(100, 6L, 0)
                .withColumn("memory_used_kb", used);

        FeatureMatrix matrix = loader.prepare(raw, config);

        assertThat(matrix.featureNames()).containsExactly("cpu_usage", "net_in", "net_out", "load_one");
    }

    @Test
    void prepare_invalidMemoryTotals_excludesMemoryUsage() {
        RawTable raw = TestDataFactory.telemetryTable(100, 6L, 0)
                .withColumn("memory_total_kb", new double[100]);

        FeatureMatrix matrix = loader.prepare(raw, config);

        assertThat(matrix.featureNames()).doesNotContain("memory_usage").hasSize(4);
    }

    @Test
    void prepare_constantDerivedMemoryWithSelectionDisabled_isKept() {
        config.setFeatureSelection(false);
        double[] used = new double[100];
        Arrays.fill(used, 1_600_000);
        RawTable raw = TestDataFactory.telemetryTable(100, 6L, 0)
                .withColumn("memory_used_kb", used);

        FeatureMatrix matrix = loader.prepare(raw, config);

        assertThat(matrix.featureNames()).contains("memory_usage");
    }

    @Test
    void prepare_singleUsableFeature_throwsTooFewFeatures() {
        config.setFeatures(List.of("cpu_usage", "gpu_usage"));
        RawTable raw = TestDataFactory.telemetryTable(100, 7L, 0);

        assertThatThrownBy(() -> loader.prepare(raw, config))
                .isInstanceOf(TooFewFeaturesException.class)
                .satisfies(e -> assertThat(((TooFewFeaturesException) e).getUsableFeatures())
                        .containsExactly("cpu_usage"));
    }

    @Test
    void prepare_missingValues_filledWithColumnMedian() {
        double[] cpu = new double[100];
        for (int i = 0; i < cpu.length; i++) cpu[i] = i;
        cpu[10] = Double.NaN;
        cpu[20] = Double.NaN;
        RawTable raw = TestDataFactory.telemetryTable(100, 8L, 0).withColumn("cpu_usage", cpu);

        FeatureMatrix matrix = loader.prepare(raw, config);

        // median of 0..99 without 10 and 20
        assertThat(matrix.get(10, 0)).isEqualTo(50.5);
        assertThat(matrix.get(20, 0)).isEqualTo(50.5);
    }

    @Test
    void prepare_infiniteValues_clampedToBound() {
        RawTable base = TestDataFactory.telemetryTable(100, 9L, 0);
        double[] load = base.column("load_one");
        load[3] = Double.POSITIVE_INFINITY;
        load[4] = Double.NEGATIVE_INFINITY;

        FeatureMatrix matrix = loader.prepare(base.withColumn("load_one", load), config);

        int column = matrix.featureNames().indexOf("load_one");
        assertThat(matrix.get(3, column)).isEqualTo(1e10);
        assertThat(matrix.get(4, column)).isEqualTo(-1e10);
    }

    @Test
    void prepare_leavesInputTableUnchanged() {
        RawTable raw = TestDataFactory.telemetryTable(100, 10L, 0);
        List<String> before = raw.columnNames();

        loader.prepare(raw, config);

        assertThat(raw.columnNames()).isEqualTo(before);
    }

    @Test
    void hasVariance_ignoresNonFiniteValues() {
        assertThat(TelemetryLoader.hasVariance(new double[]{1, 1, Double.NaN, 1})).isFalse();
        assertThat(TelemetryLoader.hasVariance(new double[]{1, 2, Double.NaN})).isTrue();
        assertThat(TelemetryLoader.hasVariance(new double[]{Double.NaN, 5})).isFalse();
    }
}
