package com.lynx.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "trainer")
public class TrainingConfig {

    public static final double DEFAULT_CONTAMINATION = 0.10;
    public static final double DEFAULT_VALIDATION_SPLIT = 0.2;
    public static final int DEFAULT_NUM_TREES = 100;
    public static final int AUTO_MAX_SAMPLES = 256;

    // Run the pipeline from the CommandLineRunner on startup. Disabled in context tests.
    private boolean runOnStartup = true;

    private String inputCsv = "system_metrics.csv";
    private String outputDir = "model_assets";

    // Expected fraction of anomalies, valid range (0, 0.5) exclusive.
    private double contamination = DEFAULT_CONTAMINATION;

    private int numTrees = DEFAULT_NUM_TREES;
    private long randomState = 42L;

    // Candidate features, in the order they appear in the exported model.
    private List<String> features = new ArrayList<>(List.of(
            "cpu_usage", "memory_usage", "net_in", "net_out", "load_one"));

    // Derive memory_usage (percent) from memory_used_kb / memory_total_kb.
    private boolean memoryUsageRatio = true;

    private List<String> dropColumns = new ArrayList<>(List.of(
            "time", "uptime", "docker_containers_running", "system_id",
            "components", "ctid", "load_fifteen", "load_five"));

    private int minSamples = 100;

    // Fraction held out for threshold calibration. 0 calibrates on the training rows.
    private double validationSplit = DEFAULT_VALIDATION_SPLIT;

    // "robust" (median / IQR) or "standard" (mean / std).
    private String scaler = "robust";

    // "auto" = min(256, N), otherwise an integer subsample size.
    private String maxSamples = "auto";

    private boolean bootstrap = false;

    // Drop zero-variance candidates instead of keeping every present column.
    private boolean featureSelection = true;

    // Non-finite values left after imputation are clamped to +/- this bound.
    private double nonFiniteBound = 1e10;

    // 0 = ceil(log2(subsample size)).
    private int maxDepth = 0;

    // Tree-building worker count. 0 = available processors.
    private int parallelism = 0;

    private boolean writeDebugCsv = true;

    // Attempt the optional tree-ensemble graph export.
    private boolean interchangeExport = true;
    private int onnxOpset = 15;
    private int aiOnnxMlOpset = 3;

    // Columns with a larger missing fraction than this are reported.
    private double highNullWarnFraction = 0.5;
}
