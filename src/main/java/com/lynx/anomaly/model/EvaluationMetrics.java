package com.lynx.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Decision score distribution statistics for one scored dataset. Returned to the
 * caller and exported as {@code evaluation_metrics}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EvaluationMetrics {

    @JsonProperty("n_samples")
    private int sampleCount;

    @JsonProperty("n_anomalies_detected")
    private int anomaliesDetected;

    @JsonProperty("anomaly_ratio")
    private double anomalyRatio;

    @JsonProperty("expected_contamination")
    private double expectedContamination;

    @JsonProperty("contamination_error")
    private double contaminationError;

    @JsonProperty("score_threshold")
    private double scoreThreshold;

    @JsonProperty("scores_below_threshold")
    private int scoresBelowThreshold;

    @JsonProperty("mean_anomaly_score")
    private double meanAnomalyScore;

    @JsonProperty("std_anomaly_score")
    private double stdAnomalyScore;

    @JsonProperty("min_anomaly_score")
    private double minAnomalyScore;

    @JsonProperty("max_anomaly_score")
    private double maxAnomalyScore;

    @JsonProperty("score_range")
    private String scoreRange;

    // p1, p5, p10, p25, p50, p75, p90, p95, p99
    @JsonProperty("score_percentiles")
    private Map<String, Double> scorePercentiles;

    @JsonProperty("model_health")
    private ModelHealth modelHealth;
}
