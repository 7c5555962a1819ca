package com.lynx.anomaly.export;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.lynx.anomaly.model.EvaluationMetrics;
import com.lynx.anomaly.model.ScalerKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * {@code metadata.json}: what the model is, how it was trained and how to apply it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BundleMetadata {

    @JsonProperty("model_type")
    private String modelType;

    @JsonProperty("model_version")
    private String modelVersion;

    @JsonProperty("feature_names")
    private List<String> featureNames;

    @JsonProperty("n_features")
    private int featureCount;

    @JsonProperty("feature_order_hash")
    private String featureOrderHash;

    @JsonProperty("scaler_kind")
    private ScalerKind scalerKind;

    @JsonProperty("contamination")
    private double contamination;

    @JsonProperty("n_estimators")
    private int estimatorCount;

    @JsonProperty("max_samples")
    private int maxSamples;

    @JsonProperty("max_depth")
    private int maxDepth;

    @JsonProperty("bootstrap")
    private boolean bootstrap;

    @JsonProperty("decision_offset")
    private double decisionOffset;

    @JsonProperty("score_convention")
    private String scoreConvention;

    @JsonProperty("training_timestamp")
    private String trainingTimestamp;

    @JsonProperty("evaluation_metrics")
    private EvaluationMetrics evaluationMetrics;

    @JsonProperty("validation_metrics")
    private EvaluationMetrics validationMetrics;

    @JsonProperty("config")
    private Map<String, Object> config;
}
