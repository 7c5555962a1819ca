package com.lynx.anomaly.export;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * {@code integration_guide.json}: how an independent runtime consumes the bundle.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IntegrationGuide {

    @JsonProperty("interchange_model")
    private String interchangeModel;

    @JsonProperty("forest_model")
    private String forestModel;

    @JsonProperty("scaler_config")
    private String scalerConfig;

    @JsonProperty("feature_order")
    private List<String> featureOrder;

    @JsonProperty("feature_order_hash")
    private String featureOrderHash;

    @JsonProperty("expected_contamination")
    private double expectedContamination;

    @JsonProperty("anomaly_threshold")
    private double anomalyThreshold;

    @JsonProperty("preprocessing_steps")
    private List<String> preprocessingSteps;

    @JsonProperty("threshold_check")
    private String thresholdCheck;

    @JsonProperty("confidence")
    private String confidence;
}
