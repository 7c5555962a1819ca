package com.lynx.anomaly.export;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.lynx.anomaly.model.ScalerKind;
import com.lynx.anomaly.model.ScalerParams;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * {@code scaler.json}: per-feature center and scale in the documented feature order.
 * Inference computes {@code (x - center) / scale} element-wise.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScalerDocument {

    @JsonProperty("scaler_kind")
    private ScalerKind scalerKind;

    @JsonProperty("center")
    private double[] center;

    @JsonProperty("scale")
    private double[] scale;

    @JsonProperty("feature_names")
    private List<String> featureNames;

    @JsonProperty("n_features")
    private int featureCount;

    @JsonProperty("feature_order_hash")
    private String featureOrderHash;

    @JsonProperty("preprocessing_formula")
    private String preprocessingFormula;

    @JsonProperty("expected_input_shape")
    private int[] expectedInputShape;

    public static ScalerDocument from(ScalerParams params, String featureOrderHash) {
        return ScalerDocument.builder()
                .scalerKind(params.kind())
                .center(params.center())
                .scale(params.scale())
                .featureNames(params.featureNames())
                .featureCount(params.featureCount())
                .featureOrderHash(featureOrderHash)
                .preprocessingFormula(params.kind().formula())
                .expectedInputShape(new int[]{-1, params.featureCount()})
                .build();
    }

    public ScalerParams toParams() {
        return new ScalerParams(scalerKind, featureNames, center, scale);
    }
}
