package com.lynx.anomaly.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Advisory health flags. A failing flag is surfaced as a warning, never as an error.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelHealth {

    // Score standard deviation above the minimum: the ensemble discriminates at all.
    @JsonProperty("good_variance")
    private boolean goodVariance;

    // Realized anomaly ratio within tolerance of the requested contamination.
    @JsonProperty("reasonable_contamination")
    private boolean reasonableContamination;

    @JsonProperty("negative_scores_present")
    private boolean negativeScoresPresent;

    @JsonIgnore
    public Map<String, Boolean> asMap() {
        Map<String, Boolean> map = new LinkedHashMap<>();
        map.put("good_variance", goodVariance);
        map.put("reasonable_contamination", reasonableContamination);
        map.put("negative_scores_present", negativeScoresPresent);
        return map;
    }

    @JsonIgnore
    public boolean isHealthy() {
        return goodVariance && reasonableContamination && negativeScoresPresent;
    }
}
