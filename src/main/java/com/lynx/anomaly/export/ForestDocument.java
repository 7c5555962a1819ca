package com.lynx.anomaly.export;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.lynx.anomaly.engine.isolationforest.IsolationForest;
import com.lynx.anomaly.engine.isolationforest.IsolationTree;
import com.lynx.anomaly.engine.isolationforest.TreeStructure;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * {@code forest.json}: native per-tree node arrays of a calibrated forest.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ForestDocument {

    @JsonProperty("n_estimators")
    private int estimatorCount;

    @JsonProperty("subsample_size")
    private int subsampleSize;

    @JsonProperty("contamination")
    private double contamination;

    @JsonProperty("decision_offset")
    private double decisionOffset;

    @JsonProperty("feature_order_hash")
    private String featureOrderHash;

    @JsonProperty("score_convention")
    private String scoreConvention;

    @JsonProperty("trees")
    private List<TreeStructure> trees;

    public static ForestDocument from(IsolationForest forest, String featureOrderHash) {
        return ForestDocument.builder()
                .estimatorCount(forest.getTrees().size())
                .subsampleSize(forest.getSampleSize())
                .contamination(forest.getContamination())
                .decisionOffset(forest.getOffset())
                .featureOrderHash(featureOrderHash)
                .scoreConvention(IsolationForest.SCORE_CONVENTION)
                .trees(forest.getTrees().stream().map(IsolationTree::toStructure).toList())
                .build();
    }

    public IsolationForest toForest() {
        List<IsolationTree> rebuilt = trees.stream().map(IsolationTree::fromStructure).toList();
        return new IsolationForest(rebuilt, subsampleSize).calibrated(contamination, decisionOffset);
    }
}
