package com.lynx.anomaly.engine.isolationforest;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Pre-order node arrays of one isolation tree, indexed by node id (root = 0).
 *
 * Internal nodes have {@code leafDepth = leafSize = -1}; leaves have
 * {@code splitFeatureIndex = leftChild = rightChild = -1} and {@code splitValue = 0}.
 * Enough to reimplement scoring without this library.
 */
public record TreeStructure(
        @JsonProperty("split_feature_index") int[] splitFeatureIndex,
        @JsonProperty("split_value") double[] splitValue,
        @JsonProperty("left_child") int[] leftChild,
        @JsonProperty("right_child") int[] rightChild,
        @JsonProperty("leaf_depth") int[] leafDepth,
        @JsonProperty("leaf_size") int[] leafSize) {

    public int nodeCount() {
        return splitFeatureIndex.length;
    }

    public boolean isLeaf(int node) {
        return leftChild[node] < 0;
    }
}
