package com.lynx.anomaly.model;

import java.util.Arrays;
import java.util.List;

/**
 * Fitted per-feature (center, scale) pairs. {@code scale[i] > 0} for every feature.
 */
public record ScalerParams(ScalerKind kind, List<String> featureNames, double[] center, double[] scale) {

    public ScalerParams {
        if (center.length != featureNames.size() || scale.length != featureNames.size()) {
            throw new IllegalArgumentException("center/scale length must equal feature count " + featureNames.size());
        }
        featureNames = List.copyOf(featureNames);
        center = Arrays.copyOf(center, center.length);
        scale = Arrays.copyOf(scale, scale.length);
    }

    @Override
    public double[] center() {
        return Arrays.copyOf(center, center.length);
    }

    @Override
    public double[] scale() {
        return Arrays.copyOf(scale, scale.length);
    }

    public int featureCount() {
        return featureNames.size();
    }

    public double centerAt(int feature) {
        return center[feature];
    }

    public double scaleAt(int feature) {
        return scale[feature];
    }
}
