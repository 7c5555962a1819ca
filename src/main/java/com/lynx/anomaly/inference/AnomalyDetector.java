package com.lynx.anomaly.inference;

import com.lynx.anomaly.engine.isolationforest.IsolationForest;
import com.lynx.anomaly.model.ScalerParams;
import com.lynx.anomaly.scaling.FeatureScaler;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

/**
 * Single-sample inference over a loaded bundle: scale with the stored center and
 * scale, score with the stored forest, compare against the stored offset.
 */
public class AnomalyDetector {

    private static final int TOP_FACTORS = 3;

    private final ScalerParams scaler;
    private final IsolationForest forest;

    public AnomalyDetector(ScalerParams scaler, IsolationForest forest) {
        if (!forest.isCalibrated()) {
            throw new IllegalArgumentException("Detector needs a calibrated forest");
        }
        this.scaler = scaler;
        this.forest = forest;
    }

    public List<String> featureNames() {
        return scaler.featureNames();
    }

    public double threshold() {
        return forest.getOffset();
    }

    /**
     * @param raw unscaled feature vector in {@link #featureNames()} order
     */
    public double decisionScore(double[] raw) {
        return forest.decisionScore(FeatureScaler.transformRow(raw, scaler));
    }

    public double[] decisionScores(double[][] raw) {
        double[][] scaled = new double[raw.length][];
        for (int i = 0; i < raw.length; i++) {
            scaled[i] = FeatureScaler.transformRow(raw[i], scaler);
        }
        return forest.decisionScores(scaled);
    }

    public Detection detect(double[] raw) {
        double[] scaled = FeatureScaler.transformRow(raw, scaler);
        double score = forest.decisionScore(scaled);
        double threshold = forest.getOffset();

        // The training center maps to 0 in scaled space
        double[] contributions = forest.featureContributions(scaled, new double[scaled.length]);
        Map<String, Double> top = new LinkedHashMap<>();
        IntStream.range(0, contributions.length)
                .boxed()
                .filter(i -> contributions[i] > 0)
                .sorted(Comparator.comparingDouble((Integer i) -> contributions[i]).reversed())
                .limit(TOP_FACTORS)
                .forEach(i -> top.put(scaler.featureNames().get(i), contributions[i]));

        return new Detection(score, threshold, score < threshold, Math.abs(score - threshold), top);
    }

    /**
     * Scores a sample given by feature name. Every documented feature must be present.
     */
    public Detection detect(Map<String, Double> features) {
        List<String> names = scaler.featureNames();
        double[] raw = new double[names.size()];
        for (int i = 0; i < raw.length; i++) {
            Double value = features.get(names.get(i));
            if (value == null) {
                throw new IllegalArgumentException("Missing feature: " + names.get(i));
            }
            raw[i] = value;
        }
        return detect(raw);
    }
}
