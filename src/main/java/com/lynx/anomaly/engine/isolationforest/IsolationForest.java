package com.lynx.anomaly.engine.isolationforest;

import java.util.Arrays;
import java.util.List;
import java.util.stream.IntStream;

/**
 * An immutable ensemble of isolation trees.
 *
 * Scores follow one convention throughout: the raw anomaly score
 * {@code s(x) = 2^(-E[h(x)] / c(S))} lies in [0, 1] with values near 1 anomalous,
 * and the decision score is {@code 0.5 - s(x)}, so more negative means more
 * anomalous. A calibrated forest classifies {@code x} as anomalous iff
 * {@code decisionScore(x) < offset}.
 */
public final class IsolationForest {

    public static final String SCORE_CONVENTION =
            "decision_score = 0.5 - 2^(-mean_path_length / c(subsample_size)); anomalous iff decision_score < decision_offset";

    private final List<IsolationTree> trees;
    private final int sampleSize;
    private final double contamination;
    private final double offset;
    private final boolean calibrated;

    public IsolationForest(List<IsolationTree> trees, int sampleSize) {
        this(trees, sampleSize, Double.NaN, Double.NaN, false);
    }

    private IsolationForest(List<IsolationTree> trees, int sampleSize,
                            double contamination, double offset, boolean calibrated) {
        if (trees.isEmpty()) {
            throw new IllegalArgumentException("An isolation forest needs at least one tree");
        }
        this.trees = List.copyOf(trees);
        this.sampleSize = sampleSize;
        this.contamination = contamination;
        this.offset = offset;
        this.calibrated = calibrated;
    }

    /** Same trees with a decision threshold attached. */
    public IsolationForest calibrated(double contamination, double offset) {
        return new IsolationForest(trees, sampleSize, contamination, offset, true);
    }

    public double averagePathLength(double[] point) {
        double total = 0.0;
        for (IsolationTree tree : trees) {
            total += tree.pathLength(point);
        }
        return total / trees.size();
    }

    /**
     * Compute anomaly score for a single point.
     *
     * @return score between 0.0 (normal) and 1.0 (anomalous)
     *         Score > 0.5 indicates anomaly; score ≈ 0.5 is uncertain; score < 0.5 is normal
     */
    public double anomalyScore(double[] point) {
        double c = IsolationNode.averagePathLength(sampleSize);
        if (c <= 0) return 0.5;

        // IF scoring formula: s(x, n) = 2^(-E(h(x)) / c(n))
        return Math.pow(2.0, -averagePathLength(point) / c);
    }

    public double decisionScore(double[] point) {
        return 0.5 - anomalyScore(point);
    }

    /** Decision scores for a batch, computed in parallel across samples. */
    public double[] decisionScores(double[][] points) {
        return IntStream.range(0, points.length)
                .parallel()
                .mapToDouble(i -> decisionScore(points[i]))
                .toArray();
    }

    public boolean isAnomaly(double[] point) {
        if (!calibrated) {
            throw new IllegalStateException("Forest has no decision offset; calibrate it first");
        }
        return decisionScore(point) < offset;
    }

    /**
     * Per-feature contribution to the anomaly score: how much the score drops when
     * that feature alone is replaced by its reference value.
     */
    public double[] featureContributions(double[] point, double[] reference) {
        double baseScore = anomalyScore(point);
        double[] contributions = new double[point.length];

        for (int i = 0; i < point.length; i++) {
            double[] modified = Arrays.copyOf(point, point.length);
            modified[i] = reference[i];
            double modifiedScore = anomalyScore(modified);
            contributions[i] = Math.max(0, baseScore - modifiedScore);
        }

        return contributions;
    }

    public List<IsolationTree> getTrees() { return trees; }
    public int getSampleSize() { return sampleSize; }
    public double getContamination() { return contamination; }
    public double getOffset() { return offset; }
    public boolean isCalibrated() { return calibrated; }
}
