package com.lynx.anomaly.calibration;

import com.lynx.anomaly.model.EvaluationMetrics;
import com.lynx.anomaly.model.ModelHealth;
import com.lynx.anomaly.util.Quantiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Computes decision score statistics and advisory health flags. Nothing here fails
 * training; failed checks are returned and logged as warnings.
 */
public class ModelEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ModelEvaluator.class);

    static final int[] PERCENTILES = {1, 5, 10, 25, 50, 75, 90, 95, 99};
    static final double MIN_SCORE_STD = 0.01;
    static final double CONTAMINATION_TOLERANCE = 0.05;
    static final double NEGATIVE_SCORE_MARGIN = -0.01;

    public EvaluationMetrics evaluate(double[] scores, double offset, double contamination) {
        if (scores.length == 0) {
            throw new IllegalArgumentException("Cannot evaluate zero scores");
        }
        double[] sorted = Arrays.copyOf(scores, scores.length);
        Arrays.sort(sorted);

        int below = 0;
        for (double score : scores) {
            if (score < offset) below++;
        }
        double ratio = (double) below / scores.length;
        double mean = Quantiles.mean(scores);
        double std = Quantiles.std(scores);
        double min = sorted[0];
        double max = sorted[sorted.length - 1];

        Map<String, Double> percentiles = new LinkedHashMap<>();
        for (int p : PERCENTILES) {
            percentiles.put("p" + p, Quantiles.percentileOfSorted(sorted, p));
        }

        ModelHealth health = ModelHealth.builder()
                .goodVariance(std > MIN_SCORE_STD)
                .reasonableContamination(Math.abs(ratio - contamination) < CONTAMINATION_TOLERANCE)
                .negativeScoresPresent(min < NEGATIVE_SCORE_MARGIN)
                .build();

        return EvaluationMetrics.builder()
                .sampleCount(scores.length)
                .anomaliesDetected(below)
                .anomalyRatio(ratio)
                .expectedContamination(contamination)
                .contaminationError(Math.abs(ratio - contamination))
                .scoreThreshold(offset)
                .scoresBelowThreshold(below)
                .meanAnomalyScore(mean)
                .stdAnomalyScore(std)
                .minAnomalyScore(min)
                .maxAnomalyScore(max)
                .scoreRange(String.format("%.4f to %.4f", min, max))
                .scorePercentiles(percentiles)
                .modelHealth(health)
                .build();
    }

    /**
     * Logs a warning for every failed health check.
     */
    public void warnOnHealth(EvaluationMetrics metrics) {
        ModelHealth health = metrics.getModelHealth();
        if (!health.isGoodVariance()) {
            log.warn("Low score variance - model may not discriminate well");
        }
        if (!health.isReasonableContamination()) {
            log.warn("Large contamination mismatch: expected {}, got {}",
                    String.format("%.3f", metrics.getExpectedContamination()),
                    String.format("%.3f", metrics.getAnomalyRatio()));
        }
        if (!health.isNegativeScoresPresent()) {
            log.warn("No strong negative scores - model may not be detecting anomalies properly");
        }
    }
}
