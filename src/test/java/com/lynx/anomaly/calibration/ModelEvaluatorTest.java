package com.lynx.anomaly.calibration;

import com.lynx.anomaly.model.EvaluationMetrics;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ModelEvaluatorTest {

    private final ModelEvaluator evaluator = new ModelEvaluator();

    private static double[] spreadScores() {
        Random random = new Random(1);
        double[] scores = new double[1000];
        for (int i = 0; i < scores.length; i++) scores[i] = 0.1 + 0.08 * random.nextGaussian();
        return scores;
    }

    @Test
    void evaluate_computesRatioAndStatistics() {
        double[] scores = {-0.2, -0.1, 0.0, 0.1, 0.2};

        EvaluationMetrics metrics = evaluator.evaluate(scores, -0.05, 0.1);

        assertThat(metrics.getSampleCount()).isEqualTo(5);
        assertThat(metrics.getAnomaliesDetected()).isEqualTo(2);
        assertThat(metrics.getScoresBelowThreshold()).isEqualTo(2);
        assertThat(metrics.getAnomalyRatio()).isCloseTo(0.4, within(1e-12));
        assertThat(metrics.getContaminationError()).isCloseTo(0.3, within(1e-12));
        assertThat(metrics.getMeanAnomalyScore()).isCloseTo(0.0, within(1e-12));
        assertThat(metrics.getMinAnomalyScore()).isEqualTo(-0.2);
        assertThat(metrics.getMaxAnomalyScore()).isEqualTo(0.2);
        assertThat(metrics.getScoreRange()).isEqualTo("-0.2000 to 0.2000");
        assertThat(metrics.getScorePercentiles()).containsKeys("p1", "p5", "p10", "p25", "p50", "p75", "p90", "p95", "p99");
        assertThat(metrics.getScorePercentiles().get("p50")).isCloseTo(0.0, within(1e-12));
    }

    @Test
    void evaluate_healthyScores_allChecksPass() {
        double[] scores = spreadScores();
        double offset = new ThresholdCalibrator().calibrate(scores, 0.1);

        EvaluationMetrics metrics = evaluator.evaluate(scores, offset, 0.1);

        assertThat(metrics.getModelHealth().isGoodVariance()).isTrue();
        assertThat(metrics.getModelHealth().isReasonableContamination()).isTrue();
        assertThat(metrics.getModelHealth().isNegativeScoresPresent()).isTrue();
        assertThat(metrics.getModelHealth().isHealthy()).isTrue();
    }

    @Test
    void evaluate_flatPositiveScores_failsVarianceAndNegativeChecks() {
        double[] scores = new double[100];
        Arrays.fill(scores, 0.12);

        EvaluationMetrics metrics = evaluator.evaluate(scores, 0.12, 0.1);

        assertThat(metrics.getModelHealth().isGoodVariance()).isFalse();
        assertThat(metrics.getModelHealth().isNegativeScoresPresent()).isFalse();
        // nothing is strictly below the offset
        assertThat(metrics.getAnomalyRatio()).isEqualTo(0.0);
        assertThat(metrics.getModelHealth().isReasonableContamination()).isFalse();
        assertThat(metrics.getModelHealth().asMap())
                .containsEntry("good_variance", false)
                .containsEntry("negative_scores_present", false);
    }

    @Test
    void evaluate_noScores_rejected() {
        assertThatThrownBy(() -> evaluator.evaluate(new double[0], 0, 0.1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
