package com.lynx.anomaly.calibration;

import com.lynx.anomaly.config.ConfigSanitizer;
import com.lynx.anomaly.util.Quantiles;

/**
 * Derives the decision offset from a target contamination rate: the
 * contamination-quantile of the decision scores, so that roughly that fraction of
 * the scores falls below it.
 */
public class ThresholdCalibrator {

    public double calibrate(double[] decisionScores, double contamination) {
        if (decisionScores.length == 0) {
            throw new IllegalArgumentException("Cannot calibrate a threshold on zero scores");
        }
        double resolved = ConfigSanitizer.resolveContamination(contamination);
        return Quantiles.percentile(decisionScores, 100.0 * resolved);
    }
}
