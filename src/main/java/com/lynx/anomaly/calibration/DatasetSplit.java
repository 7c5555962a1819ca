package com.lynx.anomaly.calibration;

import com.lynx.anomaly.model.FeatureMatrix;

/**
 * Training rows and held-out validation rows. {@code validation} is null when no
 * split was requested.
 */
public record DatasetSplit(FeatureMatrix training, FeatureMatrix validation) {

    public boolean hasValidation() {
        return validation != null;
    }

    /** Rows used for threshold calibration: the validation rows if present, else the training rows. */
    public FeatureMatrix calibrationRows() {
        return hasValidation() ? validation : training;
    }
}
