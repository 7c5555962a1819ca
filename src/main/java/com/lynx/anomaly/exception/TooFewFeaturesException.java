package com.lynx.anomaly.exception;

import java.util.List;

public class TooFewFeaturesException extends TrainingException {

    private final List<String> usableFeatures;

    public TooFewFeaturesException(List<String> usableFeatures) {
        super(PipelineStage.LOAD, "Insufficient valid features: " + usableFeatures
                + ". Need at least 2 features for anomaly detection.");
        this.usableFeatures = List.copyOf(usableFeatures);
    }

    public List<String> getUsableFeatures() {
        return usableFeatures;
    }
}
