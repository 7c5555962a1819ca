package com.lynx.anomaly.exception;

public class DegenerateScaleException extends TrainingException {

    private final String feature;

    public DegenerateScaleException(String feature, String message) {
        super(PipelineStage.SCALE, message);
        this.feature = feature;
    }

    public String getFeature() {
        return feature;
    }
}
