package com.lynx.anomaly.exception;

public class InsufficientSamplesException extends TrainingException {

    private final int actual;
    private final int required;

    public InsufficientSamplesException(int actual, int required) {
        super(PipelineStage.LOAD, String.format(
                "Insufficient samples: %d < %d. Need at least %d samples for reliable training.",
                actual, required, required));
        this.actual = actual;
        this.required = required;
    }

    public int getActual() {
        return actual;
    }

    public int getRequired() {
        return required;
    }
}
