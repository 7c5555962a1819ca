package com.lynx.anomaly.exception;

public class EmptyInputException extends TrainingException {

    public EmptyInputException(String source) {
        super(PipelineStage.LOAD, "Input is empty: " + source);
    }
}
