package com.lynx.anomaly.exception;

/**
 * Fatal pipeline failure. Always identifies the stage that failed and keeps the
 * original cause, if any.
 */
public class TrainingException extends RuntimeException {

    private final PipelineStage stage;

    public TrainingException(PipelineStage stage, String message) {
        super(message);
        this.stage = stage;
    }

    public TrainingException(PipelineStage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public PipelineStage getStage() {
        return stage;
    }

    @Override
    public String getMessage() {
        return "[" + stage.label() + "] " + super.getMessage();
    }
}
