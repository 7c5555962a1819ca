package com.lynx.anomaly.exception;

public class ExportException extends TrainingException {

    public ExportException(String message) {
        super(PipelineStage.EXPORT, message);
    }

    public ExportException(String message, Throwable cause) {
        super(PipelineStage.EXPORT, message, cause);
    }
}
