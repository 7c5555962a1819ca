package com.lynx.anomaly.exception;

import java.util.List;

public class MissingColumnException extends TrainingException {

    private final List<String> columns;

    public MissingColumnException(String purpose, List<String> columns) {
        super(PipelineStage.LOAD, "Missing required columns for " + purpose + ": " + columns);
        this.columns = List.copyOf(columns);
    }

    public List<String> getColumns() {
        return columns;
    }
}
