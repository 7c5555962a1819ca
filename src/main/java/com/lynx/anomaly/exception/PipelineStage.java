package com.lynx.anomaly.exception;

public enum PipelineStage {
    LOAD("load"),
    SCALE("scale"),
    TRAIN("train"),
    EVALUATE("evaluate"),
    EXPORT("export");

    private final String label;

    PipelineStage(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
