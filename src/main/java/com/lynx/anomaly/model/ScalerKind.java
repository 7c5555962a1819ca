package com.lynx.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum ScalerKind {
    /** Mean and population standard deviation. */
    STANDARD("standard", "standard_scaling"),
    /** Median and interquartile range. */
    ROBUST("robust", "robust_scaling");

    private final String label;
    private final String formula;

    ScalerKind(String label, String formula) {
        this.label = label;
        this.formula = formula;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public String formula() {
        return formula;
    }

    public static Optional<ScalerKind> parse(String value) {
        if (value == null) return Optional.empty();
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(k -> k.label.equals(normalized))
                .findFirst();
    }

    @JsonCreator
    public static ScalerKind fromLabel(String value) {
        return parse(value).orElseThrow(() -> new IllegalArgumentException("Unknown scaler kind: " + value));
    }
}
