package com.lynx.anomaly.scaling;

import com.lynx.anomaly.model.ScalerKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class FeatureScalers {

    private static final Logger log = LoggerFactory.getLogger(FeatureScalers.class);

    private FeatureScalers() {}

    public static FeatureScaler forKind(ScalerKind kind) {
        return switch (kind) {
            case STANDARD -> new StandardFeatureScaler();
            case ROBUST -> new RobustFeatureScaler();
        };
    }

    /**
     * Resolves a sanitized scaler name.
     *
     * @throws IllegalArgumentException if the name is not a known scaler kind
     */
    public static FeatureScaler forName(String name) {
        ScalerKind kind = ScalerKind.fromLabel(name);
        if (kind == ScalerKind.ROBUST) {
            log.info("Using robust scaler (less sensitive to outliers)");
        } else {
            log.info("Using standard scaler");
        }
        return forKind(kind);
    }
}
