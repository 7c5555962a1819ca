package com.lynx.anomaly.scaling;

import com.lynx.anomaly.model.ScalerKind;
import com.lynx.anomaly.util.Quantiles;

public class StandardFeatureScaler extends FeatureScaler {

    @Override
    public ScalerKind kind() {
        return ScalerKind.STANDARD;
    }

    @Override
    protected double center(double[] column) {
        return Quantiles.mean(column);
    }

    @Override
    protected double scale(double[] column) {
        return Quantiles.std(column);
    }
}
