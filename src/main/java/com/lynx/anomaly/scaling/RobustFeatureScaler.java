package com.lynx.anomaly.scaling;

import com.lynx.anomaly.model.ScalerKind;
import com.lynx.anomaly.util.Quantiles;

import java.util.Arrays;

/**
 * Median / interquartile-range scaling. Less sensitive to the outliers the training
 * data is expected to contain.
 */
public class RobustFeatureScaler extends FeatureScaler {

    private static final double LOWER_QUANTILE = 25.0;
    private static final double UPPER_QUANTILE = 75.0;

    @Override
    public ScalerKind kind() {
        return ScalerKind.ROBUST;
    }

    @Override
    protected double center(double[] column) {
        return Quantiles.median(column);
    }

    @Override
    protected double scale(double[] column) {
        double[] sorted = Arrays.copyOf(column, column.length);
        Arrays.sort(sorted);
        return Quantiles.percentileOfSorted(sorted, UPPER_QUANTILE)
                - Quantiles.percentileOfSorted(sorted, LOWER_QUANTILE);
    }
}
