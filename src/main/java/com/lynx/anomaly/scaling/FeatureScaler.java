package com.lynx.anomaly.scaling;

import com.lynx.anomaly.exception.DegenerateScaleException;
import com.lynx.anomaly.model.FeatureMatrix;
import com.lynx.anomaly.model.ScalerKind;
import com.lynx.anomaly.model.ScalerParams;

/**
 * Per-feature location/scale normalization: {@code (x - center) / scale}.
 *
 * Subclasses decide how center and scale are estimated from a column. Fitting and
 * transforming are pure; transform works row by row, so scaling a single row gives
 * the same result as scaling it inside a batch.
 */
public abstract class FeatureScaler {

    public abstract ScalerKind kind();

    protected abstract double center(double[] column);

    protected abstract double scale(double[] column);

    public ScalerParams fit(FeatureMatrix matrix) {
        int features = matrix.columnCount();
        double[] center = new double[features];
        double[] scale = new double[features];

        for (int f = 0; f < features; f++) {
            double[] column = matrix.column(f);
            center[f] = center(column);
            scale[f] = scale(column);
            String name = matrix.featureNames().get(f);
            if (!(scale[f] > 0) || !Double.isFinite(scale[f]) || !Double.isFinite(center[f])) {
                throw new DegenerateScaleException(name, String.format(
                        "Feature '%s' has degenerate %s scale (center=%s, scale=%s)",
                        name, kind().label(), center[f], scale[f]));
            }
        }
        return new ScalerParams(kind(), matrix.featureNames(), center, scale);
    }

    public FeatureMatrix transform(FeatureMatrix matrix, ScalerParams params) {
        if (!matrix.featureNames().equals(params.featureNames())) {
            throw new IllegalArgumentException("Feature order " + matrix.featureNames()
                    + " does not match fitted order " + params.featureNames());
        }
        double[][] scaled = new double[matrix.rowCount()][];
        for (int r = 0; r < scaled.length; r++) {
            scaled[r] = transformRow(matrix.row(r), params);
        }
        return new FeatureMatrix(params.featureNames(), scaled);
    }

    public FeatureMatrix fitTransform(FeatureMatrix matrix) {
        return transform(matrix, fit(matrix));
    }

    /**
     * Scales one feature vector given in the fitted feature order.
     *
     * @throws DegenerateScaleException if any scaled value is not finite
     */
    public static double[] transformRow(double[] row, ScalerParams params) {
        if (row.length != params.featureCount()) {
            throw new IllegalArgumentException(String.format(
                    "Expected %d features, got %d", params.featureCount(), row.length));
        }
        double[] scaled = new double[row.length];
        for (int f = 0; f < row.length; f++) {
            scaled[f] = (row[f] - params.centerAt(f)) / params.scaleAt(f);
            if (!Double.isFinite(scaled[f])) {
                String name = params.featureNames().get(f);
                throw new DegenerateScaleException(name, String.format(
                        "Scaling produced non-finite value for feature '%s' (value=%s)", name, row[f]));
            }
        }
        return scaled;
    }
}
