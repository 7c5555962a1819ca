package com.lynx.anomaly.model;

import java.util.Arrays;
import java.util.List;

/**
 * Immutable N x F matrix of finite feature values with a fixed, order-significant
 * feature naming. Column j holds the feature {@code featureNames().get(j)}.
 */
public final class FeatureMatrix {

    private final List<String> featureNames;
    private final double[][] rows;

    public FeatureMatrix(List<String> featureNames, double[][] rows) {
        this.featureNames = List.copyOf(featureNames);
        this.rows = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            if (rows[i].length != featureNames.size()) {
                throw new IllegalArgumentException(String.format(
                        "Row %d has %d values, expected %d", i, rows[i].length, featureNames.size()));
            }
            this.rows[i] = Arrays.copyOf(rows[i], rows[i].length);
        }
    }

    public List<String> featureNames() {
        return featureNames;
    }

    public int rowCount() {
        return rows.length;
    }

    public int columnCount() {
        return featureNames.size();
    }

    public double get(int row, int column) {
        return rows[row][column];
    }

    public double[] row(int index) {
        return Arrays.copyOf(rows[index], rows[index].length);
    }

    public double[] column(int index) {
        double[] column = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            column[i] = rows[i][index];
        }
        return column;
    }

    /** Deep copy of the values, safe for the caller to mutate. */
    public double[][] toArray() {
        double[][] copy = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            copy[i] = Arrays.copyOf(rows[i], rows[i].length);
        }
        return copy;
    }

    /** Rows at the given indices, in the given order. */
    public FeatureMatrix selectRows(int[] indices) {
        double[][] selected = new double[indices.length][];
        for (int i = 0; i < indices.length; i++) {
            selected[i] = rows[indices[i]];
        }
        return new FeatureMatrix(featureNames, selected);
    }
}
