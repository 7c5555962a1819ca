package com.lynx.anomaly.calibration;

import com.lynx.anomaly.model.FeatureMatrix;

import java.util.Random;

/**
 * Seeded shuffle split into training and validation rows.
 */
public class DatasetSplitter {

    public DatasetSplit split(FeatureMatrix matrix, double validationFraction, long seed) {
        int n = matrix.rowCount();
        if (validationFraction <= 0 || n < 2) {
            return new DatasetSplit(matrix, null);
        }

        int validationSize = (int) Math.ceil(validationFraction * n);
        validationSize = Math.max(1, Math.min(validationSize, n - 1));

        int[] indices = new int[n];
        for (int i = 0; i < n; i++) indices[i] = i;
        Random random = new Random(seed);
        for (int i = n - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
        }

        int trainingSize = n - validationSize;
        int[] trainIdx = new int[trainingSize];
        int[] validationIdx = new int[validationSize];
        System.arraycopy(indices, 0, trainIdx, 0, trainingSize);
        System.arraycopy(indices, trainingSize, validationIdx, 0, validationSize);

        return new DatasetSplit(matrix.selectRows(trainIdx), matrix.selectRows(validationIdx));
    }
}
