package com.lynx.anomaly.data;

import com.lynx.anomaly.util.Quantiles;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Column-wise median imputation of NaN values.
 */
public class MedianImputer {

    /**
     * Replaces NaN entries of each column with the median of that column's present
     * values. A column with no present values is filled with 0.
     *
     * @param columns feature columns, modified in place
     * @param names   column names, used for the returned counts
     * @return number of imputed values per affected feature, in column order
     */
    public Map<String, Integer> impute(double[][] columns, List<String> names) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (int c = 0; c < columns.length; c++) {
            double[] column = columns[c];
            int missing = 0;
            for (double v : column) {
                if (Double.isNaN(v)) missing++;
            }
            if (missing == 0) continue;

            double median = Quantiles.nanMedian(column);
            double fill = Double.isNaN(median) ? 0.0 : median;
            for (int r = 0; r < column.length; r++) {
                if (Double.isNaN(column[r])) column[r] = fill;
            }
            counts.put(names.get(c), missing);
        }
        return counts;
    }
}
