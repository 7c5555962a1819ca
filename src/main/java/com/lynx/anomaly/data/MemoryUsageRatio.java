package com.lynx.anomaly.data;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Derives {@code memory_usage} (percent) from the raw memory counters.
 *
 * A row with a non-positive total or a negative used value maps to 0 instead of
 * failing the batch. Results are clamped to [0, 100].
 */
public final class MemoryUsageRatio {

    private static final Logger log = LoggerFactory.getLogger(MemoryUsageRatio.class);

    public static final String FEATURE = "memory_usage";
    public static final String USED_COLUMN = "memory_used_kb";
    public static final String TOTAL_COLUMN = "memory_total_kb";
    public static final List<String> REQUIRED_COLUMNS = List.of(USED_COLUMN, TOTAL_COLUMN);

    private MemoryUsageRatio() {}

    public static boolean canDerive(RawTable table) {
        return table.hasColumn(USED_COLUMN) && table.hasColumn(TOTAL_COLUMN);
    }

    /**
     * Adds the derived column and removes the raw counters.
     */
    public static RawTable apply(RawTable table) {
        double[] used = table.column(USED_COLUMN);
        double[] total = table.column(TOTAL_COLUMN);
        double[] ratio = new double[table.rowCount()];

        int invalid = 0;
        for (int i = 0; i < ratio.length; i++) {
            // NaN fails both comparisons and is counted as invalid
            if (total[i] > 0 && used[i] >= 0) {
                ratio[i] = clamp(100.0 * used[i] / total[i]);
            } else {
                ratio[i] = 0.0;
                invalid++;
            }
        }

        if (invalid > 0) {
            log.warn("Found {} invalid memory readings, set to 0%", invalid);
        }
        log.info("Calculated memory usage percentage");
        return table.withoutColumns(REQUIRED_COLUMNS).withColumn(FEATURE, ratio);
    }

    static double clamp(double percent) {
        if (Double.isNaN(percent)) return 0.0;
        return Math.max(0.0, Math.min(100.0, percent));
    }
}
