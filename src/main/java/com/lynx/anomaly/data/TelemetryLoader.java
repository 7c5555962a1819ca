package com.lynx.anomaly.data;

import com.lynx.anomaly.config.TrainingConfig;
import com.lynx.anomaly.exception.EmptyInputException;
import com.lynx.anomaly.exception.InsufficientSamplesException;
import com.lynx.anomaly.exception.MissingColumnException;
import com.lynx.anomaly.exception.TooFewFeaturesException;
import com.lynx.anomaly.model.FeatureMatrix;
import com.lynx.anomaly.util.Quantiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Turns raw telemetry into a validated, finite {@link FeatureMatrix}.
 *
 * Pipeline: validate shape and prerequisite columns, drop unused columns, derive
 * the memory usage ratio, select usable features, impute missing values with the
 * column median, clamp any remaining non-finite value.
 */
@Component
public class TelemetryLoader {

    private static final Logger log = LoggerFactory.getLogger(TelemetryLoader.class);

    private static final int MIN_FEATURES = 2;

    private final TelemetryCsvReader csvReader;
    private final MedianImputer imputer;

    public TelemetryLoader(TelemetryCsvReader csvReader) {
        this.csvReader = csvReader;
        this.imputer = new MedianImputer();
    }

    public FeatureMatrix load(Path inputCsv, TrainingConfig config) {
        return prepare(csvReader.read(inputCsv), config);
    }

    public FeatureMatrix prepare(RawTable raw, TrainingConfig config) {
        validate(raw, config);

        RawTable table = dropUnused(raw, config.getDropColumns());

        boolean derived = false;
        if (config.isMemoryUsageRatio() && MemoryUsageRatio.canDerive(table)) {
            table = MemoryUsageRatio.apply(table);
            derived = true;
        }

        List<String> features = selectFeatures(table, config, derived);

        double[][] columns = new double[features.size()][];
        for (int c = 0; c < features.size(); c++) {
            columns[c] = table.column(features.get(c));
        }

        Map<String, Integer> imputed = imputer.impute(columns, features);
        if (!imputed.isEmpty()) {
            log.warn("Found NaN values in features: {}", imputed);
            log.info("Filled NaN values with column medians");
        }

        int clamped = clampNonFinite(columns, config.getNonFiniteBound());
        if (clamped > 0) {
            log.warn("Found {} infinite values, clipping to +/-{}", clamped, config.getNonFiniteBound());
        }

        FeatureMatrix matrix = new FeatureMatrix(features, transpose(columns, table.rowCount()));
        log.info("Final dataset: {} samples x {} features", matrix.rowCount(), matrix.columnCount());
        return matrix;
    }

    void validate(RawTable raw, TrainingConfig config) {
        if (raw.isEmpty()) {
            throw new EmptyInputException("telemetry table has no rows");
        }
        if (raw.rowCount() < config.getMinSamples()) {
            throw new InsufficientSamplesException(raw.rowCount(), config.getMinSamples());
        }

        List<String> highNull = new ArrayList<>();
        for (String column : raw.columnNames()) {
            if (raw.missingCount(column) > raw.rowCount() * config.getHighNullWarnFraction()) {
                highNull.add(column);
            }
        }
        if (!highNull.isEmpty()) {
            log.warn("Columns with >{}% missing data: {}", Math.round(config.getHighNullWarnFraction() * 100), highNull);
        }

        if (config.isMemoryUsageRatio()) {
            List<String> missing = MemoryUsageRatio.REQUIRED_COLUMNS.stream()
                    .filter(c -> !raw.hasColumn(c))
                    .toList();
            if (!missing.isEmpty()) {
                throw new MissingColumnException("memory calculation", missing);
            }
        }

        log.info("Data validation passed: {} samples, {} columns", raw.rowCount(), raw.columnNames().size());
    }

    private RawTable dropUnused(RawTable table, List<String> dropColumns) {
        List<String> present = dropColumns.stream().filter(table::hasColumn).toList();
        if (present.isEmpty()) {
            return table;
        }
        log.info("Dropped {} unused columns: {}", present.size(), present);
        return table.withoutColumns(present);
    }

    List<String> selectFeatures(RawTable table, TrainingConfig config, boolean memoryDerived) {
        List<String> accepted = new ArrayList<>();
        List<String> rejected = new ArrayList<>();

        for (String feature : config.getFeatures()) {
            if (MemoryUsageRatio.FEATURE.equals(feature) && config.isMemoryUsageRatio()) {
                if (!memoryDerived) {
                    rejected.add(feature + " (requires " + String.join(", ", MemoryUsageRatio.REQUIRED_COLUMNS) + ")");
                } else if (config.isFeatureSelection() && !hasVariance(table.column(feature))) {
                    log.warn("Feature '{}' has no variance, excluding", feature);
                    rejected.add(feature + " (no variance)");
                } else {
                    accepted.add(feature);
                }
            } else if (!table.hasColumn(feature)) {
                rejected.add(feature);
            } else if (config.isFeatureSelection() && !hasVariance(table.column(feature))) {
                log.warn("Feature '{}' has no variance, excluding", feature);
                rejected.add(feature + " (no variance)");
            } else {
                accepted.add(feature);
            }
        }

        if (!rejected.isEmpty()) {
            log.warn("Missing or invalid features: {}", rejected);
        }
        if (accepted.size() < MIN_FEATURES) {
            throw new TooFewFeaturesException(accepted);
        }

        log.info("Using {} valid features: {}", accepted.size(), accepted);
        return accepted;
    }

    static boolean hasVariance(double[] column) {
        double[] present = Arrays.stream(column).filter(Double::isFinite).toArray();
        if (present.length < 2) return false;
        return Quantiles.std(present) > 0;
    }

    private static int clampNonFinite(double[][] columns, double bound) {
        int clamped = 0;
        for (double[] column : columns) {
            for (int r = 0; r < column.length; r++) {
                double v = column[r];
                if (Double.isFinite(v)) continue;
                column[r] = v < 0 ? -bound : bound;
                clamped++;
            }
        }
        return clamped;
    }

    private static double[][] transpose(double[][] columns, int rowCount) {
        double[][] rows = new double[rowCount][columns.length];
        for (int c = 0; c < columns.length; c++) {
            for (int r = 0; r < rowCount; r++) {
                rows[r][c] = columns[c][r];
            }
        }
        return rows;
    }
}
