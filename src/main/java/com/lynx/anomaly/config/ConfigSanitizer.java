package com.lynx.anomaly.config;

import com.lynx.anomaly.model.ScalerKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Corrects common configuration mistakes to safe defaults.
 *
 * Configuration errors never abort a training run: every correction is logged
 * as a warning and the run continues with the default value.
 */
@Component
public class ConfigSanitizer {

    private static final Logger log = LoggerFactory.getLogger(ConfigSanitizer.class);

    public TrainingConfig sanitize(TrainingConfig config) {
        config.setContamination(resolveContamination(config.getContamination()));

        if (ScalerKind.parse(config.getScaler()).isEmpty()) {
            log.warn("Unknown scaler kind '{}'. Using {}", config.getScaler(), ScalerKind.ROBUST.label());
            config.setScaler(ScalerKind.ROBUST.label());
        }

        if (config.getValidationSplit() < 0 || config.getValidationSplit() >= 1) {
            log.warn("Validation split {} is outside [0, 1). Using {}",
                    config.getValidationSplit(), TrainingConfig.DEFAULT_VALIDATION_SPLIT);
            config.setValidationSplit(TrainingConfig.DEFAULT_VALIDATION_SPLIT);
        }

        if (config.getNumTrees() <= 0) {
            log.warn("num_trees {} must be positive. Using {}",
                    config.getNumTrees(), TrainingConfig.DEFAULT_NUM_TREES);
            config.setNumTrees(TrainingConfig.DEFAULT_NUM_TREES);
        }

        if (config.getMaxSamples() == null) {
            config.setMaxSamples("auto");
        } else if (!"auto".equalsIgnoreCase(config.getMaxSamples()) && parseMaxSamples(config.getMaxSamples()) <= 0) {
            log.warn("max_samples '{}' is neither 'auto' nor a positive integer. Using auto", config.getMaxSamples());
            config.setMaxSamples("auto");
        }

        if (config.getMinSamples() < 1) {
            log.warn("min_samples {} must be at least 1. Using 100", config.getMinSamples());
            config.setMinSamples(100);
        }
        return config;
    }

    /**
     * Contamination must lie in (0, 0.5). Anything else is replaced with the default.
     */
    public static double resolveContamination(double contamination) {
        if (Double.isNaN(contamination) || contamination <= 0 || contamination >= 0.5) {
            log.warn("Contamination {} is unrealistic. Using {}", contamination, TrainingConfig.DEFAULT_CONTAMINATION);
            return TrainingConfig.DEFAULT_CONTAMINATION;
        }
        return contamination;
    }

    /**
     * Resolves the per-tree subsample size against the number of training rows.
     */
    public static int resolveSubsampleSize(String maxSamples, int rows) {
        if (maxSamples == null || "auto".equalsIgnoreCase(maxSamples)) {
            return Math.min(TrainingConfig.AUTO_MAX_SAMPLES, rows);
        }
        int requested = parseMaxSamples(maxSamples);
        if (requested <= 0) {
            return Math.min(TrainingConfig.AUTO_MAX_SAMPLES, rows);
        }
        if (requested > rows) {
            log.warn("max_samples ({}) is greater than the number of training rows ({}). Using {}",
                    requested, rows, rows);
            return rows;
        }
        return requested;
    }

    private static int parseMaxSamples(String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
