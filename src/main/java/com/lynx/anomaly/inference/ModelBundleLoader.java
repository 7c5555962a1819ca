package com.lynx.anomaly.inference;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lynx.anomaly.exception.FeatureOrderMismatchException;
import com.lynx.anomaly.export.BundleMetadata;
import com.lynx.anomaly.export.FeatureOrderHash;
import com.lynx.anomaly.export.ForestDocument;
import com.lynx.anomaly.export.ModelBundleExporter;
import com.lynx.anomaly.export.ScalerDocument;
import com.lynx.anomaly.model.ScalerParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads an exported bundle back and verifies it against the feature order the
 * caller will supply. A bundle whose stored hashes disagree with that order, or
 * whose scaler feature list no longer matches its own hash, is rejected.
 */
@Component
public class ModelBundleLoader {

    private static final Logger log = LoggerFactory.getLogger(ModelBundleLoader.class);

    private final ObjectMapper objectMapper = new ObjectMapper();

    public AnomalyDetector load(Path bundleDir, List<String> expectedFeatureOrder) {
        BundleMetadata metadata = read(bundleDir.resolve(ModelBundleExporter.METADATA_FILE), BundleMetadata.class);
        ScalerDocument scaler = read(bundleDir.resolve(ModelBundleExporter.SCALER_FILE), ScalerDocument.class);
        ForestDocument forest = read(bundleDir.resolve(ModelBundleExporter.FOREST_FILE), ForestDocument.class);

        String callerHash = FeatureOrderHash.of(expectedFeatureOrder);
        verify(ModelBundleExporter.METADATA_FILE, metadata.getFeatureOrderHash(), callerHash);
        verify(ModelBundleExporter.SCALER_FILE, scaler.getFeatureOrderHash(), callerHash);
        verify(ModelBundleExporter.FOREST_FILE, forest.getFeatureOrderHash(), callerHash);
        verify(ModelBundleExporter.SCALER_FILE + " feature_names", scaler.getFeatureOrderHash(),
                FeatureOrderHash.of(scaler.getFeatureNames()));

        ScalerParams params = scaler.toParams();
        log.debug("Loaded bundle from {}: {} trees, offset={}", bundleDir,
                forest.getTrees().size(), forest.getDecisionOffset());
        return new AnomalyDetector(params, forest.toForest());
    }

    private static void verify(String document, String storedHash, String callerHash) {
        if (!callerHash.equals(storedHash)) {
            throw new FeatureOrderMismatchException(document, storedHash, callerHash);
        }
    }

    private <T> T read(Path file, Class<T> type) {
        try {
            return objectMapper.readValue(file.toFile(), type);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }
}
