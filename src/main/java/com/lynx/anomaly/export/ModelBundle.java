package com.lynx.anomaly.export;

/**
 * The exported unit. {@code interchange} is null when the optional tree-ensemble
 * graph could not be produced.
 */
public record ModelBundle(BundleMetadata metadata,
                          ScalerDocument scaler,
                          ForestDocument forest,
                          IntegrationGuide guide,
                          TreeEnsembleGraph interchange) {
}
