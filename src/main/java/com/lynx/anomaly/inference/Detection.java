package com.lynx.anomaly.inference;

import java.util.Map;

/**
 * Result of scoring one sample.
 *
 * @param decisionScore    more negative means more anomalous
 * @param anomalous        {@code decisionScore < threshold}
 * @param confidence       {@code |decisionScore - threshold|}
 * @param topContributions up to three features that raised the anomaly score the most
 */
public record Detection(double decisionScore, double threshold, boolean anomalous, double confidence,
                        Map<String, Double> topContributions) {
}
