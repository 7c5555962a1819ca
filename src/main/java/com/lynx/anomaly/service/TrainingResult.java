package com.lynx.anomaly.service;

import com.lynx.anomaly.engine.isolationforest.IsolationForest;
import com.lynx.anomaly.export.ExportReport;
import com.lynx.anomaly.model.EvaluationMetrics;
import com.lynx.anomaly.model.ScalerParams;

import java.util.List;

/**
 * @param validationMetrics metrics over the held-out split, null when no split was made
 * @param metrics           metrics over the full scaled dataset
 */
public record TrainingResult(List<String> featureNames,
                             ScalerParams scalerParams,
                             IsolationForest forest,
                             EvaluationMetrics validationMetrics,
                             EvaluationMetrics metrics,
                             ExportReport exportReport) {
}
