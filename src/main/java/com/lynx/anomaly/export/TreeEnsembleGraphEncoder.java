package com.lynx.anomaly.export;

import com.lynx.anomaly.engine.isolationforest.IsolationForest;
import com.lynx.anomaly.engine.isolationforest.IsolationNode;
import com.lynx.anomaly.engine.isolationforest.IsolationTree;
import com.lynx.anomaly.engine.isolationforest.TreeStructure;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Encodes a forest as a {@link TreeEnsembleGraph}.
 *
 * Every leaf carries {@code depth + c(size)} as its target weight, so the
 * ensemble's AVERAGE aggregate is the mean path length E[h(x)]. The trailing
 * nodes compute {@code 0.5 - 2^(-E[h(x)] / c(S))}.
 */
public class TreeEnsembleGraphEncoder {

    static final String INPUT = "float_input";
    static final String OUTPUT = "decision_score";

    public TreeEnsembleGraph encode(IsolationForest forest, int featureCount, int onnxOpset, int mlOpset) {
        List<Integer> treeIds = new ArrayList<>();
        List<Integer> nodeIds = new ArrayList<>();
        List<Integer> featureIds = new ArrayList<>();
        List<Double> values = new ArrayList<>();
        List<String> modes = new ArrayList<>();
        List<Integer> trueIds = new ArrayList<>();
        List<Integer> falseIds = new ArrayList<>();
        List<Integer> targetTreeIds = new ArrayList<>();
        List<Integer> targetNodeIds = new ArrayList<>();
        List<Integer> targetIds = new ArrayList<>();
        List<Double> targetWeights = new ArrayList<>();

        List<IsolationTree> trees = forest.getTrees();
        for (int t = 0; t < trees.size(); t++) {
            TreeStructure s = trees.get(t).toStructure();
            for (int n = 0; n < s.nodeCount(); n++) {
                treeIds.add(t);
                nodeIds.add(n);
                if (s.isLeaf(n)) {
                    featureIds.add(0);
                    values.add(0.0);
                    modes.add("LEAF");
                    trueIds.add(0);
                    falseIds.add(0);
                    targetTreeIds.add(t);
                    targetNodeIds.add(n);
                    targetIds.add(0);
                    targetWeights.add(s.leafDepth()[n] + IsolationNode.averagePathLength(s.leafSize()[n]));
                } else {
                    int feature = s.splitFeatureIndex()[n];
                    if (feature < 0 || feature >= featureCount) {
                        throw new IllegalStateException(String.format(
                                "Tree %d node %d splits on feature %d outside [0, %d)", t, n, feature, featureCount));
                    }
                    featureIds.add(feature);
                    values.add(s.splitValue()[n]);
                    // true branch is taken when x < value
                    modes.add("BRANCH_LT");
                    trueIds.add(s.leftChild()[n]);
                    falseIds.add(s.rightChild()[n]);
                }
            }
        }

        Map<String, Object> ensemble = new LinkedHashMap<>();
        ensemble.put("n_targets", 1);
        ensemble.put("aggregate_function", "AVERAGE");
        ensemble.put("post_transform", "NONE");
        ensemble.put("nodes_treeids", treeIds);
        ensemble.put("nodes_nodeids", nodeIds);
        ensemble.put("nodes_featureids", featureIds);
        ensemble.put("nodes_values", values);
        ensemble.put("nodes_modes", modes);
        ensemble.put("nodes_truenodeids", trueIds);
        ensemble.put("nodes_falsenodeids", falseIds);
        ensemble.put("target_treeids", targetTreeIds);
        ensemble.put("target_nodeids", targetNodeIds);
        ensemble.put("target_ids", targetIds);
        ensemble.put("target_weights", targetWeights);

        Map<String, Double> initializers = new LinkedHashMap<>();
        initializers.put("c_subsample", IsolationNode.averagePathLength(forest.getSampleSize()));
        initializers.put("two", 2.0);
        initializers.put("half", 0.5);

        List<TreeEnsembleGraph.GraphNode> nodes = List.of(
                node("TreeEnsembleRegressor", "ai.onnx.ml", List.of(INPUT), "mean_path_length", ensemble),
                node("Div", "", List.of("mean_path_length", "c_subsample"), "normalized_path", Map.of()),
                node("Neg", "", List.of("normalized_path"), "neg_normalized_path", Map.of()),
                node("Pow", "", List.of("two", "neg_normalized_path"), "anomaly_score", Map.of()),
                node("Sub", "", List.of("half", "anomaly_score"), OUTPUT, Map.of()));

        Map<String, Integer> opsets = new LinkedHashMap<>();
        opsets.put("", onnxOpset);
        opsets.put("ai.onnx.ml", mlOpset);

        return TreeEnsembleGraph.builder()
                .producerName("lynx-anomaly-trainer")
                .opsetImport(opsets)
                .inputs(List.of(new TreeEnsembleGraph.ValueInfo(INPUT, "float", List.of(-1, featureCount))))
                .outputs(List.of(new TreeEnsembleGraph.ValueInfo(OUTPUT, "float", List.of(-1, 1))))
                .initializers(initializers)
                .nodes(nodes)
                .build();
    }

    private static TreeEnsembleGraph.GraphNode node(String opType, String domain, List<String> inputs,
                                                    String output, Map<String, Object> attributes) {
        return TreeEnsembleGraph.GraphNode.builder()
                .name(output + "_op")
                .opType(opType)
                .domain(domain)
                .inputs(inputs)
                .outputs(List.of(output))
                .attributes(attributes)
                .build();
    }
}
