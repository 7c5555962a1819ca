package com.lynx.anomaly.export;

import com.lynx.anomaly.engine.isolationforest.IsolationForest;
import com.lynx.anomaly.engine.isolationforest.IsolationNode;
import com.lynx.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TreeEnsembleGraphEncoderTest {

    private final TreeEnsembleGraphEncoder encoder = new TreeEnsembleGraphEncoder();

    @Test
    void encode_declaresOpsetsAndShapes() {
        IsolationForest forest = TestDataFactory.trainedModel(300, 10, 0.1).forest();

        TreeEnsembleGraph graph = encoder.encode(forest, 5, 15, 3);

        assertThat(graph.getOpsetImport()).containsEntry("", 15).containsEntry("ai.onnx.ml", 3);
        assertThat(graph.getInputs().get(0).getShape()).containsExactly(-1, 5);
        assertThat(graph.getNodes()).extracting(TreeEnsembleGraph.GraphNode::getOpType)
                .containsExactly("TreeEnsembleRegressor", "Div", "Neg", "Pow", "Sub");
        assertThat(graph.getInitializers().get("c_subsample"))
                .isEqualTo(IsolationNode.averagePathLength(forest.getSampleSize()));
    }

    @Test
    void encode_graphReproducesDecisionScores() {
        TestDataFactory.TrainedModel model = TestDataFactory.trainedModel(300, 20, 0.1);
        IsolationForest forest = model.forest();
        TreeEnsembleGraph graph = encoder.encode(forest, 5, 15, 3);
        Map<String, Object> ensemble = graph.getNodes().get(0).getAttributes();

        double[][] points = TestDataFactory.gaussianPoints(25, 5, 3L);
        for (double[] point : points) {
            double meanPath = evaluateEnsemble(ensemble, point, forest.getTrees().size());
            double score = 0.5 - Math.pow(2, -meanPath / graph.getInitializers().get("c_subsample"));
            assertThat(score).isCloseTo(forest.decisionScore(point), within(1e-9));
        }
    }

    @Test
    void encode_featureIndexOutOfRange_rejected() {
        IsolationForest forest = TestDataFactory.trainedModel(300, 5, 0.1).forest();

        assertThatThrownBy(() -> encoder.encode(forest, 1, 15, 3))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("outside");
    }

    // Walks the flattened node arrays the way a tree-ensemble runtime would
    @SuppressWarnings("unchecked")
    private static double evaluateEnsemble(Map<String, Object> ensemble, double[] point, int treeCount) {
        List<Integer> treeIds = (List<Integer>) ensemble.get("nodes_treeids");
        List<Integer> nodeIds = (List<Integer>) ensemble.get("nodes_nodeids");
        List<Integer> features = (List<Integer>) ensemble.get("nodes_featureids");
        List<Double> values = (List<Double>) ensemble.get("nodes_values");
        List<String> modes = (List<String>) ensemble.get("nodes_modes");
        List<Integer> trueIds = (List<Integer>) ensemble.get("nodes_truenodeids");
        List<Integer> falseIds = (List<Integer>) ensemble.get("nodes_falsenodeids");
        List<Integer> targetTrees = (List<Integer>) ensemble.get("target_treeids");
        List<Integer> targetNodes = (List<Integer>) ensemble.get("target_nodeids");
        List<Double> weights = (List<Double>) ensemble.get("target_weights");

        double sum = 0;
        for (int t = 0; t < treeCount; t++) {
            int node = 0;
            while (true) {
                int row = indexOf(treeIds, nodeIds, t, node);
                if ("LEAF".equals(modes.get(row))) break;
                node = point[features.get(row)] < values.get(row) ? trueIds.get(row) : falseIds.get(row);
            }
            sum += weights.get(indexOf(targetTrees, targetNodes, t, node));
        }
        return sum / treeCount;
    }

    private static int indexOf(List<Integer> trees, List<Integer> nodes, int tree, int node) {
        for (int i = 0; i < trees.size(); i++) {
            if (trees.get(i) == tree && nodes.get(i) == node) return i;
        }
        throw new AssertionError("No entry for tree " + tree + " node " + node);
    }
}
