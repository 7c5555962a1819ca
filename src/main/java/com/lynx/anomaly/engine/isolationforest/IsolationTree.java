package com.lynx.anomaly.engine.isolationforest;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

public class IsolationTree {

    private final IsolationNode root;

    public IsolationTree(IsolationNode root) {
        this.root = root;
    }

    public static IsolationTree build(double[][] data, int maxDepth, Random random) {
        IsolationNode root = buildNode(data, 0, maxDepth, random);
        return new IsolationTree(root);
    }

    private static IsolationNode buildNode(double[][] data, int depth, int maxDepth, Random random) {
        int n = data.length;

        if (depth >= maxDepth || n <= 1) {
            return IsolationNode.externalNode(n, depth);
        }

        // Only features with a non-degenerate range in this node can split it
        int numFeatures = data[0].length;
        double[] mins = new double[numFeatures];
        double[] maxs = new double[numFeatures];
        List<Integer> candidates = new ArrayList<>(numFeatures);
        for (int f = 0; f < numFeatures; f++) {
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (double[] row : data) {
                if (row[f] < min) min = row[f];
                if (row[f] > max) max = row[f];
            }
            mins[f] = min;
            maxs[f] = max;
            if (min < max) candidates.add(f);
        }

        // All remaining points are identical
        if (candidates.isEmpty()) {
            return IsolationNode.externalNode(n, depth);
        }

        int featureIdx = candidates.get(random.nextInt(candidates.size()));
        double min = mins[featureIdx];
        double max = maxs[featureIdx];
        double splitValue = min + random.nextDouble() * (max - min);

        // Partition data
        int leftCount = 0;
        for (double[] row : data) {
            if (row[featureIdx] < splitValue) leftCount++;
        }

        double[][] leftData = new double[leftCount][];
        double[][] rightData = new double[n - leftCount][];
        int li = 0, ri = 0;
        for (double[] row : data) {
            if (row[featureIdx] < splitValue) {
                leftData[li++] = row;
            } else {
                rightData[ri++] = row;
            }
        }

        IsolationNode left = buildNode(leftData, depth + 1, maxDepth, random);
        IsolationNode right = buildNode(rightData, depth + 1, maxDepth, random);

        return IsolationNode.internalNode(featureIdx, splitValue, left, right);
    }

    public double pathLength(double[] point) {
        return root.pathLength(point, 0);
    }

    public IsolationNode getRoot() { return root; }

    /** Deepest leaf depth in this tree. */
    public int height() {
        return height(root);
    }

    private static int height(IsolationNode node) {
        if (node.isExternal()) return node.getDepth();
        return Math.max(height(node.getLeft()), height(node.getRight()));
    }

    public TreeStructure toStructure() {
        List<IsolationNode> order = new ArrayList<>();
        collectPreOrder(root, order);

        int count = order.size();
        Map<IsolationNode, Integer> ids = new IdentityHashMap<>(count * 2);
        for (int i = 0; i < count; i++) {
            ids.put(order.get(i), i);
        }

        int[] feature = new int[count];
        double[] value = new double[count];
        int[] left = new int[count];
        int[] right = new int[count];
        int[] leafDepth = new int[count];
        int[] leafSize = new int[count];

        for (int id = 0; id < count; id++) {
            IsolationNode node = order.get(id);
            if (node.isExternal()) {
                feature[id] = -1;
                value[id] = 0.0;
                left[id] = -1;
                right[id] = -1;
                leafDepth[id] = node.getDepth();
                leafSize[id] = node.getSize();
            } else {
                feature[id] = node.getSplitFeature();
                value[id] = node.getSplitValue();
                left[id] = ids.get(node.getLeft());
                right[id] = ids.get(node.getRight());
                leafDepth[id] = -1;
                leafSize[id] = -1;
            }
        }
        return new TreeStructure(feature, value, left, right, leafDepth, leafSize);
    }

    private static void collectPreOrder(IsolationNode node, List<IsolationNode> out) {
        out.add(node);
        if (!node.isExternal()) {
            collectPreOrder(node.getLeft(), out);
            collectPreOrder(node.getRight(), out);
        }
    }

    public static IsolationTree fromStructure(TreeStructure structure) {
        if (structure.nodeCount() == 0) {
            throw new IllegalArgumentException("Tree structure has no nodes");
        }
        return new IsolationTree(rebuild(structure, 0, 0));
    }

    private static IsolationNode rebuild(TreeStructure s, int id, int depth) {
        if (depth > s.nodeCount()) {
            throw new IllegalArgumentException("Tree structure contains a cycle");
        }
        if (s.isLeaf(id)) {
            return IsolationNode.externalNode(s.leafSize()[id], s.leafDepth()[id]);
        }
        return IsolationNode.internalNode(s.splitFeatureIndex()[id], s.splitValue()[id],
                rebuild(s, s.leftChild()[id], depth + 1),
                rebuild(s, s.rightChild()[id], depth + 1));
    }
}
