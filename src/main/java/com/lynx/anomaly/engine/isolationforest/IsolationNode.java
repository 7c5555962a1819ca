package com.lynx.anomaly.engine.isolationforest;

public final class IsolationNode {

    private static final double EULER_GAMMA = 0.5772156649;

    private final int splitFeature;
    private final double splitValue;
    private final IsolationNode left;
    private final IsolationNode right;
    private final int size;  // number of samples that reached this node (leaf nodes)
    private final int depth; // depth at which recursion stopped (leaf nodes)
    private final boolean external;

    private IsolationNode(int splitFeature, double splitValue, IsolationNode left, IsolationNode right,
                          int size, int depth, boolean external) {
        this.splitFeature = splitFeature;
        this.splitValue = splitValue;
        this.left = left;
        this.right = right;
        this.size = size;
        this.depth = depth;
        this.external = external;
    }

    public static IsolationNode internalNode(int splitFeature, double splitValue,
                                             IsolationNode left, IsolationNode right) {
        return new IsolationNode(splitFeature, splitValue, left, right, 0, -1, false);
    }

    public static IsolationNode externalNode(int size, int depth) {
        return new IsolationNode(-1, Double.NaN, null, null, size, depth, true);
    }

    /**
     * Descends to the leaf matching {@code point}; a point goes left iff
     * {@code point[splitFeature] < splitValue}.
     */
    public double pathLength(double[] point, int currentDepth) {
        IsolationNode node = this;
        int depth = currentDepth;
        while (!node.external) {
            node = point[node.splitFeature] < node.splitValue ? node.left : node.right;
            depth++;
        }
        return depth + averagePathLength(node.size);
    }

    /**
     * Average path length of unsuccessful search in a BST (Equation 1 from the IF paper).
     * c(n) = 2H(n-1) - 2(n-1)/n where H(i) = ln(i) + Euler's constant (0.5772...)
     */
    public static double averagePathLength(int n) {
        if (n <= 1) return 0;
        if (n == 2) return 1;
        double harmonicNumber = Math.log(n - 1.0) + EULER_GAMMA;
        return 2.0 * harmonicNumber - (2.0 * (n - 1.0) / n);
    }

    public int getSplitFeature() { return splitFeature; }
    public double getSplitValue() { return splitValue; }
    public IsolationNode getLeft() { return left; }
    public IsolationNode getRight() { return right; }
    public int getSize() { return size; }
    public int getDepth() { return depth; }
    public boolean isExternal() { return external; }
}
