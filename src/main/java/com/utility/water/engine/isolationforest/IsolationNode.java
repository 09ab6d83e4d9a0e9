package com.utility.water.engine.isolationforest;

/**
 * Node of an isolation tree. Internal nodes split one feature at a value;
 * external nodes remember how many training samples reached them.
 */
final class IsolationNode {

    private static final double EULER_GAMMA = 0.5772156649;

    private final int splitFeature;
    private final double splitValue;
    private final IsolationNode left;
    private final IsolationNode right;
    private final int size;

    private IsolationNode(int splitFeature, double splitValue, IsolationNode left, IsolationNode right, int size) {
        this.splitFeature = splitFeature;
        this.splitValue = splitValue;
        this.left = left;
        this.right = right;
        this.size = size;
    }

    static IsolationNode internal(int splitFeature, double splitValue, IsolationNode left, IsolationNode right) {
        return new IsolationNode(splitFeature, splitValue, left, right, 0);
    }

    static IsolationNode external(int size) {
        return new IsolationNode(-1, Double.NaN, null, null, size);
    }

    boolean isExternal() {
        return left == null;
    }

    double pathLength(double[] point, int depth) {
        IsolationNode node = this;
        while (!node.isExternal()) {
            node = point[node.splitFeature] < node.splitValue ? node.left : node.right;
            depth++;
        }
        return depth + averagePathLength(node.size);
    }

    /**
     * Average path length of an unsuccessful BST search over n points:
     * c(n) = 2H(n-1) - 2(n-1)/n, with H(i) approximated by ln(i) + Euler's constant.
     */
    static double averagePathLength(int n) {
        if (n <= 1) return 0;
        if (n == 2) return 1;
        double harmonic = Math.log(n - 1.0) + EULER_GAMMA;
        return 2.0 * harmonic - (2.0 * (n - 1.0) / n);
    }
}
