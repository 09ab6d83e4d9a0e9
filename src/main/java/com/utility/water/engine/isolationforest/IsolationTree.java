package com.utility.water.engine.isolationforest;

import java.util.Random;

final class IsolationTree {

    private final IsolationNode root;

    private IsolationTree(IsolationNode root) {
        this.root = root;
    }

    /**
     * Grows a tree over the rows selected by {@code indices}. The index array is
     * partitioned in place as the tree splits.
     */
    static IsolationTree grow(double[][] data, int[] indices, int maxDepth, Random random) {
        return new IsolationTree(grow(data, indices, 0, indices.length, 0, maxDepth, random));
    }

    private static IsolationNode grow(double[][] data, int[] indices, int from, int to,
                                      int depth, int maxDepth, Random random) {
        int n = to - from;
        if (depth >= maxDepth || n <= 1) {
            return IsolationNode.external(n);
        }

        int feature = random.nextInt(data[indices[from]].length);

        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (int i = from; i < to; i++) {
            double v = data[indices[i]][feature];
            if (v < min) min = v;
            if (v > max) max = v;
        }
        if (min >= max) {
            return IsolationNode.external(n);
        }

        double split = min + random.nextDouble() * (max - min);

        // Rows below the split move to the front of [from, to)
        int mid = from;
        for (int i = from; i < to; i++) {
            if (data[indices[i]][feature] < split) {
                int tmp = indices[mid];
                indices[mid] = indices[i];
                indices[i] = tmp;
                mid++;
            }
        }

        IsolationNode left = grow(data, indices, from, mid, depth + 1, maxDepth, random);
        IsolationNode right = grow(data, indices, mid, to, depth + 1, maxDepth, random);
        return IsolationNode.internal(feature, split, left, right);
    }

    double pathLength(double[] point) {
        return root.pathLength(point, 0);
    }
}
