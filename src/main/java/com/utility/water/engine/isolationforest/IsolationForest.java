package com.utility.water.engine.isolationforest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Ensemble of isolation trees. Points that are isolated after few random
 * splits get scores close to 1.0; typical points score well below 0.5.
 */
public final class IsolationForest {

    private final List<IsolationTree> trees;
    private final int sampleSize;

    private IsolationForest(List<IsolationTree> trees, int sampleSize) {
        this.trees = trees;
        this.sampleSize = sampleSize;
    }

    /**
     * @param data       training rows, one feature vector each
     * @param numTrees   number of trees
     * @param maxSamples sub-sample size per tree, capped at the number of rows
     * @param seed       random seed
     */
    public static IsolationForest train(double[][] data, int numTrees, int maxSamples, long seed) {
        if (data.length == 0) {
            throw new IllegalArgumentException("Cannot train an isolation forest on an empty data set");
        }
        if (numTrees <= 0 || maxSamples <= 0) {
            throw new IllegalArgumentException("numTrees and maxSamples must be positive");
        }

        int sampleSize = Math.min(maxSamples, data.length);
        int maxDepth = (int) Math.ceil(Math.log(sampleSize) / Math.log(2));
        Random random = new Random(seed);

        List<IsolationTree> trees = new ArrayList<>(numTrees);
        for (int t = 0; t < numTrees; t++) {
            trees.add(IsolationTree.grow(data, subsample(data.length, sampleSize, random), maxDepth, random));
        }
        return new IsolationForest(Collections.unmodifiableList(trees), sampleSize);
    }

    /**
     * s(x, n) = 2^(-E(h(x)) / c(n)), in [0, 1]. Returns 0 for a forest trained on a single row.
     */
    public double anomalyScore(double[] point) {
        double c = IsolationNode.averagePathLength(sampleSize);
        if (c <= 0) return 0.0;

        double total = 0.0;
        for (IsolationTree tree : trees) {
            total += tree.pathLength(point);
        }
        return Math.pow(2.0, -(total / trees.size()) / c);
    }

    public int getTreeCount() {
        return trees.size();
    }

    public int getSampleSize() {
        return sampleSize;
    }

    // Partial Fisher-Yates: the first `size` slots end up a uniform sample without replacement
    private static int[] subsample(int rows, int size, Random random) {
        int[] indices = new int[rows];
        for (int i = 0; i < rows; i++) indices[i] = i;
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(rows - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
        }
        int[] sample = new int[size];
        System.arraycopy(indices, 0, sample, 0, size);
        return sample;
    }
}
