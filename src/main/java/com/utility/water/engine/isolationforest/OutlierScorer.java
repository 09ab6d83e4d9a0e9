package com.utility.water.engine.isolationforest;

import com.utility.water.engine.ModelTrainingException;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

/**
 * Univariate outlier scorer over usage values.
 *
 * Scores follow the decision-function convention: {@code -s(x) - offset}, where
 * {@code s} is the isolation forest anomaly score and {@code offset} is chosen so
 * that a {@code contamination} share of the training values score below zero.
 * Negative means anomalous, and the more negative the more anomalous.
 */
public final class OutlierScorer {

    public static final String MODEL_NAME = "IsolationForest";

    private final IsolationForest forest;
    private final double offset;
    private final int trainingSize;

    private OutlierScorer(IsolationForest forest, double offset, int trainingSize) {
        this.forest = forest;
        this.offset = offset;
        this.trainingSize = trainingSize;
    }

    public static OutlierScorer fit(double[] values, double contamination, int numTrees, int maxSamples, long seed) {
        if (contamination <= 0 || contamination > 0.5) {
            throw new IllegalArgumentException("contamination must be in (0, 0.5], got " + contamination);
        }
        if (values.length == 0) {
            throw ModelTrainingException.insufficientHistory(MODEL_NAME, 1, 0);
        }

        double[][] data = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            if (!Double.isFinite(values[i])) {
                throw new ModelTrainingException(ModelTrainingException.Reason.NUMERICAL_FAILURE,
                        "Non-finite usage value at position " + i);
            }
            data[i] = new double[]{values[i]};
        }

        IsolationForest forest = IsolationForest.train(data, numTrees, maxSamples, seed);

        double[] trainingScores = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            trainingScores[i] = -forest.anomalyScore(data[i]);
        }
        // R_7 is the linear interpolation used by numpy.percentile
        double offset = new Percentile()
                .withEstimationType(Percentile.EstimationType.R_7)
                .evaluate(trainingScores, contamination * 100.0);

        return new OutlierScorer(forest, offset, values.length);
    }

    public double score(double value) {
        return -forest.anomalyScore(new double[]{value}) - offset;
    }

    public double getOffset() {
        return offset;
    }

    public int getTrainingSize() {
        return trainingSize;
    }
}
