package com.utility.water.engine.forecast;

import com.utility.water.engine.ModelTrainingException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;

import java.util.Arrays;

/**
 * ARIMA(5,1,0) one-step-ahead forecaster: an AR(5) model without constant on the
 * first differences, estimated by conditional least squares.
 *
 * <pre>
 *   d(t)     = y(t) - y(t-1)
 *   d(t)     = phi1*d(t-1) + ... + phi5*d(t-5) + e(t)
 *   y(T+1)^  = y(T) + phi1*d(T) + ... + phi5*d(T-4)
 * </pre>
 */
public final class AutoRegressiveForecaster {

    public static final String MODEL_NAME = "ARIMA(5,1,0)";
    public static final int AR_ORDER = 5;

    // One difference, then strictly more regression rows than coefficients
    public static final int MIN_OBSERVATIONS = 1 + AR_ORDER + AR_ORDER + 1;

    private static final double SINGULARITY_THRESHOLD = 1e-10;

    private final double[] coefficients;
    private final double[] lastDifferences;
    private final double lastValue;

    private AutoRegressiveForecaster(double[] coefficients, double[] lastDifferences, double lastValue) {
        this.coefficients = coefficients;
        this.lastDifferences = lastDifferences;
        this.lastValue = lastValue;
    }

    /**
     * @param series cleaned usage values in timestamp order
     * @throws ModelTrainingException if the series is too short or the lag matrix is degenerate
     */
    public static AutoRegressiveForecaster fit(double[] series) {
        if (series.length < MIN_OBSERVATIONS) {
            throw ModelTrainingException.insufficientHistory(MODEL_NAME, MIN_OBSERVATIONS, series.length);
        }

        double[] diffs = new double[series.length - 1];
        for (int i = 1; i < series.length; i++) {
            diffs[i - 1] = series[i] - series[i - 1];
        }

        int rows = diffs.length - AR_ORDER;
        double[] y = new double[rows];
        double[][] x = new double[rows][AR_ORDER];
        for (int t = 0; t < rows; t++) {
            int target = t + AR_ORDER;
            y[t] = diffs[target];
            for (int lag = 1; lag <= AR_ORDER; lag++) {
                x[t][lag - 1] = diffs[target - lag];
            }
        }

        double[] phi;
        try {
            OLSMultipleLinearRegression ols = new OLSMultipleLinearRegression(SINGULARITY_THRESHOLD);
            ols.setNoIntercept(true);
            ols.newSampleData(y, x);
            phi = ols.estimateRegressionParameters();
        } catch (MathIllegalArgumentException e) {
            throw new ModelTrainingException(ModelTrainingException.Reason.NUMERICAL_FAILURE,
                    MODEL_NAME + " least-squares fit failed: " + e.getMessage(), e);
        }

        for (double coefficient : phi) {
            if (!Double.isFinite(coefficient)) {
                throw new ModelTrainingException(ModelTrainingException.Reason.NUMERICAL_FAILURE,
                        MODEL_NAME + " produced non-finite coefficients " + Arrays.toString(phi));
            }
        }

        double[] tail = Arrays.copyOfRange(diffs, diffs.length - AR_ORDER, diffs.length);
        return new AutoRegressiveForecaster(phi, tail, series[series.length - 1]);
    }

    public double forecastNext() {
        double delta = 0.0;
        for (int lag = 1; lag <= AR_ORDER; lag++) {
            delta += coefficients[lag - 1] * lastDifferences[AR_ORDER - lag];
        }
        double forecast = lastValue + delta;
        if (!Double.isFinite(forecast)) {
            throw new IllegalStateException(MODEL_NAME + " forecast is not finite");
        }
        return forecast;
    }

    public double[] getCoefficients() {
        return coefficients.clone();
    }
}
