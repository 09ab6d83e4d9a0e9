package com.utility.water.model;

/**
 * One-step-ahead expected usage, tagged with whether the autoregressive model
 * produced it or the historical mean was substituted.
 */
public record ExpectedUsage(double value, EstimateSource source) {

    public static ExpectedUsage forecast(double value) {
        return new ExpectedUsage(value, EstimateSource.MODEL);
    }

    public static ExpectedUsage meanFallback(double value) {
        return new ExpectedUsage(value, EstimateSource.FALLBACK);
    }
}
