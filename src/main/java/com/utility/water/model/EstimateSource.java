package com.utility.water.model;

/**
 * Where a model-backed estimate came from.
 */
public enum EstimateSource {
    /** Produced by the trained model. */
    MODEL,
    /** Model unavailable or failed; a statistical fallback was substituted. */
    FALLBACK
}
