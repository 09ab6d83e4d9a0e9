package com.utility.water.engine;

/**
 * Raised when a model cannot be fitted on the current series.
 */
public class ModelTrainingException extends RuntimeException {

    public enum Reason {
        /** Too few observations for the model's fixed structure. */
        INSUFFICIENT_HISTORY,
        /** Degenerate input: singular design matrix, non-finite estimates. */
        NUMERICAL_FAILURE,
        /** The retrain did not finish within the configured bound. */
        TIMEOUT
    }

    private final Reason reason;

    public ModelTrainingException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ModelTrainingException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public static ModelTrainingException insufficientHistory(String model, int required, int actual) {
        return new ModelTrainingException(Reason.INSUFFICIENT_HISTORY,
                String.format("%s needs at least %d observations, got %d", model, required, actual));
    }

    public Reason getReason() {
        return reason;
    }
}
