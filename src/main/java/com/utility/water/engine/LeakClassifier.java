package com.utility.water.engine;

import com.utility.water.config.WaterModelConfig;
import com.utility.water.model.ClassificationResult;
import com.utility.water.model.ExpectedUsage;
import com.utility.water.model.LeakStatus;
import org.springframework.stereotype.Component;

/**
 * Classifies a live flow reading against the historical mean.
 *
 * Above the mean the reading is a Potential Leak, or a Leak Detected once it
 * reaches {@code mean * leakThresholdMultiplier}; the probability is how far the
 * reading sits between the mean and that threshold, capped at 100.
 * At or below the mean the reading is Normal and the outlier score (x100,
 * clamped to 0-100) stands in as the probability.
 *
 * With no usable baseline (mean NaN or <= 0) there is no threshold to compare
 * against, so the reading is reported Normal with probability 0.
 */
@Component
public class LeakClassifier {

    private final WaterModelConfig config;

    public LeakClassifier(WaterModelConfig config) {
        this.config = config;
    }

    /**
     * @param liveFlowRate   the live reading
     * @param expectedUsage  next-interval expectation, reported back unchanged (rounded)
     * @param historicalMean mean of all stored usage values
     * @param outlierScore   decision score of the live reading, or {@code null} when no scorer is trained
     */
    public ClassificationResult classify(double liveFlowRate, ExpectedUsage expectedUsage,
                                         double historicalMean, Double outlierScore) {
        LeakStatus status;
        double probability;

        if (!Double.isFinite(historicalMean) || historicalMean <= 0) {
            status = LeakStatus.NORMAL;
            probability = 0.0;
        } else if (liveFlowRate > historicalMean) {
            double threshold = historicalMean * config.getLeakThresholdMultiplier();
            status = liveFlowRate < threshold ? LeakStatus.POTENTIAL_LEAK : LeakStatus.LEAK_DETECTED;
            double band = threshold - historicalMean;
            double overuseFactor = band > 0 ? clamp((liveFlowRate - historicalMean) / band, 0.0, 1.0) : 1.0;
            probability = round2(overuseFactor * 100.0);
        } else {
            status = LeakStatus.NORMAL;
            probability = outlierScore == null || outlierScore.isNaN()
                    ? 0.0
                    : round2(clamp(outlierScore * 100.0, 0.0, 100.0));
        }

        return ClassificationResult.builder()
                .liveFlowRate(liveFlowRate)
                .expectedUsage(round2(expectedUsage.value()))
                .leakStatus(status)
                .leakProbability(probability)
                .expectedUsageSource(expectedUsage.source())
                .build();
    }

    static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    public static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
