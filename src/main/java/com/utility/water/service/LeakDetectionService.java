package com.utility.water.service;

import com.utility.water.config.MetricsConfig;
import com.utility.water.model.ClassificationResult;
import com.utility.water.model.EstimateSource;
import com.utility.water.model.LeakDetectionRequest;
import com.utility.water.model.LeakStatus;
import com.utility.water.model.WeeklyForecast;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for the REST layer.
 *
 * Flow:
 * 1. Hand the reading (and optional usage total) to the ModelManager
 * 2. Record classification and fallback metrics
 * 3. Alert asynchronously when a leak is detected
 */
@Service
public class LeakDetectionService {

    private static final Logger log = LoggerFactory.getLogger(LeakDetectionService.class);

    private final ModelManager modelManager;
    private final MetricsConfig metricsConfig;
    private final TwilioNotificationService notificationService;

    public LeakDetectionService(ModelManager modelManager,
                                MetricsConfig metricsConfig,
                                TwilioNotificationService notificationService) {
        this.modelManager = modelManager;
        this.metricsConfig = metricsConfig;
        this.notificationService = notificationService;
    }

    @Observed(name = "leak.detect", contextualName = "detect-leak")
    public ClassificationResult detectLeak(LeakDetectionRequest request) {
        if (request.getLiveFlowRate() == null) {
            throw new IllegalArgumentException("live_flow_rate is required");
        }

        ClassificationResult result = modelManager.detectLeak(request.getLiveFlowRate(), request.observedUsage());

        metricsConfig.recordClassification(result.getLeakStatus(), result.getLeakProbability());
        if (result.getExpectedUsageSource() == EstimateSource.FALLBACK) {
            metricsConfig.recordFallback(FittedModelSet.FORECASTER);
        }

        if (result.getLeakStatus() == LeakStatus.LEAK_DETECTED) {
            log.warn("Leak detected: flow={}, expected={}, probability={}",
                    result.getLiveFlowRate(), result.getExpectedUsage(), result.getLeakProbability());
            notificationService.notifyIfLeakDetected(result);
        } else if (result.getLeakStatus() == LeakStatus.POTENTIAL_LEAK) {
            log.info("Potential leak: flow={}, expected={}, probability={}",
                    result.getLiveFlowRate(), result.getExpectedUsage(), result.getLeakProbability());
        }

        return result;
    }

    @Observed(name = "usage.forecast.weekly", contextualName = "predict-weekly-usage")
    public WeeklyForecast predictWeeklyUsage() {
        WeeklyForecast forecast = modelManager.predictWeeklyUsage();
        if (forecast.getPredictionSource() == EstimateSource.FALLBACK) {
            metricsConfig.recordFallback(FittedModelSet.SEASONAL_FORECASTER);
            log.debug("Weekly forecast served from the flat daily-average fallback");
        }
        return forecast;
    }
}
