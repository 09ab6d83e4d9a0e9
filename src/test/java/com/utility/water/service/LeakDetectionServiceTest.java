package com.utility.water.service;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.utility.water.config.MetricsConfig;
import com.utility.water.model.*;
import com.utility.water.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LeakDetectionServiceTest {

    @Mock
    private ModelManager modelManager;

    @Mock
    private MetricsConfig metricsConfig;

    @Mock
    private TwilioNotificationService notificationService;

    private LeakDetectionService service;

    @BeforeEach
    void setUp() {
        service = new LeakDetectionService(modelManager, metricsConfig, notificationService);
    }

    @Test
    void detectLeak_leakDetected_recordsMetricsAndNotifies() {
        ClassificationResult result = TestDataFactory.classification(20.2, LeakStatus.LEAK_DETECTED, 100.0);
        when(modelManager.detectLeak(20.2, 14.0)).thenReturn(result);

        ClassificationResult returned = service.detectLeak(request(20.2, 14.0));

        assertThat(returned).isSameAs(result);
        verify(metricsConfig).recordClassification(LeakStatus.LEAK_DETECTED, 100.0);
        verify(notificationService).notifyIfLeakDetected(result);
        verify(metricsConfig, never()).recordFallback(anyString());
    }

    @Test
    void detectLeak_normal_noNotification() {
        when(modelManager.detectLeak(5.0, null))
                .thenReturn(TestDataFactory.classification(5.0, LeakStatus.NORMAL, 0.0));

        service.detectLeak(LeakDetectionRequest.builder().liveFlowRate(5.0).build());

        verify(metricsConfig).recordClassification(LeakStatus.NORMAL, 0.0);
        verify(notificationService, never()).notifyIfLeakDetected(any());
    }

    @Test
    void detectLeak_nonNumericUsage_treatedAsNoObservation() {
        when(modelManager.detectLeak(eq(12.0), isNull()))
                .thenReturn(TestDataFactory.classification(12.0, LeakStatus.POTENTIAL_LEAK, 40.0));

        LeakDetectionRequest request = LeakDetectionRequest.builder()
                .liveFlowRate(12.0)
                .totalWaterUsage(JsonNodeFactory.instance.textNode("n/a"))
                .build();
        ClassificationResult result = service.detectLeak(request);

        assertThat(result.getLeakStatus()).isEqualTo(LeakStatus.POTENTIAL_LEAK);
        verify(notificationService, never()).notifyIfLeakDetected(any());
    }

    @Test
    void detectLeak_meanFallback_recordsForecasterFallback() {
        ClassificationResult result = TestDataFactory.classification(5.0, LeakStatus.NORMAL, 0.0);
        result.setExpectedUsageSource(EstimateSource.FALLBACK);
        when(modelManager.detectLeak(5.0, null)).thenReturn(result);

        service.detectLeak(LeakDetectionRequest.builder().liveFlowRate(5.0).build());

        verify(metricsConfig).recordFallback(FittedModelSet.FORECASTER);
    }

    @Test
    void detectLeak_missingLiveReading_rejected() {
        assertThatThrownBy(() -> service.detectLeak(LeakDetectionRequest.builder().build()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("live_flow_rate");
        verifyNoInteractions(modelManager);
    }

    @Test
    void predictWeeklyUsage_fallback_recordsSeasonalFallback() {
        WeeklyForecast forecast = WeeklyForecast.builder()
                .predictedNextWeek(List.of())
                .lastWeekUsage(List.of())
                .predictionSource(EstimateSource.FALLBACK)
                .build();
        when(modelManager.predictWeeklyUsage()).thenReturn(forecast);

        assertThat(service.predictWeeklyUsage()).isSameAs(forecast);
        verify(metricsConfig).recordFallback(FittedModelSet.SEASONAL_FORECASTER);
    }

    private static LeakDetectionRequest request(double live, double total) {
        return LeakDetectionRequest.builder()
                .liveFlowRate(live)
                .totalWaterUsage(JsonNodeFactory.instance.numberNode(total))
                .build();
    }
}
