package com.utility.water.service;

import com.utility.water.config.MetricsConfig;
import com.utility.water.config.WaterModelConfig;
import com.utility.water.engine.LeakClassifier;
import com.utility.water.engine.ModelTrainingException;
import com.utility.water.model.*;
import com.utility.water.repository.UsageObservationRepository;
import com.utility.water.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ModelManagerTest {

    @Mock
    private UsageObservationRepository repository;

    private WaterModelConfig config;
    private SimpleMeterRegistry meterRegistry;
    private ModelManager manager;

    @BeforeEach
    void setUp() {
        config = TestDataFactory.modelConfig();
        meterRegistry = new SimpleMeterRegistry();
        UsageSeriesStore store = new UsageSeriesStore(repository, TestDataFactory.fixedClock());
        manager = new ModelManager(store, new LeakClassifier(config), config,
                new MetricsConfig(meterRegistry), TestDataFactory.fixedClock());
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
    }

    @Test
    void initialize_emptyStore_servesFallbacks() {
        start(List.of());

        ClassificationResult result = manager.detectLeak(5.0, null);

        assertThat(result.getLeakStatus()).isEqualTo(LeakStatus.NORMAL);
        assertThat(result.getLeakProbability()).isEqualTo(0.0);
        assertThat(result.getExpectedUsage()).isEqualTo(0.0);
        assertThat(result.getExpectedUsageSource()).isEqualTo(EstimateSource.FALLBACK);
    }

    @Test
    void predictWeeklyUsage_emptyStore_sevenZeroPredictionsNoHistory() {
        start(List.of());

        WeeklyForecast forecast = manager.predictWeeklyUsage();

        assertThat(forecast.getPredictedNextWeek()).hasSize(7);
        assertThat(forecast.getPredictedNextWeek())
                .allSatisfy(p -> assertThat(p.getPredictedWaterUsage()).isEqualTo(0.0));
        assertThat(forecast.getLastWeekUsage()).isEmpty();
        assertThat(forecast.getPredictionSource()).isEqualTo(EstimateSource.FALLBACK);
    }

    @Test
    void detectLeak_constantSeries_readingsAboveThresholdAreLeaks() {
        start(TestDataFactory.constantSeries(30, 10.0));

        ClassificationResult result = manager.detectLeak(20.2, null);

        assertThat(result.getLeakStatus()).isEqualTo(LeakStatus.LEAK_DETECTED);
        assertThat(result.getLeakProbability()).isEqualTo(100.0);
        // a flat series has no differences to regress on, so the mean stands in
        assertThat(result.getExpectedUsage()).isEqualTo(10.0);
        assertThat(result.getExpectedUsageSource()).isEqualTo(EstimateSource.FALLBACK);
    }

    @Test
    void detectLeak_constantSeries_readingBetweenMeanAndThreshold() {
        start(TestDataFactory.constantSeries(30, 10.0));

        ClassificationResult result = manager.detectLeak(12.0, null);

        assertThat(result.getLeakStatus()).isEqualTo(LeakStatus.POTENTIAL_LEAK);
        assertThat(result.getLeakProbability()).isEqualTo(40.0);
    }

    @Test
    void detectLeak_constantSeries_readingBelowMeanIsNormal() {
        start(TestDataFactory.constantSeries(30, 10.0));

        ClassificationResult result = manager.detectLeak(5.0, null);

        assertThat(result.getLeakStatus()).isEqualTo(LeakStatus.NORMAL);
        assertThat(result.getLeakProbability()).isEqualTo(0.0);
    }

    @Test
    void detectLeak_noisySeries_usesForecasterAndStaysInBounds() {
        start(TestDataFactory.hourlySeries(24 * 14, 10.0, 21L));

        ClassificationResult result = manager.detectLeak(10.5, null);

        assertThat(result.getExpectedUsageSource()).isEqualTo(EstimateSource.MODEL);
        assertThat(result.getLeakProbability()).isBetween(0.0, 100.0);
        assertThat(manager.status().getComponents().values())
                .allSatisfy(c -> assertThat(c.getState()).isEqualTo(ComponentState.TRAINED));
    }

    @Test
    void detectLeak_withUsage_appendsAtCurrentHourAndRetrains() {
        start(TestDataFactory.hourlySeries(48, 10.0, 5L));
        long versionBefore = manager.status().getVersion();

        manager.detectLeak(11.0, 14.0);

        ModelStatus status = manager.status();
        assertThat(status.getVersion()).isEqualTo(versionBefore + 1);
        assertThat(status.getStoredObservations()).isEqualTo(49);
        assertThat(status.getTrainingObservations()).isEqualTo(49);
        assertThat(status.isStale()).isFalse();
        verify(repository).saveAll(argThat(rows ->
                rows.get(rows.size() - 1).equals(new Observation(Instant.parse("2026-10-18T10:00:00Z"), 14.0))));
    }

    @Test
    void detectLeak_nonFiniteUsage_noNewObservation() {
        start(TestDataFactory.hourlySeries(48, 10.0, 5L));
        long versionBefore = manager.status().getVersion();

        manager.detectLeak(11.0, Double.NaN);
        manager.detectLeak(11.0, Double.POSITIVE_INFINITY);
        manager.detectLeak(11.0, null);

        verify(repository, never()).saveAll(anyList());
        assertThat(manager.status().getVersion()).isEqualTo(versionBefore);
        assertThat(manager.status().getStoredObservations()).isEqualTo(48);
    }

    @Test
    void detectLeak_negativeUsage_rejected() {
        start(List.of());

        assertThatThrownBy(() -> manager.detectLeak(11.0, -1.0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("total_water_usage");
        verify(repository, never()).saveAll(anyList());
    }

    @Test
    void detectLeak_nonFiniteLiveReading_rejected() {
        start(List.of());

        assertThatThrownBy(() -> manager.detectLeak(Double.NaN, 3.0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("live_flow_rate");
    }

    @Test
    void status_shortHistory_reportsDegradedComponents() {
        start(TestDataFactory.constantSeries(5, 10.0));

        ModelStatus status = manager.status();

        assertThat(status.getState()).isEqualTo(ModelState.TRAINED);
        assertThat(status.getComponents()).containsOnlyKeys(
                FittedModelSet.FORECASTER, FittedModelSet.OUTLIER_SCORER, FittedModelSet.SEASONAL_FORECASTER);

        ComponentStatus forecaster = status.getComponents().get(FittedModelSet.FORECASTER);
        assertThat(forecaster.getState()).isEqualTo(ComponentState.FAILED);
        assertThat(forecaster.getFailureReason()).isEqualTo(ModelTrainingException.Reason.INSUFFICIENT_HISTORY);

        assertThat(status.getComponents().get(FittedModelSet.OUTLIER_SCORER).getState())
                .isEqualTo(ComponentState.TRAINED);
        // five hours inside one calendar day
        assertThat(status.getComponents().get(FittedModelSet.SEASONAL_FORECASTER).getFailureReason())
                .isEqualTo(ModelTrainingException.Reason.INSUFFICIENT_HISTORY);
        assertThat(meterRegistry.counter("model.retrain.count", "outcome", "degraded").count()).isEqualTo(1.0);
    }

    @Test
    void predictWeeklyUsage_monthOfHistory_sevenDatesFromTomorrow() {
        start(TestDataFactory.hourlySeries(24 * 30, 5.0, 8L));

        WeeklyForecast forecast = manager.predictWeeklyUsage();

        assertThat(forecast.getPredictionSource()).isEqualTo(EstimateSource.MODEL);
        assertThat(forecast.getPredictedNextWeek()).extracting(DailyPrediction::getDate)
                .containsExactly(
                        LocalDate.of(2026, 10, 19), LocalDate.of(2026, 10, 20), LocalDate.of(2026, 10, 21),
                        LocalDate.of(2026, 10, 22), LocalDate.of(2026, 10, 23), LocalDate.of(2026, 10, 24),
                        LocalDate.of(2026, 10, 25));
        assertThat(forecast.getPredictedNextWeek())
                .allSatisfy(p -> assertThat(p.getPredictedWaterUsage()).isGreaterThanOrEqualTo(0.0));
        assertThat(forecast.getLastWeekUsage()).hasSizeLessThanOrEqualTo(7);
    }

    @Test
    void periodicMode_appendMarksStaleUntilScheduledRetrain() {
        config.setRetrainMode(WaterModelConfig.RetrainMode.PERIODIC);
        start(TestDataFactory.hourlySeries(48, 10.0, 5L));
        long versionBefore = manager.status().getVersion();

        manager.detectLeak(11.0, 14.0);

        assertThat(manager.status().isStale()).isTrue();
        assertThat(manager.status().getVersion()).isEqualTo(versionBefore);

        manager.retrainIfStale();

        assertThat(manager.status().isStale()).isFalse();
        assertThat(manager.status().getVersion()).isEqualTo(versionBefore + 1);
    }

    @Test
    void retrainIfStale_everyWriteMode_doesNothing() {
        start(TestDataFactory.hourlySeries(48, 10.0, 5L));
        long versionBefore = manager.status().getVersion();

        manager.retrainIfStale();

        assertThat(manager.status().getVersion()).isEqualTo(versionBefore);
    }

    @Test
    void retrain_manual_bumpsVersion() {
        start(TestDataFactory.hourlySeries(48, 10.0, 5L));

        ModelStatus status = manager.retrain();

        assertThat(status.getVersion()).isEqualTo(2);
        assertThat(status.getLastRetrainFailure()).isNull();
        assertThat(meterRegistry.get("model.version").gauge().value()).isEqualTo(2.0);
    }

    @Test
    void detectLeak_retrainTimesOut_keepsPreviousModelSet() {
        start(TestDataFactory.hourlySeries(24 * 14, 10.0, 21L));
        long versionBefore = manager.status().getVersion();
        config.setRetrainTimeout(Duration.ZERO);

        ClassificationResult result = manager.detectLeak(10.5, 12.0);

        assertThat(result).isNotNull();
        assertThat(result.getExpectedUsageSource()).isEqualTo(EstimateSource.MODEL);

        ModelStatus status = manager.status();
        assertThat(status.getVersion()).isEqualTo(versionBefore);
        assertThat(status.isStale()).isTrue();
        assertThat(status.getStoredObservations()).isEqualTo(24 * 14 + 1);
        assertThat(status.getLastRetrainFailure().getFailureReason())
                .isEqualTo(ModelTrainingException.Reason.TIMEOUT);
        assertThat(status.getLastRetrainFailure().getState()).isEqualTo(ComponentState.CARRIED_OVER);
        assertThat(meterRegistry.counter("model.retrain.count", "outcome", "timeout").count()).isEqualTo(1.0);
    }

    @Test
    void retrain_historyLost_scorerAndSeasonalCarriedOver() {
        start(TestDataFactory.hourlySeries(24 * 14, 10.0, 21L));

        // the table was truncated while the service was down
        when(repository.findAll()).thenReturn(List.of());
        manager.initialize();

        ModelStatus status = manager.status();
        assertThat(status.getVersion()).isEqualTo(2);
        assertThat(status.getComponents().get(FittedModelSet.FORECASTER).getState())
                .isEqualTo(ComponentState.FAILED);

        ComponentStatus scorer = status.getComponents().get(FittedModelSet.OUTLIER_SCORER);
        assertThat(scorer.getState()).isEqualTo(ComponentState.CARRIED_OVER);
        assertThat(scorer.getFailureReason()).isEqualTo(ModelTrainingException.Reason.INSUFFICIENT_HISTORY);

        ComponentStatus seasonal = status.getComponents().get(FittedModelSet.SEASONAL_FORECASTER);
        assertThat(seasonal.getState()).isEqualTo(ComponentState.CARRIED_OVER);
        assertThat(seasonal.getFailureReason()).isEqualTo(ModelTrainingException.Reason.INSUFFICIENT_HISTORY);

        assertThat(manager.predictWeeklyUsage().getPredictionSource()).isEqualTo(EstimateSource.MODEL);
    }

    private void start(List<Observation> persisted) {
        when(repository.findAll()).thenReturn(persisted);
        manager.initialize();
    }
}
