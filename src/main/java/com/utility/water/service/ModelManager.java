package com.utility.water.service;

import com.utility.water.config.MetricsConfig;
import com.utility.water.config.WaterModelConfig;
import com.utility.water.engine.LeakClassifier;
import com.utility.water.engine.ModelTrainingException;
import com.utility.water.engine.forecast.AutoRegressiveForecaster;
import com.utility.water.engine.forecast.SeasonalForecaster;
import com.utility.water.engine.isolationforest.OutlierScorer;
import com.utility.water.model.ClassificationResult;
import com.utility.water.model.ComponentStatus;
import com.utility.water.model.DailyUsage;
import com.utility.water.model.EstimateSource;
import com.utility.water.model.ExpectedUsage;
import com.utility.water.model.ModelState;
import com.utility.water.model.ModelStatus;
import com.utility.water.model.WeeklyForecast;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Owns the usage series and the fitted model set, and answers the two public
 * questions: is this live reading a leak, and what will next week look like.
 *
 * Concurrency: the series and the model set are one unit of state behind a
 * read/write lock. Appending and retraining hold the write lock; classification
 * and forecasting hold the read lock. Each retrain runs on a dedicated thread and
 * is bounded by {@code water.model.retrain-timeout}; a retrain that times out or
 * blows up leaves the previous model set in place.
 *
 * Degradation: the forecaster falls back to the series mean; the outlier scorer
 * and the seasonal forecaster keep their last good fit when a retrain fails, and
 * use their own fallback (probability 0, flat daily average) when they never had one.
 */
@Service
public class ModelManager {

    private static final Logger log = LoggerFactory.getLogger(ModelManager.class);

    private final UsageSeriesStore store;
    private final LeakClassifier classifier;
    private final WaterModelConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final ExecutorService trainingExecutor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "model-training");
        t.setDaemon(true);
        return t;
    });

    // Guarded by lock
    private FittedModelSet models = FittedModelSet.uninitialized();
    private boolean stale;
    private ComponentStatus lastRetrainFailure;

    public ModelManager(UsageSeriesStore store,
                        LeakClassifier classifier,
                        WaterModelConfig config,
                        MetricsConfig metricsConfig,
                        Clock clock) {
        this.store = store;
        this.classifier = classifier;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    @PostConstruct
    public void initialize() {
        lock.writeLock().lock();
        try {
            store.load();
            retrainLocked("startup");
        } finally {
            lock.writeLock().unlock();
        }
    }

    @PreDestroy
    public void shutdown() {
        trainingExecutor.shutdownNow();
    }

    /**
     * Classifies a live reading. A finite {@code totalUsage} is first recorded at the
     * current hour and, in {@code EVERY_WRITE} mode, all models are retrained before
     * the reading is classified.
     *
     * @param liveFlowRate instantaneous flow, must be finite
     * @param totalUsage   usage for the current hour; {@code null}, NaN or infinite means no new observation
     * @throws IllegalArgumentException if the live reading is not finite or the usage is negative
     */
    public ClassificationResult detectLeak(double liveFlowRate, Double totalUsage) {
        if (!Double.isFinite(liveFlowRate)) {
            throw new IllegalArgumentException("live_flow_rate must be a finite number");
        }
        boolean hasObservation = totalUsage != null && Double.isFinite(totalUsage);
        if (hasObservation && totalUsage < 0) {
            throw new IllegalArgumentException("total_water_usage must not be negative, got " + totalUsage);
        }

        if (!hasObservation) {
            lock.readLock().lock();
            try {
                return classifyLocked(liveFlowRate);
            } finally {
                lock.readLock().unlock();
            }
        }

        lock.writeLock().lock();
        try {
            Instant hour = store.append(clock.instant(), totalUsage);
            log.debug("Recorded usage {} at {}", totalUsage, hour);
            stale = true;
            if (config.getRetrainMode() == WaterModelConfig.RetrainMode.EVERY_WRITE) {
                retrainLocked("new observation");
            }
            // Downgrade so the classification sees exactly the state we just produced
            lock.readLock().lock();
        } finally {
            lock.writeLock().unlock();
        }
        try {
            return classifyLocked(liveFlowRate);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Predicted daily usage for the next {@code forecastDays} calendar days and actual
     * daily usage for up to the last {@code trailingDays} days.
     *
     * The forecast starts tomorrow, not today: today's total is still accumulating and
     * is already reported, partially, in the trailing week.
     */
    public WeeklyForecast predictWeeklyUsage() {
        lock.readLock().lock();
        try {
            LocalDate today = LocalDate.now(clock);
            List<LocalDate> dates = new ArrayList<>(config.getForecastDays());
            for (int i = 1; i <= config.getForecastDays(); i++) {
                dates.add(today.plusDays(i));
            }

            SeasonalForecaster seasonal = models.getSeasonalForecaster();
            EstimateSource source = EstimateSource.MODEL;
            if (seasonal == null) {
                seasonal = SeasonalForecaster.flatLine(averageDailyUsage());
                source = EstimateSource.FALLBACK;
            }

            return WeeklyForecast.builder()
                    .predictedNextWeek(seasonal.forecast(dates))
                    .lastWeekUsage(store.trailing(config.getTrailingDays()))
                    .predictionSource(source)
                    .build();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Retrains all models on the current series regardless of the retrain mode.
     */
    public ModelStatus retrain() {
        lock.writeLock().lock();
        try {
            retrainLocked("manual");
            return statusLocked();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Scheduled(fixedRateString = "${water.model.periodic-retrain-minutes:15}",
               initialDelayString = "${water.model.periodic-retrain-minutes:15}",
               timeUnit = TimeUnit.MINUTES)
    public void retrainIfStale() {
        if (config.getRetrainMode() != WaterModelConfig.RetrainMode.PERIODIC) {
            return;
        }
        lock.writeLock().lock();
        try {
            if (stale) {
                retrainLocked("scheduled");
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public ModelStatus status() {
        lock.readLock().lock();
        try {
            return statusLocked();
        } finally {
            lock.readLock().unlock();
        }
    }

    private ClassificationResult classifyLocked(double liveFlowRate) {
        FittedModelSet current = models;
        double mean = store.mean();
        ExpectedUsage expected = expectedUsage(current, mean);

        Double outlierScore = null;
        if (current.getOutlierScorer() != null) {
            outlierScore = current.getOutlierScorer().score(liveFlowRate);
        }

        return classifier.classify(liveFlowRate, expected, mean, outlierScore);
    }

    private ExpectedUsage expectedUsage(FittedModelSet current, double mean) {
        double fallback = Double.isNaN(mean) ? 0.0 : LeakClassifier.round2(mean);
        AutoRegressiveForecaster forecaster = current.getForecaster();
        if (forecaster == null) {
            return ExpectedUsage.meanFallback(fallback);
        }
        try {
            return ExpectedUsage.forecast(forecaster.forecastNext());
        } catch (RuntimeException e) {
            log.warn("Expected usage forecast failed, using series mean {}: {}", fallback, e.getMessage());
            return ExpectedUsage.meanFallback(fallback);
        }
    }

    private void retrainLocked(String trigger) {
        FittedModelSet previous = models;
        double[] values = store.cleanedValues();
        List<DailyUsage> daily = store.daily();
        long version = previous.getVersion() + 1;

        long started = System.nanoTime();
        Future<FittedModelSet> training = trainingExecutor.submit(() -> trainAll(previous, values, daily, version));
        FittedModelSet next;
        try {
            next = training.get(config.getRetrainTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            training.cancel(true);
            lastRetrainFailure = ComponentStatus.failed(new ModelTrainingException(
                    ModelTrainingException.Reason.TIMEOUT,
                    "Retrain exceeded " + config.getRetrainTimeout()), previous.isInitialized());
            metricsConfig.recordRetrain("timeout");
            log.warn("Retrain ({}) exceeded {} on {} observations. Keeping model set v{}.",
                    trigger, config.getRetrainTimeout(), values.length, previous.getVersion());
            return;
        } catch (InterruptedException e) {
            training.cancel(true);
            Thread.currentThread().interrupt();
            metricsConfig.recordRetrain("interrupted");
            log.warn("Retrain ({}) interrupted. Keeping model set v{}.", trigger, previous.getVersion());
            return;
        } catch (ExecutionException e) {
            lastRetrainFailure = ComponentStatus.failed(new ModelTrainingException(
                    ModelTrainingException.Reason.NUMERICAL_FAILURE,
                    "Retrain failed: " + e.getCause(), e.getCause()), previous.isInitialized());
            metricsConfig.recordRetrain("error");
            log.error("Retrain ({}) failed unexpectedly. Keeping model set v{}.",
                    trigger, previous.getVersion(), e.getCause());
            return;
        }

        models = next;
        stale = false;
        lastRetrainFailure = null;
        metricsConfig.updateModelVersion(next.getVersion());
        metricsConfig.recordRetrain(next.isDegraded() ? "degraded" : "success");

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        if (next.isDegraded()) {
            log.warn("Retrained ({}) model set v{} on {} observations in {} ms, degraded: {}",
                    trigger, next.getVersion(), values.length, elapsedMs, next.getComponents());
        } else {
            log.info("Retrained ({}) model set v{} on {} observations in {} ms",
                    trigger, next.getVersion(), values.length, elapsedMs);
        }
    }

    private FittedModelSet trainAll(FittedModelSet previous, double[] values, List<DailyUsage> daily, long version) {
        AutoRegressiveForecaster forecaster = null;
        ComponentStatus forecasterStatus;
        try {
            forecaster = AutoRegressiveForecaster.fit(values);
            forecasterStatus = ComponentStatus.trained();
        } catch (ModelTrainingException e) {
            // Mean substitution, never a stale forecaster
            forecasterStatus = ComponentStatus.failed(e, false);
            log.debug("{} not fitted: {}", AutoRegressiveForecaster.MODEL_NAME, e.getMessage());
        }

        OutlierScorer scorer = previous.getOutlierScorer();
        ComponentStatus scorerStatus;
        try {
            scorer = OutlierScorer.fit(values, config.getContamination(), config.getNumTrees(),
                    config.getMaxSamples(), config.getRandomSeed());
            scorerStatus = ComponentStatus.trained();
        } catch (ModelTrainingException e) {
            scorerStatus = ComponentStatus.failed(e, scorer != null);
            log.debug("{} not fitted: {}", OutlierScorer.MODEL_NAME, e.getMessage());
        }

        SeasonalForecaster seasonal = previous.getSeasonalForecaster();
        ComponentStatus seasonalStatus;
        try {
            seasonal = SeasonalForecaster.fit(daily);
            seasonalStatus = ComponentStatus.trained();
        } catch (ModelTrainingException e) {
            seasonalStatus = ComponentStatus.failed(e, seasonal != null);
            log.debug("{} not fitted: {}", SeasonalForecaster.MODEL_NAME, e.getMessage());
        }

        return FittedModelSet.builder()
                .version(version)
                .trainedAt(clock.millis())
                .trainingObservations(values.length)
                .forecaster(forecaster)
                .outlierScorer(scorer)
                .seasonalForecaster(seasonal)
                .components(FittedModelSet.orderedComponents(forecasterStatus, scorerStatus, seasonalStatus))
                .build();
    }

    private double averageDailyUsage() {
        List<DailyUsage> daily = store.daily();
        if (daily.isEmpty()) {
            return 0.0;
        }
        return daily.stream().mapToDouble(DailyUsage::getWaterUsage).average().orElse(0.0);
    }

    private ModelStatus statusLocked() {
        return ModelStatus.builder()
                .version(models.getVersion())
                .state(models.isInitialized() ? ModelState.TRAINED : ModelState.UNINITIALIZED)
                .trainedAt(models.getTrainedAt())
                .trainingObservations(models.getTrainingObservations())
                .storedObservations(store.size())
                .retrainMode(config.getRetrainMode())
                .stale(stale)
                .lastRetrainFailure(lastRetrainFailure)
                .components(models.getComponents())
                .build();
    }
}
