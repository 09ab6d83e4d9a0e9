package com.utility.water.engine.forecast;

import com.utility.water.engine.ModelTrainingException;
import com.utility.water.model.DailyPrediction;
import com.utility.water.model.DailyUsage;
import org.apache.commons.math3.stat.regression.SimpleRegression;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Daily usage forecaster: linear trend over the day index plus an additive
 * day-of-week effect.
 *
 * The weekly effect is the mean detrended residual per weekday, centred so the
 * seven effects sum to zero. It is only estimated once two full weeks of daily
 * totals exist; shorter histories forecast the trend alone.
 */
public final class SeasonalForecaster {

    public static final String MODEL_NAME = "Seasonal";
    public static final int MIN_DAYS = 2;
    public static final int WEEKLY_SEASONALITY_MIN_DAYS = 14;

    private final LocalDate origin;
    private final double intercept;
    private final double slope;
    private final Map<DayOfWeek, Double> weeklyEffect;

    private SeasonalForecaster(LocalDate origin, double intercept, double slope, Map<DayOfWeek, Double> weeklyEffect) {
        this.origin = origin;
        this.intercept = intercept;
        this.slope = slope;
        this.weeklyEffect = weeklyEffect;
    }

    /**
     * @param daily one total per calendar day, ascending, gaps zero-filled
     */
    public static SeasonalForecaster fit(List<DailyUsage> daily) {
        if (daily.size() < MIN_DAYS) {
            throw ModelTrainingException.insufficientHistory(MODEL_NAME, MIN_DAYS, daily.size());
        }

        LocalDate origin = daily.get(0).getDate();
        SimpleRegression trend = new SimpleRegression(true);
        for (DailyUsage day : daily) {
            trend.addData(ChronoUnit.DAYS.between(origin, day.getDate()), day.getWaterUsage());
        }

        double intercept = trend.getIntercept();
        double slope = trend.getSlope();
        if (!Double.isFinite(intercept) || !Double.isFinite(slope)) {
            throw new ModelTrainingException(ModelTrainingException.Reason.NUMERICAL_FAILURE,
                    String.format("%s trend is not finite (intercept=%s, slope=%s)", MODEL_NAME, intercept, slope));
        }

        Map<DayOfWeek, Double> weekly = Collections.emptyMap();
        if (daily.size() >= WEEKLY_SEASONALITY_MIN_DAYS) {
            weekly = weeklyEffect(daily, origin, intercept, slope);
        }

        return new SeasonalForecaster(origin, intercept, slope, weekly);
    }

    /**
     * A forecaster that predicts {@code level} for every date.
     */
    public static SeasonalForecaster flatLine(double level) {
        return new SeasonalForecaster(LocalDate.EPOCH, Double.isFinite(level) ? level : 0.0, 0.0,
                Collections.emptyMap());
    }

    public double forecast(LocalDate date) {
        long index = ChronoUnit.DAYS.between(origin, date);
        double value = intercept + slope * index + weeklyEffect.getOrDefault(date.getDayOfWeek(), 0.0);
        return Math.max(0.0, value);
    }

    public List<DailyPrediction> forecast(List<LocalDate> dates) {
        List<DailyPrediction> predictions = new ArrayList<>(dates.size());
        for (LocalDate date : dates) {
            predictions.add(DailyPrediction.builder()
                    .date(date)
                    .predictedWaterUsage(forecast(date))
                    .build());
        }
        return predictions;
    }

    public boolean hasWeeklySeasonality() {
        return !weeklyEffect.isEmpty();
    }

    public double getSlope() {
        return slope;
    }

    private static Map<DayOfWeek, Double> weeklyEffect(List<DailyUsage> daily, LocalDate origin,
                                                       double intercept, double slope) {
        Map<DayOfWeek, double[]> sums = new EnumMap<>(DayOfWeek.class);
        for (DailyUsage day : daily) {
            double fitted = intercept + slope * ChronoUnit.DAYS.between(origin, day.getDate());
            double[] acc = sums.computeIfAbsent(day.getDate().getDayOfWeek(), d -> new double[2]);
            acc[0] += day.getWaterUsage() - fitted;
            acc[1]++;
        }

        Map<DayOfWeek, Double> effect = new EnumMap<>(DayOfWeek.class);
        double total = 0.0;
        for (Map.Entry<DayOfWeek, double[]> e : sums.entrySet()) {
            double mean = e.getValue()[0] / e.getValue()[1];
            effect.put(e.getKey(), mean);
            total += mean;
        }
        double centre = total / effect.size();
        effect.replaceAll((day, value) -> value - centre);
        return Collections.unmodifiableMap(effect);
    }
}
