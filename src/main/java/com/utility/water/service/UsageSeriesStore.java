package com.utility.water.service;

import com.utility.water.model.DailyUsage;
import com.utility.water.model.Observation;
import com.utility.water.repository.UsageObservationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * In-memory view of the usage series, backed by a {@link UsageObservationRepository}.
 *
 * Holds at most one observation per timestamp in ascending order. Not thread-safe:
 * {@link ModelManager} serialises every access.
 */
@Component
public class UsageSeriesStore {

    private static final Logger log = LoggerFactory.getLogger(UsageSeriesStore.class);

    private final UsageObservationRepository repository;
    private final Clock clock;
    private final NavigableMap<Instant, Double> series = new TreeMap<>();

    public UsageSeriesStore(UsageObservationRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Replaces the in-memory series with the persisted one: last write wins per
     * timestamp, ascending order, missing values forward-filled and then, for any
     * leading gap, filled with the mean of the forward-filled series.
     */
    public void load() {
        List<Observation> persisted = repository.findAll();

        NavigableMap<Instant, Double> loaded = new TreeMap<>();
        for (Observation obs : persisted) {
            loaded.put(obs.getTimestamp(), obs.getUsage());
        }

        int missing = 0;
        double carry = Double.NaN;
        for (Map.Entry<Instant, Double> e : loaded.entrySet()) {
            if (Double.isNaN(e.getValue())) {
                missing++;
                e.setValue(carry);
            } else {
                carry = e.getValue();
            }
        }

        double fill = meanOf(loaded);
        if (!Double.isNaN(fill)) {
            loaded.replaceAll((ts, usage) -> Double.isNaN(usage) ? fill : usage);
        }

        series.clear();
        series.putAll(loaded);

        log.info("Loaded usage series: {} rows read, {} unique timestamps, {} missing values filled",
                persisted.size(), series.size(), missing);
    }

    /**
     * Records {@code usage} at the hour enclosing {@code timestamp} (last write wins)
     * and persists the full series before returning. If persisting fails the
     * in-memory series is left as it was.
     *
     * @return the hour-aligned timestamp the value was stored under
     */
    public Instant append(Instant timestamp, double usage) {
        Instant hour = truncateToHour(timestamp);
        Double previous = series.put(hour, usage);
        try {
            repository.saveAll(snapshot());
        } catch (RuntimeException e) {
            if (previous == null) {
                series.remove(hour);
            } else {
                series.put(hour, previous);
            }
            throw e;
        }
        return hour;
    }

    /**
     * Daily totals for the last {@code days} calendar days ending today. The result
     * runs from the first to the last day that has data inside the window, with
     * empty days in between reported as 0.
     */
    public List<DailyUsage> trailing(int days) {
        LocalDate today = LocalDate.now(clock);
        LocalDate from = today.minusDays(days - 1L);
        Instant start = from.atStartOfDay(zone()).toInstant();
        Instant end = today.plusDays(1).atStartOfDay(zone()).toInstant();
        return dailyTotals(series.subMap(start, true, end, false));
    }

    /**
     * The whole series as daily totals, first to last observed day, gaps as 0.
     */
    public List<DailyUsage> daily() {
        return dailyTotals(series);
    }

    /**
     * Usage values with a value present, in timestamp order.
     */
    public double[] cleanedValues() {
        return series.values().stream()
                .mapToDouble(Double::doubleValue)
                .filter(v -> !Double.isNaN(v))
                .toArray();
    }

    /**
     * Mean of the non-missing usage values; NaN when there are none.
     */
    public double mean() {
        return meanOf(series);
    }

    public List<Observation> snapshot() {
        List<Observation> rows = new ArrayList<>(series.size());
        series.forEach((ts, usage) -> rows.add(new Observation(ts, usage)));
        return rows;
    }

    public int size() {
        return series.size();
    }

    public boolean isEmpty() {
        return series.isEmpty();
    }

    Instant truncateToHour(Instant timestamp) {
        return timestamp.atZone(zone()).truncatedTo(ChronoUnit.HOURS).toInstant();
    }

    private ZoneId zone() {
        return clock.getZone();
    }

    private List<DailyUsage> dailyTotals(NavigableMap<Instant, Double> range) {
        if (range.isEmpty()) {
            return List.of();
        }

        NavigableMap<LocalDate, Double> totals = new TreeMap<>();
        for (Map.Entry<Instant, Double> e : range.entrySet()) {
            if (Double.isNaN(e.getValue())) continue;
            LocalDate day = e.getKey().atZone(zone()).toLocalDate();
            totals.merge(day, e.getValue(), Double::sum);
        }

        LocalDate first = range.firstKey().atZone(zone()).toLocalDate();
        LocalDate last = range.lastKey().atZone(zone()).toLocalDate();
        List<DailyUsage> days = new ArrayList<>();
        for (LocalDate day = first; !day.isAfter(last); day = day.plusDays(1)) {
            days.add(DailyUsage.builder()
                    .date(day)
                    .waterUsage(totals.getOrDefault(day, 0.0))
                    .build());
        }
        return days;
    }

    private static double meanOf(Map<Instant, Double> values) {
        double sum = 0.0;
        int count = 0;
        for (double v : values.values()) {
            if (Double.isNaN(v)) continue;
            sum += v;
            count++;
        }
        return count == 0 ? Double.NaN : sum / count;
    }
}
