package com.utility.water.service;

import com.utility.water.engine.forecast.AutoRegressiveForecaster;
import com.utility.water.engine.forecast.SeasonalForecaster;
import com.utility.water.engine.isolationforest.OutlierScorer;
import com.utility.water.model.ComponentState;
import com.utility.water.model.ComponentStatus;
import lombok.Builder;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable bundle of the three fitted models, swapped in as a whole after each retrain.
 * A {@code null} model means the component has nothing to serve and its fallback applies.
 */
@Getter
@Builder
public class FittedModelSet {

    public static final String FORECASTER = "expectedUsageForecaster";
    public static final String OUTLIER_SCORER = "outlierScorer";
    public static final String SEASONAL_FORECASTER = "seasonalForecaster";

    private final long version;
    private final long trainedAt;
    private final int trainingObservations;
    private final AutoRegressiveForecaster forecaster;
    private final OutlierScorer outlierScorer;
    private final SeasonalForecaster seasonalForecaster;
    private final Map<String, ComponentStatus> components;

    public static FittedModelSet uninitialized() {
        return FittedModelSet.builder()
                .version(0)
                .trainedAt(0)
                .trainingObservations(0)
                .components(Collections.emptyMap())
                .build();
    }

    public boolean isInitialized() {
        return version > 0;
    }

    public boolean isDegraded() {
        return components.values().stream().anyMatch(c -> c.getState() != ComponentState.TRAINED);
    }

    static Map<String, ComponentStatus> orderedComponents(ComponentStatus forecaster,
                                                          ComponentStatus outlierScorer,
                                                          ComponentStatus seasonal) {
        Map<String, ComponentStatus> map = new LinkedHashMap<>();
        map.put(FORECASTER, forecaster);
        map.put(OUTLIER_SCORER, outlierScorer);
        map.put(SEASONAL_FORECASTER, seasonal);
        return Collections.unmodifiableMap(map);
    }
}
