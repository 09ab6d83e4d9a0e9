package com.utility.water.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Seven-day usage projection alongside the trailing week's actuals")
public class WeeklyForecast {

    @JsonProperty("predicted_next_week")
    @Schema(description = "Predicted daily usage for the next 7 calendar days")
    private List<DailyPrediction> predictedNextWeek;

    @JsonProperty("last_week_usage")
    @Schema(description = "Actual daily usage for up to the last 7 calendar days")
    private List<DailyUsage> lastWeekUsage;

    @JsonIgnore
    private EstimateSource predictionSource;
}
