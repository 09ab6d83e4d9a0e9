package com.utility.water.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Predicted water usage for one future calendar day")
public class DailyPrediction {

    @Schema(description = "Calendar day", example = "2026-10-19")
    private LocalDate date;

    @JsonProperty("predicted_water_usage")
    @Schema(description = "Predicted total usage for the day", example = "238.4")
    private double predictedWaterUsage;
}
