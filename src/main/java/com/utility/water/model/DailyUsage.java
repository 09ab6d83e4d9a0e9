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
@Schema(description = "Actual water usage summed over one calendar day")
public class DailyUsage {

    @Schema(description = "Calendar day", example = "2026-10-17")
    private LocalDate date;

    @JsonProperty("water_usage")
    @Schema(description = "Total usage for the day", example = "241.7")
    private double waterUsage;
}
