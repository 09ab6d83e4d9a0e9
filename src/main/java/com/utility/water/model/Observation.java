package com.utility.water.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A single water usage observation keyed by its (hour-aligned) timestamp")
public class Observation {

    @Schema(description = "Observation timestamp", example = "2026-10-18T10:00:00Z")
    private Instant timestamp;

    @Schema(description = "Water usage recorded for the interval. NaN marks a missing value in persisted data.", example = "12.5")
    private double usage;

    public boolean isMissing() {
        return Double.isNaN(usage);
    }
}
