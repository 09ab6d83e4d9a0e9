package com.utility.water.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Leak classification of a live flow reading")
public class ClassificationResult {

    @JsonProperty("live_flow_rate")
    @Schema(description = "Live flow reading that was classified", example = "20.2")
    private double liveFlowRate;

    @JsonProperty("expected_usage")
    @Schema(description = "Expected usage for the next interval, rounded to 2 decimals", example = "10.35")
    private double expectedUsage;

    @JsonProperty("leak_status")
    @Schema(description = "Leak status", example = "Leak Detected", allowableValues = {"Normal", "Potential Leak", "Leak Detected"})
    private LeakStatus leakStatus;

    @JsonProperty("leak_probability")
    @Schema(description = "Leak probability (0-100), rounded to 2 decimals", example = "100.0")
    private double leakProbability;

    // Not part of the wire format; lets callers tell a model forecast from a mean substitution.
    @JsonIgnore
    private EstimateSource expectedUsageSource;
}
