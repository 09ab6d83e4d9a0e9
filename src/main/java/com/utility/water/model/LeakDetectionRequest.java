package com.utility.water.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A live flow reading, optionally carrying the usage total for the current interval")
public class LeakDetectionRequest {

    @JsonProperty("live_flow_rate")
    @Schema(description = "Instantaneous flow measurement, same units as historical usage", example = "20.2",
            requiredMode = Schema.RequiredMode.REQUIRED)
    private Double liveFlowRate;

    @JsonProperty("total_water_usage")
    @Schema(description = "Usage total for the current hour. Absent, a string, or any other non-number means no new observation.",
            example = "14.0", type = "number")
    private JsonNode totalWaterUsage;

    /**
     * The observation carried by this request, or {@code null} when the field is absent,
     * not a JSON number (numeric strings included), NaN or infinite.
     */
    @JsonIgnore
    public Double observedUsage() {
        if (totalWaterUsage == null || !totalWaterUsage.isNumber()) {
            return null;
        }
        double value = totalWaterUsage.doubleValue();
        return Double.isFinite(value) ? value : null;
    }
}
