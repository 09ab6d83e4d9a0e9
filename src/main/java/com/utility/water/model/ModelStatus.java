package com.utility.water.model;

import com.utility.water.config.WaterModelConfig;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Snapshot of the active fitted model set")
public class ModelStatus {

    @Schema(description = "Monotonic version of the active model set; 0 before the first training", example = "42")
    private long version;

    @Schema(description = "Pipeline state", example = "TRAINED")
    private ModelState state;

    @Schema(description = "When the active model set was trained, epoch milliseconds", example = "1760781600000")
    private long trainedAt;

    @Schema(description = "Observations in the series at training time", example = "720")
    private int trainingObservations;

    @Schema(description = "Observations currently held by the series store", example = "721")
    private int storedObservations;

    @Schema(description = "Retrain policy", example = "EVERY_WRITE")
    private WaterModelConfig.RetrainMode retrainMode;

    @Schema(description = "True when observations were appended after the active model set was trained")
    private boolean stale;

    @Schema(description = "Set when the latest retrain was abandoned (timeout or unexpected error) and the previous model set kept serving")
    private ComponentStatus lastRetrainFailure;

    @Schema(description = "Per-model training outcome, keyed by model name")
    private Map<String, ComponentStatus> components;
}
