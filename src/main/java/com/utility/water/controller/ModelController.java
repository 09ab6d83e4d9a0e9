package com.utility.water.controller;

import com.utility.water.model.ModelStatus;
import com.utility.water.service.ModelManager;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/models")
@Tag(name = "Models", description = "Fitted model set status and manual retraining")
public class ModelController {

    private final ModelManager modelManager;

    public ModelController(ModelManager modelManager) {
        this.modelManager = modelManager;
    }

    @Operation(summary = "Get model status",
            description = "Returns the active model set version, when it was trained, on how many observations, " +
                    "and per-model state: TRAINED, CARRIED_OVER (last good fit still serving) or FAILED (fallback in use).")
    @GetMapping("/status")
    public ResponseEntity<ModelStatus> getStatus() {
        return ResponseEntity.ok(modelManager.status());
    }

    @Operation(summary = "Retrain all models",
            description = "Forces a full retrain of the forecaster, the outlier scorer and the seasonal forecaster " +
                    "on the current series, then returns the resulting status.")
    @PostMapping("/retrain")
    public ResponseEntity<ModelStatus> retrain() {
        return ResponseEntity.ok(modelManager.retrain());
    }
}
