package com.utility.water.controller;

import com.utility.water.model.ClassificationResult;
import com.utility.water.model.LeakDetectionRequest;
import com.utility.water.service.LeakDetectionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/leaks")
@Tag(name = "Leak Detection", description = "Classify live flow readings as Normal, Potential Leak or Leak Detected")
public class LeakDetectionController {

    private final LeakDetectionService leakDetectionService;

    public LeakDetectionController(LeakDetectionService leakDetectionService) {
        this.leakDetectionService = leakDetectionService;
    }

    @Operation(summary = "Classify a live flow reading",
            description = "Compares the live flow rate with the historical mean usage and the 1.5x leak threshold. " +
                    "When total_water_usage is a number it is first recorded for the current hour and all models " +
                    "are retrained. Returns expected usage, leak status and leak probability (0-100).")
    @PostMapping("/detect")
    public ResponseEntity<?> detectLeak(@RequestBody LeakDetectionRequest request) {
        if (request.getLiveFlowRate() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "live_flow_rate is required"));
        }

        try {
            ClassificationResult result = leakDetectionService.detectLeak(request);
            return ResponseEntity.ok(result);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }
}
