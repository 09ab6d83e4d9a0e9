package com.utility.water.controller;

import com.utility.water.model.WeeklyForecast;
import com.utility.water.service.LeakDetectionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/usage")
@Tag(name = "Usage Forecast", description = "Weekly usage projection and trailing actuals")
public class UsageForecastController {

    private final LeakDetectionService leakDetectionService;

    public UsageForecastController(LeakDetectionService leakDetectionService) {
        this.leakDetectionService = leakDetectionService;
    }

    @Operation(summary = "Predict next week's usage",
            description = "Returns predicted daily usage for the next 7 calendar days and the actual daily " +
                    "usage for up to the last 7 days.")
    @GetMapping("/weekly-forecast")
    public ResponseEntity<WeeklyForecast> predictWeeklyUsage() {
        return ResponseEntity.ok(leakDetectionService.predictWeeklyUsage());
    }
}
