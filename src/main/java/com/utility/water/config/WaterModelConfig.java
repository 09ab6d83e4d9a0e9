package com.utility.water.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "water.model")
public class WaterModelConfig {

    // Leak threshold = historical mean * this multiplier
    private double leakThresholdMultiplier = 1.5;

    // Expected proportion of outliers assumed when fitting the isolation forest
    private double contamination = 0.05;

    // Seed for the isolation forest, fixed so retrains on the same series are reproducible
    private long randomSeed = 42L;

    private int numTrees = 100;

    // Sub-sample size per tree; capped at the series length
    private int maxSamples = 256;

    private int forecastDays = 7;

    private int trailingDays = 7;

    private RetrainMode retrainMode = RetrainMode.EVERY_WRITE;

    // Upper bound on one full retrain of all three models
    private Duration retrainTimeout = Duration.ofSeconds(30);

    // Only used in PERIODIC mode
    private long periodicRetrainMinutes = 15;

    public enum RetrainMode {
        /** Retrain all models after every accepted observation. */
        EVERY_WRITE,
        /** Accept observations immediately, retrain on a fixed schedule when new data arrived. */
        PERIODIC
    }
}
