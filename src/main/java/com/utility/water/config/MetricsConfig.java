package com.utility.water.config;

import com.utility.water.model.LeakStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicLong modelVersion;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.modelVersion = registry.gauge("model.version", new AtomicLong(0));
    }

    public void recordClassification(LeakStatus status, double leakProbability) {
        Counter.builder("leak.classification.count")
                .tag("status", status.name())
                .register(registry)
                .increment();

        DistributionSummary.builder("leak.probability")
                .tag("status", status.name())
                .register(registry)
                .record(leakProbability);
    }

    public void recordRetrain(String outcome) {
        Counter.builder("model.retrain.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordFallback(String model) {
        Counter.builder("model.fallback.count")
                .tag("model", model)
                .register(registry)
                .increment();
    }

    public void recordNotification(String channel, String status) {
        Counter.builder("notification.sent.count")
                .tag("channel", channel)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void updateModelVersion(long version) {
        modelVersion.set(version);
    }
}
