package com.lynx.anomaly.config;

import com.lynx.anomaly.exception.PipelineStage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

@Component
public class TrainingMetrics {

    private final MeterRegistry registry;
    private final AtomicReference<Double> anomalyRatio;
    private final AtomicReference<Double> decisionOffset;

    public TrainingMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.anomalyRatio = new AtomicReference<>(0.0);
        this.decisionOffset = new AtomicReference<>(0.0);
        registry.gauge("trainer.anomaly.ratio", anomalyRatio, AtomicReference::get);
        registry.gauge("trainer.decision.offset", decisionOffset, AtomicReference::get);
    }

    public <T> T timeStage(PipelineStage stage, Supplier<T> work) {
        return Timer.builder("trainer.stage.duration")
                .tag("stage", stage.label())
                .register(registry)
                .record(work);
    }

    public void recordRun(double ratio, double offset) {
        anomalyRatio.set(ratio);
        decisionOffset.set(offset);
    }

    public void recordHealth(Map<String, Boolean> health) {
        health.forEach((check, passed) -> {
            if (!passed) {
                Counter.builder("trainer.health.failed")
                        .tag("check", check)
                        .register(registry)
                        .increment();
            }
        });
    }
}
