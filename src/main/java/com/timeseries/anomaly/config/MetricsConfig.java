package com.timeseries.anomaly.config;

import com.timeseries.anomaly.model.AlertLevel;
import com.timeseries.anomaly.model.AnomalyKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger trainingPhase;
    private final AtomicInteger bufferSize;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.trainingPhase = registry.gauge("engine.training.phase", new AtomicInteger(0));
        this.bufferSize = registry.gauge("engine.buffer.size", new AtomicInteger(0));
    }

    public void recordObservation() {
        Counter.builder("engine.observation.count")
                .register(registry)
                .increment();
    }

    public void recordRetraining(String outcome) {
        Counter.builder("engine.retraining.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordScoringFailure() {
        Counter.builder("engine.scoring.failure.count")
                .register(registry)
                .increment();
    }

    public void recordAnomaly(AnomalyKind kind) {
        Counter.builder("engine.anomaly.count")
                .tag("kind", kind.name())
                .register(registry)
                .increment();
    }

    public void recordAlert(AlertLevel level) {
        Counter.builder("alert.raised.count")
                .tag("level", level.name())
                .register(registry)
                .increment();
    }

    public void recordJournalWrite(String status) {
        Counter.builder("alert.journal.write.count")
                .tag("status", status)
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

    public void recordPersistence(String operation, String status) {
        Counter.builder("model.store.operation.count")
                .tag("operation", operation)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void updateEngineState(int phase, int size) {
        trainingPhase.set(phase);
        bufferSize.set(size);
    }
}
