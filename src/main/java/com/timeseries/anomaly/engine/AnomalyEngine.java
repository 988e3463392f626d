package com.timeseries.anomaly.engine;

import com.timeseries.anomaly.config.AlertConfig;
import com.timeseries.anomaly.config.MetricsConfig;
import com.timeseries.anomaly.config.PipelineConfig;
import com.timeseries.anomaly.engine.forecast.Forecast;
import com.timeseries.anomaly.engine.forecast.Forecaster;
import com.timeseries.anomaly.engine.forecast.TrainedModel;
import com.timeseries.anomaly.model.AnomalyEvent;
import com.timeseries.anomaly.model.AnomalyKind;
import com.timeseries.anomaly.model.ModelSnapshot;
import com.timeseries.anomaly.model.Observation;
import com.timeseries.anomaly.model.SeverityThresholds;
import com.timeseries.anomaly.service.PipelineConfigurationException;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Incremental anomaly detector.
 *
 * For every observation, in order:
 * 1. Append it to the training buffer (never truncated, never sorted or deduplicated)
 * 2. Retrain on the whole buffer if the {@link RetrainingSchedule} says so; phase advances by one
 * 3. If a model is live, score the observation against its prediction interval
 *
 * Training and scoring failures are logged and absorbed so the stream keeps flowing.
 * All state changes are serialized on this instance's monitor; status reads take the same lock.
 */
@Component
public class AnomalyEngine {

    private static final Logger log = LoggerFactory.getLogger(AnomalyEngine.class);

    private final Forecaster forecaster;
    private final RetrainingSchedule schedule;
    private final boolean attachThresholds;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;

    private final List<Observation> buffer = new ArrayList<>();
    private ModelSnapshot liveSnapshot;
    private int phase;
    private int lastTrainedBufferSize;
    private Instant lastTimestamp;

    private long observationCount;
    private long retrainingCount;
    private long trainingFailureCount;
    private long scoringFailureCount;
    private long anomalyCount;
    private long outOfOrderCount;

    public AnomalyEngine(Forecaster forecaster,
                         PipelineConfig pipelineConfig,
                         AlertConfig alertConfig,
                         Tracer tracer,
                         MetricsConfig metricsConfig) {
        this.forecaster = forecaster;
        try {
            this.schedule = new RetrainingSchedule(pipelineConfig.getShortThreshold(),
                    pipelineConfig.getMediumThreshold(), pipelineConfig.getRecurringThreshold());
        } catch (IllegalArgumentException e) {
            throw new PipelineConfigurationException("Invalid pipeline retraining thresholds: " + e.getMessage(), e);
        }
        this.attachThresholds = alertConfig.isUseDerivedThresholds();
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;
    }

    @Observed(name = "engine.process", contextualName = "process-observation")
    public synchronized ObservationOutcome process(Observation observation) {
        Objects.requireNonNull(observation, "observation");

        trackOrdering(observation);
        buffer.add(observation);
        observationCount++;
        metricsConfig.recordObservation();

        ModelUpdatedEvent update = null;
        if (schedule.isDue(phase, buffer.size(), lastTrainedBufferSize)) {
            update = retrain();
        }

        // no scoring before the first successful training
        AnomalyEvent anomaly = phase > 0 ? score(observation) : null;

        metricsConfig.updateEngineState(phase, buffer.size());
        return new ObservationOutcome(observation, update, anomaly);
    }

    /**
     * Resume from a persisted snapshot and the buffer it was trained on (plus anything buffered after).
     */
    public synchronized void restore(ModelSnapshot snapshot, List<Observation> trainingData) {
        Objects.requireNonNull(snapshot, "snapshot");
        Objects.requireNonNull(trainingData, "trainingData");
        if (snapshot.getModel() == null || snapshot.getPhase() < 1) {
            throw new IllegalArgumentException("Snapshot has no trained model (phase " + snapshot.getPhase() + ")");
        }
        if (snapshot.getBufferSizeAtTrain() > trainingData.size()) {
            throw new IllegalArgumentException(String.format(
                    "Snapshot was trained on %d observations but only %d were restored",
                    snapshot.getBufferSizeAtTrain(), trainingData.size()));
        }

        buffer.clear();
        buffer.addAll(trainingData);
        liveSnapshot = snapshot;
        phase = snapshot.getPhase();
        lastTrainedBufferSize = snapshot.getBufferSizeAtTrain();
        lastTimestamp = trainingData.isEmpty() ? null : trainingData.get(trainingData.size() - 1).getTimestamp();
        metricsConfig.updateEngineState(phase, buffer.size());

        log.info("Engine restored: phase={} ({}), buffer={}, trainedAt={}",
                phase, RetrainingSchedule.phaseName(phase), buffer.size(), snapshot.getTrainedAt());
    }

    public synchronized int getPhase() {
        return phase;
    }

    public synchronized int getBufferSize() {
        return buffer.size();
    }

    public synchronized Optional<ModelSnapshot> getLiveSnapshot() {
        return Optional.ofNullable(liveSnapshot);
    }

    public synchronized List<Observation> getTrainingBuffer() {
        return List.copyOf(buffer);
    }

    public synchronized EngineStatus status() {
        return EngineStatus.builder()
                .phase(phase)
                .phaseName(RetrainingSchedule.phaseName(phase))
                .bufferSize(buffer.size())
                .lastTrainedBufferSize(lastTrainedBufferSize)
                .trainedAt(liveSnapshot != null ? liveSnapshot.getTrainedAt() : null)
                .observations(observationCount)
                .retrainings(retrainingCount)
                .trainingFailures(trainingFailureCount)
                .scoringFailures(scoringFailureCount)
                .anomalies(anomalyCount)
                .outOfOrderObservations(outOfOrderCount)
                .build();
    }

    private ModelUpdatedEvent retrain() {
        int fromPhase = phase;
        int size = buffer.size();

        Span span = tracer.nextSpan()
                .name("engine.retrain")
                .tag("engine.phase", String.valueOf(fromPhase))
                .tag("engine.buffer.size", String.valueOf(size))
                .start();

        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            List<Observation> trainingData = List.copyOf(buffer);
            TrainedModel model = forecaster.fit(trainingData);

            // Interval width at the newest training point sets the severity cut-offs
            Forecast reference = model.predict(trainingData.get(size - 1).getTimestamp());
            SeverityThresholds thresholds = reference.halfWidth() > 0
                    ? SeverityThresholds.fromIntervalHalfWidth(reference.halfWidth())
                    : null;

            ModelSnapshot snapshot = ModelSnapshot.builder()
                    .model(model)
                    .phase(fromPhase + 1)
                    .trainedAt(Instant.now())
                    .bufferSizeAtTrain(size)
                    .thresholds(thresholds)
                    .build();

            liveSnapshot = snapshot;
            phase = fromPhase + 1;
            lastTrainedBufferSize = size;
            retrainingCount++;
            metricsConfig.recordRetraining("success");

            log.info("Model retrained on {} observations: phase {} -> {} ({})",
                    size, fromPhase, phase, RetrainingSchedule.phaseName(phase));
            return new ModelUpdatedEvent(snapshot, trainingData);
        } catch (Exception e) {
            span.error(e);
            trainingFailureCount++;
            metricsConfig.recordRetraining("failure");
            log.error("Retraining failed at phase {} with {} buffered observations; keeping current model: {}",
                    fromPhase, size, e.getMessage(), e);
            return null;
        } finally {
            span.end();
        }
    }

    private AnomalyEvent score(Observation observation) {
        Forecast forecast;
        try {
            forecast = liveSnapshot.getModel().predict(observation.getTimestamp());
        } catch (Exception e) {
            scoringFailureCount++;
            metricsConfig.recordScoringFailure();
            log.warn("Scoring failed for observation at {}; treating as normal: {}",
                    observation.getTimestamp(), e.getMessage());
            return null;
        }

        double actual = observation.getValue();
        boolean above = actual > forecast.getUpper();
        boolean below = actual < forecast.getLower();
        if (!above && !below) {
            return null;
        }

        AnomalyKind kind = above ? AnomalyKind.ABOVE_UPPER : AnomalyKind.BELOW_LOWER;
        AnomalyEvent event = AnomalyEvent.builder()
                .timestamp(observation.getTimestamp())
                .actualValue(actual)
                .predictedValue(forecast.getPoint())
                .lowerBound(forecast.getLower())
                .upperBound(forecast.getUpper())
                .deviation(Math.abs(actual - forecast.getPoint()))
                .kind(kind)
                .thresholds(attachThresholds ? liveSnapshot.getThresholds() : null)
                .build();

        anomalyCount++;
        metricsConfig.recordAnomaly(kind);
        log.info("Anomaly detected at {}: {} (expected {} [{}, {}])",
                observation.getTimestamp(),
                String.format("%.2f", actual),
                String.format("%.2f", forecast.getPoint()),
                String.format("%.2f", forecast.getLower()),
                String.format("%.2f", forecast.getUpper()));
        return event;
    }

    private void trackOrdering(Observation observation) {
        Instant ts = observation.getTimestamp();
        if (lastTimestamp != null && !ts.isAfter(lastTimestamp)) {
            outOfOrderCount++;
            log.warn("Observation at {} does not follow previous timestamp {}; buffering as received",
                    ts, lastTimestamp);
        }
        lastTimestamp = ts;
    }
}
