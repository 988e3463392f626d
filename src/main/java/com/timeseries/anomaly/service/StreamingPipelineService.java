package com.timeseries.anomaly.service;

import com.timeseries.anomaly.config.AlertConfig;
import com.timeseries.anomaly.config.MetricsConfig;
import com.timeseries.anomaly.config.ModelStoreConfig;
import com.timeseries.anomaly.config.PipelineConfig;
import com.timeseries.anomaly.engine.AnomalyEngine;
import com.timeseries.anomaly.engine.EngineStatus;
import com.timeseries.anomaly.engine.ModelUpdatedEvent;
import com.timeseries.anomaly.engine.ObservationOutcome;
import com.timeseries.anomaly.model.AlertStatistics;
import com.timeseries.anomaly.model.ModelSnapshot;
import com.timeseries.anomaly.model.Observation;
import com.timeseries.anomaly.model.PipelineStatus;
import com.timeseries.anomaly.repository.ModelSnapshotRepository;
import com.timeseries.anomaly.repository.ModelStoreException;
import com.timeseries.anomaly.source.JsonlObservationReader;
import com.timeseries.anomaly.source.ObservationSource;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Wires source -> engine -> alerts -> model store and owns the pull loop.
 *
 * Flow:
 * 1. Validate run parameters (fatal on error)
 * 2. Optionally restore the latest snapshot + training data and skip the source past them
 * 3. On one dedicated thread: pull an observation, run it through the engine, route the
 *    outcome (persist model updates, raise alerts), sleep baseInterval / speed, repeat
 * 4. On stop: finish the in-flight observation, flush the journal, log final statistics
 */
@Service
public class StreamingPipelineService {

    private static final Logger log = LoggerFactory.getLogger(StreamingPipelineService.class);

    private static final long STOP_TIMEOUT_SECONDS = 30;

    private final PipelineConfig config;
    private final AlertConfig alertConfig;
    private final ModelStoreConfig modelStoreConfig;
    private final JsonlObservationReader reader;
    private final AnomalyEngine engine;
    private final AlertService alertService;
    private final ModelSnapshotRepository modelRepository;
    private final MetricsConfig metricsConfig;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile ObservationSource source;
    private volatile CountDownLatch stopSignal = new CountDownLatch(0);
    private ExecutorService executor;

    public StreamingPipelineService(PipelineConfig config,
                                    AlertConfig alertConfig,
                                    ModelStoreConfig modelStoreConfig,
                                    JsonlObservationReader reader,
                                    AnomalyEngine engine,
                                    AlertService alertService,
                                    ModelSnapshotRepository modelRepository,
                                    MetricsConfig metricsConfig) {
        this.config = config;
        this.alertConfig = alertConfig;
        this.modelStoreConfig = modelStoreConfig;
        this.reader = reader;
        this.engine = engine;
        this.alertService = alertService;
        this.modelRepository = modelRepository;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Validate configuration, load the configured JSONL source and start streaming.
     */
    public void start() {
        validateConfiguration();
        start(reader.read(Paths.get(config.getSourcePath())));
    }

    public synchronized void start(ObservationSource observationSource) {
        if (running.get()) {
            log.warn("Pipeline already running; ignoring start request");
            return;
        }
        validateConfiguration();

        boolean restored = config.isResumeFromSnapshot() && restoreLatestSnapshot(observationSource);
        if (config.isRequirePretrainedModel() && !restored) {
            throw new PipelineStartupException(
                    "No trained model could be loaded from " + modelStoreConfig.getDir() + " and one is required");
        }

        if (executor != null) {
            // previous stream ended on its own; release its idle thread
            executor.shutdown();
        }

        this.source = observationSource;
        stopSignal = new CountDownLatch(1);
        running.set(true);
        executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "observation-stream");
            t.setDaemon(true);
            return t;
        });
        executor.submit(() -> runLoop(observationSource));

        log.info("Streaming started: {} observations, speed={}",
                observationSource.size(), config.getSpeed() == 0 ? "maximum (no delay)" : config.getSpeed() + "x");
    }

    /**
     * Halt after the in-flight observation, flush the journal and log final statistics.
     */
    @PreDestroy
    public synchronized void stop() {
        if (executor == null) {
            return;
        }
        log.info("Stopping anomaly detection pipeline...");
        running.set(false);
        stopSignal.countDown();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Pull loop did not finish within {}s; interrupting", STOP_TIMEOUT_SECONDS);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        executor = null;

        alertService.flushJournal();
        logFinalStatistics();
        log.info("Pipeline stopped");
    }

    /**
     * Block until the pull loop has ended on its own (source exhausted) or via {@link #stop()}.
     *
     * @return true if the loop ended within the timeout
     */
    public boolean awaitCompletion(Duration timeout) throws InterruptedException {
        ExecutorService current;
        synchronized (this) {
            current = executor;
        }
        if (current == null) {
            return true;
        }
        long deadline = System.nanoTime() + timeout.toNanos();
        while (running.get()) {
            if (System.nanoTime() > deadline) {
                return false;
            }
            Thread.sleep(10);
        }
        return true;
    }

    public boolean isRunning() {
        return running.get();
    }

    public PipelineStatus status() {
        ObservationSource current = source;
        EngineStatus engineStatus = engine.status();
        AlertStatistics alertStats = alertService.statistics();

        int position = current != null ? current.position() : 0;
        int total = current != null ? current.size() : 0;

        return PipelineStatus.builder()
                .running(running.get())
                .position(position)
                .totalRecords(total)
                .progressPercent(total > 0 ? position * 100.0 / total : 0.0)
                .phase(engineStatus.getPhase())
                .bufferSize(engineStatus.getBufferSize())
                .lastTrainedBufferSize(engineStatus.getLastTrainedBufferSize())
                .trainedAt(engineStatus.getTrainedAt())
                .retrainings(engineStatus.getRetrainings())
                .trainingFailures(engineStatus.getTrainingFailures())
                .scoringFailures(engineStatus.getScoringFailures())
                .anomalies(engineStatus.getAnomalies())
                .outOfOrderObservations(engineStatus.getOutOfOrderObservations())
                .totalAlerts(alertStats.getTotal())
                .build();
    }

    void validateConfiguration() {
        if (config.getSpeed() < 0 || !Double.isFinite(config.getSpeed())) {
            throw new PipelineConfigurationException("pipeline.speed must be >= 0, got " + config.getSpeed());
        }
        if (config.getBaseInterval() == null || config.getBaseInterval().isNegative()) {
            throw new PipelineConfigurationException("pipeline.base-interval must be a non-negative duration");
        }
        if (config.getConfidenceLevel() <= 0 || config.getConfidenceLevel() >= 1) {
            throw new PipelineConfigurationException(
                    "pipeline.confidence-level must be in (0, 1), got " + config.getConfidenceLevel());
        }
        if (config.getShortThreshold() <= 0 || config.getMediumThreshold() <= 0 || config.getRecurringThreshold() <= 0) {
            throw new PipelineConfigurationException("pipeline retraining thresholds must be positive");
        }
        if (alertConfig.getDefaultDeviation() <= 0) {
            throw new PipelineConfigurationException(
                    "alert.default-deviation must be > 0, got " + alertConfig.getDefaultDeviation());
        }
        if (modelStoreConfig.getRetention() < 1) {
            throw new PipelineConfigurationException(
                    "model-store.retention must be >= 1, got " + modelStoreConfig.getRetention());
        }
    }

    private boolean restoreLatestSnapshot(ObservationSource observationSource) {
        Optional<String> latest;
        try {
            latest = modelRepository.latest();
        } catch (ModelStoreException e) {
            log.warn("Could not list model snapshots; starting cold: {}", e.getMessage());
            return false;
        }
        if (latest.isEmpty()) {
            log.info("No persisted model snapshot found; starting cold (phase 0)");
            return false;
        }

        String name = latest.get();
        try {
            ModelSnapshot snapshot = modelRepository.load(name);
            List<Observation> trainingData = modelRepository.loadTrainingData(name);
            engine.restore(snapshot, trainingData);
            int skipped = observationSource.skip(trainingData.size());
            log.info("Resumed from {}: phase={}, skipped {} already-buffered observations",
                    name, snapshot.getPhase(), skipped);
            metricsConfig.recordPersistence("load", "success");
            return true;
        } catch (ModelStoreException | IllegalArgumentException e) {
            metricsConfig.recordPersistence("load", "error");
            log.warn("Failed to restore snapshot {}; starting cold (phase 0): {}", name, e.getMessage());
            return false;
        }
    }

    private void runLoop(ObservationSource observationSource) {
        try {
            while (running.get()) {
                Optional<Observation> next = observationSource.next();
                if (next.isEmpty()) {
                    log.info("All {} observations have been streamed", observationSource.size());
                    break;
                }

                try {
                    handle(next.get());
                } catch (Exception e) {
                    log.error("Unexpected failure processing observation at {}: {}",
                            next.get().getTimestamp(), e.getMessage(), e);
                }

                if (!pace()) {
                    break;
                }
            }
        } finally {
            running.set(false);
            alertService.flushJournal();
        }
    }

    private void handle(Observation observation) {
        ObservationOutcome outcome = engine.process(observation);
        outcome.anomaly().ifPresent(alertService::notify);
        outcome.modelUpdate().ifPresent(this::persist);
    }

    private void persist(ModelUpdatedEvent update) {
        ModelSnapshot snapshot = update.getSnapshot();
        try {
            String name = modelRepository.nameFor(snapshot.getTrainedAt());
            modelRepository.saveTrainingData(update.getTrainingData(), name);
            modelRepository.save(snapshot, name);
            metricsConfig.recordPersistence("save", "success");
        } catch (ModelStoreException e) {
            // the in-memory snapshot stays live
            metricsConfig.recordPersistence("save", "error");
            log.error("Failed to persist snapshot for phase {}: {}", snapshot.getPhase(), e.getMessage(), e);
        }
    }

    /**
     * Wait baseInterval / speed, cut short by {@link #stop()}. Returns false if the stream should end.
     */
    private boolean pace() {
        if (config.getSpeed() <= 0) {
            return true;
        }
        long delayNanos = (long) (config.getBaseInterval().toNanos() / config.getSpeed());
        if (delayNanos <= 0) {
            return true;
        }
        try {
            return !stopSignal.await(delayNanos, TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void logFinalStatistics() {
        PipelineStatus status = status();
        AlertStatistics alerts = alertService.statistics();

        log.info("=== Final statistics ===");
        log.info("Observations processed: {}/{}", status.getPosition(), status.getTotalRecords());
        log.info("Training phase: {} (retrainings={}, training failures={}, scoring failures={})",
                status.getPhase(), status.getRetrainings(), status.getTrainingFailures(), status.getScoringFailures());
        log.info("Anomalies detected: {}, alerts by level: {}, by kind: {}",
                alerts.getTotal(), alerts.getByLevel(), alerts.getByKind());
        alerts.getRecent().forEach(alert -> log.info("  recent: {} {} {} (deviation {})",
                alert.getTimestamp(), alert.getLevel(), alert.getKind(),
                String.format("%.2f", alert.getDeviation())));
    }
}
