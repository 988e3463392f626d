package com.timeseries.anomaly.service;

import com.timeseries.anomaly.config.AlertConfig;
import com.timeseries.anomaly.config.MetricsConfig;
import com.timeseries.anomaly.config.ModelStoreConfig;
import com.timeseries.anomaly.config.PipelineConfig;
import com.timeseries.anomaly.engine.AnomalyEngine;
import com.timeseries.anomaly.engine.forecast.HarmonicRegressionForecaster;
import com.timeseries.anomaly.model.AlertLevel;
import com.timeseries.anomaly.model.AlertRecord;
import com.timeseries.anomaly.model.AnomalyKind;
import com.timeseries.anomaly.model.Observation;
import com.timeseries.anomaly.model.PipelineStatus;
import com.timeseries.anomaly.repository.AlertJournalRepository;
import com.timeseries.anomaly.repository.ModelSnapshotRepository;
import com.timeseries.anomaly.source.JsonlObservationReader;
import com.timeseries.anomaly.source.ObservationSource;
import com.timeseries.anomaly.source.ReplayableObservationSource;
import com.timeseries.anomaly.testutil.TestDataFactory;
import io.micrometer.tracing.Tracer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Runs the full source -> engine -> alerts -> model store flow with real components on a temp dir.
 */
class StreamingPipelineServiceTest {

    @TempDir
    Path tempDir;

    private PipelineConfig pipelineConfig;
    private AlertConfig alertConfig;
    private ModelStoreConfig modelStoreConfig;
    private MetricsConfig metricsConfig;
    private UrgentAlertSink urgentAlertSink;

    private final List<StreamingPipelineService> started = new ArrayList<>();
    private final List<AlertJournalRepository> journals = new ArrayList<>();

    @BeforeEach
    void setUp() {
        pipelineConfig = TestDataFactory.pipelineConfig(24, 168, 720);
        alertConfig = TestDataFactory.alertConfig(tempDir.resolve("logs").toString());
        modelStoreConfig = new ModelStoreConfig();
        modelStoreConfig.setDir(tempDir.resolve("models").toString());
        modelStoreConfig.setRetention(5);
        metricsConfig = TestDataFactory.metricsConfig();
        urgentAlertSink = mock(UrgentAlertSink.class);
    }

    @AfterEach
    void tearDown() {
        started.forEach(StreamingPipelineService::stop);
        journals.forEach(AlertJournalRepository::close);
    }

    private StreamingPipelineService newPipeline() {
        AnomalyEngine engine = new AnomalyEngine(
                new HarmonicRegressionForecaster(3, 3, 0.01, pipelineConfig.getConfidenceLevel()),
                pipelineConfig, alertConfig, Tracer.NOOP, metricsConfig);
        AlertJournalRepository journal = new AlertJournalRepository(alertConfig);
        journals.add(journal);
        AlertService alertService = new AlertService(alertConfig, journal, urgentAlertSink, metricsConfig);
        StreamingPipelineService pipeline = new StreamingPipelineService(pipelineConfig, alertConfig,
                modelStoreConfig, new JsonlObservationReader(pipelineConfig), engine, alertService,
                new ModelSnapshotRepository(modelStoreConfig), metricsConfig);
        started.add(pipeline);
        return pipeline;
    }

    private static List<Observation> dayThenSpike() {
        List<Observation> data = new ArrayList<>(TestDataFactory.hourlySinusoid(24));
        data.add(Observation.of(TestDataFactory.hourAt(24), TestDataFactory.sinusoid(24) + 15.0));
        return data;
    }

    private static void runToCompletion(StreamingPipelineService pipeline, List<Observation> data) throws Exception {
        pipeline.start(new ReplayableObservationSource(data));
        assertThat(pipeline.awaitCompletion(Duration.ofSeconds(30))).isTrue();
    }

    @Test
    void stream_trainsAfterOneDay_andRaisesCriticalAlertForSpike() throws Exception {
        StreamingPipelineService pipeline = newPipeline();

        runToCompletion(pipeline, dayThenSpike());

        PipelineStatus status = pipeline.status();
        assertThat(status.isRunning()).isFalse();
        assertThat(status.getPosition()).isEqualTo(25);
        assertThat(status.getProgressPercent()).isEqualTo(100.0);
        assertThat(status.getPhase()).isEqualTo(1);
        assertThat(status.getRetrainings()).isEqualTo(1);
        assertThat(status.getAnomalies()).isEqualTo(1);
        assertThat(status.getTotalAlerts()).isEqualTo(1);

        ModelSnapshotRepository store = new ModelSnapshotRepository(modelStoreConfig);
        assertThat(store.list()).hasSize(1);
        assertThat(store.loadTrainingData(store.latest().get())).hasSize(24);

        List<AlertRecord> journaled = journals.get(0)
                .replay(LocalDate.now(ZoneId.systemDefault()));
        assertThat(journaled).hasSize(1);
        assertThat(journaled.get(0).getKind()).isEqualTo(AnomalyKind.ABOVE_UPPER);
        assertThat(journaled.get(0).getLevel()).isEqualTo(AlertLevel.CRITICAL);
        verify(urgentAlertSink).deliver(any());
    }

    @Test
    void restart_resumesFromLatestSnapshot_andSkipsBufferedObservations() throws Exception {
        List<Observation> data = dayThenSpike();
        runToCompletion(newPipeline(), data.subList(0, 24));

        pipelineConfig.setResumeFromSnapshot(true);
        pipelineConfig.setRequirePretrainedModel(true);
        StreamingPipelineService resumed = newPipeline();
        runToCompletion(resumed, data);

        PipelineStatus status = resumed.status();
        assertThat(status.getPhase()).isEqualTo(1);
        assertThat(status.getBufferSize()).isEqualTo(25);
        assertThat(status.getRetrainings()).isZero();
        assertThat(status.getAnomalies()).isEqualTo(1);
    }

    @Test
    void resumeWithEmptyStore_startsCold() throws Exception {
        pipelineConfig.setResumeFromSnapshot(true);
        StreamingPipelineService pipeline = newPipeline();

        runToCompletion(pipeline, TestDataFactory.hourlySinusoid(10));

        assertThat(pipeline.status().getPhase()).isZero();
        assertThat(pipeline.status().getBufferSize()).isEqualTo(10);
    }

    @Test
    void requirePretrainedModel_withoutSnapshot_refusesToStart() {
        pipelineConfig.setResumeFromSnapshot(true);
        pipelineConfig.setRequirePretrainedModel(true);
        StreamingPipelineService pipeline = newPipeline();

        assertThatThrownBy(() -> pipeline.start(new ReplayableObservationSource(dayThenSpike())))
                .isInstanceOf(PipelineStartupException.class)
                .hasFieldOrPropertyWithValue("exitCode", PipelineStartupException.EXIT_CODE);
        assertThat(pipeline.isRunning()).isFalse();
    }

    @Test
    void invalidSpeed_isRejectedBeforeStreaming() {
        pipelineConfig.setSpeed(-1.0);
        StreamingPipelineService pipeline = newPipeline();

        assertThatThrownBy(() -> pipeline.start(new ReplayableObservationSource(dayThenSpike())))
                .isInstanceOf(PipelineConfigurationException.class)
                .hasMessageContaining("pipeline.speed");
        assertThat(pipeline.isRunning()).isFalse();
    }

    @Test
    void invalidThresholdsAndRetention_areRejected() {
        StreamingPipelineService pipeline = newPipeline();

        alertConfig.setDefaultDeviation(0.0);
        assertThatThrownBy(pipeline::validateConfiguration).isInstanceOf(PipelineConfigurationException.class);

        alertConfig.setDefaultDeviation(5.0);
        modelStoreConfig.setRetention(0);
        assertThatThrownBy(pipeline::validateConfiguration).isInstanceOf(PipelineConfigurationException.class);
    }

    @Test
    void start_fromMissingSourceFile_isAConfigurationError() {
        pipelineConfig.setSourcePath(tempDir.resolve("missing.jsonl").toString());
        StreamingPipelineService pipeline = newPipeline();

        assertThatThrownBy(pipeline::start).isInstanceOf(PipelineConfigurationException.class);
    }

    private static void awaitPosition(StreamingPipelineService pipeline, int atLeast) throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(30).toNanos();
        while (pipeline.status().getPosition() < atLeast) {
            assertThat(System.nanoTime()).as("stream reached position %d", atLeast).isLessThan(deadline);
            Thread.sleep(5);
        }
    }

    private static long liveStreamThreads() {
        return Thread.getAllStackTraces().keySet().stream()
                .filter(t -> t.isAlive() && "observation-stream".equals(t.getName()))
                .count();
    }

    @Test
    void stop_duringLongPacingDelay_returnsWithoutWaitingItOut() throws Exception {
        pipelineConfig.setSpeed(1.0);
        pipelineConfig.setBaseInterval(Duration.ofHours(1));
        StreamingPipelineService pipeline = newPipeline();
        pipeline.start(new ReplayableObservationSource(TestDataFactory.hourlySinusoid(5)));
        awaitPosition(pipeline, 1);

        long startedAt = System.nanoTime();
        pipeline.stop();
        Duration took = Duration.ofNanos(System.nanoTime() - startedAt);

        assertThat(took).isLessThan(Duration.ofSeconds(5));
        assertThat(pipeline.isRunning()).isFalse();
        assertThat(pipeline.status().getPosition()).isEqualTo(1);
        assertThat(pipeline.status().getBufferSize()).isEqualTo(1);
    }

    @Test
    void stopMidStream_haltsAfterInFlightRecord_thenRestartResumesFromSnapshot() throws Exception {
        pipelineConfig.setMediumThreshold(60);
        pipelineConfig.setSpeed(1.0);
        pipelineConfig.setBaseInterval(Duration.ofMillis(20));
        List<Observation> data = new ArrayList<>(TestDataFactory.hourlySinusoid(100));
        data.set(24, Observation.of(TestDataFactory.hourAt(24), TestDataFactory.sinusoid(24) + 15.0));

        StreamingPipelineService first = newPipeline();
        ObservationSource firstSource = new ReplayableObservationSource(data);
        first.start(firstSource);
        awaitPosition(first, 30);
        first.stop();

        PipelineStatus stopped = first.status();
        assertThat(stopped.isRunning()).isFalse();
        assertThat(stopped.getPosition()).isLessThan(100);
        assertThat(stopped.getPosition()).isEqualTo(stopped.getBufferSize());
        assertThat(stopped.getPhase()).isEqualTo(1);
        assertThat(stopped.getLastTrainedBufferSize()).isEqualTo(24);
        int positionAfterStop = firstSource.position();
        Thread.sleep(100);
        assertThat(firstSource.position()).isEqualTo(positionAfterStop);

        List<AlertRecord> journaled = journals.get(0).replay(LocalDate.now(ZoneId.systemDefault()));
        assertThat(journaled).hasSize((int) stopped.getTotalAlerts()).isNotEmpty();

        pipelineConfig.setSpeed(0.0);
        pipelineConfig.setResumeFromSnapshot(true);
        StreamingPipelineService restarted = newPipeline();
        ObservationSource secondSource = new ReplayableObservationSource(data);
        restarted.start(secondSource);
        assertThat(restarted.awaitCompletion(Duration.ofSeconds(30))).isTrue();

        PipelineStatus resumed = restarted.status();
        assertThat(resumed.getPosition()).isEqualTo(100);
        assertThat(resumed.getBufferSize()).isEqualTo(100);
        assertThat(resumed.getPhase()).isEqualTo(2);
        assertThat(resumed.getLastTrainedBufferSize()).isEqualTo(60);
        assertThat(resumed.getRetrainings()).isEqualTo(1);
        assertThat(new ModelSnapshotRepository(modelStoreConfig).list()).hasSize(2);
    }

    @Test
    void restartAfterCompletion_releasesThePreviousStreamThread() throws Exception {
        StreamingPipelineService pipeline = newPipeline();
        runToCompletion(pipeline, TestDataFactory.hourlySinusoid(5));

        runToCompletion(pipeline, TestDataFactory.hourlySinusoid(5));

        assertThat(pipeline.status().getBufferSize()).isEqualTo(10);
        long deadline = System.nanoTime() + Duration.ofSeconds(10).toNanos();
        while (liveStreamThreads() > 1 && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertThat(liveStreamThreads()).isLessThanOrEqualTo(1);
    }

    @Test
    void stop_beforeStart_isANoOp() {
        StreamingPipelineService pipeline = newPipeline();

        pipeline.stop();

        assertThat(pipeline.isRunning()).isFalse();
    }
}
