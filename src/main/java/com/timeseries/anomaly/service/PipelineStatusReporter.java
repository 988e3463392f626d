package com.timeseries.anomaly.service;

import com.timeseries.anomaly.model.AlertStatistics;
import com.timeseries.anomaly.model.PipelineStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Periodic status line while the pipeline runs. Read-only.
 */
@Service
public class PipelineStatusReporter {

    private static final Logger log = LoggerFactory.getLogger(PipelineStatusReporter.class);

    private final StreamingPipelineService pipelineService;
    private final AlertService alertService;

    public PipelineStatusReporter(StreamingPipelineService pipelineService, AlertService alertService) {
        this.pipelineService = pipelineService;
        this.alertService = alertService;
    }

    @Scheduled(fixedRateString = "${pipeline.status-interval-seconds:10}",
               timeUnit = TimeUnit.SECONDS,
               initialDelayString = "${pipeline.status-interval-seconds:10}")
    public void report() {
        if (!pipelineService.isRunning()) {
            return;
        }

        PipelineStatus status = pipelineService.status();
        AlertStatistics alerts = alertService.statistics();

        log.info("Status: progress={}/{} ({}%), phase={}, buffer={}, model={}, alerts={} {}",
                status.getPosition(), status.getTotalRecords(),
                String.format("%.1f", status.getProgressPercent()),
                status.getPhase(), status.getBufferSize(),
                status.getPhase() > 0 ? "active" : "none (buffering)",
                alerts.getTotal(), alerts.getByLevel());
    }
}
