package com.timeseries.anomaly.controller;

import com.timeseries.anomaly.model.AlertStatistics;
import com.timeseries.anomaly.model.PipelineStatus;
import com.timeseries.anomaly.service.AlertService;
import com.timeseries.anomaly.service.StreamingPipelineService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Status", description = "Pipeline progress, training phase and alert statistics")
public class StatusController {

    private final StreamingPipelineService pipelineService;
    private final AlertService alertService;

    public StatusController(StreamingPipelineService pipelineService, AlertService alertService) {
        this.pipelineService = pipelineService;
        this.alertService = alertService;
    }

    @GetMapping("/status")
    @Operation(summary = "Get pipeline status",
               description = "Stream progress, current training phase, buffer size and failure counters")
    public ResponseEntity<PipelineStatus> getStatus() {
        return ResponseEntity.ok(pipelineService.status());
    }

    @GetMapping("/alerts/stats")
    @Operation(summary = "Get alert statistics",
               description = "Total alerts, counts by level and by anomaly kind, and the most recent alerts")
    public ResponseEntity<AlertStatistics> getAlertStatistics() {
        return ResponseEntity.ok(alertService.statistics());
    }
}
