package com.timeseries.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
@Schema(description = "Point-in-time view of the streaming pipeline")
public class PipelineStatus {

    @Schema(description = "Whether the pull loop is running", example = "true")
    boolean running;

    @Schema(description = "Observations pulled from the source so far", example = "1200")
    int position;

    @Schema(description = "Observations available in the source", example = "43824")
    int totalRecords;

    @Schema(description = "Stream progress in percent", example = "2.7")
    double progressPercent;

    @Schema(description = "Training phase: 0 cold, 1 short-horizon, 2 medium-horizon, 3+ steady-state", example = "2")
    int phase;

    @Schema(description = "Observations in the training buffer", example = "1200")
    int bufferSize;

    @Schema(description = "Buffer size at the last successful training", example = "168")
    int lastTrainedBufferSize;

    @Schema(description = "When the live model was trained; null while cold")
    Instant trainedAt;

    long retrainings;
    long trainingFailures;
    long scoringFailures;
    long anomalies;
    long outOfOrderObservations;

    @Schema(description = "Alerts raised so far", example = "7")
    long totalAlerts;
}
