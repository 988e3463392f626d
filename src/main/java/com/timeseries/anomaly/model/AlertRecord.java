package com.timeseries.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

@Value
@Builder
@Jacksonized
@Schema(description = "A leveled alert raised for one anomalous observation. Never mutated once journaled.")
public class AlertRecord {

    @Schema(description = "Unique alert ID: detection time plus sequence", example = "ALERT_20240101120000_0001")
    String alertId;

    @Schema(description = "Timestamp of the anomalous observation")
    Instant timestamp;

    @Schema(description = "Wall-clock time the alert was raised")
    Instant detectedAt;

    @Schema(description = "Alert level", example = "WARNING")
    AlertLevel level;

    double actualValue;
    double predictedValue;
    double lowerBound;
    double upperBound;

    @Schema(description = "Absolute difference between actual and predicted value", example = "4.2")
    double deviation;

    @Schema(description = "Which interval bound was crossed", example = "ABOVE_UPPER")
    AnomalyKind kind;

    @Schema(description = "Human-readable, level-prefixed message")
    String message;
}
