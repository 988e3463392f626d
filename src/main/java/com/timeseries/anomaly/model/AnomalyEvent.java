package com.timeseries.anomaly.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * An observation that fell outside the live model's prediction interval.
 * Not retained by the engine; only the consumer of the event keeps it.
 */
@Value
@Builder
public class AnomalyEvent {

    Instant timestamp;
    double actualValue;
    double predictedValue;
    double lowerBound;
    double upperBound;
    double deviation;
    AnomalyKind kind;

    // null when the producing model carries no derived thresholds
    SeverityThresholds thresholds;
}
