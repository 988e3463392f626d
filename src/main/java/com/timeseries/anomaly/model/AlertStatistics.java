package com.timeseries.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
@Schema(description = "Aggregate view over the in-memory alert history")
public class AlertStatistics {

    @Schema(description = "Total alerts raised since start (or since the history was cleared)", example = "12")
    long total;

    @Schema(description = "Alert counts per level")
    Map<AlertLevel, Long> byLevel;

    @Schema(description = "Alert counts per anomaly kind")
    Map<AnomalyKind, Long> byKind;

    @Schema(description = "Most recent alerts, oldest first")
    List<AlertRecord> recent;
}
