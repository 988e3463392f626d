package com.timeseries.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Deviation cut-offs used to level an anomaly. Derived from the prediction interval
 * of the model that produced the anomaly.
 */
@Value
@Builder
@Jacksonized
@Schema(description = "Deviation thresholds for INFO / WARNING / CRITICAL alert levels")
public class SeverityThresholds {

    @Schema(description = "Deviation at which an anomaly is at least INFO", example = "2.0")
    double info;

    @Schema(description = "Deviation at which an anomaly becomes WARNING", example = "3.5")
    double warning;

    @Schema(description = "Deviation at which an anomaly becomes CRITICAL", example = "5.0")
    double critical;

    public static SeverityThresholds fromIntervalHalfWidth(double halfWidth) {
        return new SeverityThresholds(halfWidth, halfWidth * 1.5, halfWidth * 2.0);
    }
}
