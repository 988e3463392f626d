package com.timeseries.anomaly.model;

import com.timeseries.anomaly.engine.forecast.TrainedModel;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * An immutable trained model bound to the training phase that produced it.
 * A new snapshot replaces the live one wholesale.
 */
@Value
@Builder
@Jacksonized
public class ModelSnapshot {

    TrainedModel model;
    int phase;
    Instant trainedAt;
    int bufferSizeAtTrain;

    // absent on snapshots written without derived thresholds
    SeverityThresholds thresholds;
}
